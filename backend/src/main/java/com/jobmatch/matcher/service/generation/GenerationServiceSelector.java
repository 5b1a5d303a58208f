package com.jobmatch.matcher.service.generation;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import com.jobmatch.matcher.exception.GenerationProviderException;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Chooses between OpenAI and AWS Bedrock. The configured provider wins when available; otherwise
 * any configured provider is used.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class GenerationServiceSelector {

  private final OpenAIGenerationService openAIGenerationService;
  private final BedrockGenerationService bedrockGenerationService;

  @Value("${matcher.generation.provider:openai}")
  private String preferredProvider;

  public TextGenerationService getService() {
    if ("openai".equalsIgnoreCase(preferredProvider) && openAIGenerationService.isConfigured()) {
      return openAIGenerationService;
    }
    if ("bedrock".equalsIgnoreCase(preferredProvider) && bedrockGenerationService.isConfigured()) {
      return bedrockGenerationService;
    }
    if (openAIGenerationService.isConfigured()) {
      log.debug("Preferred generation provider not available, falling back to OpenAI");
      return openAIGenerationService;
    }
    if (bedrockGenerationService.isConfigured()) {
      log.debug("Preferred generation provider not available, falling back to AWS Bedrock");
      return bedrockGenerationService;
    }
    throw new GenerationProviderException(
        "No text generation service is configured. Set OPENAI_API_KEY or enable AWS Bedrock.");
  }
}
