package com.jobmatch.matcher.service.embedding;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import com.jobmatch.matcher.exception.EmbeddingProviderException;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/** Prefers the configured provider and falls back to whichever one is available. */
@Slf4j
@Service
@RequiredArgsConstructor
public class EmbeddingProviderSelector {

  private final OpenAIEmbeddingProvider openAIEmbeddingProvider;
  private final BedrockEmbeddingProvider bedrockEmbeddingProvider;

  @Value("${matcher.embedding.provider:openai}")
  private String preferredProvider;

  public EmbeddingProvider getProvider() {
    if ("openai".equalsIgnoreCase(preferredProvider) && openAIEmbeddingProvider.isConfigured()) {
      return openAIEmbeddingProvider;
    }
    if ("bedrock".equalsIgnoreCase(preferredProvider) && bedrockEmbeddingProvider.isConfigured()) {
      return bedrockEmbeddingProvider;
    }

    if (openAIEmbeddingProvider.isConfigured()) {
      log.debug("Preferred embedding provider not available, falling back to OpenAI");
      return openAIEmbeddingProvider;
    }
    if (bedrockEmbeddingProvider.isConfigured()) {
      log.debug("Preferred embedding provider not available, falling back to Bedrock");
      return bedrockEmbeddingProvider;
    }

    throw new EmbeddingProviderException(
        "No embedding provider is configured. Set OPENAI_API_KEY or enable AWS Bedrock.");
  }
}
