package com.jobmatch.matcher.service.generation;

import java.util.List;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import com.jobmatch.matcher.exception.GenerationProviderException;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import software.amazon.awssdk.services.bedrockruntime.BedrockRuntimeClient;
import software.amazon.awssdk.services.bedrockruntime.model.ContentBlock;
import software.amazon.awssdk.services.bedrockruntime.model.ConversationRole;
import software.amazon.awssdk.services.bedrockruntime.model.ConverseRequest;
import software.amazon.awssdk.services.bedrockruntime.model.ConverseResponse;
import software.amazon.awssdk.services.bedrockruntime.model.InferenceConfiguration;
import software.amazon.awssdk.services.bedrockruntime.model.Message;
import software.amazon.awssdk.services.bedrockruntime.model.ThrottlingException;

/** Bedrock Converse API. Only throttling is retried, with exponential backoff. */
@Slf4j
@Service
@RequiredArgsConstructor
public class BedrockGenerationService implements TextGenerationService {

  private final BedrockRuntimeClient bedrockRuntimeClient;
  private final GroundedPromptComposer promptComposer;

  @Value("${aws.bedrock.enabled:false}")
  private boolean enabled;

  @Value("${aws.bedrock.model-id:anthropic.claude-3-haiku-20240307-v1:0}")
  private String modelId;

  @Value("${aws.bedrock.max-tokens:2048}")
  private int maxTokens;

  @Value("${aws.bedrock.temperature:0.7}")
  private double temperature;

  @Value("${aws.bedrock.retry.max-attempts:3}")
  private int maxRetryAttempts;

  @Value("${aws.bedrock.retry.initial-delay-ms:1000}")
  private long initialRetryDelayMs;

  @Value("${aws.bedrock.retry.max-delay-ms:16000}")
  private long maxRetryDelayMs;

  @Override
  public boolean isConfigured() {
    return enabled && modelId != null && !modelId.isBlank();
  }

  @Override
  public String getCurrentModelId() {
    return modelId;
  }

  @Override
  public String generate(String prompt, List<String> context) {
    ContentBlock contentBlock =
        ContentBlock.builder().text(promptComposer.compose(prompt, context)).build();
    Message userMessage =
        Message.builder().role(ConversationRole.USER).content(contentBlock).build();
    ConverseRequest converseRequest =
        ConverseRequest.builder()
            .modelId(modelId)
            .messages(List.of(userMessage))
            .inferenceConfig(
                InferenceConfiguration.builder()
                    .maxTokens(maxTokens)
                    .temperature((float) temperature)
                    .build())
            .build();

    int attempt = 0;
    long retryDelay = initialRetryDelayMs;
    while (true) {
      try {
        ConverseResponse response = bedrockRuntimeClient.converse(converseRequest);
        Message responseMessage = response.output().message();
        if (responseMessage != null && !responseMessage.content().isEmpty()) {
          String text = responseMessage.content().get(0).text();
          if (text != null) {
            return text;
          }
        }
        throw new GenerationProviderException("No content in Bedrock model response");
      } catch (ThrottlingException e) {
        attempt++;
        if (attempt >= maxRetryAttempts) {
          throw new GenerationProviderException(
              "AWS Bedrock throttling error after " + maxRetryAttempts + " retry attempts", e);
        }
        log.warn(
            "AWS Bedrock throttling detected. Retrying in {} ms (attempt {}/{})",
            retryDelay,
            attempt,
            maxRetryAttempts);
        try {
          Thread.sleep(retryDelay);
        } catch (InterruptedException ie) {
          Thread.currentThread().interrupt();
          throw new GenerationProviderException("Retry interrupted", ie);
        }
        retryDelay = Math.min(retryDelay * 2, maxRetryDelayMs);
      } catch (GenerationProviderException e) {
        throw e;
      } catch (Exception e) {
        log.error("Error invoking Bedrock model: {}", modelId, e);
        throw new GenerationProviderException("Failed to generate text: " + e.getMessage(), e);
      }
    }
  }
}
