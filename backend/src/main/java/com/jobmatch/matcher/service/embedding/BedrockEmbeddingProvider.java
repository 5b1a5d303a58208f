package com.jobmatch.matcher.service.embedding;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.jobmatch.matcher.exception.EmbeddingProviderException;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import software.amazon.awssdk.core.SdkBytes;
import software.amazon.awssdk.services.bedrockruntime.BedrockRuntimeClient;
import software.amazon.awssdk.services.bedrockruntime.model.InvokeModelRequest;
import software.amazon.awssdk.services.bedrockruntime.model.InvokeModelResponse;

/**
 * Amazon Titan text embeddings through Bedrock. Titan does not support batch input, so texts are
 * embedded one call at a time.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BedrockEmbeddingProvider implements EmbeddingProvider {

  private final ObjectMapper objectMapper;
  private final BedrockRuntimeClient bedrockRuntimeClient;

  @Value("${aws.bedrock.embedding.model-id:amazon.titan-embed-text-v2:0}")
  private String embeddingModelId;

  @Value("${aws.bedrock.enabled:false}")
  private boolean enabled;

  @Override
  public boolean isConfigured() {
    return enabled;
  }

  @Override
  public int maxBatchSize() {
    return 1;
  }

  @Override
  public String getModelId() {
    return embeddingModelId;
  }

  @Override
  public List<float[]> embed(List<String> texts) {
    List<float[]> vectors = new ArrayList<>(texts.size());
    for (String text : texts) {
      vectors.add(embedOne(text));
    }
    return vectors;
  }

  private float[] embedOne(String text) {
    try {
      String payload = objectMapper.writeValueAsString(Map.of("inputText", text));
      InvokeModelRequest invokeRequest =
          InvokeModelRequest.builder()
              .modelId(embeddingModelId)
              .contentType("application/json")
              .body(SdkBytes.fromString(payload, StandardCharsets.UTF_8))
              .build();

      InvokeModelResponse response = bedrockRuntimeClient.invokeModel(invokeRequest);
      JsonNode embedding = objectMapper.readTree(response.body().asUtf8String()).get("embedding");
      if (embedding == null || !embedding.isArray()) {
        throw new EmbeddingProviderException("Titan response carried no embedding");
      }
      float[] vector = new float[embedding.size()];
      for (int i = 0; i < vector.length; i++) {
        vector[i] = (float) embedding.get(i).asDouble();
      }
      return vector;
    } catch (EmbeddingProviderException e) {
      throw e;
    } catch (Exception e) {
      log.error("Error generating Titan embedding", e);
      throw new EmbeddingProviderException("Failed to generate embedding: " + e.getMessage(), e);
    }
  }
}
