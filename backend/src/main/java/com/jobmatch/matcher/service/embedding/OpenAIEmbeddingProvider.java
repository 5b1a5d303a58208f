package com.jobmatch.matcher.service.embedding;

import java.util.ArrayList;
import java.util.List;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.jobmatch.matcher.exception.EmbeddingProviderException;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/** OpenAI embeddings endpoint. Accepts a whole batch per call. */
@Slf4j
@Service
@RequiredArgsConstructor
public class OpenAIEmbeddingProvider implements EmbeddingProvider {

  private static final String OPENAI_EMBEDDINGS_URL = "https://api.openai.com/v1/embeddings";

  private final ObjectMapper objectMapper;
  private final RestTemplate restTemplate;

  @Value("${openai.api-key:}")
  private String openaiApiKey;

  @Value("${openai.embedding-model:text-embedding-3-large}")
  private String model;

  @Value("${openai.embedding-max-batch:2048}")
  private int maxBatch;

  @Override
  public boolean isConfigured() {
    return openaiApiKey != null && !openaiApiKey.trim().isEmpty();
  }

  @Override
  public int maxBatchSize() {
    return maxBatch;
  }

  @Override
  public String getModelId() {
    return model;
  }

  @Override
  public List<float[]> embed(List<String> texts) {
    if (!isConfigured()) {
      throw new EmbeddingProviderException(
          "OpenAI API key not configured. Please set OPENAI_API_KEY environment variable.");
    }

    ObjectNode requestBody = objectMapper.createObjectNode();
    requestBody.put("model", model);
    ArrayNode input = requestBody.putArray("input");
    texts.forEach(input::add);

    HttpHeaders headers = new HttpHeaders();
    headers.setContentType(MediaType.APPLICATION_JSON);
    headers.setBearerAuth(openaiApiKey);
    HttpEntity<String> entity = new HttpEntity<>(requestBody.toString(), headers);

    log.debug("OpenAI embedding request model={}, texts={}", model, texts.size());
    try {
      ResponseEntity<String> response =
          restTemplate.exchange(OPENAI_EMBEDDINGS_URL, HttpMethod.POST, entity, String.class);
      return parseResponse(response.getBody(), texts.size());
    } catch (RestClientException e) {
      throw new EmbeddingProviderException("OpenAI embedding call failed: " + e.getMessage(), e);
    }
  }

  List<float[]> parseResponse(String body, int expected) {
    if (body == null) {
      throw new EmbeddingProviderException("Empty response from OpenAI embeddings API");
    }
    JsonNode data;
    try {
      data = objectMapper.readTree(body).get("data");
    } catch (JsonProcessingException e) {
      throw new EmbeddingProviderException("Unreadable response from OpenAI embeddings API", e);
    }
    if (data == null || !data.isArray() || data.size() != expected) {
      throw new EmbeddingProviderException(
          "OpenAI embeddings API returned "
              + (data == null ? 0 : data.size())
              + " vectors for "
              + expected
              + " inputs");
    }

    float[][] ordered = new float[expected][];
    for (JsonNode item : data) {
      int index = item.path("index").asInt();
      JsonNode values = item.get("embedding");
      float[] vector = new float[values.size()];
      for (int i = 0; i < vector.length; i++) {
        vector[i] = (float) values.get(i).asDouble();
      }
      ordered[index] = vector;
    }
    return new ArrayList<>(List.of(ordered));
  }
}
