package com.jobmatch.matcher.service.generation;

import java.util.List;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestTemplate;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.jobmatch.matcher.exception.GenerationProviderException;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/** OpenAI chat completions, with a short linear backoff between attempts. */
@Slf4j
@Service
@RequiredArgsConstructor
public class OpenAIGenerationService implements TextGenerationService {

  private static final String OPENAI_API_URL = "https://api.openai.com/v1/chat/completions";

  private final ObjectMapper objectMapper;
  private final RestTemplate restTemplate;
  private final GroundedPromptComposer promptComposer;

  @Value("${openai.api-key:}")
  private String openaiApiKey;

  @Value("${openai.model:gpt-4o-mini}")
  private String model;

  @Value("${openai.max-tokens:2048}")
  private int maxTokens;

  @Value("${openai.temperature:0.7}")
  private double temperature;

  @Value("${openai.retry.max-attempts:3}")
  private int maxRetryAttempts;

  @Value("${openai.retry.backoff-ms:1000}")
  private long backoffMs;

  @Override
  public boolean isConfigured() {
    return openaiApiKey != null && !openaiApiKey.trim().isEmpty();
  }

  @Override
  public String getCurrentModelId() {
    return model;
  }

  @Override
  public String generate(String prompt, List<String> context) {
    if (!isConfigured()) {
      throw new GenerationProviderException(
          "OpenAI API key not configured. Please set OPENAI_API_KEY environment variable.");
    }

    ObjectNode requestBody = objectMapper.createObjectNode();
    requestBody.put("model", model);
    requestBody.put("max_tokens", maxTokens);
    requestBody.put("temperature", temperature);
    ArrayNode messages = requestBody.putArray("messages");
    ObjectNode message = messages.addObject();
    message.put("role", "user");
    message.put("content", promptComposer.compose(prompt, context));

    HttpHeaders headers = new HttpHeaders();
    headers.setContentType(MediaType.APPLICATION_JSON);
    headers.setBearerAuth(openaiApiKey);
    HttpEntity<String> entity = new HttpEntity<>(requestBody.toString(), headers);

    int attempt = 0;
    while (true) {
      try {
        ResponseEntity<String> response =
            restTemplate.exchange(OPENAI_API_URL, HttpMethod.POST, entity, String.class);
        return extractContent(response.getBody());
      } catch (Exception e) {
        attempt++;
        log.warn("OpenAI generation attempt {} failed: {}", attempt, e.getMessage());
        if (attempt >= maxRetryAttempts) {
          throw new GenerationProviderException(
              "OpenAI API call failed after " + maxRetryAttempts + " attempts", e);
        }
        try {
          Thread.sleep(backoffMs * attempt);
        } catch (InterruptedException ie) {
          Thread.currentThread().interrupt();
          throw new GenerationProviderException("Interrupted during retry", ie);
        }
      }
    }
  }

  private String extractContent(String body) throws Exception {
    if (body != null) {
      JsonNode choices = objectMapper.readTree(body).get("choices");
      if (choices != null && choices.isArray() && choices.size() > 0) {
        JsonNode messageNode = choices.get(0).get("message");
        if (messageNode != null && messageNode.has("content")) {
          return messageNode.get("content").asText();
        }
      }
    }
    throw new IllegalStateException("Invalid response format from OpenAI API");
  }
}
