package com.jobmatch.matcher.service.embedding;

import java.util.List;

import org.springframework.stereotype.Service;

import com.jobmatch.matcher.config.MatcherProperties;
import com.jobmatch.matcher.exception.EmbeddingProviderException;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Batch front for the embedding provider. Returns one row per input text in input order and never
 * retries; a failing batch fails the whole call.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EmbeddingGateway {

  private final EmbeddingProviderSelector providerSelector;
  private final MatcherProperties properties;

  public double[][] embed(List<String> texts) {
    if (texts == null || texts.isEmpty()) {
      throw new IllegalArgumentException("Cannot embed an empty list of texts");
    }

    EmbeddingProvider provider = providerSelector.getProvider();
    int batchSize =
        Math.max(1, Math.min(properties.getEmbedding().getBatchSize(), provider.maxBatchSize()));
    log.info(
        "Embedding {} texts with {} in batches of {}",
        texts.size(),
        provider.getModelId(),
        batchSize);

    double[][] matrix = new double[texts.size()][];
    for (int start = 0; start < texts.size(); start += batchSize) {
      int end = Math.min(start + batchSize, texts.size());
      List<float[]> batch = callProvider(provider, texts.subList(start, end));
      if (batch == null || batch.size() != end - start) {
        throw new EmbeddingProviderException(
            String.format(
                "Provider returned %d vectors for a batch of %d texts",
                batch == null ? 0 : batch.size(), end - start));
      }
      for (int i = 0; i < batch.size(); i++) {
        matrix[start + i] = toDoubles(batch.get(i));
      }
    }
    return matrix;
  }

  /** Embeds a single text and returns its vector. */
  public double[] embedOne(String text) {
    return embed(List.of(text))[0];
  }

  private List<float[]> callProvider(EmbeddingProvider provider, List<String> batch) {
    try {
      return provider.embed(batch);
    } catch (EmbeddingProviderException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new EmbeddingProviderException("Embedding provider call failed: " + e.getMessage(), e);
    }
  }

  private static double[] toDoubles(float[] vector) {
    double[] out = new double[vector.length];
    for (int i = 0; i < vector.length; i++) {
      out[i] = vector[i];
    }
    return out;
  }
}
