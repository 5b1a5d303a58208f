package com.jobmatch.matcher.service.embedding;

import java.util.List;

/** Maps texts to fixed-length vectors, one per input and in input order. */
public interface EmbeddingProvider {

  /**
   * Embeds a batch of texts.
   *
   * @param texts the texts to embed, never empty
   * @return one vector per input text, same order
   * @throws com.jobmatch.matcher.exception.EmbeddingProviderException on transport or auth failure
   */
  List<float[]> embed(List<String> texts);

  /** Largest batch the provider accepts in one call. */
  int maxBatchSize();

  String getModelId();

  boolean isConfigured();
}
