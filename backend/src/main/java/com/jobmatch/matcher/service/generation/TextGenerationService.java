package com.jobmatch.matcher.service.generation;

import java.util.List;

/** Common interface for long-form text generation providers (OpenAI, AWS Bedrock). */
public interface TextGenerationService {

  /**
   * Answers a prompt grounded on the given context passages.
   *
   * @param prompt the instruction, including the expected output structure
   * @param context passages the answer must be grounded on
   * @return the generated text
   * @throws com.jobmatch.matcher.exception.GenerationProviderException if the call fails
   */
  String generate(String prompt, List<String> context);

  String getCurrentModelId();

  boolean isConfigured();
}
