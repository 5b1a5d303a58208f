package com.jobmatch.matcher.service.generation;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.stream.Collectors;

import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;

import lombok.extern.slf4j.Slf4j;

@Slf4j
@Component
public class PromptTemplateLoader {

  private static final String PROMPTS_PATH = "prompts/";

  public String load(String promptName) throws IOException {
    String fileName = PROMPTS_PATH + promptName + ".txt";
    ClassPathResource resource = new ClassPathResource(fileName);

    try (BufferedReader reader =
        new BufferedReader(
            new InputStreamReader(resource.getInputStream(), StandardCharsets.UTF_8))) {
      return reader.lines().collect(Collectors.joining("\n")) + "\n";
    } catch (IOException e) {
      log.error("Failed to load prompt template: {}", fileName, e);
      throw new IOException("Failed to load prompt template: " + fileName, e);
    }
  }
}
