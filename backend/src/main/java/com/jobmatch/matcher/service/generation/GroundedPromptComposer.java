package com.jobmatch.matcher.service.generation;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;

import org.springframework.stereotype.Component;

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;

/** Wraps an instruction and its context passages into the single message sent to a provider. */
@Component
@RequiredArgsConstructor
public class GroundedPromptComposer {

  static final String TEMPLATE_NAME = "grounded-answer";

  private final PromptTemplateLoader templateLoader;
  private String template;

  @PostConstruct
  public void init() {
    try {
      template = templateLoader.load(TEMPLATE_NAME);
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  public String compose(String prompt, List<String> context) {
    String joined = context == null ? "" : String.join("\n\n", context);
    return template
        .replace("{{CONTEXT}}", joined)
        .replace("{{QUERY}}", prompt == null ? "" : prompt);
  }
}
