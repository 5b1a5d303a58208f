package com.jobmatch.matcher.UnitTests.service.generation;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.jobmatch.matcher.service.generation.GroundedPromptComposer;
import com.jobmatch.matcher.service.generation.PromptTemplateLoader;

@DisplayName("GroundedPromptComposer Tests")
class GroundedPromptComposerTest {

  private GroundedPromptComposer composer;

  @BeforeEach
  void setUp() {
    composer = new GroundedPromptComposer(new PromptTemplateLoader());
    composer.init();
  }

  @Test
  @DisplayName("Should place the context passages and the instruction in the template")
  void shouldFillTemplate() {
    String message =
        composer.compose("List the missing skills", List.of("Candidate knows SQL", "Job wants Go"));

    assertThat(message)
        .contains("Candidate knows SQL\n\nJob wants Go")
        .contains("List the missing skills")
        .doesNotContain("{{CONTEXT}}")
        .doesNotContain("{{QUERY}}");
  }

  @Test
  @DisplayName("Should tolerate missing context")
  void shouldHandleNullContext() {
    assertThat(composer.compose("Write a letter", null)).contains("Write a letter");
  }
}
