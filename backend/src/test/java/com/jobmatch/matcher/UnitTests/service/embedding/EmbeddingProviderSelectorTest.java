package com.jobmatch.matcher.UnitTests.service.embedding;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.lenient;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import com.jobmatch.matcher.exception.EmbeddingProviderException;
import com.jobmatch.matcher.service.embedding.BedrockEmbeddingProvider;
import com.jobmatch.matcher.service.embedding.EmbeddingProviderSelector;
import com.jobmatch.matcher.service.embedding.OpenAIEmbeddingProvider;

@ExtendWith(MockitoExtension.class)
@DisplayName("EmbeddingProviderSelector Tests")
class EmbeddingProviderSelectorTest {

  @Mock private OpenAIEmbeddingProvider openAIEmbeddingProvider;
  @Mock private BedrockEmbeddingProvider bedrockEmbeddingProvider;

  @InjectMocks private EmbeddingProviderSelector selector;

  @Test
  @DisplayName("Should use the preferred provider when it is configured")
  void shouldUsePreferredProvider() {
    ReflectionTestUtils.setField(selector, "preferredProvider", "bedrock");
    lenient().when(openAIEmbeddingProvider.isConfigured()).thenReturn(true);
    lenient().when(bedrockEmbeddingProvider.isConfigured()).thenReturn(true);

    assertThat(selector.getProvider()).isSameAs(bedrockEmbeddingProvider);
  }

  @Test
  @DisplayName("Should fall back to any configured provider")
  void shouldFallBack() {
    ReflectionTestUtils.setField(selector, "preferredProvider", "openai");
    lenient().when(openAIEmbeddingProvider.isConfigured()).thenReturn(false);
    lenient().when(bedrockEmbeddingProvider.isConfigured()).thenReturn(true);

    assertThat(selector.getProvider()).isSameAs(bedrockEmbeddingProvider);
  }

  @Test
  @DisplayName("Should fail when no provider is configured")
  void shouldFailWithoutProvider() {
    ReflectionTestUtils.setField(selector, "preferredProvider", "openai");
    lenient().when(openAIEmbeddingProvider.isConfigured()).thenReturn(false);
    lenient().when(bedrockEmbeddingProvider.isConfigured()).thenReturn(false);

    assertThatThrownBy(() -> selector.getProvider())
        .isInstanceOf(EmbeddingProviderException.class)
        .hasMessageContaining("No embedding provider");
  }
}
