package com.jobmatch.matcher.UnitTests.service.embedding;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.jobmatch.matcher.config.MatcherProperties;
import com.jobmatch.matcher.exception.EmbeddingProviderException;
import com.jobmatch.matcher.service.embedding.EmbeddingGateway;
import com.jobmatch.matcher.service.embedding.EmbeddingProvider;
import com.jobmatch.matcher.service.embedding.EmbeddingProviderSelector;

@ExtendWith(MockitoExtension.class)
@DisplayName("EmbeddingGateway Tests")
class EmbeddingGatewayTest {

  @Mock private EmbeddingProviderSelector providerSelector;
  @Mock private EmbeddingProvider provider;

  private EmbeddingGateway gateway;

  @BeforeEach
  void setUp() {
    MatcherProperties properties = new MatcherProperties();
    properties.getEmbedding().setBatchSize(2);
    gateway = new EmbeddingGateway(providerSelector, properties);
  }

  @Test
  @DisplayName("Should split input into batches and keep input order")
  void shouldBatchInOrder() {
    when(providerSelector.getProvider()).thenReturn(provider);
    when(provider.maxBatchSize()).thenReturn(100);
    when(provider.getModelId()).thenReturn("test-model");
    when(provider.embed(anyList())).thenAnswer(invocation -> vectorsFor(invocation.getArgument(0)));

    double[][] matrix = gateway.embed(List.of("a", "bb", "ccc", "dddd", "eeeee"));

    assertThat(matrix).hasNumberOfRows(5);
    for (int i = 0; i < 5; i++) {
      assertThat(matrix[i][0]).isEqualTo(i + 1.0);
    }
    verify(provider, times(3)).embed(anyList());
  }

  @Test
  @DisplayName("Should respect a provider limit smaller than the configured batch size")
  void shouldRespectProviderLimit() {
    when(providerSelector.getProvider()).thenReturn(provider);
    when(provider.maxBatchSize()).thenReturn(1);
    when(provider.getModelId()).thenReturn("single");
    when(provider.embed(anyList())).thenAnswer(invocation -> vectorsFor(invocation.getArgument(0)));

    gateway.embed(List.of("a", "b", "c"));

    verify(provider, times(3)).embed(anyList());
  }

  @Test
  @DisplayName("Should fail the whole call when a batch comes back short")
  void shouldFailOnCountMismatch() {
    when(providerSelector.getProvider()).thenReturn(provider);
    when(provider.maxBatchSize()).thenReturn(100);
    when(provider.getModelId()).thenReturn("test-model");
    when(provider.embed(anyList())).thenReturn(List.of(new float[] {1f}));

    assertThatThrownBy(() -> gateway.embed(List.of("a", "b")))
        .isInstanceOf(EmbeddingProviderException.class)
        .hasMessageContaining("1 vectors for a batch of 2");
  }

  @Test
  @DisplayName("Should wrap unexpected provider failures")
  void shouldWrapProviderFailure() {
    when(providerSelector.getProvider()).thenReturn(provider);
    when(provider.maxBatchSize()).thenReturn(100);
    when(provider.getModelId()).thenReturn("test-model");
    when(provider.embed(anyList())).thenThrow(new IllegalStateException("socket closed"));

    assertThatThrownBy(() -> gateway.embedOne("a"))
        .isInstanceOf(EmbeddingProviderException.class)
        .hasMessageContaining("socket closed");
  }

  @Test
  @DisplayName("Should reject empty input without calling a provider")
  void shouldRejectEmptyInput() {
    assertThatThrownBy(() -> gateway.embed(List.of()))
        .isInstanceOf(IllegalArgumentException.class);
    verifyNoInteractions(providerSelector);
  }

  private static List<float[]> vectorsFor(List<String> texts) {
    List<float[]> vectors = new ArrayList<>();
    for (String text : texts) {
      vectors.add(new float[] {text.length(), 0f});
    }
    return vectors;
  }
}
