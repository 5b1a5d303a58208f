package com.jobmatch.matcher.UnitTests.service.artifact;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Arrays;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.jobmatch.matcher.service.artifact.TensorCodec;

@DisplayName("TensorCodec Tests")
class TensorCodecTest {

  @Test
  @DisplayName("Should preserve awkward doubles exactly")
  void shouldPreserveBits() {
    double[][] matrix = {
      {0.1, -0.0, Double.MIN_VALUE},
      {Double.MAX_VALUE, Double.NaN, 1.0 / 3}
    };

    double[][] decoded = TensorCodec.decodeMatrix(TensorCodec.encodeMatrix(matrix));

    for (int r = 0; r < matrix.length; r++) {
      for (int c = 0; c < matrix[r].length; c++) {
        assertThat(Double.doubleToRawLongBits(decoded[r][c]))
            .isEqualTo(Double.doubleToRawLongBits(matrix[r][c]));
      }
    }
  }

  @Test
  @DisplayName("Should keep the shape of an empty matrix")
  void shouldHandleEmptyMatrix() {
    assertThat(TensorCodec.decodeMatrix(TensorCodec.encodeMatrix(new double[0][]))).isEmpty();
  }

  @Test
  @DisplayName("Should reject ragged matrices")
  void shouldRejectRaggedMatrix() {
    assertThatThrownBy(() -> TensorCodec.encodeMatrix(new double[][] {{1, 2}, {3}}))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  @DisplayName("Should refuse to read labels as a matrix")
  void shouldCheckDtype() {
    byte[] labels = TensorCodec.encodeLabels(new int[] {0, 1, 2});

    assertThatThrownBy(() -> TensorCodec.decodeMatrix(labels))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("dtype");
  }

  @Test
  @DisplayName("Should detect truncated and foreign content")
  void shouldDetectCorruption() {
    byte[] encoded = TensorCodec.encodeMatrix(new double[][] {{1.0, 2.0}});
    byte[] truncated = Arrays.copyOf(encoded, encoded.length - 3);

    assertThatThrownBy(() -> TensorCodec.decodeMatrix(truncated))
        .isInstanceOf(IllegalStateException.class);
    assertThatThrownBy(() -> TensorCodec.decodeLabels("not a tensor".getBytes()))
        .isInstanceOf(IllegalStateException.class);
  }
}
