package com.jobmatch.matcher.UnitTests.service.text;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import com.jobmatch.matcher.service.text.TextNormalizer;

@DisplayName("TextNormalizer Tests")
class TextNormalizerTest {

  private TextNormalizer normalizer;

  @BeforeEach
  void setUp() {
    normalizer = new TextNormalizer();
  }

  @Nested
  @DisplayName("Noise removal")
  class NoiseRemoval {

    @Test
    @DisplayName("Should strip URLs, hashtags, digits and punctuation")
    void shouldStripNoise() {
      String cleaned =
          normalizer.clean("Apply at https://jobs.example.com/42 #Hiring 2024: Spark, Kafka!");

      assertThat(cleaned).isEqualTo("apply at hiring spark kafka");
    }

    @Test
    @DisplayName("Should lower-case and collapse whitespace")
    void shouldLowerCaseAndCollapseWhitespace() {
      assertThat(normalizer.clean("  Data\t\tEngineer \n Python  "))
          .isEqualTo("data engineer python");
    }

    @Test
    @DisplayName("Should return empty string for null or blank input")
    void shouldHandleEmptyInput() {
      assertThat(normalizer.clean(null)).isEmpty();
      assertThat(normalizer.clean("")).isEmpty();
      assertThat(normalizer.clean("123 456 !!!")).isEmpty();
    }
  }

  @Nested
  @DisplayName("Stopwords and lemmas")
  class StopwordsAndLemmas {

    @Test
    @DisplayName("Should drop French stopwords")
    void shouldDropFrenchStopwords() {
      assertThat(normalizer.clean("le poste est pour une entreprise de la tech"))
          .isEqualTo("poste entreprise tech");
      assertThat(normalizer.isStopWord("le")).isTrue();
      assertThat(normalizer.isStopWord("kafka")).isFalse();
    }

    @Test
    @DisplayName("Should reduce plural nouns to their singular form")
    void shouldLemmatizePlurals() {
      assertThat(normalizer.clean("Developers and Engineers")).isEqualTo("developer and engineer");
      assertThat(normalizer.clean("skills teams managers companies"))
          .isEqualTo("skill team manager company");
    }

    @Test
    @DisplayName("Should leave singular and unknown tokens unchanged")
    void shouldPassUnknownTokensThrough() {
      assertThat(normalizer.clean("kafka terraform airflow")).isEqualTo("kafka terraform airflow");
      assertThat(normalizer.clean("class status")).isEqualTo("class status");
    }

    @Test
    @DisplayName("Should be deterministic")
    void shouldBeDeterministic() {
      String text = "Senior développeur Java, 5 ans d'expérience";
      assertThat(normalizer.clean(text)).isEqualTo(normalizer.clean(text));
    }
  }
}
