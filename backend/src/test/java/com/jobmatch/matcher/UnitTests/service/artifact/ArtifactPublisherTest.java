package com.jobmatch.matcher.UnitTests.service.artifact;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.when;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.jobmatch.matcher.config.MatcherProperties;
import com.jobmatch.matcher.exception.StorageException;
import com.jobmatch.matcher.fixtures.MatcherFixtures;
import com.jobmatch.matcher.service.artifact.ArtifactPublisher;
import com.jobmatch.matcher.service.artifact.ArtifactStore;
import com.jobmatch.matcher.service.artifact.PromotionResult;

@ExtendWith(MockitoExtension.class)
@DisplayName("ArtifactPublisher Tests")
class ArtifactPublisherTest {

  @Mock private ArtifactStore artifactStore;

  private ArtifactPublisher publisher;

  @BeforeEach
  void setUp() {
    MatcherProperties properties = MatcherFixtures.properties();
    properties.setPlatforms(new ArrayList<>(List.of("apec", "linkedin")));
    publisher = new ArtifactPublisher(artifactStore, properties);
  }

  @Test
  @DisplayName("Should keep promoting the remaining pairs after one aborts")
  void shouldIsolateFailures() {
    PromotionResult ok = new PromotionResult("linkedin", "france");
    when(artifactStore.promote("apec", "france", null))
        .thenThrow(new StorageException("bucket unreachable"));
    when(artifactStore.promote("linkedin", "france", null)).thenReturn(ok);

    Map<String, PromotionResult> results = publisher.promoteAll();

    assertThat(results).containsOnlyKeys("apec_france", "linkedin_france");
    assertThat(results.get("apec_france").getFailed()).containsExactly("*");
    assertThat(results.get("apec_france").getErrors()).containsEntry("*", "bucket unreachable");
    assertThat(results.get("linkedin_france")).isSameAs(ok);
  }

  @Test
  @DisplayName("Should pass an explicit member subset through")
  void shouldPassSubset() {
    PromotionResult expected = new PromotionResult("apec", "france");
    when(artifactStore.promote("apec", "france", Set.of("labels.bin"))).thenReturn(expected);

    assertThat(publisher.promote("apec", "france", Set.of("labels.bin")))
        .isSameAs(expected);
  }

  @Test
  @DisplayName("Should promote everything when no subset is given")
  void shouldPromoteAllMembersByDefault() {
    PromotionResult expected = new PromotionResult("apec", "france");
    when(artifactStore.promote(eq("apec"), eq("france"), isNull()))
        .thenReturn(expected);

    assertThat(publisher.promote("apec", "france", null)).isSameAs(expected);
  }
}
