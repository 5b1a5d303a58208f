package com.jobmatch.matcher.service.artifact;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

import org.springframework.stereotype.Service;

import com.jobmatch.matcher.config.MatcherProperties;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/** Promotes staged bundles for every configured platform and region. */
@Slf4j
@Service
@RequiredArgsConstructor
public class ArtifactPublisher {

  private final ArtifactStore artifactStore;
  private final MatcherProperties properties;

  /** Results keyed {@code <platform>_<region>}; a failing pair never stops the others. */
  public Map<String, PromotionResult> promoteAll() {
    Map<String, PromotionResult> results = new LinkedHashMap<>();
    for (String platform : properties.getPlatforms()) {
      for (String region : properties.getRegions()) {
        results.put(platform + "_" + region, promote(platform, region, null));
      }
    }
    return results;
  }

  public PromotionResult promote(String platform, String region, Set<String> members) {
    try {
      return artifactStore.promote(platform, region, members);
    } catch (RuntimeException e) {
      log.error("Promotion of {} - {} aborted", platform, region, e);
      PromotionResult result = new PromotionResult(platform, region);
      result.markFailed("*", e.getMessage());
      return result;
    }
  }
}
