package com.jobmatch.matcher.service.prediction;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

import org.springframework.stereotype.Component;

import com.jobmatch.matcher.config.MatcherProperties;
import com.jobmatch.matcher.dto.corpus.JobPosting;
import com.jobmatch.matcher.dto.prediction.RankedPosting;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Education-level and region filters over a ranked list.
 *
 * <p>The list is cut to the ranking cap before filtering and to the display cap after. When the
 * filters leave nothing, the unfiltered top of the ranking is returned instead of an empty list.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class EligibilityFilter {

  static final Map<String, Integer> LEVEL_HIERARCHY =
      Map.of("Bac+2", 0, "Bac+3", 1, "Bac+4", 2, "Master", 3);

  private final MatcherProperties properties;

  public Selection apply(List<RankedPosting> ranked, String educationLevel, String region) {
    MatcherProperties.Inference caps = properties.getInference();
    List<RankedPosting> candidates = head(ranked, caps.getRankingCap());

    Integer requested =
        educationLevel == null ? null : LEVEL_HIERARCHY.get(normalizeLevel(educationLevel));
    if (requested != null) {
      candidates =
          candidates.stream()
              .filter(posting -> levelAllows(posting.getLevel(), requested))
              .collect(Collectors.toList());
    }
    if (region != null && !region.isEmpty()) {
      candidates =
          candidates.stream()
              .filter(posting -> region.equals(posting.getRegion()))
              .collect(Collectors.toList());
    }

    if (candidates.isEmpty()) {
      log.warn(
          "No posting survived filters (level={}, region={}); returning top {} unfiltered",
          educationLevel,
          region,
          caps.getFallbackSize());
      return new Selection(head(ranked, caps.getFallbackSize()), true);
    }
    return new Selection(head(candidates, caps.getDisplayCap()), false);
  }

  /** A posting passes when it needs no level or its level is at or below the requested one. */
  static boolean levelAllows(String postingLevel, int requested) {
    if (postingLevel != null
        && JobPosting.NO_LEVEL_REQUIRED.equalsIgnoreCase(postingLevel.strip())) {
      return true;
    }
    if (postingLevel == null) {
      return false;
    }
    Integer rank = LEVEL_HIERARCHY.get(normalizeLevel(postingLevel));
    return rank != null && rank <= requested;
  }

  /** Trims and title-cases: the first letter of every run of letters upper, the rest lower. */
  static String normalizeLevel(String level) {
    String trimmed = level.strip().toLowerCase(Locale.ROOT);
    StringBuilder out = new StringBuilder(trimmed.length());
    boolean previousLetter = false;
    for (int i = 0; i < trimmed.length(); i++) {
      char c = trimmed.charAt(i);
      out.append(previousLetter ? c : Character.toUpperCase(c));
      previousLetter = Character.isLetter(c);
    }
    return out.toString();
  }

  private static List<RankedPosting> head(List<RankedPosting> postings, int size) {
    return List.copyOf(postings.subList(0, Math.min(Math.max(size, 0), postings.size())));
  }

  /** Postings to display and whether they came from the unfiltered fallback. */
  @Getter
  @RequiredArgsConstructor
  public static class Selection {
    private final List<RankedPosting> postings;
    private final boolean fallback;
  }
}
