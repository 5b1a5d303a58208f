package com.jobmatch.matcher.service.artifact;

import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.Getter;

/**
 * Outcome of promoting one bundle. Member names are relative to the bundle prefix so a caller can
 * retry exactly the failed subset.
 */
@Getter
public class PromotionResult {

  private final String platform;
  private final String region;
  private final Set<String> promoted = new TreeSet<>();
  private final Set<String> failed = new TreeSet<>();
  private final Map<String, String> errors = new TreeMap<>();

  public PromotionResult(String platform, String region) {
    this.platform = platform;
    this.region = region;
  }

  void markPromoted(String member) {
    promoted.add(member);
    failed.remove(member);
    errors.remove(member);
  }

  void markFailed(String member, String reason) {
    promoted.remove(member);
    failed.add(member);
    errors.put(member, reason);
  }

  public Set<String> getPromoted() {
    return Collections.unmodifiableSet(promoted);
  }

  public Set<String> getFailed() {
    return Collections.unmodifiableSet(failed);
  }

  public Map<String, String> getErrors() {
    return Collections.unmodifiableMap(errors);
  }

  /** True when something was promoted and nothing failed. */
  @JsonProperty("success")
  public boolean isSuccess() {
    return failed.isEmpty() && !promoted.isEmpty();
  }
}
