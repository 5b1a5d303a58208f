package com.jobmatch.matcher.service.ensemble;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Roster of fitted classifiers in voting order. Never empty; all accuracies come from the same
 * holdout split.
 */
public class ClassifierEnsemble {

  private final Map<String, ScoredClassifier> members = new LinkedHashMap<>();

  public ClassifierEnsemble(List<ScoredClassifier> roster) {
    if (roster == null || roster.isEmpty()) {
      throw new IllegalArgumentException("An ensemble needs at least one classifier");
    }
    for (ScoredClassifier member : roster) {
      if (members.put(member.getName(), member) != null) {
        throw new IllegalArgumentException("Duplicate classifier name " + member.getName());
      }
    }
  }

  public Map<String, ScoredClassifier> getMembers() {
    return Collections.unmodifiableMap(members);
  }

  public Map<String, Double> getScores() {
    Map<String, Double> scores = new LinkedHashMap<>();
    members.forEach((name, member) -> scores.put(name, member.getAccuracy()));
    return scores;
  }

  /** Highest holdout accuracy, earliest roster member on ties. */
  public String getBestModel() {
    String best = null;
    double bestScore = Double.NEGATIVE_INFINITY;
    for (ScoredClassifier member : members.values()) {
      if (member.getAccuracy() > bestScore) {
        bestScore = member.getAccuracy();
        best = member.getName();
      }
    }
    return best;
  }

  public int size() {
    return members.size();
  }
}
