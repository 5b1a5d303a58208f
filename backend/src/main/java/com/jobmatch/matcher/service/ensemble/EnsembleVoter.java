package com.jobmatch.matcher.service.ensemble;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.OptionalDouble;

import org.springframework.stereotype.Component;

import lombok.extern.slf4j.Slf4j;

/**
 * Majority vote across the roster. Ties go to the cluster whose first vote came earliest in roster
 * order; confidences are recorded but never weigh in.
 */
@Slf4j
@Component
public class EnsembleVoter {

  public VoteResult vote(ClassifierEnsemble ensemble, double[] vector) {
    Map<String, Integer> votes = new LinkedHashMap<>();
    Map<String, Double> confidences = new LinkedHashMap<>();
    for (ScoredClassifier member : ensemble.getMembers().values()) {
      int predicted = member.getClassifier().predict(vector);
      OptionalDouble confidence = member.getClassifier().predictConfidence(vector);
      votes.put(member.getName(), predicted);
      confidences.put(member.getName(), confidence.isPresent() ? confidence.getAsDouble() : null);
    }
    int majority = majority(votes.values());
    log.debug("Ensemble votes {} -> cluster {}", votes, majority);
    return new VoteResult(majority, votes, confidences);
  }

  /** Most frequent value; on equal counts the value seen first wins. */
  public static int majority(Iterable<Integer> ballots) {
    Map<Integer, Integer> counts = new LinkedHashMap<>();
    for (Integer ballot : ballots) {
      counts.merge(ballot, 1, Integer::sum);
    }
    if (counts.isEmpty()) {
      throw new IllegalArgumentException("Cannot take a majority over zero votes");
    }
    int winner = 0;
    int winnerCount = -1;
    for (Map.Entry<Integer, Integer> entry : counts.entrySet()) {
      if (entry.getValue() > winnerCount) {
        winner = entry.getKey();
        winnerCount = entry.getValue();
      }
    }
    return winner;
  }
}
