package com.jobmatch.matcher.service.ensemble;

import java.util.OptionalDouble;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.Getter;

/** Predicts the single label it was trained on, with full confidence. */
@Getter
public class ConstantClassifier implements ClusterClassifier {

  private final int label;

  @JsonCreator
  public ConstantClassifier(@JsonProperty("label") int label) {
    this.label = label;
  }

  @Override
  public int predict(double[] vector) {
    return label;
  }

  @Override
  public OptionalDouble predictConfidence(double[] vector) {
    return OptionalDouble.of(1.0);
  }
}
