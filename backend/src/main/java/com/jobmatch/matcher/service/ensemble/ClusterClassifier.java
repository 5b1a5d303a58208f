package com.jobmatch.matcher.service.ensemble;

import java.util.OptionalDouble;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * A fitted classifier mapping an embedding to a cluster id. Families that produce class
 * probabilities expose the probability of the predicted class through {@link
 * #predictConfidence(double[])}; the others return empty.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
  @JsonSubTypes.Type(value = ConstantClassifier.class, name = "constant"),
  @JsonSubTypes.Type(value = RandomForestClassifier.class, name = "random-forest"),
  @JsonSubTypes.Type(value = LinearSvmClassifier.class, name = "linear-svm"),
  @JsonSubTypes.Type(value = LogisticRegressionClassifier.class, name = "logistic-regression"),
  @JsonSubTypes.Type(value = KNearestNeighborsClassifier.class, name = "knn"),
  @JsonSubTypes.Type(value = GradientBoostingClassifier.class, name = "gradient-boosting")
})
public interface ClusterClassifier {

  int predict(double[] vector);

  default OptionalDouble predictConfidence(double[] vector) {
    return OptionalDouble.empty();
  }
}
