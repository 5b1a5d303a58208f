package com.jobmatch.matcher.service.clustering;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.Getter;

/**
 * A fitted centroid partition: {@code k} centroids plus the label of every training point. Every
 * label lies in {@code [0, k)}.
 */
@Getter
public class CentroidModel {

  private final int clusterCount;
  private final double[][] centroids;
  private final int[] labels;
  private final double inertia;
  private final double dispersion;

  @JsonCreator
  public CentroidModel(
      @JsonProperty("clusterCount") int clusterCount,
      @JsonProperty("centroids") double[][] centroids,
      @JsonProperty("labels") int[] labels,
      @JsonProperty("inertia") double inertia,
      @JsonProperty("dispersion") double dispersion) {
    if (centroids == null || centroids.length != clusterCount || clusterCount < 1) {
      throw new IllegalArgumentException(
          "Centroid model needs exactly " + clusterCount + " centroids");
    }
    this.clusterCount = clusterCount;
    this.centroids = centroids;
    this.labels = labels == null ? new int[0] : labels;
    for (int label : this.labels) {
      if (label < 0 || label >= clusterCount) {
        throw new IllegalArgumentException("Label " + label + " outside [0, " + clusterCount + ")");
      }
    }
    this.inertia = inertia;
    this.dispersion = dispersion;
  }

  /** Label of the nearest centroid for a new point. */
  public int predict(double[] point) {
    return VectorMath.nearest(point, centroids);
  }

  @JsonIgnore
  public int getDimension() {
    return centroids[0].length;
  }
}
