package com.jobmatch.matcher.fixtures;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import com.jobmatch.matcher.config.MatcherProperties;
import com.jobmatch.matcher.dto.corpus.CleanedPosting;
import com.jobmatch.matcher.dto.corpus.JobPosting;

/** Shared test data: well separated embedding blobs and matching postings. */
public final class MatcherFixtures {

  private MatcherFixtures() {}

  /** Small, fast settings for the numeric components. */
  public static MatcherProperties properties() {
    MatcherProperties properties = new MatcherProperties();
    properties.setPlatforms(new ArrayList<>(List.of("linkedin")));
    properties.setRegions(new ArrayList<>(List.of("france")));
    properties.getClustering().setRestarts(3);
    properties.getClustering().setMaxIterations(100);
    properties.getEnsemble().setForestTrees(10);
    properties.getEnsemble().setBoostingRounds(10);
    return properties;
  }

  /**
   * {@code clusters} groups of {@code perCluster} points, group {@code c} lying close to the unit
   * vector on axis {@code c} of a {@code dimension}-dimensional space.
   */
  public static double[][] blobs(int clusters, int perCluster, int dimension, long seed) {
    Random random = new Random(seed);
    double[][] points = new double[clusters * perCluster][];
    for (int c = 0; c < clusters; c++) {
      for (int i = 0; i < perCluster; i++) {
        double[] point = new double[dimension];
        for (int d = 0; d < dimension; d++) {
          point[d] = random.nextGaussian() * 0.02 + 0.05;
        }
        point[c % dimension] += 1.0;
        points[c * perCluster + i] = point;
      }
    }
    return points;
  }

  /** Group index of every row produced by {@link #blobs}. */
  public static int[] blobLabels(int clusters, int perCluster) {
    int[] labels = new int[clusters * perCluster];
    for (int i = 0; i < labels.length; i++) {
      labels[i] = i / perCluster;
    }
    return labels;
  }

  public static JobPosting posting(int index) {
    return JobPosting.builder()
        .url("https://jobs.example.com/" + index)
        .company("Company " + index)
        .title("Data Engineer " + index)
        .location("Paris")
        .publicationDate("2024-05-0" + (index % 9 + 1))
        .summary("Build data pipelines with Spark and Kafka, posting " + index)
        .summaryFr("Construire des pipelines de données, offre " + index)
        .level("Bac+3")
        .region("ile_de_france")
        .build();
  }

  public static List<CleanedPosting> cleanedPostings(int count) {
    List<CleanedPosting> postings = new ArrayList<>();
    for (int i = 0; i < count; i++) {
      postings.add(new CleanedPosting(posting(i), "build data pipeline spark kafka " + i));
    }
    return postings;
  }
}
