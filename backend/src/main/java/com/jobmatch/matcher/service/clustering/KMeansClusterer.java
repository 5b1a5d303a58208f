package com.jobmatch.matcher.service.clustering;

import java.util.Random;

import org.springframework.stereotype.Component;

import com.jobmatch.matcher.config.MatcherProperties;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Lloyd's k-means with k-means++ seeding. Several seeded restarts are run and the one with the
 * lowest cosine dispersion is kept, since that is the quantity the cluster-count search compares.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class KMeansClusterer {

  private final MatcherProperties properties;

  public CentroidModel fit(double[][] points, int k) {
    return fit(points, k, null);
  }

  /**
   * Fits {@code k} centroids. When {@code previous} holds {@code k - 1} centroids, the previous
   * solution extended by the worst-served point is also a candidate, which keeps dispersion from
   * rising as {@code k} grows.
   */
  public CentroidModel fit(double[][] points, int k, CentroidModel previous) {
    if (points.length == 0) {
      throw new IllegalArgumentException("Cannot cluster an empty set of points");
    }
    if (k < 1 || k > points.length) {
      throw new IllegalArgumentException(
          "Cluster count " + k + " must be between 1 and " + points.length);
    }
    MatcherProperties.Clustering config = properties.getClustering();
    Random random = new Random(config.getRandomSeed() + k);

    CentroidModel best = null;
    int restarts = Math.max(1, config.getRestarts());
    for (int run = 0; run < restarts; run++) {
      double[][] centroids = seedPlusPlus(points, k, random);
      CentroidModel candidate = refine(points, centroids, config);
      if (best == null || candidate.getDispersion() < best.getDispersion()) {
        best = candidate;
      }
    }

    if (previous != null && previous.getClusterCount() == k - 1) {
      double[][] extended = extend(points, previous.getCentroids());
      CentroidModel unrefined = assign(points, extended);
      CentroidModel refined = refine(points, VectorMath.copy(extended), config);
      CentroidModel warm =
          refined.getDispersion() <= unrefined.getDispersion() ? refined : unrefined;
      if (warm.getDispersion() < best.getDispersion()) {
        best = warm;
      }
    }

    log.debug("k={} dispersion={} inertia={}", k, best.getDispersion(), best.getInertia());
    return best;
  }

  /** Sum over points of the squared minimum cosine distance to any centroid. */
  public static double dispersion(double[][] points, double[][] centroids) {
    double total = 0.0;
    for (double[] point : points) {
      double min = Double.POSITIVE_INFINITY;
      for (double[] centroid : centroids) {
        min = Math.min(min, VectorMath.cosineDistance(point, centroid));
      }
      total += min * min;
    }
    return total;
  }

  private CentroidModel refine(
      double[][] points, double[][] centroids, MatcherProperties.Clustering config) {
    int k = centroids.length;
    int dimension = points[0].length;
    int[] labels = new int[points.length];

    for (int iteration = 0; iteration < config.getMaxIterations(); iteration++) {
      for (int i = 0; i < points.length; i++) {
        labels[i] = VectorMath.nearest(points[i], centroids);
      }

      double[][] sums = new double[k][dimension];
      int[] counts = new int[k];
      for (int i = 0; i < points.length; i++) {
        counts[labels[i]]++;
        double[] sum = sums[labels[i]];
        for (int d = 0; d < dimension; d++) {
          sum[d] += points[i][d];
        }
      }

      double shift = 0.0;
      for (int c = 0; c < k; c++) {
        double[] updated;
        if (counts[c] == 0) {
          updated = points[farthestPoint(points, centroids, labels)].clone();
        } else {
          updated = new double[dimension];
          for (int d = 0; d < dimension; d++) {
            updated[d] = sums[c][d] / counts[c];
          }
        }
        shift += VectorMath.squaredEuclidean(updated, centroids[c]);
        centroids[c] = updated;
      }
      if (shift <= config.getTolerance() * config.getTolerance()) {
        break;
      }
    }
    return assign(points, centroids);
  }

  private static CentroidModel assign(double[][] points, double[][] centroids) {
    int[] labels = new int[points.length];
    double inertia = 0.0;
    for (int i = 0; i < points.length; i++) {
      labels[i] = VectorMath.nearest(points[i], centroids);
      inertia += VectorMath.squaredEuclidean(points[i], centroids[labels[i]]);
    }
    return new CentroidModel(
        centroids.length, centroids, labels, inertia, dispersion(points, centroids));
  }

  private static double[][] seedPlusPlus(double[][] points, int k, Random random) {
    double[][] centroids = new double[k][];
    centroids[0] = points[random.nextInt(points.length)].clone();
    double[] distances = new double[points.length];
    for (int i = 0; i < points.length; i++) {
      distances[i] = VectorMath.squaredEuclidean(points[i], centroids[0]);
    }

    for (int c = 1; c < k; c++) {
      double total = 0.0;
      for (double distance : distances) {
        total += distance;
      }
      int chosen;
      if (total <= 0.0) {
        // every point already sits on a centroid
        chosen = random.nextInt(points.length);
      } else {
        double target = random.nextDouble() * total;
        chosen = points.length - 1;
        double cumulative = 0.0;
        for (int i = 0; i < points.length; i++) {
          cumulative += distances[i];
          if (cumulative >= target) {
            chosen = i;
            break;
          }
        }
      }
      centroids[c] = points[chosen].clone();
      for (int i = 0; i < points.length; i++) {
        distances[i] = Math.min(distances[i], VectorMath.squaredEuclidean(points[i], centroids[c]));
      }
    }
    return centroids;
  }

  private static double[][] extend(double[][] points, double[][] previous) {
    int worst = 0;
    double worstDistance = -1.0;
    for (int i = 0; i < points.length; i++) {
      double min = Double.POSITIVE_INFINITY;
      for (double[] centroid : previous) {
        min = Math.min(min, VectorMath.cosineDistance(points[i], centroid));
      }
      if (min > worstDistance) {
        worstDistance = min;
        worst = i;
      }
    }
    double[][] extended = new double[previous.length + 1][];
    for (int c = 0; c < previous.length; c++) {
      extended[c] = previous[c].clone();
    }
    extended[previous.length] = points[worst].clone();
    return extended;
  }

  private static int farthestPoint(double[][] points, double[][] centroids, int[] labels) {
    int farthest = 0;
    double farthestDistance = -1.0;
    for (int i = 0; i < points.length; i++) {
      double distance = VectorMath.squaredEuclidean(points[i], centroids[labels[i]]);
      if (distance > farthestDistance) {
        farthestDistance = distance;
        farthest = i;
      }
    }
    return farthest;
  }
}
