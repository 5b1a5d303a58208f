package com.jobmatch.matcher.service.ensemble;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Random;

import com.fasterxml.jackson.annotation.JsonAutoDetect;

/**
 * Binary CART tree stored as flat node arrays. Classification trees split on weighted Gini impurity
 * and keep a class distribution per leaf; regression trees split on squared error and keep a
 * single value per leaf.
 */
@JsonAutoDetect(
    fieldVisibility = JsonAutoDetect.Visibility.ANY,
    getterVisibility = JsonAutoDetect.Visibility.NONE,
    isGetterVisibility = JsonAutoDetect.Visibility.NONE)
public class DecisionTree {

  private static final int LEAF = -1;

  private int[] feature;
  private double[] threshold;
  private int[] left;
  private int[] right;
  private double[][] value;

  private DecisionTree() {}

  /** Leaf output reached by {@code sample}. */
  public double[] output(double[] sample) {
    return value[leaf(sample)];
  }

  public int leaf(double[] sample) {
    int node = 0;
    while (feature[node] != LEAF) {
      node = sample[feature[node]] <= threshold[node] ? left[node] : right[node];
    }
    return node;
  }

  void setLeafValue(int node, double leafValue) {
    value[node] = new double[] {leafValue};
  }

  int nodeCount() {
    return feature.length;
  }

  /**
   * Grows a classification tree.
   *
   * @param labels class index of each row in {@code [0, classCount)}
   * @param weights per-row weight; zero-weight rows are ignored
   */
  static DecisionTree classifier(
      double[][] x,
      int[] labels,
      int classCount,
      double[] weights,
      int maxDepth,
      int maxFeatures,
      Random random) {
    List<Integer> rows = new ArrayList<>();
    for (int i = 0; i < x.length; i++) {
      if (weights[i] > 0) {
        rows.add(i);
      }
    }
    Grower grower = new Grower(x, maxDepth, maxFeatures, random);
    grower.classCount = classCount;
    grower.labels = labels;
    grower.weights = weights;
    grower.grow(toArray(rows), 0);
    return grower.build();
  }

  /** Grows a regression tree on {@code targets} using the given rows. */
  static DecisionTree regressor(
      double[][] x, double[] targets, int[] rows, int maxDepth, int maxFeatures, Random random) {
    Grower grower = new Grower(x, maxDepth, maxFeatures, random);
    grower.targets = targets;
    grower.grow(rows, 0);
    return grower.build();
  }

  private static int[] toArray(List<Integer> values) {
    return values.stream().mapToInt(Integer::intValue).toArray();
  }

  private static final class Grower {
    private final double[][] x;
    private final int maxDepth;
    private final int maxFeatures;
    private final Random random;

    private int classCount;
    private int[] labels;
    private double[] weights;
    private double[] targets;

    private final List<Integer> features = new ArrayList<>();
    private final List<Double> thresholds = new ArrayList<>();
    private final List<Integer> lefts = new ArrayList<>();
    private final List<Integer> rights = new ArrayList<>();
    private final List<double[]> values = new ArrayList<>();

    Grower(double[][] x, int maxDepth, int maxFeatures, Random random) {
      this.x = x;
      this.maxDepth = maxDepth;
      this.maxFeatures = maxFeatures;
      this.random = random;
    }

    private boolean classification() {
      return targets == null;
    }

    int grow(int[] rows, int depth) {
      int node = features.size();
      features.add(LEAF);
      thresholds.add(0.0);
      lefts.add(LEAF);
      rights.add(LEAF);
      values.add(leafValue(rows));

      if (rows.length < 2 || depth >= maxDepth || pure(rows)) {
        return node;
      }
      Split split = bestSplit(rows);
      if (split == null) {
        return node;
      }

      List<Integer> leftRows = new ArrayList<>();
      List<Integer> rightRows = new ArrayList<>();
      for (int row : rows) {
        if (x[row][split.feature] <= split.threshold) {
          leftRows.add(row);
        } else {
          rightRows.add(row);
        }
      }
      if (leftRows.isEmpty() || rightRows.isEmpty()) {
        return node;
      }
      features.set(node, split.feature);
      thresholds.set(node, split.threshold);
      int leftNode = grow(toArray(leftRows), depth + 1);
      lefts.set(node, leftNode);
      int rightNode = grow(toArray(rightRows), depth + 1);
      rights.set(node, rightNode);
      return node;
    }

    private double[] leafValue(int[] rows) {
      if (classification()) {
        double[] distribution = new double[classCount];
        double total = 0.0;
        for (int row : rows) {
          distribution[labels[row]] += weights[row];
          total += weights[row];
        }
        if (total > 0) {
          for (int c = 0; c < classCount; c++) {
            distribution[c] /= total;
          }
        }
        return distribution;
      }
      double sum = 0.0;
      for (int row : rows) {
        sum += targets[row];
      }
      return new double[] {rows.length == 0 ? 0.0 : sum / rows.length};
    }

    private boolean pure(int[] rows) {
      for (int row : rows) {
        if (classification() ? labels[row] != labels[rows[0]] : targets[row] != targets[rows[0]]) {
          return false;
        }
      }
      return true;
    }

    private Split bestSplit(int[] rows) {
      int dimension = x[0].length;
      int[] candidates = sampleFeatures(dimension);
      double parentScore = classification() ? giniScore(rows) : squaredErrorScore(rows);

      Split best = null;
      double bestScore = parentScore;
      Integer[] sorted = new Integer[rows.length];
      for (int f : candidates) {
        for (int i = 0; i < rows.length; i++) {
          sorted[i] = rows[i];
        }
        final int feat = f;
        Arrays.sort(sorted, Comparator.comparingDouble(row -> x[row][feat]));
        if (x[sorted[0]][f] == x[sorted[sorted.length - 1]][f]) {
          continue;
        }
        Split split = classification() ? scanGini(sorted, f) : scanSquaredError(sorted, f);
        if (split != null && split.score < bestScore - 1e-12) {
          bestScore = split.score;
          best = split;
        }
      }
      return best;
    }

    private int[] sampleFeatures(int dimension) {
      int count = Math.min(maxFeatures, dimension);
      if (count >= dimension) {
        int[] all = new int[dimension];
        for (int i = 0; i < dimension; i++) {
          all[i] = i;
        }
        return all;
      }
      int[] pool = new int[dimension];
      for (int i = 0; i < dimension; i++) {
        pool[i] = i;
      }
      for (int i = 0; i < count; i++) {
        int j = i + random.nextInt(dimension - i);
        int tmp = pool[i];
        pool[i] = pool[j];
        pool[j] = tmp;
      }
      return Arrays.copyOf(pool, count);
    }

    /** Weighted Gini impurity times node weight; lower is better. */
    private double giniScore(int[] rows) {
      double[] counts = new double[classCount];
      double total = 0.0;
      for (int row : rows) {
        counts[labels[row]] += weights[row];
        total += weights[row];
      }
      return total * gini(counts, total);
    }

    private static double gini(double[] counts, double total) {
      if (total <= 0) {
        return 0.0;
      }
      double sumSquares = 0.0;
      for (double count : counts) {
        double p = count / total;
        sumSquares += p * p;
      }
      return 1.0 - sumSquares;
    }

    private Split scanGini(Integer[] sorted, int f) {
      double[] leftCounts = new double[classCount];
      double[] rightCounts = new double[classCount];
      double leftTotal = 0.0;
      double rightTotal = 0.0;
      for (int row : sorted) {
        rightCounts[labels[row]] += weights[row];
        rightTotal += weights[row];
      }

      Split best = null;
      for (int i = 0; i < sorted.length - 1; i++) {
        int row = sorted[i];
        leftCounts[labels[row]] += weights[row];
        rightCounts[labels[row]] -= weights[row];
        leftTotal += weights[row];
        rightTotal -= weights[row];
        double current = x[row][f];
        double next = x[sorted[i + 1]][f];
        if (current == next) {
          continue;
        }
        double score =
            leftTotal * gini(leftCounts, leftTotal) + rightTotal * gini(rightCounts, rightTotal);
        if (best == null || score < best.score) {
          best = new Split(f, midpoint(current, next), score);
        }
      }
      return best;
    }

    /** Sum of squared deviations from the node mean. */
    private double squaredErrorScore(int[] rows) {
      double sum = 0.0;
      double sumSquares = 0.0;
      for (int row : rows) {
        sum += targets[row];
        sumSquares += targets[row] * targets[row];
      }
      return sumSquares - sum * sum / rows.length;
    }

    private Split scanSquaredError(Integer[] sorted, int f) {
      double total = 0.0;
      double totalSquares = 0.0;
      for (int row : sorted) {
        total += targets[row];
        totalSquares += targets[row] * targets[row];
      }
      double leftSum = 0.0;
      Split best = null;
      for (int i = 0; i < sorted.length - 1; i++) {
        int row = sorted[i];
        leftSum += targets[row];
        double current = x[row][f];
        double next = x[sorted[i + 1]][f];
        if (current == next) {
          continue;
        }
        int leftCount = i + 1;
        int rightCount = sorted.length - leftCount;
        double rightSum = total - leftSum;
        double score =
            totalSquares - leftSum * leftSum / leftCount - rightSum * rightSum / rightCount;
        if (best == null || score < best.score) {
          best = new Split(f, midpoint(current, next), score);
        }
      }
      return best;
    }

    private static double midpoint(double current, double next) {
      double mid = current + (next - current) / 2.0;
      return mid >= next ? current : mid;
    }

    DecisionTree build() {
      DecisionTree tree = new DecisionTree();
      int n = features.size();
      tree.feature = new int[n];
      tree.threshold = new double[n];
      tree.left = new int[n];
      tree.right = new int[n];
      tree.value = new double[n][];
      for (int i = 0; i < n; i++) {
        tree.feature[i] = features.get(i);
        tree.threshold[i] = thresholds.get(i);
        tree.left[i] = lefts.get(i);
        tree.right[i] = rights.get(i);
        tree.value[i] = values.get(i);
      }
      return tree;
    }
  }

  private static final class Split {
    private final int feature;
    private final double threshold;
    private final double score;

    Split(int feature, double threshold, double score) {
      this.feature = feature;
      this.threshold = threshold;
      this.score = score;
    }
  }
}
