package com.fleetsentinel.core.forest;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Random;

/**
 * Isolation Forest over fixed-dimension points.
 *
 * <p>
 * Anomalies are few and different, so random partitioning isolates them in
 * fewer splits than normal points. The anomaly score of a point is
 * {@code 2^(-E[h(x)] / c(ψ))} where {@code E[h(x)]} is its mean path length
 * over all trees and {@code c(ψ)} the expected path length of an
 * unsuccessful binary-search-tree lookup among {@code ψ} points, ψ being the
 * per-tree sub-sample size. Scores near 1 are anomalous, scores well below
 * 0.5 are normal.
 * </p>
 *
 * <h3>Cutoff</h3>
 * <p>
 * At training time every training point is scored; the cutoff is the score at
 * rank {@code max(0, floor(n·contamination) - 1)} of the descending order.
 * {@link #predict(double[])} reports scores strictly above it.
 * </p>
 *
 * <p>
 * Instances are immutable once trained and safe to share between threads.
 * </p>
 *
 * @since 1.0.0
 */
public final class IsolationForest {

    private static final double EULER_MASCHERONI = 0.5772156649;

    private final List<IsolationTree> trees;
    private final int subSampleSize;
    private final int dimensions;
    private final double contamination;
    private final double cutoff;

    private IsolationForest(List<IsolationTree> trees, int subSampleSize, int dimensions,
                            double contamination, List<double[]> training) {
        this.trees = trees;
        this.subSampleSize = subSampleSize;
        this.dimensions = dimensions;
        this.contamination = contamination;
        this.cutoff = computeCutoff(training);
    }

    /**
     * Train a forest.
     *
     * @param points        training points, all of the same dimension and finite
     * @param treeCount     number of trees, at least 1
     * @param sampleSize    per-tree sub-sample size, at least 1; capped at
     *                      {@code points.size()}
     * @param contamination expected anomalous fraction, in (0, 0.5)
     * @param random        randomness source
     * @return the trained forest
     * @throws IllegalArgumentException if the points or parameters are invalid
     */
    public static IsolationForest train(List<double[]> points, int treeCount, int sampleSize,
                                        double contamination, Random random) {
        Objects.requireNonNull(points, "points must not be null");
        Objects.requireNonNull(random, "random must not be null");
        if (points.isEmpty()) {
            throw new IllegalArgumentException("Cannot train an Isolation Forest on an empty set");
        }
        if (treeCount < 1) {
            throw new IllegalArgumentException("treeCount must be >= 1, got: " + treeCount);
        }
        if (sampleSize < 1) {
            throw new IllegalArgumentException("sampleSize must be >= 1, got: " + sampleSize);
        }
        if (!(contamination > 0 && contamination < 0.5)) {
            throw new IllegalArgumentException("contamination must be in (0, 0.5), got: " + contamination);
        }
        int dimensions = checkDimensions(points);

        int psi = Math.min(sampleSize, points.size());
        int maxDepth = (int) Math.ceil(log2(psi));

        List<IsolationTree> trees = new ArrayList<>(treeCount);
        for (int t = 0; t < treeCount; t++) {
            trees.add(IsolationTree.grow(subSample(points, psi, random), maxDepth, random));
        }
        return new IsolationForest(Collections.unmodifiableList(trees), psi, dimensions,
                contamination, points);
    }

    /**
     * @param point point with the training dimension
     * @return anomaly score in (0, 1]; 0 if the sub-sample size was 1
     * @throws IllegalArgumentException if the dimension does not match
     */
    public double anomalyScore(double[] point) {
        Objects.requireNonNull(point, "point must not be null");
        if (point.length != dimensions) {
            throw new IllegalArgumentException(
                    "Expected a point of dimension " + dimensions + ", got: " + point.length);
        }
        double c = averagePathLength(subSampleSize);
        if (c == 0) {
            return 0;
        }
        double total = 0;
        for (IsolationTree tree : trees) {
            total += tree.pathLength(point);
        }
        return Math.pow(2, -(total / trees.size()) / c);
    }

    /**
     * @param point point with the training dimension
     * @return {@code true} if the score exceeds the training cutoff
     */
    public boolean predict(double[] point) {
        return anomalyScore(point) > cutoff;
    }

    /**
     * Expected path length of an unsuccessful search in a binary search tree
     * of {@code n} nodes: {@code 2·H(n-1) - 2(n-1)/n}, with
     * {@code H(i) ≈ ln(i) + γ}.
     *
     * @param n number of points
     * @return 0 for {@code n <= 1}, 1 for {@code n == 2}
     */
    public static double averagePathLength(int n) {
        if (n <= 1) {
            return 0;
        }
        if (n == 2) {
            return 1;
        }
        double harmonic = Math.log(n - 1.0) + EULER_MASCHERONI;
        return 2 * harmonic - (2.0 * (n - 1)) / n;
    }

    public double getCutoff() {
        return cutoff;
    }

    public int getTreeCount() {
        return trees.size();
    }

    public int getSubSampleSize() {
        return subSampleSize;
    }

    public int getDimensions() {
        return dimensions;
    }

    public double getContamination() {
        return contamination;
    }

    /**
     * @return depth of the deepest tree
     */
    int maxTreeDepth() {
        int max = 0;
        for (IsolationTree tree : trees) {
            max = Math.max(max, tree.depth());
        }
        return max;
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private double computeCutoff(List<double[]> training) {
        double[] scores = new double[training.size()];
        for (int i = 0; i < scores.length; i++) {
            scores[i] = anomalyScore(training.get(i));
        }
        Arrays.sort(scores);
        int rankFromTop = Math.max(0, (int) Math.floor(scores.length * contamination) - 1);
        return scores[scores.length - 1 - rankFromTop];
    }

    /** Partial Fisher-Yates shuffle: {@code size} distinct points. */
    private static List<double[]> subSample(List<double[]> points, int size, Random random) {
        int[] idx = new int[points.size()];
        for (int i = 0; i < idx.length; i++) {
            idx[i] = i;
        }
        List<double[]> sample = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            int j = i + random.nextInt(idx.length - i);
            int tmp = idx[i];
            idx[i] = idx[j];
            idx[j] = tmp;
            sample.add(points.get(idx[i]));
        }
        return sample;
    }

    private static int checkDimensions(List<double[]> points) {
        double[] first = Objects.requireNonNull(points.get(0), "point 0 must not be null");
        int dimensions = first.length;
        if (dimensions == 0) {
            throw new IllegalArgumentException("Points must have at least one dimension");
        }
        for (int i = 0; i < points.size(); i++) {
            double[] p = Objects.requireNonNull(points.get(i), "point " + i + " must not be null");
            if (p.length != dimensions) {
                throw new IllegalArgumentException("Point " + i + " has dimension " + p.length
                        + ", expected " + dimensions);
            }
            for (double v : p) {
                if (!Double.isFinite(v)) {
                    throw new IllegalArgumentException("Point " + i + " has a non-finite value: "
                            + Arrays.toString(p));
                }
            }
        }
        return dimensions;
    }

    private static double log2(int n) {
        return Math.log(n) / Math.log(2);
    }
}
