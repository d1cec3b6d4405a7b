package com.fleetsentinel.core.forest;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * One randomly grown isolation tree.
 *
 * <p>
 * Each internal node splits on a random dimension at a uniform random value
 * between that dimension's min and max within the node. Growth stops when a
 * node holds at most one point, its chosen dimension is constant, or the
 * depth limit is reached. Leaves remember how many points they absorbed so
 * that an unfinished subtree can be credited with its expected path length.
 * </p>
 *
 * @since 1.0.0
 */
final class IsolationTree {

    /** Spread below which a dimension is treated as constant. */
    static final double MIN_SPLIT_RANGE = 1e-10;

    private final Node root;

    private IsolationTree(Node root) {
        this.root = root;
    }

    static IsolationTree grow(List<double[]> points, int maxDepth, Random random) {
        return new IsolationTree(build(points, 0, maxDepth, random));
    }

    /**
     * @param point point to isolate
     * @return edges traversed to reach a leaf plus the leaf's expected
     *         remaining path length
     */
    double pathLength(double[] point) {
        Node node = root;
        int depth = 0;
        while (node instanceof Split split) {
            node = point[split.feature] < split.value ? split.left : split.right;
            depth++;
        }
        return depth + IsolationForest.averagePathLength(((Leaf) node).size);
    }

    int depth() {
        return depth(root);
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static Node build(List<double[]> points, int depth, int maxDepth, Random random) {
        if (depth >= maxDepth || points.size() <= 1) {
            return new Leaf(points.size());
        }

        int feature = random.nextInt(points.get(0).length);
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (double[] p : points) {
            min = Math.min(min, p[feature]);
            max = Math.max(max, p[feature]);
        }
        if (max - min < MIN_SPLIT_RANGE) {
            return new Leaf(points.size());
        }

        double value = min + random.nextDouble() * (max - min);
        List<double[]> left = new ArrayList<>();
        List<double[]> right = new ArrayList<>();
        for (double[] p : points) {
            if (p[feature] < value) {
                left.add(p);
            } else {
                right.add(p);
            }
        }
        return new Split(feature, value,
                build(left, depth + 1, maxDepth, random),
                build(right, depth + 1, maxDepth, random));
    }

    private static int depth(Node node) {
        if (node instanceof Split split) {
            return 1 + Math.max(depth(split.left), depth(split.right));
        }
        return 0;
    }

    private abstract static class Node {
    }

    private static final class Leaf extends Node {
        private final int size;

        private Leaf(int size) {
            this.size = size;
        }
    }

    private static final class Split extends Node {
        private final int feature;
        private final double value;
        private final Node left;
        private final Node right;

        private Split(int feature, double value, Node left, Node right) {
            this.feature = feature;
            this.value = value;
            this.left = left;
            this.right = right;
        }
    }
}
