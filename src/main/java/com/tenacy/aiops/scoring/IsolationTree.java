package com.tenacy.aiops.scoring;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * 무작위 이진 분할 트리 한 그루.
 */
class IsolationTree {

    private final Node root;

    private IsolationTree(Node root) {
        this.root = root;
    }

    static IsolationTree grow(double[][] data, int[] sample, int maxDepth, Random random) {
        return new IsolationTree(build(data, sample, 0, maxDepth, random));
    }

    double pathLength(double[] point) {
        Node node = root;
        int depth = 0;
        while (!node.isLeaf()) {
            node = point[node.feature] < node.threshold ? node.left : node.right;
            depth++;
        }
        return depth + IsolationForest.averagePathLength(node.size);
    }

    private static Node build(double[][] data, int[] indices, int depth, int maxDepth, Random random) {
        if (depth >= maxDepth || indices.length <= 1) {
            return Node.leaf(indices.length);
        }

        int columns = data[indices[0]].length;
        List<Integer> candidates = new ArrayList<>(columns);
        double[] mins = new double[columns];
        double[] maxs = new double[columns];

        for (int f = 0; f < columns; f++) {
            double min = Double.POSITIVE_INFINITY;
            double max = Double.NEGATIVE_INFINITY;
            for (int idx : indices) {
                double v = data[idx][f];
                if (v < min) min = v;
                if (v > max) max = v;
            }
            mins[f] = min;
            maxs[f] = max;
            if (max > min) {
                candidates.add(f);
            }
        }

        // 모든 특징이 상수면 더 이상 분리할 수 없다
        if (candidates.isEmpty()) {
            return Node.leaf(indices.length);
        }

        int feature = candidates.get(random.nextInt(candidates.size()));
        double min = mins[feature];
        double max = maxs[feature];
        double threshold = min + random.nextDouble() * (max - min);
        if (threshold <= min) {
            threshold = (min + max) / 2.0;
        }

        int leftCount = 0;
        for (int idx : indices) {
            if (data[idx][feature] < threshold) {
                leftCount++;
            }
        }
        int[] left = new int[leftCount];
        int[] right = new int[indices.length - leftCount];
        int l = 0;
        int r = 0;
        for (int idx : indices) {
            if (data[idx][feature] < threshold) {
                left[l++] = idx;
            } else {
                right[r++] = idx;
            }
        }

        return Node.split(feature, threshold,
                build(data, left, depth + 1, maxDepth, random),
                build(data, right, depth + 1, maxDepth, random));
    }

    private static final class Node {
        final int feature;
        final double threshold;
        final Node left;
        final Node right;
        final int size;

        private Node(int feature, double threshold, Node left, Node right, int size) {
            this.feature = feature;
            this.threshold = threshold;
            this.left = left;
            this.right = right;
            this.size = size;
        }

        static Node leaf(int size) {
            return new Node(-1, Double.NaN, null, null, size);
        }

        static Node split(int feature, double threshold, Node left, Node right) {
            return new Node(feature, threshold, left, right, 0);
        }

        boolean isLeaf() {
            return left == null;
        }
    }
}
