package com.accesslog.risk.engine.isolationforest;

import java.util.Arrays;
import java.util.Random;

/**
 * One isolation tree grown on a sub-sample. Rows are partitioned in place over
 * index ranges of a private copy of the row references; the caller's array is not reordered.
 */
public class IsolationTree {

    private final IsolationNode root;

    public IsolationTree(IsolationNode root) {
        this.root = root;
    }

    public static IsolationTree build(double[][] sample, int heightLimit, Random random) {
        double[][] rows = Arrays.copyOf(sample, sample.length);
        return new IsolationTree(grow(rows, 0, rows.length, 0, heightLimit, random));
    }

    // Grows the subtree over rows[from, to).
    private static IsolationNode grow(double[][] rows, int from, int to, int depth, int heightLimit, Random random) {
        int count = to - from;
        if (count <= 1 || depth >= heightLimit) {
            return IsolationNode.externalNode(count);
        }

        int feature = random.nextInt(rows[from].length);
        double lo = rows[from][feature];
        double hi = lo;
        for (int i = from + 1; i < to; i++) {
            lo = Math.min(lo, rows[i][feature]);
            hi = Math.max(hi, rows[i][feature]);
        }
        // Constant feature within this node: nothing left to split on
        if (!(hi > lo)) {
            return IsolationNode.externalNode(count);
        }

        double split = lo + random.nextDouble() * (hi - lo);
        int mid = partition(rows, from, to, feature, split);

        return IsolationNode.internalNode(feature, split,
                grow(rows, from, mid, depth + 1, heightLimit, random),
                grow(rows, mid, to, depth + 1, heightLimit, random));
    }

    /** Moves rows with {@code row[feature] < split} to the front of the range and returns the boundary. */
    static int partition(double[][] rows, int from, int to, int feature, double split) {
        int boundary = from;
        for (int i = from; i < to; i++) {
            if (rows[i][feature] < split) {
                double[] swap = rows[boundary];
                rows[boundary] = rows[i];
                rows[i] = swap;
                boundary++;
            }
        }
        return boundary;
    }

    public double pathLength(double[] point) {
        return root.pathLength(point, 0);
    }

    public IsolationNode getRoot() { return root; }
}
