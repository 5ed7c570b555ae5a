package com.accesslog.risk.engine.isolationforest;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Random;
import java.util.stream.IntStream;

/**
 * Ensemble of isolation trees fitted to one batch.
 *
 * Every tree draws its subsample and splits from its own seed, taken in order
 * from the master seed, so parallel and sequential builds produce the same forest.
 */
public class IsolationForest {

    private List<IsolationTree> trees;
    private int sampleSize;

    public IsolationForest() {
        this.trees = new ArrayList<>();
    }

    public void train(double[][] data, int numTrees, int sampleSize, long seed) {
        train(data, numTrees, sampleSize, seed, false);
    }

    /**
     * Train the isolation forest on the given data.
     *
     * @param data       training samples, each row is a feature vector
     * @param numTrees   number of trees in the forest (typically 100)
     * @param sampleSize sub-sampling size per tree (typically 256), capped at the data size
     * @param seed       master seed; the forest is a pure function of (data, seed)
     * @param parallel   build trees on the common fork-join pool
     */
    public void train(double[][] data, int numTrees, int sampleSize, long seed, boolean parallel) {
        if (data.length == 0) {
            throw new IllegalArgumentException("Cannot train an isolation forest on an empty batch");
        }
        if (numTrees <= 0 || sampleSize <= 0) {
            throw new IllegalArgumentException("numTrees and sampleSize must be positive");
        }

        this.sampleSize = Math.min(sampleSize, data.length);
        int maxDepth = (int) Math.ceil(Math.log(this.sampleSize) / Math.log(2));

        Random master = new Random(seed);
        long[] treeSeeds = new long[numTrees];
        for (int i = 0; i < numTrees; i++) {
            treeSeeds[i] = master.nextLong();
        }

        IsolationTree[] built = new IsolationTree[numTrees];
        IntStream indices = IntStream.range(0, numTrees);
        if (parallel) {
            indices = indices.parallel();
        }
        int size = this.sampleSize;
        indices.forEach(i -> {
            Random random = new Random(treeSeeds[i]);
            double[][] sample = subsample(data, size, random);
            built[i] = IsolationTree.build(sample, maxDepth, random);
        });

        this.trees = new ArrayList<>(Arrays.asList(built));
    }

    /**
     * Isolation score s(x, n) = 2^(-E(h(x)) / c(n)).
     *
     * @return score between 0.0 and 1.0; close to 1.0 means isolated quickly (anomalous),
     *         0.0 when the subsample is a single point
     */
    public double anomalyScore(double[] point) {
        if (trees.isEmpty()) return 0.0;

        double avgPathLength = 0.0;
        for (IsolationTree tree : trees) {
            avgPathLength += tree.pathLength(point);
        }
        avgPathLength /= trees.size();

        double c = IsolationNode.averagePathLength(sampleSize);
        if (c <= 0) return 0.0;

        return Math.pow(2.0, -avgPathLength / c);
    }

    /**
     * Raw score 0.5 - s(x, n). Smaller is more anomalous; negative values are
     * points isolated faster than an average point.
     */
    public double rawScore(double[] point) {
        return 0.5 - anomalyScore(point);
    }

    /**
     * Draws {@code size} distinct rows in their original order (Knuth's selection sampling).
     * Returns the input itself when it is no larger than the requested size.
     */
    static double[][] subsample(double[][] data, int size, Random random) {
        if (data.length <= size) {
            return data;
        }
        double[][] sample = new double[size][];
        int chosen = 0;
        for (int seen = 0; seen < data.length && chosen < size; seen++) {
            int remaining = data.length - seen;
            if (random.nextInt(remaining) < size - chosen) {
                sample[chosen++] = data[seen];
            }
        }
        return sample;
    }

    public List<IsolationTree> getTrees() { return trees; }
    public int getSampleSize() { return sampleSize; }
}
