package com.accesslog.risk.engine.isolationforest;

/**
 * Raw isolation scores of one batch, aligned with the scored feature vectors.
 *
 * @param rawScores        0.5 - s(x, n) per vector; smaller is more anomalous
 * @param anomalyThreshold contamination percentile of the raw scores; a vector scoring
 *                         strictly below it carries the anomaly label
 * @param seed             master seed the forest was trained with
 */
public record BatchScores(double[] rawScores, double anomalyThreshold, long seed) {

    public BatchScores {
        rawScores = rawScores.clone();
    }

    @Override
    public double[] rawScores() {
        return rawScores.clone();
    }

    public double rawScore(int index) {
        return rawScores[index];
    }

    public boolean isAnomaly(int index) {
        return rawScores[index] < anomalyThreshold;
    }
}
