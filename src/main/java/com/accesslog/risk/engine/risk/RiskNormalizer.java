package com.accesslog.risk.engine.risk;

import org.springframework.stereotype.Component;

/**
 * Rescales raw isolation scores to a 0-100 risk score relative to the batch.
 *
 * risk = clip((max - raw) / (max - min) * 100, 0, 100)
 *
 * The inversion maps the lowest (most anomalous) raw score to 100. When every raw
 * score is identical there is nothing to discriminate and every risk score is 0.
 */
@Component
public class RiskNormalizer {

    public double[] normalize(double[] rawScores) {
        double[] riskScores = new double[rawScores.length];
        if (rawScores.length == 0) {
            return riskScores;
        }

        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (double raw : rawScores) {
            if (raw < min) min = raw;
            if (raw > max) max = raw;
        }

        for (int i = 0; i < rawScores.length; i++) {
            riskScores[i] = riskScore(rawScores[i], min, max);
        }
        return riskScores;
    }

    public static double riskScore(double rawScore, double batchMin, double batchMax) {
        double range = batchMax - batchMin;
        if (!(range > 0)) {
            return 0.0;
        }
        double score = (batchMax - rawScore) / range * 100.0;
        return Math.max(0.0, Math.min(100.0, score));
    }
}
