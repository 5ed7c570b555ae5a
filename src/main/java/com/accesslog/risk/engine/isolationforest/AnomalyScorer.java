package com.accesslog.risk.engine.isolationforest;

import com.accesslog.risk.config.AnalysisConfig;
import com.accesslog.risk.engine.features.FeatureExtractor;
import com.accesslog.risk.model.FeatureVector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Scores every feature vector of a batch against the batch itself.
 *
 * The scaler and the forest are fitted inside {@link #score} and discarded on return,
 * so concurrent batches never see each other's statistics.
 *
 * Sign convention: raw score = 0.5 - s(x, n). A short mean isolation path gives a
 * high s and therefore a LOW raw score, i.e. smaller raw score = more anomalous.
 */
@Component
public class AnomalyScorer {

    private static final Logger log = LoggerFactory.getLogger(AnomalyScorer.class);

    private final AnalysisConfig config;

    public AnomalyScorer(AnalysisConfig config) {
        this.config = config;
    }

    public BatchScores score(List<FeatureVector> vectors) {
        AnalysisConfig.Forest forestConfig = config.getForest();
        long seed = forestConfig.getSeed() != null
                ? forestConfig.getSeed()
                : ThreadLocalRandom.current().nextLong();
        return score(vectors, seed);
    }

    public BatchScores score(List<FeatureVector> vectors, long seed) {
        if (vectors.isEmpty()) {
            throw new IllegalArgumentException("Cannot score an empty batch");
        }
        AnalysisConfig.Forest forestConfig = config.getForest();

        double[][] features = FeatureExtractor.toMatrix(vectors);
        StandardScaler scaler = StandardScaler.fit(features);
        double[][] scaled = scaler.transform(features);

        IsolationForest forest = new IsolationForest();
        forest.train(scaled, forestConfig.getNumTrees(), forestConfig.getSampleSize(), seed,
                forestConfig.isParallel());

        double[] rawScores = new double[scaled.length];
        for (int i = 0; i < scaled.length; i++) {
            rawScores[i] = forest.rawScore(scaled[i]);
        }

        double threshold = percentile(rawScores, forestConfig.getContamination());

        log.debug("Scored {} vectors with {} trees (subsample={}, seed={}); anomaly threshold={}",
                scaled.length, forestConfig.getNumTrees(), forest.getSampleSize(), seed,
                String.format("%.4f", threshold));
        return new BatchScores(rawScores, threshold, seed);
    }

    /**
     * Percentile with linear interpolation between closest ranks.
     *
     * @param fraction in [0, 1]
     */
    static double percentile(double[] values, double fraction) {
        double[] sorted = values.clone();
        Arrays.sort(sorted);
        double clamped = Math.max(0.0, Math.min(1.0, fraction));
        double position = clamped * (sorted.length - 1);
        int lower = (int) Math.floor(position);
        int upper = (int) Math.ceil(position);
        return sorted[lower] + (sorted[upper] - sorted[lower]) * (position - lower);
    }
}
