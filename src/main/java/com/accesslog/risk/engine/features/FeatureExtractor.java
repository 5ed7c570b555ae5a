package com.accesslog.risk.engine.features;

import com.accesslog.risk.model.FeatureVector;

import java.util.List;

/**
 * Flattens feature vectors into the numeric matrix the scorer works on.
 *
 * Features:
 *   [0] Failed count: requests with status >= 400
 *   [1] Total count: requests in the window
 *   [2] Success ratio: (total - failed) / total
 *   [3] Unique endpoints: distinct endpoint values
 *   [4] Request rate: total / window width in minutes
 *   [5] Mean gap: seconds between consecutive requests (0 for a single request)
 */
public final class FeatureExtractor {

    public static final int FEATURE_COUNT = 6;

    private FeatureExtractor() {}

    public static double[] extract(FeatureVector vector) {
        double[] features = new double[FEATURE_COUNT];
        features[0] = vector.getFailedCount();
        features[1] = vector.getTotalCount();
        features[2] = vector.getSuccessRatio();
        features[3] = vector.getUniqueEndpointCount();
        features[4] = vector.getRequestRatePerMinute();
        features[5] = vector.getAvgInterRequestGapSeconds();
        return features;
    }

    public static double[][] toMatrix(List<FeatureVector> vectors) {
        double[][] matrix = new double[vectors.size()][];
        for (int i = 0; i < vectors.size(); i++) {
            matrix[i] = extract(vectors.get(i));
        }
        return matrix;
    }
}
