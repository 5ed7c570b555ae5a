package com.accesslog.risk.service;

import com.accesslog.risk.model.AnomalyResult;
import com.accesslog.risk.model.BatchSummary;
import com.accesslog.risk.model.RiskLevel;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

@Service
public class BatchSummaryService {

    // Upper bounds (inclusive) of the risk distribution bins; the last bin takes the rest
    private static final double[] BIN_UPPER_BOUNDS = {20.0, 40.0, 60.0, 80.0};

    /**
     * Summarize the results of one batch.
     *
     * @param results         results sorted by risk score descending
     * @param droppedRowCount rows dropped during normalization
     */
    public BatchSummary summarize(List<AnomalyResult> results, int droppedRowCount) {
        Set<String> addresses = new HashSet<>();
        int highRisk = 0;
        int anomalies = 0;
        double riskSum = 0.0;
        int[] bins = new int[BIN_UPPER_BOUNDS.length + 1];

        for (AnomalyResult result : results) {
            addresses.add(result.getAddress());
            if (result.getRiskLevel() == RiskLevel.HIGH) highRisk++;
            if (result.isAnomaly()) anomalies++;
            riskSum += result.getRiskScore();
            bins[binOf(result.getRiskScore())]++;
        }

        double mean = results.isEmpty() ? 0.0 : riskSum / results.size();

        List<Integer> distribution = new ArrayList<>(bins.length);
        for (int count : bins) distribution.add(count);

        return BatchSummary.builder()
                .totalAddresses(addresses.size())
                .totalWindows(results.size())
                .highRiskCount(highRisk)
                .anomalyCount(anomalies)
                .meanRiskScore(Math.round(mean * 100.0) / 100.0) // round to 2 decimal
                .droppedRowCount(droppedRowCount)
                .riskDistribution(distribution)
                .topThreat(results.isEmpty() ? null : results.get(0))
                .build();
    }

    private int binOf(double riskScore) {
        for (int i = 0; i < BIN_UPPER_BOUNDS.length; i++) {
            if (riskScore <= BIN_UPPER_BOUNDS[i]) return i;
        }
        return BIN_UPPER_BOUNDS.length;
    }
}
