package com.accesslog.risk.service;

import com.accesslog.risk.config.MetricsConfig;
import com.accesslog.risk.engine.features.FeatureAggregator;
import com.accesslog.risk.engine.isolationforest.AnomalyScorer;
import com.accesslog.risk.engine.isolationforest.BatchScores;
import com.accesslog.risk.engine.risk.RiskNormalizer;
import com.accesslog.risk.engine.schema.SchemaNormalizer;
import com.accesslog.risk.exception.EmptyBatchException;
import com.accesslog.risk.exception.SchemaValidationException;
import com.accesslog.risk.model.AnalysisReport;
import com.accesslog.risk.model.AnomalyResult;
import com.accesslog.risk.model.BatchSummary;
import com.accesslog.risk.model.FeatureVector;
import com.accesslog.risk.model.NormalizedBatch;
import com.accesslog.risk.model.RawTable;
import com.accesslog.risk.model.RiskLevel;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Main orchestrator for batch analysis.
 *
 * Flow:
 * 1. Normalize the raw table to canonical log records (drop unparsable rows)
 * 2. Aggregate records into per-address, per-window feature vectors
 * 3. Standardize the batch and score it with a freshly trained Isolation Forest
 * 4. Rescale raw scores to a batch-relative 0-100 risk score
 * 5. Classify each risk score (LOW / MEDIUM / HIGH)
 * 6. Sort by risk descending and summarize
 *
 * Every statistic lives on this call's stack; nothing carries over between batches.
 */
@Service
public class LogAnalysisService {

    private static final Logger log = LoggerFactory.getLogger(LogAnalysisService.class);

    static final Comparator<AnomalyResult> RESULT_ORDER = Comparator
            .comparingDouble(AnomalyResult::getRiskScore).reversed()
            .thenComparing(AnomalyResult::getAddress)
            .thenComparing(AnomalyResult::getWindowStart);

    private final SchemaNormalizer schemaNormalizer;
    private final FeatureAggregator featureAggregator;
    private final AnomalyScorer anomalyScorer;
    private final RiskNormalizer riskNormalizer;
    private final BatchSummaryService summaryService;
    private final MetricsConfig metricsConfig;

    public LogAnalysisService(SchemaNormalizer schemaNormalizer,
                              FeatureAggregator featureAggregator,
                              AnomalyScorer anomalyScorer,
                              RiskNormalizer riskNormalizer,
                              BatchSummaryService summaryService,
                              MetricsConfig metricsConfig) {
        this.schemaNormalizer = schemaNormalizer;
        this.featureAggregator = featureAggregator;
        this.anomalyScorer = anomalyScorer;
        this.riskNormalizer = riskNormalizer;
        this.summaryService = summaryService;
        this.metricsConfig = metricsConfig;
    }

    /**
     * Analyze one uploaded table, seeding the forest from configuration
     * (or randomly when no seed is configured).
     */
    @Observed(name = "analysis.run", contextualName = "analyze-batch")
    public AnalysisReport analyze(RawTable table) {
        return run(table, null);
    }

    /**
     * Analyze one uploaded table with an explicit forest seed. Identical input and seed
     * give identical results.
     */
    public AnalysisReport analyze(RawTable table, long seed) {
        return run(table, seed);
    }

    private AnalysisReport run(RawTable table, Long seed) {
        // 1. Normalize
        NormalizedBatch batch;
        try {
            batch = schemaNormalizer.normalize(table);
        } catch (SchemaValidationException e) {
            metricsConfig.recordBatch("schema_rejected", table.rows().size());
            throw e;
        }
        metricsConfig.recordDroppedRows(batch.droppedRowCount());

        if (batch.isEmpty()) {
            log.warn("Rejecting batch: no valid records out of {} rows", table.rows().size());
            metricsConfig.recordBatch("empty", 0);
            throw new EmptyBatchException(batch.droppedRowCount());
        }

        // 2. Aggregate
        List<FeatureVector> vectors = featureAggregator.aggregate(batch.records());

        // 3. Score
        BatchScores scores = seed != null
                ? anomalyScorer.score(vectors, seed)
                : anomalyScorer.score(vectors);

        // 4. Normalize to 0-100
        double[] riskScores = riskNormalizer.normalize(scores.rawScores());

        // 5. Classify
        List<AnomalyResult> results = new ArrayList<>(vectors.size());
        for (int i = 0; i < vectors.size(); i++) {
            FeatureVector vector = vectors.get(i);
            RiskLevel level = RiskLevel.fromScore(riskScores[i]);
            results.add(AnomalyResult.builder()
                    .address(vector.getAddress())
                    .windowStart(vector.getWindowStart())
                    .windowEnd(vector.getWindowEnd())
                    .rawScore(scores.rawScore(i))
                    .riskScore(riskScores[i])
                    .riskLevel(level)
                    .anomaly(scores.isAnomaly(i))
                    .features(vector)
                    .build());
            metricsConfig.recordRiskScore(level.name(), riskScores[i]);
        }

        // 6. Sort and summarize
        results.sort(RESULT_ORDER);
        BatchSummary summary = summaryService.summarize(results, batch.droppedRowCount());

        metricsConfig.recordBatch("analyzed", batch.records().size());
        log.info("Analyzed batch: {} records ({} dropped), {} addresses, {} windows, {} HIGH, seed={}",
                batch.records().size(), batch.droppedRowCount(), summary.getTotalAddresses(),
                summary.getTotalWindows(), summary.getHighRiskCount(), scores.seed());

        return AnalysisReport.builder()
                .results(results)
                .summary(summary)
                .build();
    }
}
