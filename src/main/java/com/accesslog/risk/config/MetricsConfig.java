package com.accesslog.risk.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

@Component
public class MetricsConfig {

    private final MeterRegistry registry;

    public MetricsConfig(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordBatch(String outcome, int recordCount) {
        Counter.builder("analysis.batch.count")
                .tag("outcome", outcome)
                .register(registry)
                .increment();

        DistributionSummary.builder("analysis.batch.records")
                .tag("outcome", outcome)
                .register(registry)
                .record(recordCount);
    }

    public void recordDroppedRows(int droppedRows) {
        if (droppedRows <= 0) {
            return;
        }
        Counter.builder("analysis.rows.dropped")
                .register(registry)
                .increment(droppedRows);
    }

    public void recordRiskScore(String riskLevel, double riskScore) {
        DistributionSummary.builder("analysis.result.risk_score")
                .tag("risk_level", riskLevel)
                .register(registry)
                .record(riskScore);
    }
}
