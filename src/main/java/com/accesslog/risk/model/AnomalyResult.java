package com.accesslog.risk.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Risk assessment of one source address within one time window")
public class AnomalyResult {

    @Schema(description = "Source address", example = "203.0.113.7")
    private String address;

    @Schema(description = "Inclusive window start", example = "2024-03-01T10:00:00Z")
    private Instant windowStart;

    @Schema(description = "Exclusive window end", example = "2024-03-01T10:05:00Z")
    private Instant windowEnd;

    @Schema(description = "Isolation Forest raw score (0.5 - s). Lower is more anomalous.", example = "-0.08")
    private double rawScore;

    @Schema(description = "Batch-relative risk score (0-100). Higher is more anomalous.", example = "81.4")
    private double riskScore;

    @Schema(description = "Risk level: LOW (<40), MEDIUM (40-75), HIGH (>=75)", example = "HIGH")
    private RiskLevel riskLevel;

    @Schema(description = "Whether the window falls in the contamination fraction of lowest raw scores")
    private boolean anomaly;

    @Schema(description = "Feature vector the score was computed from")
    private FeatureVector features;
}
