package com.accesslog.risk.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Aggregate view of all results of one upload")
public class BatchSummary {

    @Schema(description = "Distinct source addresses in the batch", example = "42")
    private int totalAddresses;

    @Schema(description = "Address windows scored", example = "310")
    private int totalWindows;

    @Schema(description = "Results classified HIGH", example = "6")
    private int highRiskCount;

    @Schema(description = "Results carrying the anomaly label", example = "16")
    private int anomalyCount;

    @Schema(description = "Mean risk score, rounded to 2 decimals", example = "23.17")
    private double meanRiskScore;

    @Schema(description = "Rows dropped for unparsable timestamp, status, address or endpoint", example = "3")
    private int droppedRowCount;

    @Schema(description = "Result counts in the bins [0,20], (20,40], (40,60], (60,80], (80,100]",
            example = "[200, 60, 30, 14, 6]")
    private List<Integer> riskDistribution;

    @Schema(description = "Highest-risk result, null for an empty result list")
    private AnomalyResult topThreat;
}
