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
@Schema(description = "Behavioral features of one source address within one time window")
public class FeatureVector {

    @Schema(description = "Source address", example = "203.0.113.7")
    private String address;

    @Schema(description = "Inclusive window start", example = "2024-03-01T10:00:00Z")
    private Instant windowStart;

    @Schema(description = "Exclusive window end", example = "2024-03-01T10:05:00Z")
    private Instant windowEnd;

    @Schema(description = "Requests with status >= 400", example = "2")
    private int failedCount;

    @Schema(description = "Requests in the window", example = "14")
    private int totalCount;

    @Schema(description = "(total - failed) / total", example = "0.857")
    private double successRatio;

    @Schema(description = "Distinct endpoints requested", example = "3")
    private int uniqueEndpointCount;

    @Schema(description = "total / window width in minutes", example = "2.8")
    private double requestRatePerMinute;

    @Schema(description = "Mean seconds between consecutive requests; 0 for a single request", example = "21.5")
    private double avgInterRequestGapSeconds;
}
