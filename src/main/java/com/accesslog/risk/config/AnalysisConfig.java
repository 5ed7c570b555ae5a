package com.accesslog.risk.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "analysis")
public class AnalysisConfig {

    // Width of the epoch-aligned aggregation window. Also the denominator of the request rate.
    @Positive
    private int windowMinutes = 5;

    @Valid
    private Forest forest = new Forest();

    @Data
    public static class Forest {
        @Positive
        private int numTrees = 100;

        // Sub-sampling size per tree, capped at the batch size.
        @Positive
        private int sampleSize = 256;

        // Null means unseeded: every batch draws a fresh seed.
        private Long seed;

        // Build trees on the common pool. Per-tree seeds keep the result identical to a sequential build.
        private boolean parallel = false;

        // Fraction of the batch that receives the binary anomaly label.
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double contamination = 0.05;
    }

    public long getWindowMillis() {
        return windowMinutes * 60_000L;
    }
}
