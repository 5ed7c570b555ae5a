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
@Schema(description = "Outcome of analyzing one uploaded batch")
public class AnalysisReport {

    @Schema(description = "Per address-window results, sorted by risk score descending")
    private List<AnomalyResult> results;

    @Schema(description = "Batch-level summary")
    private BatchSummary summary;
}
