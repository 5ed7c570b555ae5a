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
@Schema(description = "A pre-parsed access-log table")
public class TableRequest {

    @Schema(description = "Header cells, matched case-insensitively against known aliases",
            example = "[\"IP\", \"Time\", \"URL\", \"staus\"]")
    private List<String> headers;

    @Schema(description = "Data rows, one string cell per header",
            example = "[[\"10.0.0.1\", \"2024-03-01T10:00:00Z\", \"/login\", \"401\"]]")
    private List<List<String>> rows;

    public RawTable toRawTable() {
        return new RawTable(headers, rows);
    }
}
