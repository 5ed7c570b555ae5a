package com.accesslog.risk.model;

import java.util.List;

/**
 * A parsed delimited table: one header row and untyped string rows.
 * Rows may be shorter than the header; missing cells read as blank.
 */
public record RawTable(List<String> headers, List<List<String>> rows) {

    public RawTable {
        headers = headers == null ? List.of() : List.copyOf(headers);
        rows = rows == null ? List.of() : rows;
    }

    public String cell(List<String> row, int column) {
        if (row == null || column < 0 || column >= row.size()) {
            return "";
        }
        String value = row.get(column);
        return value == null ? "" : value;
    }
}
