package com.accesslog.risk.model;

import java.util.List;

public record NormalizedBatch(List<LogRecord> records, int droppedRowCount) {

    public boolean isEmpty() {
        return records.isEmpty();
    }
}
