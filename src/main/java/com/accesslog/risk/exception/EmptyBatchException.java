package com.accesslog.risk.exception;

/**
 * No valid record survived normalization. Distinct from a batch that is scored
 * and simply contains no anomalies.
 */
public class EmptyBatchException extends RuntimeException {

    private final int droppedRowCount;

    public EmptyBatchException(int droppedRowCount) {
        super(String.format("No valid log records after normalization (%d rows dropped)", droppedRowCount));
        this.droppedRowCount = droppedRowCount;
    }

    public int getDroppedRowCount() {
        return droppedRowCount;
    }
}
