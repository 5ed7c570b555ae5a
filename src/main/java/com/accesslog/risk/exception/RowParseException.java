package com.accesslog.risk.exception;

/**
 * A single row could not be converted to a log record. Caught by the normalizer,
 * which drops the row and counts it.
 */
public class RowParseException extends Exception {

    private final String field;

    public RowParseException(String field, String message) {
        super(message);
        this.field = field;
    }

    public RowParseException(String field, String message, Throwable cause) {
        super(message, cause);
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
