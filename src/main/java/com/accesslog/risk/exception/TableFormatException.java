package com.accesslog.risk.exception;

public class TableFormatException extends RuntimeException {

    public TableFormatException(String message) {
        super(message);
    }

    public TableFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
