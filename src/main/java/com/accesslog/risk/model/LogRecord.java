package com.accesslog.risk.model;

import java.time.Instant;

public record LogRecord(String address, Instant timestamp, String endpoint, int status) {

    public boolean isFailed() {
        return status >= 400;
    }
}
