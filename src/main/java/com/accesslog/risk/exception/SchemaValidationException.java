package com.accesslog.risk.exception;

import java.util.List;

/**
 * A required canonical column could not be resolved from the table header.
 * Fatal for the whole batch; no partial report is produced.
 */
public class SchemaValidationException extends RuntimeException {

    private final String field;
    private final List<String> missingFields;

    public SchemaValidationException(List<String> missingFields, List<String> headers) {
        super(String.format("Missing required column '%s' (unresolved: %s). Found columns: %s",
                missingFields.get(0), missingFields, headers));
        this.field = missingFields.get(0);
        this.missingFields = List.copyOf(missingFields);
    }

    public String getField() {
        return field;
    }

    public List<String> getMissingFields() {
        return missingFields;
    }
}
