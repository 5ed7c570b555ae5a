package com.accesslog.risk.controller;

import com.accesslog.risk.exception.EmptyBatchException;
import com.accesslog.risk.exception.SchemaValidationException;
import com.accesslog.risk.exception.TableFormatException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

@RestControllerAdvice
public class ErrorHandler {

    private static final Logger log = LoggerFactory.getLogger(ErrorHandler.class);

    @ExceptionHandler(SchemaValidationException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleSchema(SchemaValidationException ex) {
        return Map.of(
                "code", "SCHEMA_VALIDATION",
                "message", ex.getMessage(),
                "field", ex.getField(),
                "missingFields", ex.getMissingFields()
        );
    }

    @ExceptionHandler(TableFormatException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleTableFormat(TableFormatException ex) {
        log.warn("Rejected unreadable table: {}", ex.getMessage());
        return Map.of(
                "code", "TABLE_FORMAT",
                "message", ex.getMessage()
        );
    }

    @ExceptionHandler(EmptyBatchException.class)
    @ResponseStatus(HttpStatus.UNPROCESSABLE_ENTITY)
    public Map<String, Object> handleEmptyBatch(EmptyBatchException ex) {
        return Map.of(
                "code", "EMPTY_BATCH",
                "message", ex.getMessage(),
                "droppedRowCount", ex.getDroppedRowCount()
        );
    }
}
