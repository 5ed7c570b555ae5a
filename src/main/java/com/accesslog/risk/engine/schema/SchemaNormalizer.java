package com.accesslog.risk.engine.schema;

import com.accesslog.risk.exception.RowParseException;
import com.accesslog.risk.exception.SchemaValidationException;
import com.accesslog.risk.model.LogRecord;
import com.accesslog.risk.model.NormalizedBatch;
import com.accesslog.risk.model.RawTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Maps a raw table with arbitrary header names onto canonical {@link LogRecord}s.
 *
 * Column resolution is all-or-nothing: an unresolved canonical field rejects the
 * whole table. Row conversion is tolerant: a row with a bad timestamp, status,
 * address or endpoint is dropped and counted.
 */
@Component
public class SchemaNormalizer {

    private static final Logger log = LoggerFactory.getLogger(SchemaNormalizer.class);

    private static final Pattern STATUS = Pattern.compile("\\d{3}(\\.0+)?");

    public NormalizedBatch normalize(RawTable table) {
        Map<CanonicalField, Integer> columns = resolveColumns(table.headers());

        List<LogRecord> records = new ArrayList<>(table.rows().size());
        int dropped = 0;
        int rowNumber = 0;
        for (List<String> row : table.rows()) {
            rowNumber++;
            try {
                records.add(toRecord(table, row, columns));
            } catch (RowParseException e) {
                dropped++;
                log.debug("Dropping row {} ({}): {}", rowNumber, e.getField(), e.getMessage());
            }
        }

        if (dropped > 0) {
            log.info("Normalized {} rows: {} kept, {} dropped", rowNumber, records.size(), dropped);
        }
        return new NormalizedBatch(List.copyOf(records), dropped);
    }

    /**
     * Resolve the column index of every canonical field.
     *
     * @throws SchemaValidationException naming the first unresolved field
     */
    public Map<CanonicalField, Integer> resolveColumns(List<String> headers) {
        Map<String, Integer> indexByHeader = new HashMap<>();
        for (int i = 0; i < headers.size(); i++) {
            indexByHeader.putIfAbsent(CanonicalField.normalizeHeader(headers.get(i)), i);
        }

        Map<CanonicalField, Integer> columns = new EnumMap<>(CanonicalField.class);
        List<String> missing = new ArrayList<>();
        for (CanonicalField field : CanonicalField.values()) {
            Integer index = null;
            for (String alias : field.aliases()) {
                index = indexByHeader.get(alias);
                if (index != null) break;
            }
            if (index == null) {
                missing.add(field.fieldName());
            } else {
                columns.put(field, index);
            }
        }

        if (!missing.isEmpty()) {
            log.warn("Rejecting table: unresolved columns {} in header {}", missing, headers);
            throw new SchemaValidationException(missing, headers);
        }
        log.debug("Resolved columns {} from header {}", columns, headers);
        return columns;
    }

    private LogRecord toRecord(RawTable table, List<String> row, Map<CanonicalField, Integer> columns)
            throws RowParseException {
        String address = table.cell(row, columns.get(CanonicalField.ADDRESS)).trim();
        if (address.isEmpty()) {
            throw new RowParseException("address", "Blank address");
        }

        String endpoint = table.cell(row, columns.get(CanonicalField.ENDPOINT)).trim();
        if (endpoint.isEmpty()) {
            throw new RowParseException("endpoint", "Blank endpoint");
        }

        Instant timestamp = TimestampParser.parse(table.cell(row, columns.get(CanonicalField.TIMESTAMP)));
        int status = parseStatus(table.cell(row, columns.get(CanonicalField.STATUS)));

        return new LogRecord(address, timestamp, endpoint, status);
    }

    static int parseStatus(String value) throws RowParseException {
        String text = value.trim();
        if (!STATUS.matcher(text).matches()) {
            throw new RowParseException("status", "Unparsable status '" + text + "'");
        }
        int status = Integer.parseInt(text.substring(0, 3));
        if (status < 100 || status > 599) {
            throw new RowParseException("status", "Status out of range '" + text + "'");
        }
        return status;
    }
}
