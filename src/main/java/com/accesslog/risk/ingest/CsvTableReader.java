package com.accesslog.risk.ingest;

import com.accesslog.risk.exception.TableFormatException;
import com.accesslog.risk.model.RawTable;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.RuntimeJsonMappingException;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Reads a comma-separated upload into a {@link RawTable}. The first non-empty line
 * is the header; quoted cells follow RFC 4180. No column is interpreted here.
 */
@Component
public class CsvTableReader {

    private static final Logger log = LoggerFactory.getLogger(CsvTableReader.class);

    private static final String BOM = "\uFEFF";

    private final ObjectReader reader;

    public CsvTableReader() {
        this.reader = new CsvMapper()
                .readerFor(String[].class)
                .with(CsvParser.Feature.WRAP_AS_ARRAY)
                .with(CsvParser.Feature.SKIP_EMPTY_LINES);
    }

    public RawTable read(InputStream input) {
        List<String> headers = List.of();
        List<List<String>> rows = new ArrayList<>();

        try (MappingIterator<String[]> lines = reader.readValues(input)) {
            if (lines.hasNextValue()) {
                String[] header = lines.nextValue();
                if (header.length > 0 && header[0] != null && header[0].startsWith(BOM)) {
                    header[0] = header[0].substring(BOM.length());
                }
                headers = Arrays.asList(header);
            }
            while (lines.hasNextValue()) {
                rows.add(Arrays.asList(lines.nextValue()));
            }
        } catch (IOException | RuntimeJsonMappingException e) {
            throw new TableFormatException("Unreadable CSV input: " + e.getMessage(), e);
        }

        log.debug("Read CSV table: {} columns, {} rows", headers.size(), rows.size());
        return new RawTable(headers, rows);
    }
}
