package com.accesslog.risk.engine.schema;

import com.accesslog.risk.exception.RowParseException;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Locale;
import java.util.function.Function;
import java.util.regex.Pattern;

/**
 * Parses timestamp cells into instants.
 *
 * Accepted forms, tried in order:
 *   - numeric epoch: seconds, or milliseconds when |value| >= 1e11 (fractional seconds allowed)
 *   - ISO-8601 offset date-time ("2024-03-01T10:00:00Z", "2024-03-01 10:00:00+02:00")
 *   - ISO-8601 local date-time or date, taken as UTC
 *   - Apache common log format ("01/Mar/2024:10:00:00 +0000", optionally in brackets)
 *
 * Instants before the epoch, or past the last instant representable in epoch milliseconds,
 * are rejected.
 */
public final class TimestampParser {

    private static final Pattern EPOCH = Pattern.compile("-?\\d+(\\.\\d+)?");
    private static final BigDecimal MILLIS_CUTOFF = BigDecimal.valueOf(100_000_000_000L);
    private static final Instant LATEST = Instant.ofEpochMilli(Long.MAX_VALUE);

    private static final DateTimeFormatter COMMON_LOG =
            DateTimeFormatter.ofPattern("dd/MMM/yyyy:HH:mm:ss Z", Locale.ENGLISH);

    private static final List<Function<String, Instant>> FORMATS = List.of(
            s -> OffsetDateTime.parse(isoSeparator(s), DateTimeFormatter.ISO_OFFSET_DATE_TIME).toInstant(),
            s -> LocalDateTime.parse(isoSeparator(s), DateTimeFormatter.ISO_LOCAL_DATE_TIME).toInstant(ZoneOffset.UTC),
            s -> LocalDate.parse(s, DateTimeFormatter.ISO_LOCAL_DATE).atStartOfDay().toInstant(ZoneOffset.UTC),
            s -> OffsetDateTime.parse(stripBrackets(s), COMMON_LOG).toInstant()
    );

    private TimestampParser() {}

    public static Instant parse(String value) throws RowParseException {
        String text = value == null ? "" : value.trim();
        if (text.isEmpty()) {
            throw new RowParseException("timestamp", "Blank timestamp");
        }

        Instant instant = EPOCH.matcher(text).matches() ? parseEpoch(text) : parseFormatted(text);
        if (instant.isBefore(Instant.EPOCH)) {
            throw new RowParseException("timestamp", "Timestamp before epoch '" + text + "'");
        }
        if (instant.isAfter(LATEST)) {
            throw new RowParseException("timestamp", "Timestamp out of range '" + text + "'");
        }
        return instant;
    }

    private static Instant parseFormatted(String text) throws RowParseException {
        DateTimeParseException lastFailure = null;
        for (Function<String, Instant> format : FORMATS) {
            try {
                return format.apply(text);
            } catch (DateTimeParseException e) {
                lastFailure = e;
            }
        }
        throw new RowParseException("timestamp", "Unparsable timestamp '" + text + "'", lastFailure);
    }

    private static Instant parseEpoch(String text) throws RowParseException {
        BigDecimal number = new BigDecimal(text);
        BigDecimal millis = number.abs().compareTo(MILLIS_CUTOFF) >= 0 ? number : number.movePointRight(3);
        try {
            return Instant.ofEpochMilli(millis.setScale(0, RoundingMode.DOWN).longValueExact());
        } catch (ArithmeticException e) {
            throw new RowParseException("timestamp", "Epoch value out of range '" + text + "'", e);
        }
    }

    private static String isoSeparator(String text) {
        return text.length() > 10 && text.charAt(10) == ' '
                ? text.substring(0, 10) + 'T' + text.substring(11)
                : text;
    }

    private static String stripBrackets(String text) {
        return text.startsWith("[") && text.endsWith("]") ? text.substring(1, text.length() - 1) : text;
    }
}
