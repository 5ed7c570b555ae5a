package com.accesslog.risk.engine.features;

import com.accesslog.risk.config.AnalysisConfig;
import com.accesslog.risk.model.FeatureVector;
import com.accesslog.risk.model.LogRecord;
import com.accesslog.risk.model.WindowKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Groups log records by (address, epoch-aligned window) and computes one
 * {@link FeatureVector} per populated group.
 *
 * Window start = floor(epochMillis / widthMillis) * widthMillis, so a record's
 * window never depends on the order records arrive in.
 */
@Component
public class FeatureAggregator {

    private static final Logger log = LoggerFactory.getLogger(FeatureAggregator.class);

    private final AnalysisConfig config;

    public FeatureAggregator(AnalysisConfig config) {
        this.config = config;
    }

    /**
     * @return one vector per (address, window), ordered by address then window start
     */
    public List<FeatureVector> aggregate(List<LogRecord> records) {
        long widthMillis = config.getWindowMillis();

        Map<WindowKey, List<LogRecord>> groups = new TreeMap<>();
        for (LogRecord record : records) {
            WindowKey key = new WindowKey(record.address(), windowStart(record.timestamp(), widthMillis));
            groups.computeIfAbsent(key, k -> new ArrayList<>()).add(record);
        }

        List<FeatureVector> vectors = new ArrayList<>(groups.size());
        for (Map.Entry<WindowKey, List<LogRecord>> entry : groups.entrySet()) {
            vectors.add(computeFeatures(entry.getKey(), entry.getValue(), widthMillis));
        }

        log.debug("Aggregated {} records into {} address windows of {} min",
                records.size(), vectors.size(), config.getWindowMinutes());
        return vectors;
    }

    public static Instant windowStart(Instant timestamp, long widthMillis) {
        return Instant.ofEpochMilli(Math.floorDiv(timestamp.toEpochMilli(), widthMillis) * widthMillis);
    }

    private FeatureVector computeFeatures(WindowKey key, List<LogRecord> group, long widthMillis) {
        List<LogRecord> sorted = new ArrayList<>(group);
        sorted.sort(Comparator.comparing(LogRecord::timestamp));

        int total = sorted.size();
        int failed = 0;
        Set<String> endpoints = new HashSet<>();
        for (LogRecord record : sorted) {
            if (record.isFailed()) failed++;
            endpoints.add(record.endpoint());
        }

        double gapSum = 0.0;
        for (int i = 1; i < total; i++) {
            gapSum += Duration.between(sorted.get(i - 1).timestamp(), sorted.get(i).timestamp()).toNanos() / 1_000_000_000.0;
        }
        double avgGap = total > 1 ? gapSum / (total - 1) : 0.0;

        double widthMinutes = widthMillis / 60_000.0;

        return FeatureVector.builder()
                .address(key.address())
                .windowStart(key.windowStart())
                .windowEnd(key.windowStart().plusMillis(widthMillis))
                .failedCount(failed)
                .totalCount(total)
                .successRatio((double) (total - failed) / total)
                .uniqueEndpointCount(endpoints.size())
                .requestRatePerMinute(total / widthMinutes)
                .avgInterRequestGapSeconds(avgGap)
                .build();
    }
}
