package com.accesslog.risk.engine.features;

import com.accesslog.risk.config.AnalysisConfig;
import com.accesslog.risk.model.FeatureVector;
import com.accesslog.risk.model.LogRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import static com.accesslog.risk.testutil.TestDataFactory.BASE;
import static com.accesslog.risk.testutil.TestDataFactory.createRecord;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class FeatureAggregatorTest {

    private FeatureAggregator aggregator;

    @BeforeEach
    void setUp() {
        aggregator = new FeatureAggregator(new AnalysisConfig());
    }

    @Test
    void aggregate_computesAllFeaturesForOneWindow() {
        List<LogRecord> records = List.of(
                createRecord("10.0.0.1", BASE.plusSeconds(10), "/a", 200),
                createRecord("10.0.0.1", BASE.plusSeconds(70), "/b", 404),
                createRecord("10.0.0.1", BASE.plusSeconds(40), "/a", 500),
                createRecord("10.0.0.1", BASE.plusSeconds(100), "/c", 302));

        List<FeatureVector> vectors = aggregator.aggregate(records);

        assertThat(vectors).hasSize(1);
        FeatureVector v = vectors.get(0);
        assertThat(v.getAddress()).isEqualTo("10.0.0.1");
        assertThat(v.getWindowStart()).isEqualTo(BASE);
        assertThat(v.getWindowEnd()).isEqualTo(BASE.plusSeconds(300));
        assertThat(v.getTotalCount()).isEqualTo(4);
        assertThat(v.getFailedCount()).isEqualTo(2);
        assertThat(v.getSuccessRatio()).isCloseTo(0.5, within(1e-12));
        assertThat(v.getUniqueEndpointCount()).isEqualTo(3);
        // fixed denominator: 4 requests / 5 minutes, not / elapsed 1.5 minutes
        assertThat(v.getRequestRatePerMinute()).isCloseTo(0.8, within(1e-12));
        // sorted gaps: 30, 30, 30
        assertThat(v.getAvgInterRequestGapSeconds()).isCloseTo(30.0, within(1e-12));
    }

    @Test
    void aggregate_singleRecord_hasZeroGap() {
        List<FeatureVector> vectors = aggregator.aggregate(List.of(
                createRecord("10.0.0.1", BASE.plusSeconds(42), "/a", 500)));

        FeatureVector v = vectors.get(0);
        assertThat(v.getTotalCount()).isEqualTo(1);
        assertThat(v.getFailedCount()).isEqualTo(1);
        assertThat(v.getSuccessRatio()).isEqualTo(0.0);
        assertThat(v.getAvgInterRequestGapSeconds()).isEqualTo(0.0);
        assertThat(v.getRequestRatePerMinute()).isCloseTo(0.2, within(1e-12));
    }

    @Test
    void aggregate_windowsAreEpochAlignedAndHalfOpen() {
        List<FeatureVector> vectors = aggregator.aggregate(List.of(
                createRecord("10.0.0.1", BASE.plusSeconds(299), "/a", 200),
                createRecord("10.0.0.1", BASE.plusSeconds(300), "/a", 200),
                createRecord("10.0.0.1", BASE.minusMillis(1), "/a", 200)));

        assertThat(vectors).extracting(FeatureVector::getWindowStart).containsExactly(
                BASE.minusSeconds(300), BASE, BASE.plusSeconds(300));
        assertThat(vectors).allSatisfy(v -> assertThat(v.getTotalCount()).isEqualTo(1));
    }

    @Test
    void aggregate_groupsByAddressAndOrdersByAddressThenWindow() {
        List<FeatureVector> vectors = aggregator.aggregate(List.of(
                createRecord("b", BASE.plusSeconds(400), "/", 200),
                createRecord("a", BASE.plusSeconds(400), "/", 200),
                createRecord("b", BASE.plusSeconds(5), "/", 200),
                createRecord("a", BASE.plusSeconds(6), "/", 200)));

        assertThat(vectors).extracting(v -> v.getAddress() + "@" + v.getWindowStart())
                .containsExactly(
                        "a@" + BASE, "a@" + BASE.plusSeconds(300),
                        "b@" + BASE, "b@" + BASE.plusSeconds(300));
    }

    @Test
    void aggregate_isIndependentOfInputOrder() {
        Random random = new Random(3);
        List<LogRecord> records = new ArrayList<>();
        for (int i = 0; i < 200; i++) {
            records.add(createRecord("10.0.0." + random.nextInt(4),
                    BASE.plusSeconds(random.nextInt(1800)),
                    "/p" + random.nextInt(5),
                    random.nextBoolean() ? 200 : 503));
        }
        List<LogRecord> shuffled = new ArrayList<>(records);
        Collections.shuffle(shuffled, new Random(11));

        assertThat(aggregator.aggregate(shuffled)).isEqualTo(aggregator.aggregate(records));
    }

    @Test
    void aggregate_featureBoundsHoldForEveryVector() {
        Random random = new Random(5);
        List<LogRecord> records = new ArrayList<>();
        for (int i = 0; i < 500; i++) {
            records.add(createRecord("h" + random.nextInt(10),
                    Instant.ofEpochSecond(1_700_000_000L + random.nextInt(7200)),
                    "/e" + random.nextInt(8),
                    100 + random.nextInt(500)));
        }

        assertThat(aggregator.aggregate(records)).allSatisfy(v -> {
            assertThat(v.getTotalCount()).isGreaterThanOrEqualTo(1);
            assertThat(v.getFailedCount()).isBetween(0, v.getTotalCount());
            assertThat(v.getSuccessRatio()).isBetween(0.0, 1.0);
            assertThat(v.getUniqueEndpointCount()).isGreaterThanOrEqualTo(1);
            assertThat(v.getRequestRatePerMinute()).isGreaterThanOrEqualTo(0.0);
            assertThat(v.getAvgInterRequestGapSeconds()).isGreaterThanOrEqualTo(0.0);
        });
    }

    @Test
    void aggregate_honorsConfiguredWindowWidth() {
        AnalysisConfig config = new AnalysisConfig();
        config.setWindowMinutes(10);
        FeatureAggregator wide = new FeatureAggregator(config);

        List<FeatureVector> vectors = wide.aggregate(List.of(
                createRecord("10.0.0.1", BASE.plusSeconds(10), "/a", 200),
                createRecord("10.0.0.1", BASE.plusSeconds(590), "/a", 200)));

        assertThat(vectors).hasSize(1);
        assertThat(vectors.get(0).getRequestRatePerMinute()).isCloseTo(0.2, within(1e-12));
        assertThat(vectors.get(0).getAvgInterRequestGapSeconds()).isCloseTo(580.0, within(1e-9));
    }
}
