package com.sandy.agentops.alerting.service;

import com.sandy.agentops.alerting.MutableClock;
import com.sandy.agentops.alerting.detector.AnomalyDetector;
import com.sandy.agentops.alerting.detector.MADAnomalyDetector;
import com.sandy.agentops.alerting.detector.SeasonalAnomalyDetector;
import com.sandy.agentops.alerting.detector.StatisticalAnomalyDetector;
import com.sandy.agentops.alerting.entity.Anomaly;
import com.sandy.agentops.alerting.entity.AnomalySeverity;
import com.sandy.agentops.alerting.entity.MetricPoint;
import com.sandy.agentops.alerting.event.AnomalyDetectedEvent;
import com.sandy.agentops.alerting.service.impl.InMemoryTimeSeriesStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static com.sandy.agentops.alerting.MetricFixtures.T0;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.spy;

class AnomalyDetectionServiceTest {

    private MutableClock clock;
    private InMemoryTimeSeriesStore store;
    private List<Object> events;
    private AnomalyDetectionService service;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0.plus(Duration.ofHours(1)));
        store = new InMemoryTimeSeriesStore(clock, 10_000);
        events = new ArrayList<>();
        service = new AnomalyDetectionService(store, events::add, clock, AnomalyDetectionService.DEFAULT_LOOKBACK, 100);
    }

    private void write(String metric, double value, Duration ago) {
        store.write(metric, value, null, clock.instant().minus(ago));
    }

    @Test
    void detectsRecordsAndPublishesOutlier() {
        for (int i = 0; i < 40; i++) {
            write("latency", i == 39 ? 200 : 100 + (i % 5), Duration.ofSeconds(39 - i));
        }
        service.addDetector("latency", new StatisticalAnomalyDetector(3, 20));

        List<Anomaly> found = service.runDetection();

        assertEquals(1, found.size());
        Anomaly a = found.get(0);
        assertEquals("latency", a.getMetric());
        assertEquals(200, a.getValue());
        assertEquals(clock.instant(), a.getTimestamp());
        assertEquals("statistical", a.getDetector());
        assertTrue(a.getSeverity().compareTo(AnomalySeverity.LOW) > 0);
        assertEquals(found, service.getHistory("latency"));
        assertEquals(1, events.size());
        assertEquals(a, ((AnomalyDetectedEvent) events.get(0)).getAnomaly());
    }

    @Test
    void eachAnomalyIsReportedOnce() {
        service.addDetector("q", new AboveDetector(150));
        write("q", 10, Duration.ofMinutes(2));
        write("q", 500, Duration.ofMinutes(1));

        assertEquals(1, service.runDetection().size());
        assertTrue(service.runDetection().isEmpty());

        clock.advance(Duration.ofSeconds(30));
        write("q", 600, Duration.ZERO);
        List<Anomaly> second = service.runDetection();

        assertEquals(1, second.size());
        assertEquals(600, second.get(0).getValue());
        assertEquals(2, service.getHistory("q").size());
        assertEquals(2, events.size());
    }

    @Test
    void lateAnomalyBehindReportedOneIsStillReported() {
        service.addDetector("cost", new MADAnomalyDetector(3));
        for (int i = 0; i < 30; i++) {
            write("cost", 100 + (i % 3), Duration.ofMinutes(30 - i));
        }
        write("cost", 4000, Duration.ZERO);
        List<Anomaly> first = service.runDetection();
        assertEquals(1, first.size());
        assertEquals(4000, first.get(0).getValue());

        // written now, stamped twenty minutes in the past
        Instant late = clock.instant().minus(Duration.ofMinutes(19)).minusSeconds(30);
        store.write("cost", 5000, null, late);
        List<Anomaly> second = service.runDetection();

        assertEquals(1, second.size());
        assertEquals(late, second.get(0).getTimestamp());
        assertEquals(5000, second.get(0).getValue());
        assertEquals(2, service.getHistory("cost").size());
        assertTrue(service.runDetection().isEmpty());
    }

    @Test
    void seasonalDetectorFiresBetweenSamples() {
        Instant monday = Instant.parse("2024-01-01T00:00:00Z");
        InMemoryTimeSeriesStore hourly = new InMemoryTimeSeriesStore(clock, 10_000);
        for (int h = 0; h < 7 * 24; h++) {
            int hourOfDay = h % 24;
            hourly.write("requests", hourOfDay >= 9 && hourOfDay <= 17 ? 100 : 20, null, monday.plus(Duration.ofHours(h)));
        }
        Instant day7 = monday.plus(Duration.ofDays(7));
        for (int i = 0; i < 3; i++) {
            hourly.write("requests", 150, null, day7.plus(Duration.ofHours(i)));
        }
        MutableClock tickClock = new MutableClock(day7.plus(Duration.ofHours(2)).plusSeconds(30));
        AnomalyDetectionService seasonal = new AnomalyDetectionService(hourly, events::add, tickClock,
                AnomalyDetectionService.DEFAULT_LOOKBACK, 100);
        seasonal.addDetector("requests", new SeasonalAnomalyDetector(SeasonalAnomalyDetector.Period.DAILY, 1.5));

        List<Anomaly> found = seasonal.runDetection();

        assertEquals(3, found.size());
        assertTrue(found.stream().allMatch(a -> a.getValue() == 150 && "seasonal-daily".equals(a.getDetector())));
    }

    @Test
    void historyIsCappedPerMetric() {
        AnomalyDetectionService small = new AnomalyDetectionService(store, events::add, clock, Duration.ofHours(1), 3);
        small.addDetector("q", new AboveDetector(150));
        for (int i = 0; i < 5; i++) {
            write("q", 200 + i, Duration.ofSeconds(10 - i));
        }

        assertEquals(5, small.runDetection().size());

        List<Double> kept = small.getHistory("q").stream().map(Anomaly::getValue).toList();
        assertEquals(List.of(202.0, 203.0, 204.0), kept);
    }

    @Test
    void removeDetectorKeepsHistory() {
        service.addDetector("q", new AboveDetector(150));
        write("q", 500, Duration.ofSeconds(1));
        service.runDetection();

        assertTrue(service.removeDetector("q"));
        assertFalse(service.removeDetector("q"));
        assertEquals(0, service.getDetectorCount());
        assertEquals(1, service.getHistory("q").size());
        assertTrue(service.runDetection().isEmpty());
    }

    @Test
    void storageFailurePropagatesWithoutTouchingHistory() {
        InMemoryTimeSeriesStore backing = spy(store);
        AnomalyDetectionService guarded = new AnomalyDetectionService(backing, events::add, clock, Duration.ofHours(1), 10);
        guarded.addDetector("q", new AboveDetector(150));
        write("q", 500, Duration.ofSeconds(5));
        guarded.runDetection();

        write("q", 900, Duration.ZERO);
        doThrow(new StorageUnavailableException("backend down")).when(backing).query(any());

        assertThrows(StorageUnavailableException.class, guarded::runDetection);
        assertEquals(1, guarded.getHistory("q").size());
        assertEquals(1, events.size());
    }

    @Test
    void failingDetectorDoesNotAffectOtherMetrics() {
        service.addDetector("broken", new AnomalyDetector() {
            @Override
            public List<Anomaly> detect(List<MetricPoint> points) {
                throw new IllegalStateException("model not loaded");
            }

            @Override
            public String getName() {
                return "broken";
            }
        });
        service.addDetector("q", new AboveDetector(150));
        write("broken", 1, Duration.ofSeconds(1));
        write("q", 500, Duration.ofSeconds(1));

        List<Anomaly> found = service.runDetection();

        assertEquals(1, found.size());
        assertEquals("q", found.get(0).getMetric());
    }

    @Test
    void honoursLongerPreferredLookback() {
        service.addDetector("short", new AboveDetector(150));
        service.addDetector("long", new AboveDetector(150, Duration.ofHours(3)));
        write("short", 500, Duration.ofHours(2));
        write("long", 500, Duration.ofHours(2));

        List<Anomaly> found = service.runDetection();

        assertEquals(1, found.size());
        assertEquals("long", found.get(0).getMetric());
    }

    @Test
    void rejectsIncompleteRegistration() {
        assertThrows(IllegalArgumentException.class, () -> service.addDetector(" ", new AboveDetector(1)));
        assertThrows(IllegalArgumentException.class, () -> service.addDetector("q", null));
        assertEquals(0, service.getDetectorCount());
    }

    /** Flags every point above a fixed limit. */
    private static class AboveDetector implements AnomalyDetector {
        private final double limit;
        private final Duration lookback;

        AboveDetector(double limit) {
            this(limit, null);
        }

        AboveDetector(double limit, Duration lookback) {
            this.limit = limit;
            this.lookback = lookback;
        }

        @Override
        public List<Anomaly> detect(List<MetricPoint> points) {
            List<Anomaly> result = new ArrayList<>();
            for (MetricPoint p : points) {
                if (p.getValue() > limit) {
                    result.add(Anomaly.builder()
                            .timestamp(p.getTimestamp())
                            .value(p.getValue())
                            .expected(limit)
                            .deviationScore(p.getValue() / limit)
                            .severity(AnomalySeverity.HIGH)
                            .detector(getName())
                            .build());
                }
            }
            return result;
        }

        @Override
        public Optional<Duration> preferredLookback() {
            return Optional.ofNullable(lookback);
        }

        @Override
        public String getName() {
            return "above";
        }
    }
}
