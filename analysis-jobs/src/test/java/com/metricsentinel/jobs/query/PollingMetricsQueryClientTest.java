package com.metricsentinel.jobs.query;

import com.metricsentinel.core.error.CollaboratorException;
import com.metricsentinel.core.model.MetricKind;
import com.metricsentinel.core.model.TimeSeries;
import com.metricsentinel.core.model.TimeSeriesPoint;
import com.metricsentinel.jobs.EngineConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link PollingMetricsQueryClient}.
 */
class PollingMetricsQueryClientTest {

    private static final Instant START = Instant.parse("2024-03-01T00:00:00Z");
    private static final Instant END = Instant.parse("2024-03-02T00:00:00Z");

    @Test
    @DisplayName("Polls until the backend reports completion and returns its series")
    void shouldReturnResultAfterPolling() {
        FakeBackend backend = new FakeBackend(3);
        PollingMetricsQueryClient client = new PollingMetricsQueryClient(backend,
                Duration.ofSeconds(5), Duration.ofMillis(1), Duration.ofMillis(4));

        TimeSeries series = client.query("orders", MetricKind.ERROR_COUNT, START, END, Duration.ofHours(1));

        assertThat(series.getSource()).isEqualTo("orders");
        assertThat(series.values()).containsExactly(42.0);
        assertThat(backend.fetches).hasValue(3);
        assertThat(backend.cancelled).isEmpty();
    }

    @Test
    @DisplayName("A query that never completes is cancelled and surfaces as CollaboratorException")
    void shouldCancelOnTimeout() {
        FakeBackend backend = new FakeBackend(Integer.MAX_VALUE);
        PollingMetricsQueryClient client = new PollingMetricsQueryClient(backend,
                Duration.ofMillis(100), Duration.ofMillis(5), Duration.ofMillis(20));

        assertThatThrownBy(() -> client.query("orders", MetricKind.LOG_VOLUME, START, END, Duration.ofHours(1)))
                .isInstanceOf(CollaboratorException.class)
                .hasMessageContaining("did not complete within 100 ms");
        assertThat(backend.cancelled).containsExactly("q-1");
        assertThat(backend.fetches.get()).isGreaterThan(1);
    }

    @Test
    @DisplayName("Backoff grows between polls so a slow query is polled only a few times")
    void shouldBackOffExponentially() {
        FakeBackend backend = new FakeBackend(Integer.MAX_VALUE);
        PollingMetricsQueryClient client = new PollingMetricsQueryClient(backend,
                Duration.ofMillis(300), Duration.ofMillis(10), Duration.ofSeconds(1));

        assertThatThrownBy(() -> client.query("orders", MetricKind.COST, START, END, Duration.ofDays(1)))
                .isInstanceOf(CollaboratorException.class);
        // 10 + 20 + 40 + 80 + 160 ms of sleep covers the timeout
        assertThat(backend.fetches.get()).isBetween(2, 7);
    }

    @Test
    @DisplayName("A failed backend query propagates its CollaboratorException")
    void shouldPropagateBackendFailure() {
        AsyncQueryBackend backend = new FakeBackend(1) {
            @Override
            public Optional<TimeSeries> fetchResults(String queryId) {
                throw new CollaboratorException("query " + queryId + " failed: MalformedQuery");
            }
        };
        PollingMetricsQueryClient client = new PollingMetricsQueryClient(backend,
                Duration.ofSeconds(1), Duration.ofMillis(1), Duration.ofMillis(1));

        assertThatThrownBy(() -> client.query("orders", MetricKind.COST, START, END, Duration.ofDays(1)))
                .isInstanceOf(CollaboratorException.class)
                .hasMessageContaining("MalformedQuery");
    }

    @Test
    @DisplayName("Takes timeout and backoff from EngineConfig")
    void shouldCreateFromEngineConfig() {
        EngineConfig config = new EngineConfig.Builder()
                .queryTimeout(Duration.ofSeconds(2))
                .pollInitialBackoff(Duration.ofMillis(1))
                .pollMaxBackoff(Duration.ofMillis(2))
                .build();
        FakeBackend backend = new FakeBackend(2);

        TimeSeries series = PollingMetricsQueryClient.create(backend, config)
                .query("orders", MetricKind.COST, START, END, Duration.ofDays(1));

        assertThat(series.size()).isEqualTo(1);
    }

    @Test
    @DisplayName("Initial backoff larger than the maximum is rejected")
    void shouldRejectInvertedBackoff() {
        assertThatThrownBy(() -> new PollingMetricsQueryClient(new FakeBackend(1),
                Duration.ofSeconds(1), Duration.ofSeconds(2), Duration.ofSeconds(1)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    /** Completes on the n-th fetch. */
    private static class FakeBackend implements AsyncQueryBackend {
        private final int completeOnFetch;
        private final AtomicInteger started = new AtomicInteger();
        final AtomicInteger fetches = new AtomicInteger();
        final List<String> cancelled = new CopyOnWriteArrayList<>();
        private volatile String source;
        private volatile MetricKind kind;

        FakeBackend(int completeOnFetch) {
            this.completeOnFetch = completeOnFetch;
        }

        @Override
        public String startQuery(String source, MetricKind metricKind, Instant start, Instant end,
                Duration resolution) {
            this.source = source;
            this.kind = metricKind;
            return "q-" + started.incrementAndGet();
        }

        @Override
        public Optional<TimeSeries> fetchResults(String queryId) {
            if (fetches.incrementAndGet() < completeOnFetch) {
                return Optional.empty();
            }
            return Optional.of(TimeSeries.of(source, kind, List.of(new TimeSeriesPoint(START, 42.0))));
        }

        @Override
        public void cancelQuery(String queryId) {
            cancelled.add(queryId);
        }
    }
}
