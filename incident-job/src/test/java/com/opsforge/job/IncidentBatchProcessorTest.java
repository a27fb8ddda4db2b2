package com.opsforge.job;

import com.opsforge.core.config.AnalyticsConfig;
import com.opsforge.core.forecast.RiskLevel;
import com.opsforge.core.model.RawRecord;
import com.opsforge.core.model.SelectionObservation;
import com.opsforge.core.model.RecordParser;
import com.opsforge.core.pipeline.IncidentPipeline;
import com.opsforge.core.pipeline.IncidentReport;
import com.opsforge.core.store.InMemorySelectionHistoryStore;
import com.opsforge.core.store.SelectionHistoryStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link IncidentBatchProcessor}.
 */
class IncidentBatchProcessorTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-05-01T10:00:00Z"), ZoneOffset.UTC);

    private InMemorySelectionHistoryStore store;
    private IncidentBatchProcessor processor;

    @BeforeEach
    void setUp() {
        store = new InMemorySelectionHistoryStore(1000);
        IncidentPipeline pipeline = new IncidentPipeline(AnalyticsConfig.defaults(), store, CLOCK);
        processor = new IncidentBatchProcessor(pipeline, new RecordParser(CLOCK), 3, 10);
    }

    @AfterEach
    void tearDown() {
        processor.close();
    }

    @Test
    @DisplayName("Should isolate a malformed incident and keep input order")
    void shouldIsolateFailures() throws Exception {
        List<IncidentOutcome> outcomes = processor.process(sampleBatch());

        assertThat(outcomes).extracting(IncidentOutcome::getIncidentId)
                .containsExactly("INC-100", "INC-101", "INC-102");
        assertThat(outcomes).extracting(IncidentOutcome::getStatus).containsExactly(
                IncidentOutcome.Status.OK, IncidentOutcome.Status.FAILED, IncidentOutcome.Status.OK);
        assertThat(outcomes.get(1).getError()).contains("not-a-timestamp");
        assertThat(outcomes.get(1).getReport()).isNull();
    }

    @Test
    @DisplayName("Should correlate, forecast and score the healthy incidents")
    void shouldProduceReports() throws Exception {
        List<IncidentOutcome> outcomes = processor.process(sampleBatch());

        IncidentReport first = outcomes.get(0).getReport();
        assertThat(first.getCorrelation().getPrimaryAlertId()).isEqualTo("A");
        assertThat(first.getCorrelation().getRelatedAlertIds()).containsExactly("B");
        assertThat(first.getForecast().getSeries()).singleElement()
                .satisfies(r -> assertThat(r.getLastValue()).isEqualTo(96.0));
        assertThat(first.getRisk().getLevel()).isEqualTo(RiskLevel.HIGH);
        assertThat(first.getRecordedQuality()).isEqualTo(0.9);

        IncidentReport third = outcomes.get(2).getReport();
        assertThat(third.getSelection().getAgents()).containsExactly("Orchestrator", "PatchOps");
        assertThat(third.getRecordedQuality()).isEqualTo(0.8);
        assertThat(store.getHistory(third.getSignatureKey())).isNotEmpty();
        assertThat(store.signatureCount()).isEqualTo(2);
    }

    @Test
    @DisplayName("An incident without an id should fail on its own")
    void missingIdFails() throws Exception {
        IncidentEnvelope anonymous = new IncidentEnvelope();
        anonymous.setAlerts(List.of(RawRecord.of(Map.of(
                "id", "Z", "title", "Disk full", "host", "web1",
                "severity", "low", "timestamp", "2024-05-01T10:00:00Z"))));
        IncidentBatch batch = new IncidentBatch();
        batch.setIncidents(new ArrayList<>(List.of(anonymous)));

        List<IncidentOutcome> outcomes = processor.process(batch);

        assertThat(outcomes).singleElement().satisfies(o -> {
            assertThat(o.getStatus()).isEqualTo(IncidentOutcome.Status.FAILED);
            assertThat(o.getError()).contains("incidentId");
        });
    }

    @Test
    @DisplayName("A timed-out incident should fail without feeding the learner")
    void timedOutIncidentIsNotRecorded() throws Exception {
        SlowHistoryStore slowStore = new SlowHistoryStore(TimeUnit.MILLISECONDS.toNanos(1500));
        IncidentPipeline pipeline = new IncidentPipeline(AnalyticsConfig.defaults(), slowStore, CLOCK);
        IncidentEnvelope envelope = new IncidentEnvelope();
        envelope.setIncidentId("INC-200");
        envelope.setAlerts(List.of(RawRecord.of(Map.of(
                "id", "Z", "title", "Disk full", "host", "web1",
                "severity", "low", "timestamp", "2024-05-01T10:00:00Z"))));
        IncidentBatch batch = new IncidentBatch();
        batch.setIncidents(new ArrayList<>(List.of(envelope)));

        List<IncidentOutcome> outcomes;
        try (IncidentBatchProcessor slow = new IncidentBatchProcessor(pipeline, new RecordParser(CLOCK), 1, 1)) {
            outcomes = slow.process(batch);
            assertThat(slowStore.stalled.await(5, TimeUnit.SECONDS)).isTrue();
            // let the abandoned analysis run to completion
            Thread.sleep(500);
        }

        assertThat(outcomes).singleElement().satisfies(o -> {
            assertThat(o.getStatus()).isEqualTo(IncidentOutcome.Status.FAILED);
            assertThat(o.getError()).contains("Timed out");
        });
        assertThat(slowStore.getHistory("disk")).isEmpty();
    }

    @Test
    @DisplayName("An empty batch should produce no outcomes")
    void emptyBatch() throws Exception {
        assertThat(processor.process(new IncidentBatch())).isEmpty();
    }

    /**
     * History store whose first read spins past the incident timeout,
     * ignoring interrupts like CPU-bound analysis does.
     */
    private static final class SlowHistoryStore implements SelectionHistoryStore {

        private final InMemorySelectionHistoryStore delegate = new InMemorySelectionHistoryStore(1000);
        private final AtomicBoolean first = new AtomicBoolean(true);
        private final CountDownLatch stalled = new CountDownLatch(1);
        private final long stallNanos;

        SlowHistoryStore(long stallNanos) {
            this.stallNanos = stallNanos;
        }

        @Override
        public List<SelectionObservation> getHistory(String key) {
            if (first.compareAndSet(true, false)) {
                long until = System.nanoTime() + stallNanos;
                while (System.nanoTime() < until) {
                    Thread.onSpinWait();
                }
                stalled.countDown();
            }
            return delegate.getHistory(key);
        }

        @Override
        public void appendHistory(String key, SelectionObservation observation) {
            delegate.appendHistory(key, observation);
        }
    }

    private IncidentBatch sampleBatch() throws IOException {
        try (InputStream in = getClass().getClassLoader().getResourceAsStream("sample-batch.json")) {
            return new IncidentBatchReader().read(in);
        }
    }
}
