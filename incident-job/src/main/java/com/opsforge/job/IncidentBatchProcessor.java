package com.opsforge.job;

import com.opsforge.core.model.AlertRecord;
import com.opsforge.core.model.MalformedInputException;
import com.opsforge.core.model.MetricPoint;
import com.opsforge.core.model.RawRecord;
import com.opsforge.core.model.RecordParser;
import com.opsforge.core.pipeline.IncidentPipeline;
import com.opsforge.core.pipeline.IncidentRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs every incident of a batch through one shared {@link IncidentPipeline}
 * on a fixed thread pool.
 *
 * <h3>Failure isolation</h3>
 * <p>
 * Each incident is converted and processed independently. A malformed or
 * failing incident is logged at ERROR and reported as
 * {@link IncidentOutcome.Status#FAILED}; the rest of the batch continues.
 * An incident that does not finish within the configured timeout, measured
 * from its submission, is cancelled and reported the same way.
 * </p>
 *
 * <h3>Learning</h3>
 * <p>
 * Workers only analyze. The outcome is recorded in the learner by the
 * awaiting thread once a report arrives in time, so an incident reported as
 * failed never contributes to the selection history.
 * </p>
 *
 * <p>
 * Outcomes are returned in input order regardless of completion order.
 * </p>
 *
 * @since 1.0.0
 */
public class IncidentBatchProcessor implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(IncidentBatchProcessor.class);

    private final IncidentPipeline pipeline;
    private final RecordParser parser;
    private final long incidentTimeoutSeconds;
    private final ExecutorService executor;

    /**
     * @param pipeline               shared analytics pipeline
     * @param parser                 converts raw alerts and metrics
     * @param parallelism            worker threads, {@code >= 1}
     * @param incidentTimeoutSeconds maximum wait per incident, {@code >= 1}
     */
    public IncidentBatchProcessor(IncidentPipeline pipeline, RecordParser parser, int parallelism,
            long incidentTimeoutSeconds) {
        this.pipeline = Objects.requireNonNull(pipeline, "pipeline must not be null");
        this.parser = Objects.requireNonNull(parser, "parser must not be null");
        if (parallelism < 1) {
            throw new IllegalArgumentException("parallelism must be >= 1, got: " + parallelism);
        }
        if (incidentTimeoutSeconds < 1) {
            throw new IllegalArgumentException(
                    "incidentTimeoutSeconds must be >= 1, got: " + incidentTimeoutSeconds);
        }
        this.incidentTimeoutSeconds = incidentTimeoutSeconds;
        AtomicInteger counter = new AtomicInteger();
        this.executor = Executors.newFixedThreadPool(parallelism, r -> {
            Thread t = new Thread(r, "incident-worker-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    // ---------------------------------------------------------------
    // Processing
    // ---------------------------------------------------------------

    /**
     * @param batch the incidents to process
     * @return one outcome per incident, in input order
     * @throws InterruptedException if the calling thread is interrupted while waiting
     */
    public List<IncidentOutcome> process(IncidentBatch batch) throws InterruptedException {
        Objects.requireNonNull(batch, "batch must not be null");
        List<IncidentEnvelope> incidents = batch.getIncidents();

        List<Future<IncidentOutcome>> futures = new ArrayList<>(incidents.size());
        long[] deadlines = new long[incidents.size()];
        long timeoutNanos = TimeUnit.SECONDS.toNanos(incidentTimeoutSeconds);
        for (int i = 0; i < incidents.size(); i++) {
            IncidentEnvelope envelope = incidents.get(i);
            deadlines[i] = System.nanoTime() + timeoutNanos;
            futures.add(executor.submit(() -> analyzeOne(envelope)));
        }

        List<IncidentOutcome> outcomes = new ArrayList<>(incidents.size());
        for (int i = 0; i < futures.size(); i++) {
            outcomes.add(await(incidents.get(i), futures.get(i), deadlines[i]));
        }

        long failed = outcomes.stream().filter(o -> o.getStatus() == IncidentOutcome.Status.FAILED).count();
        LOG.info("Processed {} incident(s), {} failed", outcomes.size(), failed);
        return outcomes;
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private IncidentOutcome analyzeOne(IncidentEnvelope envelope) {
        try {
            return IncidentOutcome.ok(pipeline.analyze(toRequest(envelope)));
        } catch (MalformedInputException e) {
            LOG.error("Incident {} is malformed: {}", envelope.getIncidentId(), e.getMessage());
            return IncidentOutcome.failed(envelope.getIncidentId(), e.getMessage());
        } catch (RuntimeException e) {
            LOG.error("Incident {} failed", envelope.getIncidentId(), e);
            return IncidentOutcome.failed(envelope.getIncidentId(), e.toString());
        }
    }

    private IncidentOutcome await(IncidentEnvelope envelope, Future<IncidentOutcome> future, long deadline)
            throws InterruptedException {
        IncidentOutcome outcome;
        try {
            outcome = future.get(Math.max(0L, deadline - System.nanoTime()), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            LOG.error("Incident {} timed out after {}s", envelope.getIncidentId(), incidentTimeoutSeconds);
            return IncidentOutcome.failed(envelope.getIncidentId(),
                    "Timed out after " + incidentTimeoutSeconds + "s");
        } catch (ExecutionException e) {
            LOG.error("Incident {} failed", envelope.getIncidentId(), e.getCause());
            return IncidentOutcome.failed(envelope.getIncidentId(), String.valueOf(e.getCause()));
        }
        if (outcome.getStatus() == IncidentOutcome.Status.OK) {
            try {
                pipeline.record(outcome.getReport());
            } catch (RuntimeException e) {
                LOG.error("Incident {} outcome could not be recorded", envelope.getIncidentId(), e);
                return IncidentOutcome.failed(envelope.getIncidentId(), e.toString());
            }
        }
        return outcome;
    }

    IncidentRequest toRequest(IncidentEnvelope envelope) {
        String id = envelope.getIncidentId();
        if (id == null || id.isBlank()) {
            throw new MalformedInputException("Incident is missing required field 'incidentId'");
        }
        List<AlertRecord> alerts = new ArrayList<>(envelope.getAlerts().size());
        for (RawRecord raw : envelope.getAlerts()) {
            alerts.add(parser.parseAlert(raw));
        }
        List<MetricPoint> metrics = new ArrayList<>(envelope.getMetrics().size());
        for (RawRecord raw : envelope.getMetrics()) {
            metrics.add(parser.parseMetric(raw));
        }
        return IncidentRequest.builder()
                .incidentId(id)
                .alerts(alerts)
                .metrics(metrics)
                .relevanceScores(envelope.getRelevanceScores())
                .observedQuality(envelope.getOutcomeQuality())
                .build();
    }
}
