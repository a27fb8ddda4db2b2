package com.opsforge.core.store;

import com.opsforge.core.model.SelectionObservation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Process-local {@link SelectionHistoryStore}.
 *
 * <h3>Concurrency</h3>
 * <p>
 * Buckets live in a {@link ConcurrentHashMap} and are created atomically on
 * first append. Each bucket is guarded by its own
 * {@link ReentrantReadWriteLock}, so writers to different signatures never
 * contend.
 * </p>
 *
 * <h3>Retention</h3>
 * <p>
 * A bucket holds at most {@code maxObservationsPerSignature} observations; the
 * oldest is evicted first. A cap of {@code 0} disables eviction.
 * </p>
 *
 * @since 1.0.0
 */
public class InMemorySelectionHistoryStore implements SelectionHistoryStore {

    private static final Logger LOG = LoggerFactory.getLogger(InMemorySelectionHistoryStore.class);

    private final ConcurrentMap<String, Bucket> buckets = new ConcurrentHashMap<>();
    private final int maxObservationsPerSignature;

    /**
     * @param maxObservationsPerSignature per-key cap; {@code 0} means unbounded
     * @throws IllegalArgumentException if the cap is negative
     */
    public InMemorySelectionHistoryStore(int maxObservationsPerSignature) {
        if (maxObservationsPerSignature < 0) {
            throw new IllegalArgumentException(
                    "maxObservationsPerSignature must be >= 0, got: " + maxObservationsPerSignature);
        }
        this.maxObservationsPerSignature = maxObservationsPerSignature;
    }

    // -------------------------------------------------------------------------
    // Public API
    // -------------------------------------------------------------------------

    @Override
    public List<SelectionObservation> getHistory(String key) {
        Objects.requireNonNull(key, "key must not be null");
        Bucket bucket = buckets.get(key);
        return bucket == null ? List.of() : bucket.snapshot();
    }

    @Override
    public void appendHistory(String key, SelectionObservation observation) {
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(observation, "observation must not be null");
        buckets.computeIfAbsent(key, k -> new Bucket()).append(observation, maxObservationsPerSignature, key);
    }

    /**
     * @return number of signatures with at least one observation
     */
    public int signatureCount() {
        return buckets.size();
    }

    // -------------------------------------------------------------------------
    // Internal
    // -------------------------------------------------------------------------

    private static final class Bucket {
        private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
        private final Deque<SelectionObservation> observations = new ArrayDeque<>();

        void append(SelectionObservation observation, int cap, String key) {
            lock.writeLock().lock();
            try {
                observations.addLast(observation);
                if (cap > 0) {
                    while (observations.size() > cap) {
                        observations.removeFirst();
                        LOG.trace("Evicted oldest observation for signature '{}'", key);
                    }
                }
            } finally {
                lock.writeLock().unlock();
            }
        }

        List<SelectionObservation> snapshot() {
            lock.readLock().lock();
            try {
                return List.copyOf(observations);
            } finally {
                lock.readLock().unlock();
            }
        }
    }
}
