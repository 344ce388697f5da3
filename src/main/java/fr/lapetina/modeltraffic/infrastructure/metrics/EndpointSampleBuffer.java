package fr.lapetina.modeltraffic.infrastructure.metrics;

import fr.lapetina.modeltraffic.domain.model.RequestMetricSample;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Fixed-capacity, time-windowed ring buffer of samples for a single endpoint.
 *
 * Writers and readers of one endpoint share a lock; different endpoints never contend.
 * Samples older than the retention window are evicted lazily on write, and the oldest
 * sample is overwritten once the buffer is full.
 *
 * A smoothed latency estimate is maintained on write and published through a volatile field,
 * so routing can read it without taking the lock or copying samples.
 */
final class EndpointSampleBuffer {

    private final RequestMetricSample[] samples;
    private final Duration retention;
    static final double LATENCY_SMOOTHING = 0.2;

    private final ReentrantLock lock = new ReentrantLock();
    private volatile LatencyEstimate latency;
    private int head;
    private int size;

    EndpointSampleBuffer(int capacity, Duration retention) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Capacity must be positive: " + capacity);
        }
        this.samples = new RequestMetricSample[capacity];
        this.retention = retention;
    }

    void add(RequestMetricSample sample, Instant now) {
        lock.lock();
        try {
            evictOlderThan(now.minus(retention));
            int tail = (head + size) % samples.length;
            samples[tail] = sample;
            if (size < samples.length) {
                size++;
            } else {
                head = (head + 1) % samples.length;
            }
            latency = LatencyEstimate.next(latency, sample);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Copies the samples whose timestamp lies within [from, to].
     */
    List<RequestMetricSample> snapshot(Instant from, Instant to) {
        lock.lock();
        try {
            List<RequestMetricSample> copy = new ArrayList<>(size);
            for (int i = 0; i < size; i++) {
                RequestMetricSample sample = samples[(head + i) % samples.length];
                if (!sample.timestamp().isBefore(from) && !sample.timestamp().isAfter(to)) {
                    copy.add(sample);
                }
            }
            return copy;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Latest latency estimate, or null before the first sample. Never blocks.
     */
    LatencyEstimate latency() {
        return latency;
    }

    int size() {
        lock.lock();
        try {
            return size;
        } finally {
            lock.unlock();
        }
    }

    int capacity() {
        return samples.length;
    }

    // Caller holds the lock.
    private void evictOlderThan(Instant cutoff) {
        while (size > 0 && samples[head].timestamp().isBefore(cutoff)) {
            samples[head] = null;
            head = (head + 1) % samples.length;
            size--;
        }
    }

    /**
     * Exponentially weighted moving average of latency, with the time of the newest sample.
     */
    record LatencyEstimate(double averageMs, Instant lastSampleAt) {

        static LatencyEstimate next(LatencyEstimate previous, RequestMetricSample sample) {
            if (previous == null) {
                return new LatencyEstimate(sample.latencyMs(), sample.timestamp());
            }
            double average = previous.averageMs + LATENCY_SMOOTHING * (sample.latencyMs() - previous.averageMs);
            Instant last = sample.timestamp().isAfter(previous.lastSampleAt) ? sample.timestamp() : previous.lastSampleAt;
            return new LatencyEstimate(average, last);
        }
    }
}
