package com.nayem.revision.session;

import com.nayem.revision.core.OperationKind;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.util.Locale;
import java.util.concurrent.TimeUnit;

/**
 * Micrometer metrics for unit-of-work activity.
 */
public class RevisionMetrics {

    private final MeterRegistry registry;
    private final Timer flushTimer;

    public RevisionMetrics(MeterRegistry registry) {
        this.registry = registry;
        this.flushTimer = registry == null ? null
                : Timer.builder("revision.flush.duration")
                        .description("Time spent handing operations to the sink")
                        .register(registry);
    }

    public void recordEvent(OperationKind event) {
        if (registry != null) {
            registry.counter("revision.events", "event", tagValue(event)).increment();
        }
    }

    public void recordEmitted(OperationKind kind, int count) {
        if (registry != null && count > 0) {
            registry.counter("revision.operations.emitted", "kind", tagValue(kind)).increment(count);
        }
    }

    public void recordStale(int count) {
        if (registry != null && count > 0) {
            registry.counter("revision.operations.stale").increment(count);
        }
    }

    public void recordRetracted(int count) {
        if (registry != null && count > 0) {
            registry.counter("revision.operations.retracted").increment(count);
        }
    }

    public void recordFlushDuration(long durationNanos) {
        if (flushTimer != null) {
            flushTimer.record(durationNanos, TimeUnit.NANOSECONDS);
        }
    }

    public void recordOutcome(UnitOfWorkStatus status) {
        if (registry != null) {
            registry.counter("revision.units", "outcome", status.name().toLowerCase(Locale.ROOT)).increment();
        }
    }

    private static String tagValue(OperationKind kind) {
        return kind.name().toLowerCase(Locale.ROOT);
    }

    public static RevisionMetrics noOp() {
        return new RevisionMetrics(null);
    }
}
