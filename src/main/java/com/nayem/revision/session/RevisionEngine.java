package com.nayem.revision.session;

import com.nayem.revision.core.EntityIntrospector;
import com.nayem.revision.core.OperationLedger;
import com.nayem.revision.metadata.EntityDescriptorRegistry;
import com.nayem.revision.metadata.IdentityTracker;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.UUID;
import java.util.function.Consumer;

/**
 * Entry point creating one {@link UnitOfWork} per transaction.
 * <p>
 * The engine itself holds only shared, read-mostly collaborators (metadata,
 * sink, metrics). Units of work are independent of each other and must not be
 * shared between threads.
 * </p>
 */
public class RevisionEngine {

    private static final Logger log = LoggerFactory.getLogger(RevisionEngine.class);

    private final EntityIntrospector introspector;
    private final OperationSink sink;
    private final RevisionMetrics metrics;
    private final IdentityTracker identities;
    private final Consumer<Throwable> errorHandler;

    public RevisionEngine(EntityIntrospector introspector, OperationSink sink, RevisionMetrics metrics,
            IdentityTracker identities, Consumer<Throwable> errorHandler) {
        this.introspector = introspector;
        this.sink = sink;
        this.metrics = metrics != null ? metrics : RevisionMetrics.noOp();
        this.identities = identities;
        this.errorHandler = errorHandler;
    }

    /**
     * Starts a unit of work with an empty ledger.
     */
    public UnitOfWork begin() {
        UUID id = UUID.randomUUID();
        log.debug("Beginning unit of work {}", id);
        return new UnitOfWork(id, new OperationLedger(introspector), sink, metrics, identities, errorHandler);
    }

    public EntityIntrospector getIntrospector() {
        return introspector;
    }

    public OperationSink getSink() {
        return sink;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for creating a {@link RevisionEngine} instance.
     * <p>
     * Required: an {@link EntityIntrospector} and an {@link OperationSink}.
     * When the introspector is an {@link EntityDescriptorRegistry}, its
     * {@link IdentityTracker} is refreshed on flush unless
     * {@link #trackIdentities(boolean)} turns it off.
     * </p>
     */
    public static class Builder {
        private EntityIntrospector introspector;
        private OperationSink sink;
        private MeterRegistry registry;
        private Consumer<Throwable> errorHandler;
        private IdentityTracker identities;
        private boolean trackIdentities = true;

        /**
         * Sets the metadata capability used to key entities.
         *
         * @return this builder
         */
        public Builder introspector(EntityIntrospector introspector) {
            this.introspector = introspector;
            return this;
        }

        /**
         * Sets the consumer of finalized operations.
         *
         * @return this builder
         */
        public Builder sink(OperationSink sink) {
            this.sink = sink;
            return this;
        }

        /**
         * Sets the Micrometer registry for recording metrics. Optional.
         *
         * @return this builder
         */
        public Builder metrics(MeterRegistry registry) {
            this.registry = registry;
            return this;
        }

        /**
         * Sets an optional handler notified when the sink fails.
         *
         * @return this builder
         */
        public Builder onError(Consumer<Throwable> errorHandler) {
            this.errorHandler = errorHandler;
            return this;
        }

        /**
         * Sets the tracker refreshed with persisted identities on flush. Defaults
         * to the tracker of an {@link EntityDescriptorRegistry} introspector.
         *
         * @return this builder
         */
        public Builder identities(IdentityTracker identities) {
            this.identities = identities;
            return this;
        }

        /**
         * Whether flushes update persisted identities. Default is true.
         *
         * @return this builder
         */
        public Builder trackIdentities(boolean trackIdentities) {
            this.trackIdentities = trackIdentities;
            return this;
        }

        /**
         * @throws IllegalStateException if introspector or sink is missing
         */
        public RevisionEngine build() {
            if (introspector == null || sink == null) {
                throw new IllegalStateException("Introspector and Sink are required.");
            }

            IdentityTracker tracker = null;
            if (trackIdentities) {
                tracker = identities;
                if (tracker == null && introspector instanceof EntityDescriptorRegistry descriptors) {
                    tracker = descriptors.getIdentities();
                }
            }

            return new RevisionEngine(introspector, sink, new RevisionMetrics(registry), tracker, errorHandler);
        }
    }
}
