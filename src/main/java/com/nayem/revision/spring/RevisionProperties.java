package com.nayem.revision.spring;

import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the Revision operation-merging engine.
 * <p>
 * These properties can be configured in {@code application.yml} under the
 * {@code revision} prefix.
 * </p>
 */
@ConfigurationProperties(prefix = "revision")
@Validated
public class RevisionProperties {

    /**
     * Whether the auto-configuration creates the engine at all.
     */
    private boolean enabled = true;

    /**
     * Maximum number of entity types whose metadata is kept in memory.
     */
    @Min(1)
    private long metadataCacheSize = 1000;

    /**
     * Whether flushes update the persisted identity of written entities, so a
     * later primary-key change finds the entry recorded under the old key.
     */
    private boolean trackIdentities = true;

    /**
     * Whether to log finalized operations as JSON when the application defines
     * no OperationSink bean. When false, operations are kept in memory instead.
     */
    private boolean logOperations = true;

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public long getMetadataCacheSize() {
        return metadataCacheSize;
    }

    public void setMetadataCacheSize(long metadataCacheSize) {
        this.metadataCacheSize = metadataCacheSize;
    }

    public boolean isTrackIdentities() {
        return trackIdentities;
    }

    public void setTrackIdentities(boolean trackIdentities) {
        this.trackIdentities = trackIdentities;
    }

    public boolean isLogOperations() {
        return logOperations;
    }

    public void setLogOperations(boolean logOperations) {
        this.logOperations = logOperations;
    }
}
