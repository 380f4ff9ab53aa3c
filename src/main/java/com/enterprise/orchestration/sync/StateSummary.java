package com.enterprise.orchestration.sync;

import java.time.Instant;

/**
 * Listing entry for a locally known state key
 */
public class StateSummary {

    private final String key;
    private final long version;
    private final String lastWriter;
    private final Instant updatedAt;

    public StateSummary(String key, long version, String lastWriter, Instant updatedAt) {
        this.key = key;
        this.version = version;
        this.lastWriter = lastWriter;
        this.updatedAt = updatedAt;
    }

    public String getKey() { return key; }

    public long getVersion() { return version; }

    public String getLastWriter() { return lastWriter; }

    public Instant getUpdatedAt() { return updatedAt; }

    @Override
    public String toString() {
        return key + "@" + version + " by " + lastWriter;
    }
}
