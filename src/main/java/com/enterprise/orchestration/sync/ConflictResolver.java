package com.enterprise.orchestration.sync;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Pure resolution rules for the {@link ConflictStrategy#MERGE} and {@link ConflictStrategy#LATEST} strategies.
 * <p>
 * "Local" is the value the conflicting writer is trying to store, "remote" is the value already stored.
 */
public final class ConflictResolver {

    private static final Logger logger = LoggerFactory.getLogger(ConflictResolver.class);

    public static final String TIMESTAMP_FIELD = "_timestamp";
    public static final String MERGED_FIELD = "_merged";
    public static final String MERGE_TIMESTAMP_FIELD = "_mergeTimestamp";

    private ConflictResolver() {
    }

    /**
     * Shallow merge of two objects, remote fields win on collision. Non-object values resolve to remote.
     */
    public static Object merge(Object local, Object remote, Instant now) {
        if (!(local instanceof Map) || !(remote instanceof Map)) {
            return remote;
        }
        Map<String, Object> merged = new LinkedHashMap<>();
        ((Map<?, ?>) local).forEach((k, v) -> merged.put(String.valueOf(k), v));
        ((Map<?, ?>) remote).forEach((k, v) -> merged.put(String.valueOf(k), v));
        merged.put(MERGED_FIELD, true);
        merged.put(MERGE_TIMESTAMP_FIELD, now.toString());
        return merged;
    }

    /**
     * Keeps remote only if its embedded timestamp is strictly newer. Values without a timestamp count as oldest.
     */
    public static Object latest(Object local, Object remote) {
        Instant localTime = timestampOf(local);
        Instant remoteTime = timestampOf(remote);
        return remoteTime.isAfter(localTime) ? remote : local;
    }

    static Instant timestampOf(Object value) {
        if (!(value instanceof Map)) {
            return Instant.EPOCH;
        }
        Object raw = ((Map<?, ?>) value).get(TIMESTAMP_FIELD);
        if (raw instanceof Instant) {
            return (Instant) raw;
        }
        if (raw instanceof Number) {
            return Instant.ofEpochMilli(((Number) raw).longValue());
        }
        if (raw instanceof String) {
            String text = (String) raw;
            try {
                return Instant.parse(text);
            } catch (DateTimeParseException e) {
                try {
                    return OffsetDateTime.parse(text).toInstant();
                } catch (DateTimeParseException ignored) {
                    logger.debug("Unparseable {} value '{}', treating as oldest", TIMESTAMP_FIELD, text);
                }
            }
        }
        return Instant.EPOCH;
    }
}
