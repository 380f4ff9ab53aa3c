package com.enterprise.orchestration.sync;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ConflictResolverTest {

    private static final Instant NOW = Instant.parse("2026-05-01T12:00:00Z");

    @Test
    void testMergeRemoteWinsOnCollision() {
        Object merged = ConflictResolver.merge(Map.of("x", 1, "y", 1), Map.of("y", 2, "z", 2), NOW);

        Map<?, ?> map = (Map<?, ?>) merged;
        assertEquals(1, map.get("x"));
        assertEquals(2, map.get("y"));
        assertEquals(2, map.get("z"));
        assertEquals(true, map.get(ConflictResolver.MERGED_FIELD));
        assertEquals(NOW.toString(), map.get(ConflictResolver.MERGE_TIMESTAMP_FIELD));
    }

    @Test
    void testMergeOfScalarsKeepsRemote() {
        assertEquals(20, ConflictResolver.merge(10, 20, NOW));
        assertEquals("remote", ConflictResolver.merge(Map.of("a", 1), "remote", NOW));
    }

    @Test
    void testLatestComparesTimestamps() {
        Map<String, Object> older = Map.of("v", "old", "_timestamp", "2026-01-01T00:00:00Z");
        Map<String, Object> newer = Map.of("v", "new", "_timestamp", "2026-02-01T00:00:00Z");

        assertSame(newer, ConflictResolver.latest(older, newer));
        assertSame(newer, ConflictResolver.latest(newer, older));
    }

    @Test
    void testLatestTieKeepsLocal() {
        Map<String, Object> local = Map.of("v", "local", "_timestamp", "2026-01-01T00:00:00Z");
        Map<String, Object> remote = Map.of("v", "remote", "_timestamp", "2026-01-01T00:00:00Z");

        assertSame(local, ConflictResolver.latest(local, remote));
        assertEquals("local", ConflictResolver.latest("local", "remote"));
    }

    @Test
    void testTimestampFormats() {
        assertEquals(Instant.ofEpochMilli(1000), ConflictResolver.timestampOf(Map.of("_timestamp", 1000L)));
        assertEquals(NOW, ConflictResolver.timestampOf(Map.of("_timestamp", NOW)));
        assertEquals(NOW, ConflictResolver.timestampOf(Map.of("_timestamp", "2026-05-01T14:00:00+02:00")));
        assertEquals(Instant.EPOCH, ConflictResolver.timestampOf(Map.of("_timestamp", "yesterday")));
        assertEquals(Instant.EPOCH, ConflictResolver.timestampOf(Map.of("other", 1)));
        assertEquals(Instant.EPOCH, ConflictResolver.timestampOf(42));
    }

    @Test
    void testStrategyParsing() {
        assertEquals(ConflictStrategy.MERGE, ConflictStrategy.fromString(null));
        assertEquals(ConflictStrategy.LATEST, ConflictStrategy.fromString("latest"));
        assertEquals(ConflictStrategy.MANUAL, ConflictStrategy.fromString(" Manual "));
        assertThrows(com.enterprise.orchestration.exception.ValidationException.class,
            () -> ConflictStrategy.fromString("oldest"));
    }
}
