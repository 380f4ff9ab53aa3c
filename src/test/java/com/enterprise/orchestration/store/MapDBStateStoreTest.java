package com.enterprise.orchestration.store;

import com.enterprise.orchestration.events.EventPublisher;
import com.enterprise.orchestration.sync.ConflictStrategy;
import com.enterprise.orchestration.sync.StateSynchronizer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for the MapDB-backed state store
 */
class MapDBStateStoreTest {

    @TempDir
    File tempDir;

    private String dbPath;
    private MapDBStateStore store;

    @BeforeEach
    void setUp() {
        dbPath = new File(tempDir, "state.db").getAbsolutePath();
        store = new MapDBStateStore(dbPath);
    }

    @AfterEach
    void tearDown() {
        store.close();
    }

    @Test
    void testSaveAndLoadState() {
        Instant at = Instant.parse("2026-03-01T10:15:30Z");
        store.saveState(new StateRecord("workflow:wf-1", Map.of("progress", 40, "status", "IN_PROGRESS"),
                                        3, "leader-1", at));

        StateRecord loaded = store.loadState("workflow:wf-1").orElseThrow();
        assertEquals("workflow:wf-1", loaded.getKey());
        assertEquals(3, loaded.getVersion());
        assertEquals("leader-1", loaded.getLastWriter());
        assertEquals(at, loaded.getUpdatedAt());
        assertEquals(40, ((Map<?, ?>) loaded.getValue()).get("progress"));

        assertFalse(store.loadState("missing").isPresent());
    }

    @Test
    void testSaveReplacesRecord() {
        store.saveState(new StateRecord("counter", 1, 1, "dev-1", null));
        store.saveState(new StateRecord("counter", 2, 2, "dev-2", null));

        StateRecord loaded = store.loadState("counter").orElseThrow();
        assertEquals(2, loaded.getValue());
        assertEquals(2, loaded.getVersion());
        assertEquals(List.of("counter"), store.listStateKeys());
    }

    @Test
    void testDeleteState() {
        store.saveState(new StateRecord("temp", "value", 1, "dev-1", null));

        assertTrue(store.deleteState("temp"));
        assertFalse(store.deleteState("temp"));
        assertFalse(store.loadState("temp").isPresent());
        assertTrue(store.listStateKeys().isEmpty());
    }

    @Test
    void testWorkflowRecords() {
        store.saveWorkflow(new WorkflowRecord("wf-1", Map.of("id", "wf-1", "status", "CREATED"), 1, null));
        store.saveWorkflow(new WorkflowRecord("wf-1", Map.of("id", "wf-1", "status", "COMPLETED"), 2, null));

        WorkflowRecord loaded = store.loadWorkflow("wf-1").orElseThrow();
        assertEquals(2, loaded.getVersion());
        assertEquals("COMPLETED", loaded.getData().get("status"));
        assertFalse(store.loadWorkflow("wf-2").isPresent());
    }

    @Test
    void testResultsAreGroupedByWorker() {
        Instant first = Instant.parse("2026-03-01T10:00:00Z");
        store.saveResult(new ResultRecord("dev-1", "task-2", "second", first.plusSeconds(60)));
        store.saveResult(new ResultRecord("dev-1", "task-1", Map.of("lines", 120), first));
        store.saveResult(new ResultRecord("dev-10", "task-3", "other worker", first));

        List<ResultRecord> results = store.loadResults("dev-1");
        assertEquals(2, results.size());
        assertEquals("task-1", results.get(0).getTaskId());
        assertEquals(120, ((Map<?, ?>) results.get(0).getResult()).get("lines"));
        assertEquals("task-2", results.get(1).getTaskId());

        assertTrue(store.loadResults("nobody").isEmpty());
    }

    @Test
    void testRecordsSurviveReopen() {
        store.saveState(new StateRecord("shared", Map.of("k", "v"), 7, "dev-1", null));
        store.saveWorkflow(new WorkflowRecord("wf-1", Map.of("id", "wf-1"), 1, null));
        store.close();

        store = new MapDBStateStore(dbPath);

        assertEquals(7, store.loadState("shared").orElseThrow().getVersion());
        assertTrue(store.loadWorkflow("wf-1").isPresent());
    }

    @Test
    void testSynchronizerResumesFromReopenedStore() throws Exception {
        StateSynchronizer writer = new StateSynchronizer(store, new EventPublisher(), Duration.ofSeconds(1),
                                                         Duration.ofSeconds(1), ConflictStrategy.MERGE);
        writer.setState("config", Map.of("mode", "fast"), "leader-1");
        writer.setState("config", Map.of("mode", "safe"), "leader-1");
        store.close();

        store = new MapDBStateStore(dbPath);
        StateSynchronizer restarted = new StateSynchronizer(store, new EventPublisher(), Duration.ofSeconds(1),
                                                            Duration.ofSeconds(1), ConflictStrategy.MERGE);

        // Unknown locally, loaded from the store on first read
        assertEquals(2, restarted.getStateRecord("config").orElseThrow().getVersion());
        assertEquals("safe", ((Map<?, ?>) restarted.getState("config").orElseThrow()).get("mode"));

        // Next write continues the version sequence
        assertEquals(3, restarted.setState("config", Map.of("mode", "strict"), "leader-1"));
        assertEquals(3, store.loadState("config").orElseThrow().getVersion());
        assertEquals(Set.of("config"), Set.copyOf(store.listStateKeys()));
    }
}
