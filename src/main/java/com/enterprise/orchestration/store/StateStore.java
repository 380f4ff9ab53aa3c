package com.enterprise.orchestration.store;

import java.util.List;
import java.util.Optional;

/**
 * Persistence collaborator for workflow, result and state records.
 * <p>
 * Writes are best-effort: implementations report failures with
 * {@link com.enterprise.orchestration.exception.StateStoreException}.
 * There is no cross-record transaction.
 */
public interface StateStore {

    /**
     * Stores a state record, replacing any record with the same key.
     */
    void saveState(StateRecord record);

    /**
     * Loads the stored record for a key.
     *
     * @param key the state key
     * @return the record, or empty when the key was never written or was deleted
     */
    Optional<StateRecord> loadState(String key);

    /**
     * Deletes the record for a key.
     *
     * @return true if a record was removed
     */
    boolean deleteState(String key);

    /**
     * Lists the keys of all stored state records.
     */
    List<String> listStateKeys();

    void saveWorkflow(WorkflowRecord record);

    Optional<WorkflowRecord> loadWorkflow(String workflowId);

    void saveResult(ResultRecord record);

    /**
     * Loads every result the given worker reported, oldest first.
     */
    List<ResultRecord> loadResults(String workerId);

    /**
     * Releases resources held by the store.
     */
    void close();
}
