package com.purchasingpower.flowinsight.storage;

import com.purchasingpower.flowinsight.workflow.state.AgentState;

import java.util.Optional;

/**
 * Key-value store for the latest state of each analysis thread.
 *
 * <p>An absent entry is a normal outcome: the thread is new or was evicted.
 */
public interface CheckpointStore {

    Optional<AgentState> get(String threadId);

    /**
     * Replaces the stored state of the thread.
     *
     * @throws IllegalArgumentException if {@code threadId} is null
     */
    void put(String threadId, AgentState state);
}
