package com.purchasingpower.flowinsight.storage;

import com.purchasingpower.flowinsight.config.AnalysisConfig;
import com.purchasingpower.flowinsight.workflow.state.AgentState;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Process-local checkpoint store. Entries are lost on restart.
 *
 * <p>Holds at most {@code app.analysis.max-checkpoints} threads. Saving a
 * thread makes it the newest; the thread saved longest ago is evicted first.
 */
@Slf4j
@Component
public class InMemoryCheckpointStore implements CheckpointStore {

    private final int maxCheckpoints;
    private final Map<String, AgentState> storage;

    public InMemoryCheckpointStore(AnalysisConfig config) {
        this.maxCheckpoints = config.getMaxCheckpoints();
        this.storage = new LinkedHashMap<>() {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, AgentState> eldest) {
                if (size() <= maxCheckpoints) {
                    return false;
                }
                log.debug("Evicting checkpoint for thread {} (limit {})", eldest.getKey(), maxCheckpoints);
                return true;
            }
        };
    }

    @Override
    public synchronized Optional<AgentState> get(String threadId) {
        if (threadId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(storage.get(threadId));
    }

    @Override
    public synchronized void put(String threadId, AgentState state) {
        if (threadId == null) {
            throw new IllegalArgumentException("Thread ID is required");
        }
        // re-insert so the thread moves to the newest position
        storage.remove(threadId);
        storage.put(threadId, state);
        log.debug("Checkpointed thread {} at phase {}", threadId, state.getPhase());
    }

    synchronized int size() {
        return storage.size();
    }
}
