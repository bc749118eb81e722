package com.purchasingpower.flowinsight.storage;

import com.purchasingpower.flowinsight.ProcessFixtures;
import com.purchasingpower.flowinsight.config.AnalysisConfig;
import com.purchasingpower.flowinsight.workflow.state.AgentState;
import com.purchasingpower.flowinsight.workflow.state.AnalysisPhase;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("In-Memory Checkpoint Store Tests")
class InMemoryCheckpointStoreTest {

    private final InMemoryCheckpointStore store = new InMemoryCheckpointStore(new AnalysisConfig());
    private final AgentState state = AgentState.initial("thread-1", ProcessFixtures.clientOnboarding(), null, null);

    @Test
    @DisplayName("Should keep only the latest state per thread")
    void put_replaces() {
        store.put("thread-1", state);
        AgentState done = state.toBuilder().phase(AnalysisPhase.DONE).build();
        store.put("thread-1", done);

        assertThat(store.get("thread-1")).containsSame(done);
        assertThat(store.size()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should treat unknown and null ids as absent")
    void get_absent() {
        assertThat(store.get("nope")).isEmpty();
        assertThat(store.get(null)).isEmpty();
    }

    @Test
    @DisplayName("Should require a thread id when saving")
    void put_nullId() {
        assertThatThrownBy(() -> store.put(null, state))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Thread ID is required");
    }

    @Test
    @DisplayName("Should evict the thread saved longest ago once the limit is reached")
    void put_evictsOldest() {
        // Given
        AnalysisConfig config = new AnalysisConfig();
        config.setMaxCheckpoints(2);
        InMemoryCheckpointStore bounded = new InMemoryCheckpointStore(config);
        bounded.put("thread-1", state);
        bounded.put("thread-2", state);

        // When: thread-1 is saved again, then a third thread arrives
        bounded.put("thread-1", state);
        bounded.put("thread-3", state);

        // Then
        assertThat(bounded.size()).isEqualTo(2);
        assertThat(bounded.get("thread-2")).isEmpty();
        assertThat(bounded.get("thread-1")).isPresent();
        assertThat(bounded.get("thread-3")).isPresent();
    }
}
