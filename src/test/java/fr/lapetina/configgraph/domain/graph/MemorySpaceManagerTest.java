package fr.lapetina.configgraph.domain.graph;

import fr.lapetina.configgraph.domain.model.InstanceState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class MemorySpaceManagerTest {

    private MemorySpaceManager memory;

    @BeforeEach
    void setUp() {
        memory = new MemorySpaceManager();
    }

    @Test
    @DisplayName("should report unknown sections as UNRESOLVED")
    void shouldStartUnresolved() {
        assertThat(memory.state("a")).isEqualTo(InstanceState.UNRESOLVED);
        assertThat(memory.get("a")).isEmpty();
    }

    @Test
    @DisplayName("should not hand out an instance while it is resolving")
    void shouldHideResolving() {
        memory.markResolving("a");

        assertThat(memory.state("a")).isEqualTo(InstanceState.RESOLVING);
        assertThat(memory.get("a")).isEmpty();
    }

    @Test
    @DisplayName("should return the stored instance once resolved")
    void shouldStoreInstance() {
        Object instance = new Object();
        memory.markResolving("a");
        memory.put("a", instance);

        assertThat(memory.get("a")).containsSame(instance);
        assertThat(memory.instances()).containsExactly(instance);
    }

    @Test
    @DisplayName("should return the held instance on evict")
    void shouldEvict() {
        Object instance = new Object();
        memory.put("a", instance);

        assertThat(memory.evict("a")).containsSame(instance);
        assertThat(memory.evict("a")).isEmpty();
        assertThat(memory.size()).isZero();
    }

    @Test
    @DisplayName("should return only resolved instances on clear")
    void shouldClear() {
        Object instance = new Object();
        memory.put("a", instance);
        memory.markResolving("b");

        assertThat(memory.clear()).containsExactly(instance);
        assertThat(memory.getSectionNames()).isEmpty();
    }
}
