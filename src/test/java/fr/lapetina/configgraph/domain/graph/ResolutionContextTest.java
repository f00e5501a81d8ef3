package fr.lapetina.configgraph.domain.graph;

import fr.lapetina.configgraph.domain.exception.CyclicDependencyException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ResolutionContextTest {

    @Test
    @DisplayName("should track the path outermost first")
    void shouldTrackPath() {
        ResolutionContext context = ResolutionContext.root();
        context.enter("a");
        context.enter("b");

        assertThat(context.path()).containsExactly("a", "b");
        assertThat(context.isResolving("a")).isTrue();
        assertThat(context.pathTo("c")).containsExactly("a", "b", "c");
    }

    @Test
    @DisplayName("should reject re-entry with the cycle")
    void shouldRejectReentry() {
        ResolutionContext context = ResolutionContext.root();
        context.enter("a");
        context.enter("b");

        assertThatThrownBy(() -> context.enter("a"))
                .isInstanceOf(CyclicDependencyException.class)
                .satisfies(e -> assertThat(((CyclicDependencyException) e).getCycle())
                        .containsExactly("a", "b", "a"));
    }

    @Test
    @DisplayName("should share the stack with its deep view")
    void shouldShareStackWithDeepView() {
        ResolutionContext context = ResolutionContext.root();
        context.enter("a");
        ResolutionContext deep = context.deep();

        assertThat(deep.isDeep()).isTrue();
        assertThat(context.isDeep()).isFalse();
        assertThat(deep.isResolving("a")).isTrue();
    }

    @Test
    @DisplayName("should patch deferred references")
    void shouldPatchDeferred() {
        ResolutionContext context = ResolutionContext.root();
        context.enter("a");
        LazyReference<Object> ref = context.defer("a");

        assertThat(ref.isResolved()).isFalse();
        assertThatThrownBy(ref::get).isInstanceOf(IllegalStateException.class);

        context.exit("a");
        Object instance = new Object();
        assertThat(context.patch("a", instance)).isEqualTo(1);
        assertThat(ref.get()).isSameAs(instance);
    }
}
