package fr.lapetina.configgraph.domain.graph;

import fr.lapetina.configgraph.domain.exception.CyclicDependencyException;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * State of one top-level resolution: the stack of sections being built,
 * the pending lazy references, and whether the cache is bypassed.
 *
 * A deep view shares the stack and pending references with its parent, so
 * cycles are detected across the switch to deep resolution.
 */
public final class ResolutionContext {

    private final Deque<String> stack;
    private final Map<String, List<LazyReference<?>>> pending;
    private final boolean deep;

    private ResolutionContext(Deque<String> stack, Map<String, List<LazyReference<?>>> pending, boolean deep) {
        this.stack = stack;
        this.pending = pending;
        this.deep = deep;
    }

    public static ResolutionContext root() {
        return new ResolutionContext(new ArrayDeque<>(), new HashMap<>(), false);
    }

    /**
     * Returns a view of this context that never touches the instance cache.
     */
    public ResolutionContext deep() {
        return deep ? this : new ResolutionContext(stack, pending, true);
    }

    public boolean isDeep() {
        return deep;
    }

    /**
     * Pushes a section onto the stack.
     *
     * @throws CyclicDependencyException if the section is already being resolved
     */
    void enter(String sectionName) {
        if (stack.contains(sectionName)) {
            List<String> cycle = new ArrayList<>();
            boolean inCycle = false;
            for (Iterator<String> it = stack.descendingIterator(); it.hasNext(); ) {
                String name = it.next();
                inCycle |= name.equals(sectionName);
                if (inCycle) {
                    cycle.add(name);
                }
            }
            cycle.add(sectionName);
            throw new CyclicDependencyException(cycle);
        }
        stack.push(sectionName);
    }

    void exit(String sectionName) {
        if (!sectionName.equals(stack.peek())) {
            throw new IllegalStateException("Unbalanced resolution stack: expected '" + sectionName
                    + "' but found '" + stack.peek() + "'");
        }
        stack.pop();
    }

    public boolean isResolving(String sectionName) {
        return stack.contains(sectionName);
    }

    /**
     * Returns the sections being resolved, outermost first.
     */
    public List<String> path() {
        List<String> path = new ArrayList<>(stack.size());
        stack.descendingIterator().forEachRemaining(path::add);
        return path;
    }

    /**
     * Returns the path extended with a section about to be resolved.
     */
    public List<String> pathTo(String sectionName) {
        List<String> path = path();
        path.add(sectionName);
        return path;
    }

    <T> LazyReference<T> defer(String sectionName) {
        LazyReference<T> ref = new LazyReference<>(sectionName);
        pending.computeIfAbsent(sectionName, k -> new ArrayList<>()).add(ref);
        return ref;
    }

    /**
     * Fills every reference waiting on the section.
     *
     * @return the number of references patched
     */
    int patch(String sectionName, Object instance) {
        List<LazyReference<?>> refs = pending.remove(sectionName);
        if (refs == null) {
            return 0;
        }
        refs.forEach(ref -> ref.patch(instance));
        return refs.size();
    }
}
