package fr.lapetina.configgraph.domain.graph;

import java.util.function.Supplier;

/**
 * Placeholder for an instance that may still be under construction.
 *
 * Handed out for {@code instance({'lazy': true}):} references to a section on
 * the active resolution stack, and patched by the builder once that section
 * finishes building.
 *
 * @param <T> the referenced type
 */
public final class LazyReference<T> implements Supplier<T> {

    private final String sectionName;
    private T target;
    private boolean resolved;

    LazyReference(String sectionName) {
        this.sectionName = sectionName;
    }

    static <T> LazyReference<T> of(String sectionName, T value) {
        LazyReference<T> ref = new LazyReference<>(sectionName);
        ref.patch(value);
        return ref;
    }

    @SuppressWarnings("unchecked")
    void patch(Object value) {
        this.target = (T) value;
        this.resolved = true;
    }

    public String getSectionName() {
        return sectionName;
    }

    public boolean isResolved() {
        return resolved;
    }

    /**
     * Returns the referenced instance.
     *
     * @throws IllegalStateException if the section has not finished building
     */
    @Override
    public T get() {
        if (!resolved) {
            throw new IllegalStateException("Section '" + sectionName + "' is still being resolved");
        }
        return target;
    }

    @Override
    public String toString() {
        return "LazyReference{" + sectionName + (resolved ? "" : ", pending") + "}";
    }
}
