package fr.lapetina.configgraph.domain.graph;

import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * A type known to the {@link TypeRegistry}: its identifier, Java class,
 * factory and the injections it accepts.
 *
 * @param id         identifier used in {@code class_name} options
 * @param type       the constructed Java type
 * @param factory    builds instances from resolved bindings
 * @param injections builder-supplied values this type accepts
 */
public record RegisteredType(
        String id,
        Class<?> type,
        InstanceFactory<?> factory,
        Set<Injection> injections
) {
    public RegisteredType {
        Objects.requireNonNull(id, "Type id is required");
        Objects.requireNonNull(type, "Type class is required");
        Objects.requireNonNull(factory, "Factory is required");
        injections = injections == null || injections.isEmpty()
                ? Set.of()
                : Set.copyOf(EnumSet.copyOf(injections));
    }

    public boolean accepts(Injection injection) {
        return injections.contains(injection);
    }

    public boolean isRecord() {
        return type.isRecord();
    }

    public Object create(Bindings bindings) throws Exception {
        return factory.create(bindings);
    }
}
