package fr.lapetina.configgraph.domain.graph;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.RecordComponent;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.ServiceLoader;
import java.util.Set;

/**
 * Explicit mapping from type identifiers to factories.
 *
 * Replaces reflective class lookup by name: a {@code class_name} option can
 * only name a type registered here, either by its short id or by its fully
 * qualified class name.
 */
public final class TypeRegistry {

    private static final Logger log = LoggerFactory.getLogger(TypeRegistry.class);

    private final Map<String, RegisteredType> registry = new LinkedHashMap<>();
    private final RecordBinder recordBinder;

    public TypeRegistry() {
        this(new ObjectMapper());
    }

    public TypeRegistry(ObjectMapper mapper) {
        this.recordBinder = new RecordBinder(mapper);
    }

    /**
     * Registers a type.
     *
     * @param id         identifier used in configuration
     * @param type       the constructed class, also registered under its fully qualified name
     * @param factory    builds instances from resolved bindings
     * @param injections builder-supplied values the type accepts
     */
    public <T> TypeRegistry register(String id, Class<T> type, InstanceFactory<? extends T> factory,
                                     Injection... injections) {
        Set<Injection> accepted = injections.length == 0
                ? EnumSet.noneOf(Injection.class)
                : EnumSet.copyOf(Arrays.asList(injections));
        RegisteredType registered = new RegisteredType(id, type, factory, accepted);
        registry.put(id, registered);
        registry.putIfAbsent(type.getName(), registered);
        log.debug("Registered type '{}' -> {}", id, type.getName());
        return this;
    }

    /**
     * Registers a record type bound through its canonical constructor.
     * Components named {@code name}, {@code config} or {@code config_factory}
     * are treated as injection points.
     */
    public <R extends Record> TypeRegistry registerRecord(String id, Class<R> type) {
        EnumSet<Injection> accepted = EnumSet.noneOf(Injection.class);
        for (RecordComponent component : type.getRecordComponents()) {
            for (Injection injection : Injection.values()) {
                if (injection.getBindingName().equals(component.getName())) {
                    accepted.add(injection);
                }
            }
        }
        return register(id, type, bindings -> recordBinder.bind(type, bindings.asMap()),
                accepted.toArray(new Injection[0]));
    }

    public <R extends Record> TypeRegistry registerRecord(Class<R> type) {
        return registerRecord(type.getSimpleName(), type);
    }

    /**
     * Loads every {@link TypeRegistrar} on the class path.
     */
    public TypeRegistry loadRegistrars() {
        for (TypeRegistrar registrar : ServiceLoader.load(TypeRegistrar.class)) {
            log.info("Loading types from {}", registrar.getClass().getName());
            registrar.registerTypes(this);
        }
        return this;
    }

    public Optional<RegisteredType> find(String id) {
        return Optional.ofNullable(registry.get(id));
    }

    public boolean contains(String id) {
        return registry.containsKey(id);
    }

    public RecordBinder getRecordBinder() {
        return recordBinder;
    }

    /**
     * Returns all registered identifiers, including class-name aliases.
     */
    public Set<String> getRegisteredIds() {
        return Collections.unmodifiableSet(registry.keySet());
    }
}
