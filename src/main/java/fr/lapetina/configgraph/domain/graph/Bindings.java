package fr.lapetina.configgraph.domain.graph;

import fr.lapetina.configgraph.domain.model.SectionStore;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Resolved constructor arguments handed to an {@link InstanceFactory}.
 *
 * Values are already classified by the directive parser: integers, reals,
 * booleans, collections, paths and nested instances arrive with their
 * final Java types.
 */
public final class Bindings {

    private final String sectionName;
    private final Map<String, Object> values;

    public Bindings(String sectionName, Map<String, Object> values) {
        this.sectionName = sectionName;
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public String getSectionName() {
        return sectionName;
    }

    public boolean contains(String name) {
        return values.containsKey(name);
    }

    public Object get(String name) {
        return values.get(name);
    }

    public Optional<Object> find(String name) {
        return Optional.ofNullable(values.get(name));
    }

    /**
     * Returns a required binding cast to the given type.
     *
     * @throws IllegalArgumentException if absent or of another type
     */
    public <T> T get(String name, Class<T> type) {
        if (!values.containsKey(name)) {
            throw new IllegalArgumentException("Missing required binding '" + name + "'");
        }
        Object value = values.get(name);
        if (value != null && !type.isInstance(value)) {
            throw new IllegalArgumentException("Binding '" + name + "' is a "
                    + value.getClass().getSimpleName() + ", expected " + type.getSimpleName());
        }
        return type.cast(value);
    }

    public <T> T getOrDefault(String name, Class<T> type, T defaultValue) {
        return values.containsKey(name) ? get(name, type) : defaultValue;
    }

    public String getString(String name) {
        Object value = values.get(name);
        if (value == null && !values.containsKey(name)) {
            throw new IllegalArgumentException("Missing required binding '" + name + "'");
        }
        return value == null ? null : value.toString();
    }

    public int getInt(String name) {
        return get(name, Number.class).intValue();
    }

    public long getLong(String name) {
        return get(name, Number.class).longValue();
    }

    public double getDouble(String name) {
        return get(name, Number.class).doubleValue();
    }

    public boolean getBoolean(String name) {
        return get(name, Boolean.class);
    }

    @SuppressWarnings("unchecked")
    public <E> List<E> getList(String name) {
        return (List<E>) get(name, List.class);
    }

    /**
     * Returns the injected section name, if the type accepted it.
     */
    public String getName() {
        return getOrDefault(Injection.NAME.getBindingName(), String.class, sectionName);
    }

    public Optional<SectionStore> getConfig() {
        return Optional.ofNullable(getOrDefault(Injection.CONFIG.getBindingName(), SectionStore.class, null));
    }

    public Optional<InstanceGraphBuilder> getConfigFactory() {
        return Optional.ofNullable(getOrDefault(
                Injection.CONFIG_FACTORY.getBindingName(), InstanceGraphBuilder.class, null));
    }

    public Set<String> names() {
        return values.keySet();
    }

    public Map<String, Object> asMap() {
        return values;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Bindings other)) return false;
        return Objects.equals(sectionName, other.sectionName) && values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sectionName, values);
    }

    @Override
    public String toString() {
        return "Bindings{" + sectionName + "=" + values.keySet() + "}";
    }
}
