package fr.lapetina.configgraph.domain.graph;

import fr.lapetina.configgraph.domain.model.InstanceRecord;
import fr.lapetina.configgraph.domain.model.InstanceState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Instance cache of one builder, keyed by section name.
 *
 * Pure lifecycle store: it tracks record state but makes no sharing
 * decisions. Not thread-safe.
 */
public final class MemorySpaceManager {

    private static final Logger log = LoggerFactory.getLogger(MemorySpaceManager.class);

    private final Map<String, InstanceRecord> records = new LinkedHashMap<>();

    /**
     * Returns the cached instance if the section is RESOLVED.
     */
    public Optional<Object> get(String name) {
        InstanceRecord record = records.get(name);
        if (record == null || !record.isResolved()) {
            return Optional.empty();
        }
        return Optional.ofNullable(record.getInstance());
    }

    public Optional<InstanceRecord> getRecord(String name) {
        return Optional.ofNullable(records.get(name));
    }

    public void markResolving(String name) {
        records.computeIfAbsent(name, InstanceRecord::new).markResolving();
    }

    public void put(String name, Object instance) {
        records.computeIfAbsent(name, InstanceRecord::new).resolve(instance);
    }

    /**
     * Drops a section's record.
     *
     * @return the instance the record held, if it was RESOLVED
     */
    public Optional<Object> evict(String name) {
        InstanceRecord record = records.remove(name);
        if (record == null) {
            return Optional.empty();
        }
        Optional<Object> held = record.isResolved()
                ? Optional.ofNullable(record.getInstance())
                : Optional.empty();
        record.evict();
        log.debug("Evicted section '{}'", name);
        return held;
    }

    /**
     * Drops every record and returns the instances that were RESOLVED.
     */
    public List<Object> clear() {
        List<Object> dropped = instances();
        records.values().forEach(InstanceRecord::evict);
        records.clear();
        return dropped;
    }

    /**
     * Returns the state of a section; sections without a record are UNRESOLVED.
     */
    public InstanceState state(String name) {
        InstanceRecord record = records.get(name);
        return record == null ? InstanceState.UNRESOLVED : record.getState();
    }

    public int size() {
        return records.size();
    }

    /**
     * Returns the RESOLVED instances, in resolution order.
     */
    public List<Object> instances() {
        List<Object> out = new ArrayList<>();
        for (InstanceRecord record : records.values()) {
            if (record.isResolved()) {
                out.add(record.getInstance());
            }
        }
        return out;
    }

    public Collection<String> getSectionNames() {
        return List.copyOf(records.keySet());
    }
}
