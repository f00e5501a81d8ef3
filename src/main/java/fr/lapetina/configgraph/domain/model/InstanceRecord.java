package fr.lapetina.configgraph.domain.model;

import java.util.Objects;

/**
 * Cached, stateful record of a section's instance.
 */
public final class InstanceRecord {

    private final String sectionName;
    private InstanceState state;
    private Object instance;

    public InstanceRecord(String sectionName) {
        this.sectionName = Objects.requireNonNull(sectionName);
        this.state = InstanceState.UNRESOLVED;
    }

    public String getSectionName() {
        return sectionName;
    }

    public InstanceState getState() {
        return state;
    }

    public Object getInstance() {
        return instance;
    }

    public boolean isResolved() {
        return state == InstanceState.RESOLVED;
    }

    public void markResolving() {
        this.state = InstanceState.RESOLVING;
        this.instance = null;
    }

    public void resolve(Object value) {
        this.instance = value;
        this.state = InstanceState.RESOLVED;
    }

    public void evict() {
        this.instance = null;
        this.state = InstanceState.EVICTED;
    }

    @Override
    public String toString() {
        return "InstanceRecord{" + sectionName + ", state=" + state + "}";
    }
}
