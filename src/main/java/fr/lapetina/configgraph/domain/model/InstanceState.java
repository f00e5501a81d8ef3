package fr.lapetina.configgraph.domain.model;

/**
 * Lifecycle state of a section's instance record.
 */
public enum InstanceState {
    /** Never built, or dropped by an explicit cache clear */
    UNRESOLVED,

    /** Currently being built; re-entry signals a cycle */
    RESOLVING,

    /** Built and cached */
    RESOLVED,

    /** Returned once to a caller and then dropped from the cache */
    EVICTED
}
