package fr.lapetina.configgraph.infrastructure.config;

import fr.lapetina.configgraph.domain.model.SectionStore;

/**
 * Listener interface for configuration changes.
 */
@FunctionalInterface
public interface ConfigChangeListener {

    /**
     * Called when the root configuration has been reloaded.
     *
     * @param oldStore The previous store (may be null on initial load)
     * @param newStore The freshly resolved store
     */
    void onConfigChanged(SectionStore oldStore, SectionStore newStore);
}
