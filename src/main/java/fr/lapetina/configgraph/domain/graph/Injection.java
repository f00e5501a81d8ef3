package fr.lapetina.configgraph.domain.graph;

/**
 * Values the builder can inject into a type's bindings when the
 * configuration does not already supply them.
 */
public enum Injection {
    /** The section name the instance is built from. */
    NAME("name"),

    /** The merged {@link fr.lapetina.configgraph.domain.model.SectionStore}. */
    CONFIG("config"),

    /** The {@link InstanceGraphBuilder} doing the build. */
    CONFIG_FACTORY("config_factory");

    private final String bindingName;

    Injection(String bindingName) {
        this.bindingName = bindingName;
    }

    public String getBindingName() {
        return bindingName;
    }
}
