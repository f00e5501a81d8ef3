package fr.lapetina.configgraph.domain.directive;

import fr.lapetina.configgraph.domain.graph.InstanceGraphBuilder;
import fr.lapetina.configgraph.domain.graph.ResolutionContext;
import fr.lapetina.configgraph.domain.model.SectionStore;

import java.util.List;

/**
 * Where a value is being parsed: the builder, the active resolution and the
 * section that owns the option.
 *
 * @param builder     builder to delegate instantiation to
 * @param resolution  active resolution stack and sharing mode
 * @param sectionName owning section, or {@code null} outside a section
 */
public record DirectiveContext(
        InstanceGraphBuilder builder,
        ResolutionContext resolution,
        String sectionName
) {

    /**
     * Re-applies the directive rules to a nested value.
     */
    public Object parse(String raw) {
        return builder.getParser().parse(raw, this);
    }

    public SectionStore store() {
        return builder.getStore();
    }

    public List<String> path() {
        return resolution.path();
    }
}
