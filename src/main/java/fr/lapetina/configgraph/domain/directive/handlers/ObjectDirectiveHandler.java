package fr.lapetina.configgraph.domain.directive.handlers;

import fr.lapetina.configgraph.domain.directive.Directive;
import fr.lapetina.configgraph.domain.directive.DirectiveContext;
import fr.lapetina.configgraph.domain.directive.DirectiveHandler;
import fr.lapetina.configgraph.domain.directive.DirectiveParams;
import fr.lapetina.configgraph.domain.model.ObjectSpec;

import java.util.Map;
import java.util.Set;

/**
 * {@code object[(<params>)]:<type>} - a new instance of a registered type,
 * built from {@code param} alone. Never cached.
 */
public final class ObjectDirectiveHandler implements DirectiveHandler {

    private static final Set<String> PARAMS = Set.of("param");

    @Override
    public String getName() {
        return "object";
    }

    @Override
    public Object handle(Directive directive, DirectiveContext context) {
        Map<String, Object> params = DirectiveParams.parse(directive, PARAMS);
        String typeId = directive.payload().trim();
        ObjectSpec spec = new ObjectSpec(typeId, typeId, Map.of(),
                "object directive in section '" + context.sectionName() + "'");
        return context.builder().build(spec, DirectiveParams.overrides(directive, params), context.resolution());
    }
}
