package fr.lapetina.configgraph.domain.directive.handlers;

import fr.lapetina.configgraph.domain.directive.Directive;
import fr.lapetina.configgraph.domain.directive.DirectiveContext;
import fr.lapetina.configgraph.domain.directive.DirectiveHandler;
import fr.lapetina.configgraph.domain.exception.MissingSectionException;

/**
 * {@code class:<type>} - the {@link fr.lapetina.configgraph.domain.graph.RegisteredType}
 * itself rather than an instance.
 */
public final class ClassDirectiveHandler implements DirectiveHandler {

    @Override
    public String getName() {
        return "class";
    }

    @Override
    public Object handle(Directive directive, DirectiveContext context) {
        String typeId = directive.payload().trim();
        return context.builder().getTypeRegistry().find(typeId)
                .orElseThrow(() -> MissingSectionException.type(typeId, context.sectionName(), context.path()));
    }
}
