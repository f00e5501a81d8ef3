package fr.lapetina.configgraph.domain.directive.handlers;

import fr.lapetina.configgraph.domain.directive.Directive;
import fr.lapetina.configgraph.domain.directive.DirectiveContext;
import fr.lapetina.configgraph.domain.directive.DirectiveHandler;

/**
 * {@code resource[(<owner>)]:<path>} - a path found by the configured
 * resource locator.
 */
public final class ResourceDirectiveHandler implements DirectiveHandler {

    @Override
    public String getName() {
        return "resource";
    }

    @Override
    public Object handle(Directive directive, DirectiveContext context) {
        String owner = directive.hasParams() ? directive.params().trim() : null;
        return context.builder().resolveResource(owner, directive.payload());
    }
}
