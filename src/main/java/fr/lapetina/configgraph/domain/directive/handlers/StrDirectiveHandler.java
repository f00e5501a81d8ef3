package fr.lapetina.configgraph.domain.directive.handlers;

import fr.lapetina.configgraph.domain.directive.Directive;
import fr.lapetina.configgraph.domain.directive.DirectiveContext;
import fr.lapetina.configgraph.domain.directive.DirectiveHandler;

/**
 * {@code str:<payload>} - the payload as a string, for values that would
 * otherwise match another rule.
 */
public final class StrDirectiveHandler implements DirectiveHandler {

    @Override
    public String getName() {
        return "str";
    }

    @Override
    public Object handle(Directive directive, DirectiveContext context) {
        return directive.payload();
    }
}
