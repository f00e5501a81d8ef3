package fr.lapetina.configgraph.domain.directive.handlers;

import com.fasterxml.jackson.core.JsonProcessingException;
import fr.lapetina.configgraph.domain.directive.Directive;
import fr.lapetina.configgraph.domain.directive.DirectiveContext;
import fr.lapetina.configgraph.domain.directive.DirectiveHandler;
import fr.lapetina.configgraph.domain.exception.MalformedDirectiveException;

/**
 * {@code json:<payload>} - the payload parsed as JSON into maps, lists and scalars.
 */
public final class JsonDirectiveHandler implements DirectiveHandler {

    @Override
    public String getName() {
        return "json";
    }

    @Override
    public Object handle(Directive directive, DirectiveContext context) {
        try {
            return context.builder().getObjectMapper().readValue(directive.payload(), Object.class);
        } catch (JsonProcessingException e) {
            throw new MalformedDirectiveException(directive.raw(), "invalid JSON: " + e.getOriginalMessage(), e);
        }
    }
}
