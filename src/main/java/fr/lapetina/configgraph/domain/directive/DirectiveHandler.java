package fr.lapetina.configgraph.domain.directive;

/**
 * Interprets one directive prefix.
 *
 * Handlers are stateless; everything they need comes from the
 * {@link DirectiveContext}. Throwing
 * {@link fr.lapetina.configgraph.domain.exception.MalformedDirectiveException}
 * makes the parser fall back to the literal value.
 */
public interface DirectiveHandler {

    /**
     * Returns the prefix this handler is registered under.
     */
    String getName();

    Object handle(Directive directive, DirectiveContext context);
}
