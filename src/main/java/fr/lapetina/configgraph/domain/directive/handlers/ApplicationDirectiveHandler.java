package fr.lapetina.configgraph.domain.directive.handlers;

import fr.lapetina.configgraph.domain.directive.Directive;
import fr.lapetina.configgraph.domain.directive.DirectiveContext;
import fr.lapetina.configgraph.domain.directive.DirectiveHandler;
import fr.lapetina.configgraph.domain.directive.DirectiveParams;

/**
 * {@code application(<owner>):<section>} - a section resolved in another
 * application's independently configured graph.
 */
public final class ApplicationDirectiveHandler implements DirectiveHandler {

    @Override
    public String getName() {
        return "application";
    }

    @Override
    public Object handle(Directive directive, DirectiveContext context) {
        String owner = DirectiveParams.token(directive);
        return context.builder().getApplication(owner).resolve(directive.payload().trim());
    }
}
