package fr.lapetina.configgraph.domain.directive.handlers;

import fr.lapetina.configgraph.domain.directive.Directive;
import fr.lapetina.configgraph.domain.directive.DirectiveContext;
import fr.lapetina.configgraph.domain.directive.DirectiveHandler;
import fr.lapetina.configgraph.domain.exception.ObjectInstantiationException;
import fr.lapetina.configgraph.domain.model.ObjectSpec;
import fr.lapetina.configgraph.domain.model.Settings;
import fr.lapetina.configgraph.domain.model.SharingPolicy;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * {@code asdict:<section>} - the parsed options of an untyped section as a
 * plain map.
 */
public final class AsDictDirectiveHandler implements DirectiveHandler {

    @Override
    public String getName() {
        return "asdict";
    }

    @Override
    public Object handle(Directive directive, DirectiveContext context) {
        String section = directive.payload().trim();
        ObjectSpec spec = context.builder().spec(section, context.resolution());
        if (spec.isTyped()) {
            throw new ObjectInstantiationException(section, spec.provenance(),
                    "asdict requires a section without " + context.builder().getClassNameOption(),
                    context.resolution().pathTo(section), null);
        }
        Settings settings = (Settings) context.builder().resolve(context.resolution(), section, Map.of(),
                SharingPolicy.DEFAULT);
        return new LinkedHashMap<>(settings.asMap());
    }
}
