package fr.lapetina.configgraph.domain.directive.handlers;

import fr.lapetina.configgraph.domain.directive.Directive;
import fr.lapetina.configgraph.domain.directive.DirectiveContext;
import fr.lapetina.configgraph.domain.directive.DirectiveHandler;
import fr.lapetina.configgraph.domain.exception.CyclicDependencyException;
import fr.lapetina.configgraph.domain.exception.MalformedDirectiveException;
import fr.lapetina.configgraph.domain.exception.MissingSectionException;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * {@code alias:<section>:<option>} - the value of another option, parsed as
 * if it were written here. Chains of aliases are followed and checked for
 * cycles.
 */
public final class AliasDirectiveHandler implements DirectiveHandler {

    @Override
    public String getName() {
        return "alias";
    }

    @Override
    public Object handle(Directive directive, DirectiveContext context) {
        List<String> chain = new ArrayList<>();
        Directive current = directive;
        while (true) {
            String ref = current.payload().trim();
            int sep = ref.indexOf(':');
            if (sep <= 0 || sep == ref.length() - 1) {
                throw new MalformedDirectiveException(current.raw(), "expected <section>:<option>");
            }
            if (chain.contains(ref)) {
                chain.add(ref);
                throw new CyclicDependencyException("Alias cycle: " + String.join(" -> ", chain), chain);
            }
            chain.add(ref);
            String section = ref.substring(0, sep);
            String option = ref.substring(sep + 1);
            if (!context.store().contains(section)) {
                throw MissingSectionException.section(section, context.resolution().pathTo(section));
            }
            String raw = context.store().getOption(section, option)
                    .orElseThrow(() -> new MissingSectionException(ref,
                            "No option '" + option + "' in section '" + section + "'", chain));
            Optional<Directive> next = Directive.scan(raw, getName()::equals);
            if (next.isEmpty()) {
                return new DirectiveContext(context.builder(), context.resolution(), section).parse(raw);
            }
            current = next.get();
        }
    }
}
