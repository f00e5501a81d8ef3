package fr.lapetina.configgraph.domain.directive.handlers;

import fr.lapetina.configgraph.domain.directive.Directive;
import fr.lapetina.configgraph.domain.directive.DirectiveContext;
import fr.lapetina.configgraph.domain.directive.DirectiveHandler;
import fr.lapetina.configgraph.domain.directive.DirectiveParams;
import fr.lapetina.configgraph.domain.exception.ConfigGraphException;
import fr.lapetina.configgraph.domain.exception.ObjectInstantiationException;
import fr.lapetina.configgraph.domain.graph.ConfigCallable;
import fr.lapetina.configgraph.domain.model.Section;
import fr.lapetina.configgraph.domain.model.Settings;
import fr.lapetina.configgraph.domain.model.SharingPolicy;

import java.util.Map;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * {@code call[(<params>)]:<section>} - resolves the section, then calls it.
 *
 * With {@code method} the named method of a {@link ConfigCallable} is
 * invoked; with {@code attribute} an attribute is read; otherwise the
 * object itself must be a {@link ConfigCallable}, {@link Function} or
 * {@link Supplier}. Remaining parameters are passed as keyword arguments.
 */
public final class CallDirectiveHandler implements DirectiveHandler {

    @Override
    public String getName() {
        return "call";
    }

    @Override
    @SuppressWarnings("unchecked")
    public Object handle(Directive directive, DirectiveContext context) {
        Map<String, Object> kwargs = DirectiveParams.parse(directive);
        String method = text(kwargs.remove("method"));
        String attribute = text(kwargs.remove("attribute"));
        String section = directive.payload().trim();
        Object target = context.builder().resolve(context.resolution(), section, Map.of(), SharingPolicy.DEFAULT);
        try {
            if (attribute != null) {
                if (target instanceof ConfigCallable callable) return callable.attribute(attribute);
                if (target instanceof Settings settings) return settings.get(attribute);
                if (target instanceof Map<?, ?> map) return map.get(attribute);
                throw new UnsupportedOperationException("can not read attribute '" + attribute + "' of "
                        + target.getClass().getSimpleName());
            }
            if (target instanceof ConfigCallable callable) {
                return callable.call(method, kwargs);
            }
            if (method != null) {
                throw new UnsupportedOperationException(target.getClass().getSimpleName()
                        + " does not implement ConfigCallable, can not call '" + method + "'");
            }
            if (target instanceof Function<?, ?> function) {
                return ((Function<Map<String, Object>, ?>) function).apply(kwargs);
            }
            if (target instanceof Supplier<?> supplier) {
                return supplier.get();
            }
            throw new UnsupportedOperationException(target.getClass().getSimpleName() + " is not callable");
        } catch (ConfigGraphException e) {
            throw e;
        } catch (Exception e) {
            String provenance = context.store().get(section).map(Section::getProvenance).orElse("call directive");
            throw new ObjectInstantiationException(section, provenance, "call failed: " + e.getMessage(),
                    context.resolution().pathTo(section), e);
        }
    }

    private static String text(Object value) {
        return value == null ? null : value.toString();
    }
}
