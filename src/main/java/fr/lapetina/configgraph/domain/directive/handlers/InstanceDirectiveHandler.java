package fr.lapetina.configgraph.domain.directive.handlers;

import fr.lapetina.configgraph.domain.directive.Directive;
import fr.lapetina.configgraph.domain.directive.DirectiveContext;
import fr.lapetina.configgraph.domain.directive.DirectiveHandler;
import fr.lapetina.configgraph.domain.directive.DirectiveParams;
import fr.lapetina.configgraph.domain.exception.MalformedDirectiveException;
import fr.lapetina.configgraph.domain.graph.InstanceGraphBuilder;
import fr.lapetina.configgraph.domain.model.SharingPolicy;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * {@code instance[(<params>)]:<section>} - the object built from a section.
 *
 * Parameters: {@code param} overrides bindings, {@code share} selects the
 * sharing policy and {@code lazy} returns a
 * {@link fr.lapetina.configgraph.domain.graph.LazyReference} that tolerates
 * back references to sections still being built.
 *
 * A {@code json:}, {@code list:} or {@code tuple:} payload names several
 * sections and yields a list, or a map for a JSON object.
 */
public final class InstanceDirectiveHandler implements DirectiveHandler {

    private static final Set<String> PARAMS = Set.of("param", "share", "lazy");

    @Override
    public String getName() {
        return "instance";
    }

    @Override
    public Object handle(Directive directive, DirectiveContext context) {
        Map<String, Object> params = DirectiveParams.parse(directive, PARAMS);
        Map<String, Object> overrides = DirectiveParams.overrides(directive, params);
        SharingPolicy policy = policy(directive, params.get("share"), context.builder().getDefaultPolicy());
        boolean lazy = Boolean.TRUE.equals(params.get("lazy"));
        String payload = directive.payload();

        if (isCollection(payload)) {
            Object names = context.parse(payload);
            if (names instanceof List<?> list) {
                List<Object> instances = new ArrayList<>(list.size());
                for (Object name : list) {
                    instances.add(instance(context, String.valueOf(name), overrides, policy, lazy));
                }
                return instances;
            }
            if (names instanceof Map<?, ?> map) {
                Map<String, Object> instances = new LinkedHashMap<>();
                for (Map.Entry<?, ?> e : map.entrySet()) {
                    instances.put(String.valueOf(e.getKey()),
                            instance(context, String.valueOf(e.getValue()), overrides, policy, lazy));
                }
                return instances;
            }
            throw new MalformedDirectiveException(directive.raw(), "expected a list or mapping of section names");
        }
        return instance(context, payload.trim(), overrides, policy, lazy);
    }

    private static Object instance(DirectiveContext context, String section, Map<String, Object> overrides,
                                   SharingPolicy policy, boolean lazy) {
        InstanceGraphBuilder builder = context.builder();
        return lazy
                ? builder.resolveLazy(context.resolution(), section, overrides, policy)
                : builder.resolve(context.resolution(), section, overrides, policy);
    }

    private static boolean isCollection(String payload) {
        return payload.startsWith("json:") || payload.startsWith("list:") || payload.startsWith("tuple:");
    }

    static SharingPolicy policy(Directive directive, Object share, SharingPolicy defaultPolicy) {
        if (share == null) {
            return defaultPolicy;
        }
        try {
            return SharingPolicy.parse(String.valueOf(share));
        } catch (IllegalArgumentException e) {
            throw new MalformedDirectiveException(directive.raw(), e.getMessage(), e);
        }
    }
}
