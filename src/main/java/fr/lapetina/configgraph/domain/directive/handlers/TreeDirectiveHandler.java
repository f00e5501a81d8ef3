package fr.lapetina.configgraph.domain.directive.handlers;

import fr.lapetina.configgraph.domain.directive.Directive;
import fr.lapetina.configgraph.domain.directive.DirectiveContext;
import fr.lapetina.configgraph.domain.directive.DirectiveHandler;
import fr.lapetina.configgraph.domain.directive.DirectiveParams;
import fr.lapetina.configgraph.domain.exception.MissingSectionException;
import fr.lapetina.configgraph.domain.model.ObjectSpec;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * {@code tree[(<params>)]:<dot.path>} - builds an object from a nested
 * mapping of the configuration tree. String leaves are parsed as options,
 * other leaves are passed as they are. Never cached.
 */
public final class TreeDirectiveHandler implements DirectiveHandler {

    private static final Set<String> PARAMS = Set.of("param");

    @Override
    public String getName() {
        return "tree";
    }

    @Override
    public Object handle(Directive directive, DirectiveContext context) {
        Map<String, Object> params = DirectiveParams.parse(directive, PARAMS);
        String path = directive.payload().trim();
        Map<?, ?> node = navigate(path, context);

        String classNameOption = context.builder().getClassNameOption();
        String typeId = null;
        Map<String, String> bindings = new LinkedHashMap<>();
        Map<String, Object> overrides = new LinkedHashMap<>();
        for (Map.Entry<?, ?> e : node.entrySet()) {
            String key = String.valueOf(e.getKey());
            Object value = e.getValue();
            if (key.equals(classNameOption)) {
                typeId = String.valueOf(value);
            } else if (value instanceof String s) {
                bindings.put(key, s);
            } else {
                overrides.put(key, value);
            }
        }
        overrides.putAll(DirectiveParams.overrides(directive, params));
        ObjectSpec spec = new ObjectSpec(path, typeId, bindings, "tree:" + path);
        return context.builder().build(spec, overrides, context.resolution());
    }

    private static Map<?, ?> navigate(String path, DirectiveContext context) {
        String[] parts = path.split("\\.");
        Object node = context.store().getTreeNode(parts[0])
                .orElseThrow(() -> MissingSectionException.section(parts[0], context.resolution().pathTo(path)));
        for (int i = 1; i < parts.length; i++) {
            if (!(node instanceof Map<?, ?> map) || !map.containsKey(parts[i])) {
                throw new MissingSectionException(path, "No tree node '" + path + "' (missing '" + parts[i] + "')",
                        context.resolution().pathTo(path));
            }
            node = map.get(parts[i]);
        }
        if (!(node instanceof Map<?, ?> map)) {
            throw new MissingSectionException(path, "Tree node '" + path + "' is not a mapping",
                    context.resolution().pathTo(path));
        }
        return map;
    }
}
