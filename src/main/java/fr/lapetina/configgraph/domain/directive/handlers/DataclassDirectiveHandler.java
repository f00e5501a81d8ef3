package fr.lapetina.configgraph.domain.directive.handlers;

import fr.lapetina.configgraph.domain.directive.Directive;
import fr.lapetina.configgraph.domain.directive.DirectiveContext;
import fr.lapetina.configgraph.domain.directive.DirectiveHandler;
import fr.lapetina.configgraph.domain.directive.DirectiveParams;
import fr.lapetina.configgraph.domain.exception.ConfigGraphException;
import fr.lapetina.configgraph.domain.exception.MissingSectionException;
import fr.lapetina.configgraph.domain.exception.ObjectInstantiationException;
import fr.lapetina.configgraph.domain.graph.Bindings;
import fr.lapetina.configgraph.domain.graph.RegisteredType;
import fr.lapetina.configgraph.domain.model.Section;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * {@code dataclass(<type>):<section>} - binds the section's tree onto a
 * registered record type. String leaves go through the directive rules
 * first; missing fields fail the build.
 */
public final class DataclassDirectiveHandler implements DirectiveHandler {

    @Override
    public String getName() {
        return "dataclass";
    }

    @Override
    @SuppressWarnings("unchecked")
    public Object handle(Directive directive, DirectiveContext context) {
        String typeId = DirectiveParams.token(directive);
        String target = directive.payload().trim();
        RegisteredType type = context.builder().getTypeRegistry().find(typeId)
                .orElseThrow(() -> MissingSectionException.type(typeId, target, context.path()));
        Object node = context.store().getTreeNode(target)
                .orElseThrow(() -> MissingSectionException.section(target, context.resolution().pathTo(target)));
        if (!(node instanceof Map)) {
            throw new MissingSectionException(target, "Tree node '" + target + "' is not a mapping",
                    context.resolution().pathTo(target));
        }
        DirectiveContext nested = new DirectiveContext(context.builder(), context.resolution(), target);
        Map<String, Object> values = (Map<String, Object>) classify(node, nested);
        String provenance = context.store().get(target).map(Section::getProvenance).orElse("tree");
        try {
            if (type.isRecord()) {
                return context.builder().getTypeRegistry().getRecordBinder()
                        .bind((Class<? extends Record>) type.type(), values);
            }
            return type.create(new Bindings(target, values));
        } catch (ConfigGraphException e) {
            throw e;
        } catch (Exception e) {
            throw new ObjectInstantiationException(target, provenance,
                    "dataclass " + typeId + ": " + e.getMessage(), context.resolution().pathTo(target), e);
        }
    }

    private static Object classify(Object node, DirectiveContext context) {
        if (node instanceof String s) {
            return context.parse(s);
        }
        if (node instanceof Map<?, ?> map) {
            Map<String, Object> out = new LinkedHashMap<>();
            map.forEach((k, v) -> out.put(String.valueOf(k), classify(v, context)));
            return out;
        }
        if (node instanceof List<?> list) {
            List<Object> out = new ArrayList<>(list.size());
            list.forEach(v -> out.add(classify(v, context)));
            return out;
        }
        return node;
    }
}
