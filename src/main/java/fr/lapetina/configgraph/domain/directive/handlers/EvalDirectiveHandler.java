package fr.lapetina.configgraph.domain.directive.handlers;

import fr.lapetina.configgraph.domain.directive.Directive;
import fr.lapetina.configgraph.domain.directive.DirectiveContext;
import fr.lapetina.configgraph.domain.directive.DirectiveHandler;
import fr.lapetina.configgraph.domain.directive.DirectiveParams;
import fr.lapetina.configgraph.domain.exception.MalformedDirectiveException;
import fr.lapetina.configgraph.domain.model.SharingPolicy;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * {@code eval[(<params>)]:<expression>} - evaluates a sandboxed expression.
 *
 * {@code import} lists module imports such as {@code 'itertools as it'};
 * {@code resolve} maps local names to sections resolved before evaluation.
 */
public final class EvalDirectiveHandler implements DirectiveHandler {

    private static final Set<String> PARAMS = Set.of("import", "resolve");

    @Override
    public String getName() {
        return "eval";
    }

    @Override
    public Object handle(Directive directive, DirectiveContext context) {
        Map<String, Object> params = DirectiveParams.parse(directive, PARAMS);
        List<String> imports = imports(directive, params.get("import"));
        Map<String, Object> locals = new LinkedHashMap<>();
        Object resolve = params.get("resolve");
        if (resolve != null) {
            if (!(resolve instanceof Map<?, ?> bindings)) {
                throw new MalformedDirectiveException(directive.raw(), "'resolve' must be a JSON object");
            }
            for (Map.Entry<?, ?> e : bindings.entrySet()) {
                locals.put(String.valueOf(e.getKey()), context.builder().resolve(
                        context.resolution(), String.valueOf(e.getValue()), Map.of(), SharingPolicy.DEFAULT));
            }
        }
        return context.builder().getEvaluator().evaluate(directive.payload(), imports, locals);
    }

    private static List<String> imports(Directive directive, Object value) {
        List<String> imports = new ArrayList<>();
        if (value == null) {
            return imports;
        }
        if (value instanceof String s) {
            imports.add(s);
        } else if (value instanceof List<?> list) {
            list.forEach(i -> imports.add(String.valueOf(i)));
        } else {
            throw new MalformedDirectiveException(directive.raw(), "'import' must be a list of module names");
        }
        return imports;
    }
}
