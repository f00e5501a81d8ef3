package fr.lapetina.configgraph.domain.expression;

import fr.lapetina.configgraph.domain.exception.ConfigGraphException;
import fr.lapetina.configgraph.domain.exception.ExpressionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Evaluates sandboxed expressions for the {@code eval:} directive.
 *
 * <p>Imports take the form {@code module} or {@code module as alias} and may
 * only name modules registered in {@link ExpressionModules}. Integral results
 * are narrowed to {@link Integer} where they fit.
 */
public class ExpressionEvaluator {

    private static final Logger log = LoggerFactory.getLogger(ExpressionEvaluator.class);

    private static final Pattern IMPORT = Pattern.compile(
            "^\\s*(?:import\\s+)?([A-Za-z_][A-Za-z0-9_]*)(?:\\s+as\\s+([A-Za-z_][A-Za-z0-9_]*))?\\s*$");

    private final ExpressionModules modules;

    public ExpressionEvaluator() {
        this(ExpressionModules.standard());
    }

    public ExpressionEvaluator(ExpressionModules modules) {
        this.modules = modules;
    }

    public Object evaluate(String expression) {
        return evaluate(expression, List.of(), Map.of());
    }

    /**
     * Evaluates an expression.
     *
     * @param expression source text
     * @param imports    module imports, e.g. {@code itertools as it}
     * @param locals     extra names visible to the expression
     * @return the result, with longs narrowed to integers where they fit
     * @throws ExpressionException on syntax or evaluation failure
     */
    public Object evaluate(String expression, List<String> imports, Map<String, Object> locals) {
        Map<String, Object> scope = new HashMap<>(modules.getBuiltins());
        for (String spec : imports) {
            Matcher m = IMPORT.matcher(spec);
            if (!m.matches()) {
                throw new ExpressionException("Invalid import: '" + spec + "'");
            }
            String alias = m.group(2) != null ? m.group(2) : m.group(1);
            scope.put(alias, modules.getModule(m.group(1)));
        }
        locals.forEach((name, value) -> scope.put(name, Operators.widen(value)));

        log.debug("Evaluating expression: {} (imports={}, locals={})", expression, imports, locals.keySet());
        try {
            Object result = ExpressionParser.parse(expression).evaluate(scope);
            return Operators.normalize(materialize(result));
        } catch (ConfigGraphException e) {
            throw e;
        } catch (ArithmeticException | ClassCastException | IndexOutOfBoundsException e) {
            throw new ExpressionException("Failed to evaluate '" + expression + "': " + e.getMessage(), e);
        }
    }

    private static Object materialize(Object value) {
        if (value instanceof java.util.Iterator<?>) {
            return ExpressionModules.drain(value);
        }
        return value;
    }
}
