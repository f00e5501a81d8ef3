package fr.lapetina.configgraph.domain.expression;

import java.util.List;
import java.util.Map;

/**
 * A whitelisted function callable from a sandboxed expression.
 */
@FunctionalInterface
public interface ExpressionFunction {

    /**
     * Applies the function.
     *
     * @param args   positional arguments, already evaluated
     * @param kwargs keyword arguments, already evaluated, in call order
     * @return the result
     */
    Object apply(List<Object> args, Map<String, Object> kwargs);
}
