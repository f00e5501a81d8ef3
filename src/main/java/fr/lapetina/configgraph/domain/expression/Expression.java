package fr.lapetina.configgraph.domain.expression;

import fr.lapetina.configgraph.domain.exception.ExpressionException;
import fr.lapetina.configgraph.domain.model.Settings;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Node of a parsed expression.
 */
interface Expression {

    Object evaluate(Map<String, Object> scope);

    record Literal(Object value) implements Expression {
        @Override
        public Object evaluate(Map<String, Object> scope) {
            return value;
        }
    }

    record Name(String name) implements Expression {
        @Override
        public Object evaluate(Map<String, Object> scope) {
            if (!scope.containsKey(name)) {
                throw new ExpressionException("Name '" + name + "' is not defined");
            }
            return scope.get(name);
        }
    }

    record ListDisplay(List<Expression> elements, boolean tuple) implements Expression {
        @Override
        public Object evaluate(Map<String, Object> scope) {
            List<Object> values = new ArrayList<>(elements.size());
            for (Expression e : elements) {
                values.add(e.evaluate(scope));
            }
            return tuple ? Collections.unmodifiableList(values) : values;
        }
    }

    record DictDisplay(List<Expression> keys, List<Expression> values) implements Expression {
        @Override
        public Object evaluate(Map<String, Object> scope) {
            Map<Object, Object> map = new LinkedHashMap<>();
            for (int i = 0; i < keys.size(); i++) {
                map.put(keys.get(i).evaluate(scope), values.get(i).evaluate(scope));
            }
            return map;
        }
    }

    record Unary(String op, Expression operand) implements Expression {
        @Override
        public Object evaluate(Map<String, Object> scope) {
            Object value = operand.evaluate(scope);
            return switch (op) {
                case "-" -> Operators.negate(value);
                case "+" -> Operators.requireNumber(value, "+");
                case "not" -> !Operators.truthy(value);
                default -> throw new ExpressionException("Unknown unary operator: " + op);
            };
        }
    }

    record Binary(String op, Expression left, Expression right) implements Expression {
        @Override
        public Object evaluate(Map<String, Object> scope) {
            if (op.equals("and")) {
                Object l = left.evaluate(scope);
                return Operators.truthy(l) ? right.evaluate(scope) : l;
            }
            if (op.equals("or")) {
                Object l = left.evaluate(scope);
                return Operators.truthy(l) ? l : right.evaluate(scope);
            }
            return Operators.binary(op, left.evaluate(scope), right.evaluate(scope));
        }
    }

    /**
     * Chained comparison: {@code a < b <= c} holds when every adjacent pair holds.
     */
    record Comparison(List<String> ops, List<Expression> operands) implements Expression {
        @Override
        public Object evaluate(Map<String, Object> scope) {
            Object left = operands.get(0).evaluate(scope);
            for (int i = 0; i < ops.size(); i++) {
                Object right = operands.get(i + 1).evaluate(scope);
                if (!Operators.compare(ops.get(i), left, right)) {
                    return false;
                }
                left = right;
            }
            return true;
        }
    }

    record Conditional(Expression test, Expression then, Expression otherwise) implements Expression {
        @Override
        public Object evaluate(Map<String, Object> scope) {
            return Operators.truthy(test.evaluate(scope))
                    ? then.evaluate(scope)
                    : otherwise.evaluate(scope);
        }
    }

    record Attribute(Expression target, String name) implements Expression {
        @Override
        public Object evaluate(Map<String, Object> scope) {
            Object value = target.evaluate(scope);
            if (value instanceof ExpressionModules.Module module) {
                return module.member(name);
            }
            if (value instanceof Settings settings) {
                if (!settings.containsKey(name)) {
                    throw new ExpressionException("No attribute '" + name + "' in " + settings.getName());
                }
                return settings.get(name);
            }
            if (value instanceof Map<?, ?> map) {
                if (!map.containsKey(name)) {
                    throw new ExpressionException("No key '" + name + "' in mapping");
                }
                return map.get(name);
            }
            throw new ExpressionException("Attribute access '" + name + "' is not allowed on "
                    + Operators.typeName(value));
        }
    }

    record Subscript(Expression target, Expression index) implements Expression {
        @Override
        public Object evaluate(Map<String, Object> scope) {
            return Operators.subscript(target.evaluate(scope), index.evaluate(scope));
        }
    }

    record Call(Expression function, List<Expression> args, Map<String, Expression> kwargs) implements Expression {
        @Override
        public Object evaluate(Map<String, Object> scope) {
            Object fn = function.evaluate(scope);
            if (!(fn instanceof ExpressionFunction callable)) {
                throw new ExpressionException("Object of type " + Operators.typeName(fn) + " is not callable");
            }
            List<Object> argValues = new ArrayList<>(args.size());
            for (Expression arg : args) {
                argValues.add(arg.evaluate(scope));
            }
            Map<String, Object> kwValues = new LinkedHashMap<>();
            kwargs.forEach((k, v) -> kwValues.put(k, v.evaluate(scope)));
            return callable.apply(argValues, kwValues);
        }
    }
}
