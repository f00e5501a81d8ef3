package fr.lapetina.configgraph.domain.expression;

import fr.lapetina.configgraph.domain.exception.ExpressionException;
import fr.lapetina.configgraph.domain.model.Settings;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Value semantics shared by the expression nodes and builtins.
 *
 * Integers are carried as {@code Long} and reals as {@code Double} while
 * evaluating; {@link #normalize(Object)} narrows integers back to
 * {@code Integer} where they fit.
 */
final class Operators {

    private Operators() {
    }

    static boolean truthy(Object value) {
        if (value == null) return false;
        if (value instanceof Boolean b) return b;
        if (value instanceof Number n) return n.doubleValue() != 0.0;
        if (value instanceof CharSequence s) return s.length() > 0;
        if (value instanceof Collection<?> c) return !c.isEmpty();
        if (value instanceof Map<?, ?> m) return !m.isEmpty();
        if (value instanceof Settings s) return s.size() > 0;
        return true;
    }

    static Object requireNumber(Object value, String op) {
        if (value instanceof Long || value instanceof Double) {
            return value;
        }
        if (value instanceof Number n) {
            return widen(n);
        }
        if (value instanceof Boolean b) {
            return b ? 1L : 0L;
        }
        throw new ExpressionException("Unsupported operand type for " + op + ": " + typeName(value));
    }

    static Object negate(Object value) {
        Object n = requireNumber(value, "-");
        return n instanceof Long l ? (Object) (-l) : (Object) (-((Double) n));
    }

    private static int repeatCount(Object count) {
        try {
            return Math.toIntExact(Math.max(0, toLong(count)));
        } catch (ArithmeticException e) {
            throw new ExpressionException("Repeat count too large: " + count, e);
        }
    }

    static Object binary(String op, Object left, Object right) {
        if (op.equals("+")) {
            if (left instanceof String l && right instanceof String r) {
                return l + r;
            }
            if (left instanceof List<?> l && right instanceof List<?> r) {
                List<Object> joined = new ArrayList<>(l);
                joined.addAll(r);
                return joined;
            }
        }
        if (op.equals("*")) {
            if (left instanceof String s && isIntegral(right)) {
                return s.repeat(repeatCount(right));
            }
            if (left instanceof List<?> l && isIntegral(right)) {
                List<Object> repeated = new ArrayList<>();
                int count = repeatCount(right);
                for (int i = 0; i < count; i++) {
                    repeated.addAll(l);
                }
                return repeated;
            }
        }
        Object l = requireNumber(left, op);
        Object r = requireNumber(right, op);
        boolean integral = l instanceof Long && r instanceof Long;
        switch (op) {
            case "+":
                return integral ? (Object) Math.addExact((Long) l, (Long) r) : (Object) (dbl(l) + dbl(r));
            case "-":
                return integral ? (Object) Math.subtractExact((Long) l, (Long) r) : (Object) (dbl(l) - dbl(r));
            case "*":
                return integral ? (Object) Math.multiplyExact((Long) l, (Long) r) : (Object) (dbl(l) * dbl(r));
            case "/":
                if (dbl(r) == 0.0) throw new ExpressionException("Division by zero");
                return dbl(l) / dbl(r);
            case "//":
                if (dbl(r) == 0.0) throw new ExpressionException("Division by zero");
                return integral ? (Object) Math.floorDiv((Long) l, (Long) r) : (Object) Math.floor(dbl(l) / dbl(r));
            case "%":
                if (dbl(r) == 0.0) throw new ExpressionException("Modulo by zero");
                if (integral) {
                    return Math.floorMod((Long) l, (Long) r);
                }
                double m = dbl(l) % dbl(r);
                return (m != 0 && (m < 0) != (dbl(r) < 0)) ? m + dbl(r) : m;
            case "**":
                if (integral && (Long) r >= 0) {
                    long result = 1;
                    for (long i = 0; i < (Long) r; i++) {
                        result = Math.multiplyExact(result, (Long) l);
                    }
                    return result;
                }
                return Math.pow(dbl(l), dbl(r));
            default:
                throw new ExpressionException("Unknown operator: " + op);
        }
    }

    static boolean compare(String op, Object left, Object right) {
        switch (op) {
            case "==":
                return valueEquals(left, right);
            case "!=":
                return !valueEquals(left, right);
            case "is":
                return left == right || (left instanceof Boolean && left.equals(right));
            case "is not":
                return !compare("is", left, right);
            case "in":
                return contains(right, left);
            case "not in":
                return !contains(right, left);
            default:
                int c = order(left, right);
                return switch (op) {
                    case "<" -> c < 0;
                    case "<=" -> c <= 0;
                    case ">" -> c > 0;
                    case ">=" -> c >= 0;
                    default -> throw new ExpressionException("Unknown comparison: " + op);
                };
        }
    }

    static Object subscript(Object target, Object index) {
        if (target instanceof List<?> list) {
            int i = (int) toLong(index);
            int size = list.size();
            int resolved = i < 0 ? size + i : i;
            if (resolved < 0 || resolved >= size) {
                throw new ExpressionException("List index out of range: " + i);
            }
            return list.get(resolved);
        }
        if (target instanceof String s) {
            int i = (int) toLong(index);
            int resolved = i < 0 ? s.length() + i : i;
            if (resolved < 0 || resolved >= s.length()) {
                throw new ExpressionException("String index out of range: " + i);
            }
            return String.valueOf(s.charAt(resolved));
        }
        if (target instanceof Map<?, ?> map) {
            Object key = index instanceof Long l && !map.containsKey(l) ? (Object) l.intValue() : index;
            if (!map.containsKey(key)) {
                throw new ExpressionException("Key not found: " + index);
            }
            return map.get(key);
        }
        if (target instanceof Settings settings && index instanceof String key) {
            return settings.get(key);
        }
        throw new ExpressionException("Object of type " + typeName(target) + " is not subscriptable");
    }

    static Iterator<?> iterate(Object value) {
        if (value instanceof Iterator<?> it) return it;
        if (value instanceof Iterable<?> it) return it.iterator();
        if (value instanceof Map<?, ?> map) return map.keySet().iterator();
        if (value instanceof String s) {
            List<String> chars = new ArrayList<>();
            s.codePoints().forEach(cp -> chars.add(new String(Character.toChars(cp))));
            return chars.iterator();
        }
        throw new ExpressionException("Object of type " + typeName(value) + " is not iterable");
    }

    static boolean isIntegral(Object value) {
        return value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte;
    }

    static long toLong(Object value) {
        if (value instanceof Number n && isIntegral(value)) {
            return n.longValue();
        }
        if (value instanceof Boolean b) {
            return b ? 1 : 0;
        }
        throw new ExpressionException("Expected an integer but got " + typeName(value));
    }

    static double dbl(Object value) {
        return ((Number) value).doubleValue();
    }

    static String typeName(Object value) {
        return value == null ? "None" : value.getClass().getSimpleName();
    }

    /**
     * Narrows {@code Long} values that fit into {@code Integer}, recursively
     * through lists and maps.
     */
    static Object normalize(Object value) {
        if (value instanceof Long l && l >= Integer.MIN_VALUE && l <= Integer.MAX_VALUE) {
            return l.intValue();
        }
        if (value instanceof List<?> list) {
            List<Object> out = new ArrayList<>(list.size());
            list.forEach(e -> out.add(normalize(e)));
            return isUnmodifiable(list) ? Collections.unmodifiableList(out) : out;
        }
        if (value instanceof Map<?, ?> map) {
            Map<Object, Object> out = new LinkedHashMap<>();
            map.forEach((k, v) -> out.put(normalize(k), normalize(v)));
            return out;
        }
        return value;
    }

    /**
     * Widens boxed integral values to {@code Long} and reals to {@code Double}.
     */
    static Object widen(Object value) {
        if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return ((Number) value).longValue();
        }
        if (value instanceof Float f) {
            return f.doubleValue();
        }
        return value;
    }

    private static boolean isUnmodifiable(List<?> list) {
        String name = list.getClass().getName();
        return name.startsWith("java.util.ImmutableCollections")
                || name.startsWith("java.util.Collections$Unmodifiable");
    }

    private static boolean valueEquals(Object left, Object right) {
        if (left instanceof Number l && right instanceof Number r) {
            if (isIntegral(l) && isIntegral(r)) {
                return l.longValue() == r.longValue();
            }
            return l.doubleValue() == r.doubleValue();
        }
        return Objects.equals(left, right);
    }

    private static boolean contains(Object container, Object item) {
        if (container instanceof String s && item instanceof String i) {
            return s.contains(i);
        }
        if (container instanceof Map<?, ?> map) {
            return map.containsKey(item);
        }
        Iterator<?> it = iterate(container);
        while (it.hasNext()) {
            if (valueEquals(it.next(), item)) {
                return true;
            }
        }
        return false;
    }

    @SuppressWarnings({"unchecked", "rawtypes"})
    private static int order(Object left, Object right) {
        if (left instanceof Number l && right instanceof Number r) {
            if (isIntegral(l) && isIntegral(r)) {
                return Long.compare(l.longValue(), r.longValue());
            }
            return Double.compare(l.doubleValue(), r.doubleValue());
        }
        if (left instanceof String l && right instanceof String r) {
            return l.compareTo(r);
        }
        if (left instanceof Comparable l && right != null && left.getClass().equals(right.getClass())) {
            return l.compareTo(right);
        }
        throw new ExpressionException("Can not order " + typeName(left) + " and " + typeName(right));
    }
}
