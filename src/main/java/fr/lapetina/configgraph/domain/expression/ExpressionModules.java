package fr.lapetina.configgraph.domain.expression;

import fr.lapetina.configgraph.domain.exception.ExpressionException;
import fr.lapetina.configgraph.domain.model.Settings;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Whitelist of builtin functions and importable modules available to
 * sandboxed expressions.
 *
 * Nothing outside this registry is reachable from an expression: there is
 * no reflection and no access to arbitrary Java types.
 */
public final class ExpressionModules {

    private final Map<String, Object> builtins = new LinkedHashMap<>();
    private final Map<String, Module> modules = new ConcurrentHashMap<>();

    /**
     * An importable namespace of functions and constants.
     */
    public record Module(String name, Map<String, Object> members) {
        public Module {
            members = Map.copyOf(members);
        }

        public Object member(String memberName) {
            Object value = members.get(memberName);
            if (value == null) {
                throw new ExpressionException("Module '" + name + "' has no attribute '" + memberName + "'");
            }
            return value;
        }
    }

    private ExpressionModules() {
    }

    /**
     * Creates the standard whitelist: builtins plus the {@code itertools}
     * and {@code math} modules.
     */
    public static ExpressionModules standard() {
        ExpressionModules m = new ExpressionModules();
        m.registerBuiltins();
        m.register(new Module("itertools", itertools()));
        m.register(new Module("math", math()));
        return m;
    }

    /**
     * Restricts the importable modules to the given names.
     */
    public ExpressionModules restrictTo(Collection<String> allowed) {
        modules.keySet().retainAll(Set.copyOf(allowed));
        return this;
    }

    public void register(Module module) {
        modules.put(module.name(), module);
    }

    public Module getModule(String name) {
        Module module = modules.get(name);
        if (module == null) {
            throw new ExpressionException("No module named '" + name + "' (available: " + modules.keySet() + ")");
        }
        return module;
    }

    public Set<String> getModuleNames() {
        return Collections.unmodifiableSet(modules.keySet());
    }

    Map<String, Object> getBuiltins() {
        return Collections.unmodifiableMap(builtins);
    }

    private void registerBuiltins() {
        builtins.put("list", (ExpressionFunction) (args, kw) -> args.isEmpty() ? new ArrayList<>() : drain(args.get(0)));
        builtins.put("tuple", (ExpressionFunction) (args, kw) ->
                Collections.unmodifiableList(args.isEmpty() ? new ArrayList<>() : drain(args.get(0))));
        builtins.put("len", (ExpressionFunction) (args, kw) -> (long) length(arg(args, 0, "len")));
        builtins.put("str", (ExpressionFunction) (args, kw) -> args.isEmpty() ? "" : str(args.get(0)));
        builtins.put("int", (ExpressionFunction) (args, kw) -> toInt(arg(args, 0, "int")));
        builtins.put("float", (ExpressionFunction) (args, kw) -> toFloat(arg(args, 0, "float")));
        builtins.put("bool", (ExpressionFunction) (args, kw) -> !args.isEmpty() && Operators.truthy(args.get(0)));
        builtins.put("abs", (ExpressionFunction) (args, kw) -> {
            Object n = Operators.requireNumber(arg(args, 0, "abs"), "abs()");
            return n instanceof Long l ? (Object) Math.abs(l) : (Object) Math.abs((Double) n);
        });
        builtins.put("min", (ExpressionFunction) (args, kw) -> extreme(args, -1));
        builtins.put("max", (ExpressionFunction) (args, kw) -> extreme(args, 1));
        builtins.put("sum", (ExpressionFunction) (args, kw) -> {
            Object total = args.size() > 1 ? args.get(1) : 0L;
            for (Object value : drain(arg(args, 0, "sum"))) {
                total = Operators.binary("+", total, value);
            }
            return total;
        });
        builtins.put("range", (ExpressionFunction) (args, kw) -> range(args));
        builtins.put("sorted", (ExpressionFunction) (args, kw) -> {
            List<Object> values = drain(arg(args, 0, "sorted"));
            values.sort(ExpressionModules::compareValues);
            if (Operators.truthy(kw.get("reverse"))) {
                Collections.reverse(values);
            }
            return values;
        });
    }

    private static Map<String, Object> itertools() {
        Map<String, Object> members = new LinkedHashMap<>();
        members.put("count", (ExpressionFunction) (args, kw) -> {
            long start = args.isEmpty() ? 0 : Operators.toLong(args.get(0));
            long step = args.size() > 1 ? Operators.toLong(args.get(1)) : 1;
            return new Iterator<Object>() {
                private long next = start;

                @Override
                public boolean hasNext() {
                    return true;
                }

                @Override
                public Object next() {
                    long value = next;
                    next += step;
                    return value;
                }
            };
        });
        members.put("islice", (ExpressionFunction) (args, kw) -> islice(args));
        members.put("repeat", (ExpressionFunction) (args, kw) -> {
            Object value = arg(args, 0, "repeat");
            long times = args.size() > 1 ? Operators.toLong(args.get(1)) : Long.MAX_VALUE;
            return new Iterator<Object>() {
                private long emitted;

                @Override
                public boolean hasNext() {
                    return emitted < times;
                }

                @Override
                public Object next() {
                    if (!hasNext()) throw new NoSuchElementException();
                    emitted++;
                    return value;
                }
            };
        });
        members.put("chain", (ExpressionFunction) (args, kw) -> {
            List<Object> chained = new ArrayList<>();
            for (Object iterable : args) {
                chained.addAll(drain(iterable));
            }
            return chained.iterator();
        });
        return members;
    }

    private static Map<String, Object> math() {
        Map<String, Object> members = new LinkedHashMap<>();
        members.put("pi", Math.PI);
        members.put("e", Math.E);
        members.put("sqrt", (ExpressionFunction) (args, kw) -> Math.sqrt(real(args, 0, "sqrt")));
        members.put("floor", (ExpressionFunction) (args, kw) -> (long) Math.floor(real(args, 0, "floor")));
        members.put("ceil", (ExpressionFunction) (args, kw) -> (long) Math.ceil(real(args, 0, "ceil")));
        members.put("pow", (ExpressionFunction) (args, kw) -> Math.pow(real(args, 0, "pow"), real(args, 1, "pow")));
        members.put("exp", (ExpressionFunction) (args, kw) -> Math.exp(real(args, 0, "exp")));
        members.put("log", (ExpressionFunction) (args, kw) -> args.size() > 1
                ? Math.log(real(args, 0, "log")) / Math.log(real(args, 1, "log"))
                : Math.log(real(args, 0, "log")));
        return members;
    }

    private static Iterator<Object> islice(List<Object> args) {
        Iterator<?> source = Operators.iterate(arg(args, 0, "islice"));
        long start = 0;
        Long stop;
        long step = 1;
        if (args.size() == 2) {
            stop = bound(args.get(1));
        } else if (args.size() >= 3) {
            start = args.get(1) == null ? 0 : Operators.toLong(args.get(1));
            stop = bound(args.get(2));
            if (args.size() > 3 && args.get(3) != null) {
                step = Operators.toLong(args.get(3));
            }
        } else {
            throw new ExpressionException("islice expected at least 2 arguments");
        }
        if (start < 0 || step < 1 || (stop != null && stop < 0)) {
            throw new ExpressionException("Indices for islice() must be None or non-negative integers");
        }
        List<Object> out = new ArrayList<>();
        long index = 0;
        long nextIndex = start;
        while (source.hasNext() && (stop == null || index < stop)) {
            Object value = source.next();
            if (index == nextIndex) {
                out.add(value);
                nextIndex += step;
            }
            index++;
        }
        return out.iterator();
    }

    private static Long bound(Object value) {
        return value == null ? null : Operators.toLong(value);
    }

    private static List<Object> range(List<Object> args) {
        long start = 0;
        long stop;
        long step = 1;
        if (args.size() == 1) {
            stop = Operators.toLong(args.get(0));
        } else if (args.size() >= 2) {
            start = Operators.toLong(args.get(0));
            stop = Operators.toLong(args.get(1));
            if (args.size() > 2) {
                step = Operators.toLong(args.get(2));
            }
        } else {
            throw new ExpressionException("range expected at least 1 argument");
        }
        if (step == 0) {
            throw new ExpressionException("range() arg 3 must not be zero");
        }
        List<Object> values = new ArrayList<>();
        for (long i = start; step > 0 ? i < stop : i > stop; i += step) {
            values.add(i);
        }
        return values;
    }

    private static Object extreme(List<Object> args, int sign) {
        List<Object> values = args.size() == 1 ? drain(args.get(0)) : new ArrayList<>(args);
        if (values.isEmpty()) {
            throw new ExpressionException((sign > 0 ? "max" : "min") + "() arg is an empty sequence");
        }
        Comparator<Object> order = ExpressionModules::compareValues;
        return sign > 0 ? Collections.max(values, order) : Collections.min(values, order);
    }

    private static int compareValues(Object a, Object b) {
        return Operators.compare("<", a, b) ? -1 : (Operators.compare("==", a, b) ? 0 : 1);
    }

    static List<Object> drain(Object value) {
        List<Object> out = new ArrayList<>();
        Iterator<?> it = Operators.iterate(value);
        int guard = 0;
        while (it.hasNext()) {
            if (++guard > 1_000_000) {
                throw new ExpressionException("Refusing to materialize an unbounded sequence");
            }
            out.add(it.next());
        }
        return out;
    }

    private static int length(Object value) {
        if (value instanceof CharSequence s) return s.length();
        if (value instanceof Collection<?> c) return c.size();
        if (value instanceof Map<?, ?> m) return m.size();
        if (value instanceof Settings s) return s.size();
        throw new ExpressionException("Object of type " + Operators.typeName(value) + " has no len()");
    }

    private static Object toInt(Object value) {
        if (value instanceof String s) {
            try {
                return Long.parseLong(s.trim());
            } catch (NumberFormatException e) {
                throw new ExpressionException("Invalid literal for int(): '" + s + "'", e);
            }
        }
        Object n = Operators.requireNumber(value, "int()");
        return n instanceof Double d ? (Object) d.longValue() : n;
    }

    private static Object toFloat(Object value) {
        if (value instanceof String s) {
            try {
                return Double.parseDouble(s.trim());
            } catch (NumberFormatException e) {
                throw new ExpressionException("Could not convert string to float: '" + s + "'", e);
            }
        }
        return Operators.dbl(Operators.requireNumber(value, "float()"));
    }

    private static String str(Object value) {
        if (value == null) return "None";
        if (value instanceof Boolean b) return b ? "True" : "False";
        return String.valueOf(value);
    }

    private static double real(List<Object> args, int index, String fn) {
        return Operators.dbl(Operators.requireNumber(arg(args, index, fn), fn + "()"));
    }

    private static Object arg(List<Object> args, int index, String fn) {
        if (args.size() <= index) {
            throw new ExpressionException(fn + "() missing argument " + (index + 1));
        }
        return args.get(index);
    }
}
