package fr.lapetina.configgraph.infrastructure.config;

import fr.lapetina.configgraph.domain.exception.ImportResolutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.AbstractMap;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Function;
import java.util.function.UnaryOperator;

/**
 * Replaces {@code condition} nodes of a YAML tree by one of their branches.
 *
 * <pre>
 * app:
 *   condition:
 *     if: ${default:testing}
 *     then:
 *       store: {class_name: MemoryStore}
 *     else:
 *       store: {class_name: FileStore}
 * </pre>
 *
 * The {@code if} value goes through the classifier when it is a string and
 * picks {@code then} when truthy. Both branches must hold the same single
 * child, which takes the place of the condition node.
 */
public final class ConditionalTreeRewriter implements UnaryOperator<Map<String, Object>> {

    private static final Logger log = LoggerFactory.getLogger(ConditionalTreeRewriter.class);

    static final String CONDITION = "condition";
    static final String IF = "if";
    static final String THEN = "then";
    static final String ELSE = "else";

    private final Function<String, Object> classifier;
    private final String source;

    /**
     * @param classifier turns a string {@code if} value into a typed value
     * @param source     description of the document, for error messages
     */
    public ConditionalTreeRewriter(Function<String, Object> classifier, String source) {
        this.classifier = classifier;
        this.source = source;
    }

    @Override
    public Map<String, Object> apply(Map<String, Object> document) {
        return rewrite(document);
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> rewrite(Map<String, Object> node) {
        Map<String, Object> out = new LinkedHashMap<>();
        for (Map.Entry<String, Object> e : node.entrySet()) {
            if (e.getKey().equals(CONDITION) && e.getValue() instanceof Map<?, ?> condition) {
                Map.Entry<String, Object> chosen = choose((Map<String, Object>) condition);
                Object child = chosen.getValue() instanceof Map<?, ?> m
                        ? rewrite((Map<String, Object>) m)
                        : chosen.getValue();
                out.put(chosen.getKey(), child);
            } else if (e.getValue() instanceof Map<?, ?> m) {
                out.put(e.getKey(), rewrite((Map<String, Object>) m));
            } else {
                out.put(e.getKey(), e.getValue());
            }
        }
        return out;
    }

    private Map.Entry<String, Object> choose(Map<String, Object> condition) {
        for (String required : new String[]{IF, THEN, ELSE}) {
            if (!condition.containsKey(required)) {
                throw new ImportResolutionException(source, "Missing '" + required + "' in condition: " + condition);
            }
        }
        Map<String, Object> then = branch(condition, THEN);
        Map<String, Object> otherwise = branch(condition, ELSE);
        String thenChild = then.keySet().iterator().next();
        String elseChild = otherwise.keySet().iterator().next();
        if (!thenChild.equals(elseChild)) {
            throw new ImportResolutionException(source, "Conditionals must have the same child root, got '"
                    + thenChild + "' and '" + elseChild + "'");
        }
        Object test = condition.get(IF);
        if (test instanceof String s) {
            test = classifier.apply(s);
        }
        boolean truthy = truthy(test);
        log.debug("Condition on '{}': {} -> {}", thenChild, condition.get(IF), truthy ? THEN : ELSE);
        return new AbstractMap.SimpleEntry<>(thenChild, (truthy ? then : otherwise).get(thenChild));
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> branch(Map<String, Object> condition, String name) {
        Object node = condition.get(name);
        if (!(node instanceof Map<?, ?> map) || map.size() != 1) {
            throw new ImportResolutionException(source, "Conditionals can have only one child under '"
                    + name + "', got: " + node);
        }
        return (Map<String, Object>) map;
    }

    static boolean truthy(Object value) {
        if (value == null) return false;
        if (value instanceof Boolean b) return b;
        if (value instanceof Number n) return n.doubleValue() != 0;
        if (value instanceof CharSequence s) return s.length() > 0;
        if (value instanceof Collection<?> c) return !c.isEmpty();
        if (value instanceof Map<?, ?> m) return !m.isEmpty();
        return true;
    }
}
