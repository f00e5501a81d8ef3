package fr.lapetina.configgraph.infrastructure.config;

import fr.lapetina.configgraph.domain.exception.ImportResolutionException;

import java.util.Map;
import java.util.Optional;
import java.util.function.BiFunction;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Variable substitution for option values and import paths.
 *
 * <ul>
 *   <li>{@code ${section:option}} - an option of another section</li>
 *   <li>{@code ${option}} - an option of the same section</li>
 *   <li>{@code $$} - a literal dollar sign</li>
 *   <li>{@code ^{name}} - a caller supplied token, for import paths</li>
 * </ul>
 *
 * Referenced values are substituted in turn, up to a maximum depth.
 */
public final class Substitutor {

    private static final Pattern VARIABLE = Pattern.compile("\\$\\$|\\$\\{([^}:]+)(?::([^}]+))?}");
    private static final Pattern TOKEN = Pattern.compile("\\^\\{([^}]+)}");

    private final int maxDepth;

    public Substitutor(int maxDepth) {
        this.maxDepth = maxDepth;
    }

    public Substitutor() {
        this(10);
    }

    /**
     * Substitutes {@code ${...}} placeholders.
     *
     * @param value   raw value
     * @param section section the value belongs to, for {@code ${option}}
     * @param lookup  raw value of (section, option), empty when unknown
     * @param context entry or section name used in error messages
     * @throws ImportResolutionException if a placeholder can not be resolved
     *                                   or the maximum depth is exceeded
     */
    public String substitute(String value, String section,
                             BiFunction<String, String, Optional<String>> lookup, String context) {
        return substitute(value, section, lookup, context, 0);
    }

    private String substitute(String value, String section,
                              BiFunction<String, String, Optional<String>> lookup, String context, int depth) {
        if (value.indexOf('$') < 0) {
            return value;
        }
        if (depth > maxDepth) {
            throw new ImportResolutionException(context, "Substitution depth " + maxDepth
                    + " exceeded in '" + value + "' (recursive reference?)");
        }
        Matcher m = VARIABLE.matcher(value);
        StringBuilder out = new StringBuilder();
        while (m.find()) {
            String replacement;
            if (m.group(0).equals("$$")) {
                replacement = "$";
            } else {
                String targetSection = m.group(2) == null ? section : m.group(1);
                String option = m.group(2) == null ? m.group(1) : m.group(2);
                String raw = lookup.apply(targetSection, option).orElseThrow(() ->
                        new ImportResolutionException(context, "Can not resolve '" + m.group(0)
                                + "': no option '" + option + "' in section '" + targetSection + "'"));
                replacement = substitute(raw, targetSection, lookup, context, depth + 1);
            }
            m.appendReplacement(out, Matcher.quoteReplacement(replacement));
        }
        m.appendTail(out);
        return out.toString();
    }

    /**
     * Substitutes {@code ^{name}} caller tokens.
     *
     * @throws ImportResolutionException if a token has no value
     */
    public String substituteTokens(String value, Map<String, String> tokens, String context) {
        Matcher m = TOKEN.matcher(value);
        StringBuilder out = new StringBuilder();
        while (m.find()) {
            String name = m.group(1);
            String replacement = tokens.get(name);
            if (replacement == null) {
                throw new ImportResolutionException(context, "No value for token '^{" + name + "}'");
            }
            m.appendReplacement(out, Matcher.quoteReplacement(replacement));
        }
        m.appendTail(out);
        return out.toString();
    }
}
