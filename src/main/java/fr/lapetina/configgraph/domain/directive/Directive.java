package fr.lapetina.configgraph.domain.directive;

import fr.lapetina.configgraph.domain.exception.MalformedDirectiveException;

import java.util.Optional;
import java.util.function.Predicate;

/**
 * A scanned {@code <prefix>[(<params>)]:<payload>} option value.
 *
 * @param prefix  directive name
 * @param params  raw text between the parentheses, or {@code null} when absent
 * @param payload text after the colon, leading whitespace removed
 * @param raw     the whole option value
 */
public record Directive(String prefix, String params, String payload, String raw) {

    public boolean hasParams() {
        return params != null && !params.isBlank();
    }

    /**
     * Scans a raw value.
     *
     * Values whose leading word is not a known prefix, or is not followed by
     * {@code (} or {@code :}, are not directives.
     *
     * @param raw   the option value
     * @param known predicate over registered prefixes
     * @return the directive, or empty for plain values
     * @throws MalformedDirectiveException if a known prefix is followed by
     *                                     unbalanced or unterminated parameters
     */
    public static Optional<Directive> scan(String raw, Predicate<String> known) {
        int n = raw.length();
        int i = 0;
        while (i < n && Character.isLetter(raw.charAt(i))) {
            i++;
        }
        if (i == 0 || i == n) {
            return Optional.empty();
        }
        String prefix = raw.substring(0, i);
        char next = raw.charAt(i);
        if (!known.test(prefix) || (next != ':' && next != '(')) {
            return Optional.empty();
        }
        String params = null;
        if (next == '(') {
            int close = closingParen(raw, i);
            if (close < 0) {
                throw new MalformedDirectiveException(raw, "unbalanced parameters for '" + prefix + "'");
            }
            params = raw.substring(i + 1, close);
            i = close + 1;
            if (i >= n || raw.charAt(i) != ':') {
                throw new MalformedDirectiveException(raw, "expected ':' after parameters of '" + prefix + "'");
            }
        }
        String payload = raw.substring(i + 1).stripLeading();
        return Optional.of(new Directive(prefix, params, payload, raw));
    }

    private static int closingParen(String raw, int open) {
        int depth = 0;
        char quote = 0;
        for (int i = open; i < raw.length(); i++) {
            char c = raw.charAt(i);
            if (quote != 0) {
                if (c == '\\') {
                    i++;
                } else if (c == quote) {
                    quote = 0;
                }
            } else if (c == '\'' || c == '"') {
                quote = c;
            } else if (c == '(') {
                depth++;
            } else if (c == ')' && --depth == 0) {
                return i;
            }
        }
        return -1;
    }
}
