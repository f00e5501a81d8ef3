package fr.lapetina.configgraph.domain.directive;

import fr.lapetina.configgraph.domain.exception.MalformedDirectiveException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Classifies raw option strings into typed values.
 *
 * Rules, first match wins: integer, real, {@code True}/{@code False},
 * {@code None}, a registered directive prefix, otherwise the literal string.
 * Malformed directives are logged and returned as literals.
 */
public class DirectiveParser {

    private static final Logger log = LoggerFactory.getLogger(DirectiveParser.class);

    private static final Pattern INTEGER = Pattern.compile("^[-+]?[0-9]+$");
    private static final Pattern REAL = Pattern.compile("^[-+]?[0-9]*\\.[0-9]+$");

    private final DirectiveRegistry registry;

    public DirectiveParser() {
        this(DirectiveRegistry.defaults());
    }

    public DirectiveParser(DirectiveRegistry registry) {
        this.registry = registry;
    }

    public DirectiveRegistry getRegistry() {
        return registry;
    }

    /**
     * Parses a raw value.
     *
     * @param raw     option value, may be {@code null}
     * @param context where the value is parsed, used by instantiation directives
     * @return the typed value
     */
    public Object parse(String raw, DirectiveContext context) {
        if (raw == null) {
            return null;
        }
        Object primitive = parsePrimitive(raw);
        if (primitive != raw) {
            return primitive;
        }
        try {
            Optional<Directive> directive = Directive.scan(raw, registry::contains);
            if (directive.isEmpty()) {
                return raw;
            }
            Directive d = directive.get();
            DirectiveHandler handler = registry.find(d.prefix()).orElseThrow();
            if (log.isDebugEnabled()) {
                log.debug("Section '{}': applying '{}' to '{}'", context.sectionName(), d.prefix(), d.payload());
            }
            return handler.handle(d, context);
        } catch (MalformedDirectiveException e) {
            log.warn("Malformed directive in section '{}', using literal value '{}': {}",
                    context.sectionName(), raw, e.getMessage());
            return raw;
        }
    }

    /**
     * Applies the scalar rules only.
     *
     * @return the typed value, or {@code raw} itself if no scalar rule matched
     */
    public static Object parsePrimitive(String raw) {
        if (INTEGER.matcher(raw).matches()) {
            return parseInteger(raw);
        }
        if (REAL.matcher(raw).matches()) {
            return Double.parseDouble(raw);
        }
        switch (raw) {
            case "True":
                return Boolean.TRUE;
            case "False":
                return Boolean.FALSE;
            case "None":
                return null;
            default:
                return raw;
        }
    }

    private static Number parseInteger(String raw) {
        BigInteger value = new BigInteger(raw.startsWith("+") ? raw.substring(1) : raw);
        if (value.bitLength() < 32) {
            return value.intValue();
        }
        if (value.bitLength() < 64) {
            return value.longValue();
        }
        return value;
    }
}
