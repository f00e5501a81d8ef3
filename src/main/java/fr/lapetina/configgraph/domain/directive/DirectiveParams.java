package fr.lapetina.configgraph.domain.directive;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import fr.lapetina.configgraph.domain.exception.MalformedDirectiveException;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Parses the JSON object between a directive's parentheses.
 *
 * Single quotes and unquoted field names are accepted so that
 * {@code instance({'share': 'deep'}): bob} reads naturally.
 */
public final class DirectiveParams {

    private static final ObjectMapper LENIENT = JsonMapper.builder()
            .enable(JsonReadFeature.ALLOW_SINGLE_QUOTES)
            .enable(JsonReadFeature.ALLOW_UNQUOTED_FIELD_NAMES)
            .enable(JsonReadFeature.ALLOW_TRAILING_COMMA)
            .build();

    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private DirectiveParams() {
    }

    /**
     * Parses the parameters, allowing any key.
     */
    public static Map<String, Object> parse(Directive directive) {
        if (!directive.hasParams()) {
            return new LinkedHashMap<>();
        }
        try {
            Map<String, Object> params = LENIENT.readValue(directive.params(), MAP_TYPE);
            return params == null ? new LinkedHashMap<>() : params;
        } catch (JsonProcessingException e) {
            throw new MalformedDirectiveException(directive.raw(),
                    "parameters are not a JSON object: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Parses the parameters, rejecting keys outside {@code allowed}.
     */
    public static Map<String, Object> parse(Directive directive, Set<String> allowed) {
        Map<String, Object> params = parse(directive);
        Set<String> unknown = new LinkedHashSet<>(params.keySet());
        unknown.removeAll(allowed);
        if (!unknown.isEmpty()) {
            throw new MalformedDirectiveException(directive.raw(),
                    "unknown parameters " + unknown + " for '" + directive.prefix() + "', allowed: " + allowed);
        }
        return params;
    }

    /**
     * Returns the parameters as a bare token, such as a type or owner name.
     */
    public static String token(Directive directive) {
        if (!directive.hasParams()) {
            throw new MalformedDirectiveException(directive.raw(),
                    "'" + directive.prefix() + "' requires a parameter");
        }
        return directive.params().trim();
    }

    /**
     * Returns the {@code param} overrides as a map.
     */
    @SuppressWarnings("unchecked")
    public static Map<String, Object> overrides(Directive directive, Map<String, Object> params) {
        Object param = params.get("param");
        if (param == null) {
            return new LinkedHashMap<>();
        }
        if (!(param instanceof Map)) {
            throw new MalformedDirectiveException(directive.raw(), "'param' must be a JSON object");
        }
        return new LinkedHashMap<>((Map<String, Object>) param);
    }
}
