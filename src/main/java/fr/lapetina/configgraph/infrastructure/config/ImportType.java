package fr.lapetina.configgraph.infrastructure.config;

import java.util.Locale;

/**
 * Kind of source an import entry reads.
 */
public enum ImportType {
    /** INI file */
    INI,

    /** YAML file, top-level keys as sections */
    YAML,

    /** JSON file, top-level keys as sections */
    JSON,

    /** Inline {@code section.option=value} string */
    STRING,

    /** Environment variables */
    ENVIRONMENT,

    /** Another file with its own import manifest */
    IMPORT,

    /** YAML file with {@code condition} nodes */
    CONDYAML;

    /**
     * Parses a type name, case-insensitive.
     *
     * @throws IllegalArgumentException for unknown names
     */
    public static ImportType parse(String value) {
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown import type: " + value, e);
        }
    }

    /**
     * Infers the type from a file extension, defaulting to INI.
     */
    public static ImportType fromFileName(String fileName) {
        String name = fileName.toLowerCase(Locale.ROOT);
        if (name.endsWith(".yml") || name.endsWith(".yaml")) {
            return YAML;
        }
        if (name.endsWith(".json")) {
            return JSON;
        }
        return INI;
    }
}
