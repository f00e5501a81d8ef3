package fr.lapetina.configgraph.infrastructure.source;

import fr.lapetina.configgraph.domain.exception.ImportResolutionException;
import fr.lapetina.configgraph.domain.model.Section;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * INI reader.
 *
 * Supports {@code [section]} headers, {@code key = value} and
 * {@code key: value} options, {@code #} and {@code ;} comment lines, and
 * indented continuation lines appended to the previous value with a newline.
 * Repeated sections are merged.
 */
public final class IniConfigSource implements ConfigSource {

    private final Path path;
    private final String text;
    private final String description;

    public IniConfigSource(Path path) {
        this.path = path;
        this.text = null;
        this.description = path.toString();
    }

    private IniConfigSource(String text, String description) {
        this.path = null;
        this.text = text;
        this.description = description;
    }

    /**
     * Creates a source over INI text held in memory.
     */
    public static IniConfigSource ofText(String text, String description) {
        return new IniConfigSource(text, description);
    }

    @Override
    public String getDescription() {
        return description;
    }

    @Override
    public ConfigContent load() {
        String content = text;
        if (content == null) {
            try {
                content = Files.readString(path, StandardCharsets.UTF_8);
            } catch (IOException e) {
                throw new ImportResolutionException(description, "Can not read INI file: " + e.getMessage(), e);
            }
        }
        ParseContext ctx = new ParseContext(description);
        int lineNo = 0;
        for (String line : content.split("\\r?\\n", -1)) {
            ctx.accept(line, ++lineNo);
        }
        return ConfigContent.flat(ctx.finish());
    }

    private static final class ParseContext {
        final Map<String, Map<String, String>> sections = new LinkedHashMap<>();
        final String description;
        Map<String, String> current;
        String lastKey;

        ParseContext(String description) {
            this.description = description;
        }

        void accept(String line, int lineNo) {
            String trimmed = line.trim();
            if (trimmed.isEmpty()) {
                lastKey = null;
                return;
            }
            if (trimmed.startsWith("#") || trimmed.startsWith(";")) {
                return;
            }
            if (Character.isWhitespace(line.charAt(0)) && lastKey != null) {
                current.put(lastKey, current.get(lastKey) + "\n" + trimmed);
                return;
            }
            if (trimmed.startsWith("[")) {
                if (!trimmed.endsWith("]") || trimmed.length() < 3) {
                    throw error(lineNo, "malformed section header '" + trimmed + "'");
                }
                String name = trimmed.substring(1, trimmed.length() - 1).trim();
                current = sections.computeIfAbsent(name, k -> new LinkedHashMap<>());
                lastKey = null;
                return;
            }
            if (current == null) {
                throw error(lineNo, "option outside of a section");
            }
            int sep = separator(trimmed);
            if (sep <= 0) {
                throw error(lineNo, "expected 'key = value' but got '" + trimmed + "'");
            }
            lastKey = trimmed.substring(0, sep).trim();
            current.put(lastKey, trimmed.substring(sep + 1).trim());
        }

        List<Section> finish() {
            List<Section> out = new ArrayList<>(sections.size());
            sections.forEach((name, options) -> out.add(new Section(name, options, description)));
            return out;
        }

        private ImportResolutionException error(int lineNo, String message) {
            return new ImportResolutionException(description, "Line " + lineNo + ": " + message);
        }

        private static int separator(String line) {
            int eq = line.indexOf('=');
            int colon = line.indexOf(':');
            if (eq < 0) return colon;
            if (colon < 0) return eq;
            return Math.min(eq, colon);
        }
    }
}
