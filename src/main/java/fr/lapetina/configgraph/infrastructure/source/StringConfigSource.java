package fr.lapetina.configgraph.infrastructure.source;

import fr.lapetina.configgraph.domain.exception.ImportResolutionException;
import fr.lapetina.configgraph.domain.model.Section;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Inline configuration of the form
 * {@code <section>.<name>=<value>[,<section>.<name>=<value>...]}.
 * Options without a section go to the default section.
 */
public final class StringConfigSource implements ConfigSource {

    private static final Pattern KEY_VALUE = Pattern.compile("^(?:([^.]+?)\\.)?([^=]+?)=(.+)$");

    private final String config;
    private final String optionSeparator;
    private final String defaultSection;

    public StringConfigSource(String config, String optionSeparator, String defaultSection) {
        this.config = config;
        this.optionSeparator = optionSeparator;
        this.defaultSection = defaultSection;
    }

    public StringConfigSource(String config) {
        this(config, ",", "default");
    }

    @Override
    public String getDescription() {
        return "string";
    }

    @Override
    public ConfigContent load() {
        Map<String, Map<String, String>> sections = new LinkedHashMap<>();
        for (String pair : config.split(Pattern.quote(optionSeparator))) {
            Matcher m = KEY_VALUE.matcher(pair.trim());
            if (!m.matches()) {
                throw new ImportResolutionException(getDescription(), "Unexpected format: '" + pair + "'");
            }
            String section = m.group(1) == null ? defaultSection : m.group(1);
            sections.computeIfAbsent(section, k -> new LinkedHashMap<>()).put(m.group(2), m.group(3));
        }
        List<Section> out = new ArrayList<>();
        sections.forEach((name, options) -> out.add(new Section(name, options, getDescription())));
        return ConfigContent.flat(out);
    }
}
