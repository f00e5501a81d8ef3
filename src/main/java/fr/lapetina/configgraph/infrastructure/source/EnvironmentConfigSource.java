package fr.lapetina.configgraph.infrastructure.source;

import fr.lapetina.configgraph.domain.model.Section;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Environment variables as a single section, {@code env} by default.
 *
 * With a map delimiter every occurrence of it in a value is doubled, so that
 * values such as {@code PS1} survive variable substitution.
 */
public final class EnvironmentConfigSource implements ConfigSource {

    private final String sectionName;
    private final String mapDelimiter;
    private final Map<String, String> environment;

    public EnvironmentConfigSource(String sectionName, String mapDelimiter, Map<String, String> environment) {
        this.sectionName = sectionName;
        this.mapDelimiter = mapDelimiter;
        this.environment = environment;
    }

    public EnvironmentConfigSource(String sectionName, String mapDelimiter) {
        this(sectionName, mapDelimiter, System.getenv());
    }

    @Override
    public String getDescription() {
        return "environment";
    }

    @Override
    public ConfigContent load() {
        Map<String, String> options = new LinkedHashMap<>();
        new TreeMap<>(environment).forEach((k, v) -> options.put(k,
                mapDelimiter == null || mapDelimiter.isEmpty() ? v : v.replace(mapDelimiter, mapDelimiter + mapDelimiter)));
        return ConfigContent.flat(List.of(new Section(sectionName, options, getDescription())));
    }
}
