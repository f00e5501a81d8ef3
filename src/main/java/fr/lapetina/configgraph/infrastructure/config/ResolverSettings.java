package fr.lapetina.configgraph.infrastructure.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Settings of the resolver itself, as opposed to the configuration it
 * resolves. Designed to be populated from YAML.
 */
public class ResolverSettings {

    private static final Logger log = LoggerFactory.getLogger(ResolverSettings.class);

    public static final String DEFAULT_RESOURCE = "config-graph.yml";

    private ImportsConfig imports = new ImportsConfig();
    private InstancesConfig instances = new InstancesConfig();
    private EvaluationConfig evaluation = new EvaluationConfig();
    private MetricsConfig metrics = new MetricsConfig();
    private WatchConfig watch = new WatchConfig();

    // Getters and Setters
    public ImportsConfig getImports() { return imports; }
    public void setImports(ImportsConfig imports) { this.imports = imports; }

    public InstancesConfig getInstances() { return instances; }
    public void setInstances(InstancesConfig instances) { this.instances = instances; }

    public EvaluationConfig getEvaluation() { return evaluation; }
    public void setEvaluation(EvaluationConfig evaluation) { this.evaluation = evaluation; }

    public MetricsConfig getMetrics() { return metrics; }
    public void setMetrics(MetricsConfig metrics) { this.metrics = metrics; }

    public WatchConfig getWatch() { return watch; }
    public void setWatch(WatchConfig watch) { this.watch = watch; }

    /**
     * Loads settings from a file, or from the classpath when no such file
     * exists. Returns defaults when neither is found.
     *
     * @throws ConfigLoader.ConfigurationException if the settings can not be read
     */
    public static ResolverSettings load(String location) {
        Yaml yaml = new Yaml(new Constructor(ResolverSettings.class, new LoaderOptions()));
        Path path = Path.of(location);
        try {
            if (Files.exists(path)) {
                log.info("Loading resolver settings from file: {}", path);
                try (InputStream in = Files.newInputStream(path)) {
                    return orDefault(yaml.load(in));
                }
            }
            String resource = location.startsWith("/") ? location.substring(1) : location;
            try (InputStream in = ResolverSettings.class.getClassLoader().getResourceAsStream(resource)) {
                if (in != null) {
                    log.info("Loading resolver settings from classpath: {}", resource);
                    return orDefault(yaml.load(in));
                }
            }
        } catch (IOException | YAMLException e) {
            throw new ConfigLoader.ConfigurationException("Failed to load resolver settings from: " + location, e);
        }
        log.debug("No resolver settings at {}, using defaults", location);
        return new ResolverSettings();
    }

    /**
     * Loads {@value #DEFAULT_RESOURCE} when present, defaults otherwise.
     */
    public static ResolverSettings load() {
        return load(DEFAULT_RESOURCE);
    }

    private static ResolverSettings orDefault(ResolverSettings loaded) {
        return loaded != null ? loaded : new ResolverSettings();
    }

    /**
     * Import manifest and substitution settings.
     */
    public static class ImportsConfig {
        private String sectionName = "import";
        private String defaultSection = "default";
        private int substitutionDepth = 10;
        private String environmentSection = "env";
        private String mapDelimiter = "$";

        public String getSectionName() { return sectionName; }
        public void setSectionName(String sectionName) { this.sectionName = sectionName; }

        public String getDefaultSection() { return defaultSection; }
        public void setDefaultSection(String defaultSection) { this.defaultSection = defaultSection; }

        public int getSubstitutionDepth() { return substitutionDepth; }
        public void setSubstitutionDepth(int substitutionDepth) { this.substitutionDepth = substitutionDepth; }

        public String getEnvironmentSection() { return environmentSection; }
        public void setEnvironmentSection(String environmentSection) { this.environmentSection = environmentSection; }

        public String getMapDelimiter() { return mapDelimiter; }
        public void setMapDelimiter(String mapDelimiter) { this.mapDelimiter = mapDelimiter; }
    }

    /**
     * Instance graph settings.
     */
    public static class InstancesConfig {
        private String classNameOption = "class_name";
        private String defaultSharing = "default";

        public String getClassNameOption() { return classNameOption; }
        public void setClassNameOption(String classNameOption) { this.classNameOption = classNameOption; }

        public String getDefaultSharing() { return defaultSharing; }
        public void setDefaultSharing(String defaultSharing) { this.defaultSharing = defaultSharing; }
    }

    /**
     * Modules {@code eval:} expressions may import.
     */
    public static class EvaluationConfig {
        private List<String> allowedModules = new ArrayList<>(List.of("itertools", "math"));

        public List<String> getAllowedModules() { return allowedModules; }
        public void setAllowedModules(List<String> allowedModules) { this.allowedModules = allowedModules; }
    }

    /**
     * Metrics configuration.
     */
    public static class MetricsConfig {
        private boolean enabled = true;
        private String prefix = "config_graph";

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public String getPrefix() { return prefix; }
        public void setPrefix(String prefix) { this.prefix = prefix; }
    }

    /**
     * Hot reload of the root configuration file.
     */
    public static class WatchConfig {
        private boolean enabled = false;
        private long intervalMs = 1000;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public long getIntervalMs() { return intervalMs; }
        public void setIntervalMs(long intervalMs) { this.intervalMs = intervalMs; }
    }
}
