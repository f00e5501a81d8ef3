package fr.lapetina.configgraph;

import com.fasterxml.jackson.databind.ObjectMapper;
import fr.lapetina.configgraph.domain.expression.ExpressionEvaluator;
import fr.lapetina.configgraph.domain.expression.ExpressionModules;
import fr.lapetina.configgraph.domain.graph.InstanceGraphBuilder;
import fr.lapetina.configgraph.domain.graph.TypeRegistry;
import fr.lapetina.configgraph.domain.model.SectionStore;
import fr.lapetina.configgraph.domain.model.SharingPolicy;
import fr.lapetina.configgraph.infrastructure.config.ConfigLoader;
import fr.lapetina.configgraph.infrastructure.config.ImportResolver;
import fr.lapetina.configgraph.infrastructure.config.ResolverSettings;
import fr.lapetina.configgraph.infrastructure.metrics.ResolutionMetrics;
import fr.lapetina.configgraph.infrastructure.resource.ManifestApplicationLoader;
import fr.lapetina.configgraph.infrastructure.resource.OwnerResourceLocator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Factory for creating fully-wired instance graph builders from a root
 * configuration file. This is the primary entry point of the library.
 *
 * <p>Usage:
 * <pre>{@code
 * try (ResolverFactory factory = ResolverFactory.create("app.ini")) {
 *     Object service = factory.getBuilder().resolve("service");
 *     // use service...
 * }
 * }</pre>
 *
 * When the root file changes and watching is enabled, a new builder over
 * the fresh store replaces the current one. The watcher thread only swaps
 * the reference: the previous builder is retired and closed by the owner,
 * through {@link #closeRetired()} or {@link #close()}.
 */
public class ResolverFactory implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ResolverFactory.class);

    private final ResolverSettings settings;
    private final TypeRegistry types;
    private final ObjectMapper objectMapper;
    private final ResolutionMetrics metrics;
    private final ConfigLoader configLoader;
    private final OwnerResourceLocator resourceLocator;
    private final ManifestApplicationLoader applicationLoader;
    private final AtomicReference<InstanceGraphBuilder> builder = new AtomicReference<>();
    private final Queue<InstanceGraphBuilder> retired = new ConcurrentLinkedQueue<>();

    protected ResolverFactory(String configPath, ResolverSettings settings, TypeRegistry types,
                              Map<String, String> tokens, Map<String, Path> applications) {
        log.info("Initializing ResolverFactory from config: {}", configPath);

        this.settings = settings;
        this.types = types;
        this.objectMapper = new ObjectMapper();

        // Initialize metrics
        this.metrics = new ResolutionMetrics(settings.getMetrics().getPrefix(), settings.getMetrics().isEnabled());

        // Collaborators for resource(...) and application(...) directives
        ImportResolver resolver = new ImportResolver(settings, objectMapper, tokens, System.getenv());
        Path baseDirectory = Path.of(configPath).toAbsolutePath().getParent();
        Map<String, Path> ownerDirectories = new LinkedHashMap<>();
        applications.forEach((owner, root) -> ownerDirectories.put(owner, root.toAbsolutePath().getParent()));
        this.resourceLocator = new OwnerResourceLocator(baseDirectory, ownerDirectories);
        this.applicationLoader = new ManifestApplicationLoader(applications,
                new ImportResolver(settings, objectMapper, tokens, System.getenv()), this::newBuilder);

        // Load configuration
        this.configLoader = new ConfigLoader(configPath, resolver);
        this.builder.set(newBuilder(configLoader.load()));

        for (String diagnostic : resolver.getDiagnostics()) {
            log.warn("Import diagnostic: {}", diagnostic);
        }

        // Register config change listener
        configLoader.addListener(this::onConfigChanged);

        log.info("ResolverFactory initialized with {} sections", builder.get().getStore().size());
    }

    /**
     * Creates a factory from the specified root configuration file, using
     * the default settings and the types contributed by registrars found
     * on the classpath.
     */
    public static ResolverFactory create(String configPath) {
        return create(configPath, ResolverSettings.load(), new TypeRegistry().loadRegistrars());
    }

    public static ResolverFactory create(String configPath, ResolverSettings settings, TypeRegistry types) {
        return create(configPath, settings, types, Map.of(), Map.of());
    }

    /**
     * @param tokens       values of {@code ^{name}} placeholders in import paths
     * @param applications root configuration file of each {@code application(...)} owner
     */
    public static ResolverFactory create(String configPath, ResolverSettings settings, TypeRegistry types,
                                         Map<String, String> tokens, Map<String, Path> applications) {
        return new ResolverFactory(configPath, settings, types, tokens, applications);
    }

    /**
     * Starts watching the root file, when enabled in the settings.
     */
    public ResolverFactory start() {
        if (settings.getWatch().isEnabled()) {
            configLoader.startWatching(settings.getWatch().getIntervalMs());
        }
        return this;
    }

    public InstanceGraphBuilder getBuilder() {
        return builder.get();
    }

    public ResolutionMetrics getMetrics() {
        return metrics;
    }

    public ConfigLoader getConfigLoader() {
        return configLoader;
    }

    public ResolverSettings getSettings() {
        return settings;
    }

    private InstanceGraphBuilder newBuilder(SectionStore store) {
        return InstanceGraphBuilder.builder()
                .store(store)
                .types(types)
                .objectMapper(objectMapper)
                .evaluator(new ExpressionEvaluator(
                        ExpressionModules.standard().restrictTo(settings.getEvaluation().getAllowedModules())))
                .resourceLocator(resourceLocator)
                .applicationLoader(applicationLoader)
                .metrics(metrics)
                .classNameOption(settings.getInstances().getClassNameOption())
                .defaultPolicy(SharingPolicy.parse(settings.getInstances().getDefaultSharing()))
                .build();
    }

    private void onConfigChanged(SectionStore oldStore, SectionStore newStore) {
        if (oldStore == null) {
            return;
        }
        log.info("Configuration changed, rebuilding instance graph...");
        retired.add(builder.getAndSet(newBuilder(newStore)));
        log.info("Instance graph rebuilt with {} sections, {} builder(s) awaiting release",
                newStore.size(), retired.size());
    }

    /**
     * Closes the builders replaced by reloads. Call from the thread that
     * uses the builders, once it holds no instance from them.
     *
     * @return the number of builders closed
     */
    public int closeRetired() {
        int closed = 0;
        InstanceGraphBuilder previous;
        while ((previous = retired.poll()) != null) {
            try {
                previous.close();
                closed++;
            } catch (RuntimeException e) {
                log.warn("Error closing retired instance graph builder", e);
            }
        }
        return closed;
    }

    @Override
    public void close() {
        log.info("Shutting down ResolverFactory...");

        try {
            configLoader.close();
        } catch (Exception e) {
            log.warn("Error closing config loader", e);
        }

        closeRetired();

        try {
            builder.get().close();
        } catch (Exception e) {
            log.warn("Error closing instance graph builder", e);
        }

        try {
            metrics.close();
        } catch (Exception e) {
            log.warn("Error closing metrics", e);
        }

        log.info("ResolverFactory shut down");
    }
}
