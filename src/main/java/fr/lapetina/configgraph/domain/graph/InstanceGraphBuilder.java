package fr.lapetina.configgraph.domain.graph;

import com.fasterxml.jackson.databind.ObjectMapper;
import fr.lapetina.configgraph.domain.directive.DirectiveContext;
import fr.lapetina.configgraph.domain.directive.DirectiveParser;
import fr.lapetina.configgraph.domain.exception.ConfigGraphException;
import fr.lapetina.configgraph.domain.exception.CyclicDependencyException;
import fr.lapetina.configgraph.domain.exception.ImportResolutionException;
import fr.lapetina.configgraph.domain.exception.MissingSectionException;
import fr.lapetina.configgraph.domain.exception.ObjectInstantiationException;
import fr.lapetina.configgraph.domain.expression.ExpressionEvaluator;
import fr.lapetina.configgraph.domain.model.InstanceState;
import fr.lapetina.configgraph.domain.model.ObjectSpec;
import fr.lapetina.configgraph.domain.model.Section;
import fr.lapetina.configgraph.domain.model.SectionStore;
import fr.lapetina.configgraph.domain.model.Settings;
import fr.lapetina.configgraph.domain.model.SharingPolicy;
import fr.lapetina.configgraph.infrastructure.metrics.ResolutionMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Duration;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Builds objects from sections on demand.
 *
 * Every option value goes through the {@link DirectiveParser}; instantiation
 * directives recurse back here. Instances are shared through the builder's
 * own {@link MemorySpaceManager} according to the requested
 * {@link SharingPolicy}:
 * <ul>
 *   <li>DEFAULT - return the cached instance, or build and cache it</li>
 *   <li>EVICT - as DEFAULT, then drop the cache entry</li>
 *   <li>DEEP - bypass the cache for this call and every nested resolution</li>
 * </ul>
 *
 * Not thread-safe.
 */
public final class InstanceGraphBuilder implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(InstanceGraphBuilder.class);

    private final SectionStore store;
    private final TypeRegistry types;
    private final DirectiveParser parser;
    private final MemorySpaceManager memory;
    private final ObjectMapper objectMapper;
    private final ExpressionEvaluator evaluator;
    private final ResourceLocator resourceLocator;
    private final ApplicationLoader applicationLoader;
    private final ResolutionMetrics metrics;
    private final boolean ownsMetrics;
    private final String classNameOption;
    private final SharingPolicy defaultPolicy;

    private final Map<String, ObjectSpec> specs = new HashMap<>();
    private final Map<String, InstanceGraphBuilder> applications = new HashMap<>();

    private InstanceGraphBuilder(Builder builder) {
        this.store = Objects.requireNonNull(builder.store, "Section store is required");
        this.types = builder.types != null ? builder.types : new TypeRegistry();
        this.parser = builder.parser != null ? builder.parser : new DirectiveParser();
        this.memory = new MemorySpaceManager();
        this.objectMapper = builder.objectMapper != null ? builder.objectMapper : new ObjectMapper();
        this.evaluator = builder.evaluator != null ? builder.evaluator : new ExpressionEvaluator();
        this.resourceLocator = builder.resourceLocator;
        this.applicationLoader = builder.applicationLoader;
        this.ownsMetrics = builder.metrics == null;
        this.metrics = ownsMetrics ? new ResolutionMetrics("config_graph", false) : builder.metrics;
        this.classNameOption = builder.classNameOption;
        this.defaultPolicy = builder.defaultPolicy;

        log.info("InstanceGraphBuilder created: sections={}, types={}, directives={}",
                store.size(), types.getRegisteredIds().size(), parser.getRegistry().getRegisteredNames().size());
    }

    /**
     * Resolves a section with the default sharing policy.
     */
    public Object resolve(String name) {
        return resolve(name, Map.of(), defaultPolicy);
    }

    public Object resolve(String name, Map<String, Object> overrides) {
        return resolve(name, overrides, defaultPolicy);
    }

    public Object resolve(String name, Map<String, Object> overrides, SharingPolicy policy) {
        return resolve(ResolutionContext.root(), name, overrides, policy);
    }

    /**
     * Resolves a section and casts it to the expected type.
     *
     * @throws ClassCastException if the instance has another type
     */
    public <T> T resolve(String name, Class<T> type) {
        return type.cast(resolve(name));
    }

    /**
     * Builds the section and leaves nothing in the cache for it.
     */
    public Object newInstance(String name) {
        return resolve(name, Map.of(), SharingPolicy.EVICT);
    }

    /**
     * Builds the section and all of its dependencies without using the cache.
     */
    public Object newDeepInstance(String name) {
        return resolve(name, Map.of(), SharingPolicy.DEEP);
    }

    /**
     * Resolves a section inside an active resolution.
     *
     * @param context  the active resolution; deep contexts force DEEP sharing
     * @param name     section name
     * @param overrides bindings replacing or extending the section's options
     * @param policy   requested sharing policy
     */
    public Object resolve(ResolutionContext context, String name, Map<String, Object> overrides,
                          SharingPolicy policy) {
        boolean deep = context.isDeep() || policy == SharingPolicy.DEEP;
        if (!deep) {
            Optional<Object> cached = memory.get(name);
            if (cached.isPresent()) {
                metrics.recordCacheHit();
                log.debug("Cache hit for section '{}' ({})", name, policy);
                if (policy == SharingPolicy.EVICT) {
                    evict(name);
                }
                return cached.get();
            }
            if (memory.state(name) == InstanceState.RESOLVING && !context.isResolving(name)) {
                throw new CyclicDependencyException(context.pathTo(name));
            }
        }
        metrics.recordCacheMiss();
        ObjectSpec spec = spec(name, context);
        ResolutionContext active = deep ? context.deep() : context;
        SharingPolicy effective = deep ? SharingPolicy.DEEP : policy;

        active.enter(name);
        long start = System.nanoTime();
        Object instance;
        try {
            if (!deep) {
                memory.markResolving(name);
            }
            instance = build(spec, overrides, active);
        } catch (RuntimeException e) {
            if (!deep) {
                memory.evict(name);
            }
            if (e instanceof ConfigGraphException cge && context.path().isEmpty()) {
                metrics.recordError(cge.getErrorType());
            }
            throw e;
        } finally {
            active.exit(name);
        }

        if (effective == SharingPolicy.DEFAULT) {
            memory.put(name, instance);
            metrics.setCachedInstances(memory.size());
        } else if (!deep) {
            memory.evict(name);
        }
        int patched = active.patch(name, instance);
        if (patched > 0) {
            log.debug("Patched {} lazy reference(s) to section '{}'", patched, name);
        }
        metrics.recordCreated(effective, Duration.ofNanos(System.nanoTime() - start));
        log.debug("Resolved section '{}' ({}) -> {}", name, effective,
                instance == null ? "None" : instance.getClass().getSimpleName());
        return instance;
    }

    /**
     * Returns a reference to a section that may be on the active stack.
     *
     * Sections still being built get a pending reference that is filled once
     * they complete; any other section is resolved immediately.
     */
    public LazyReference<Object> resolveLazy(ResolutionContext context, String name,
                                             Map<String, Object> overrides, SharingPolicy policy) {
        if (context.isResolving(name)) {
            log.debug("Deferring reference to section '{}' on path {}", name, context.path());
            return context.defer(name);
        }
        return LazyReference.of(name, resolve(context, name, overrides, policy));
    }

    /**
     * Builds an object from a spec that is not backed by a cached section,
     * as {@code object:} and {@code tree:} directives do.
     */
    public Object build(ObjectSpec spec, Map<String, Object> overrides, ResolutionContext context) {
        Map<String, Object> values = new LinkedHashMap<>();
        DirectiveContext directives = new DirectiveContext(this, context, spec.sectionName());
        String typeId = spec.typeId();
        Map<String, Object> extra = new LinkedHashMap<>(overrides);
        if (extra.containsKey(classNameOption)) {
            typeId = String.valueOf(extra.remove(classNameOption));
        }
        for (Map.Entry<String, String> binding : spec.bindings().entrySet()) {
            String key = binding.getKey();
            values.put(key, extra.containsKey(key)
                    ? parseOverride(extra.remove(key), directives)
                    : parser.parse(binding.getValue(), directives));
        }
        extra.forEach((key, value) -> values.put(key, parseOverride(value, directives)));

        if (typeId == null) {
            return new Settings(spec.sectionName(), values);
        }
        String missingType = typeId;
        RegisteredType type = types.find(typeId)
                .orElseThrow(() -> MissingSectionException.type(missingType, spec.sectionName(), context.path()));
        inject(type, spec.sectionName(), values);
        try {
            return type.create(new Bindings(spec.sectionName(), values));
        } catch (ConfigGraphException e) {
            throw e;
        } catch (Exception e) {
            throw new ObjectInstantiationException(spec.sectionName(), spec.provenance(),
                    "type " + type.id() + ": " + e.getMessage(), context.path(), e);
        }
    }

    private Object parseOverride(Object value, DirectiveContext directives) {
        return value instanceof String s ? parser.parse(s, directives) : value;
    }

    private void inject(RegisteredType type, String sectionName, Map<String, Object> values) {
        if (type.accepts(Injection.NAME)) {
            values.putIfAbsent(Injection.NAME.getBindingName(), sectionName);
        }
        if (type.accepts(Injection.CONFIG)) {
            values.putIfAbsent(Injection.CONFIG.getBindingName(), store);
        }
        if (type.accepts(Injection.CONFIG_FACTORY)) {
            values.putIfAbsent(Injection.CONFIG_FACTORY.getBindingName(), this);
        }
    }

    /**
     * Returns the section's spec, computed once per builder.
     *
     * @throws MissingSectionException if the section does not exist
     */
    public ObjectSpec spec(String name, ResolutionContext context) {
        ObjectSpec spec = specs.get(name);
        if (spec == null) {
            Section section = store.get(name)
                    .orElseThrow(() -> MissingSectionException.section(name, context.pathTo(name)));
            spec = ObjectSpec.fromSection(section, classNameOption);
            specs.put(name, spec);
        }
        return spec;
    }

    /**
     * Returns the registered type a section would be built with.
     *
     * @throws MissingSectionException if the section or its type is unknown
     */
    public RegisteredType getType(String name) {
        ResolutionContext context = ResolutionContext.root();
        ObjectSpec spec = spec(name, context);
        if (!spec.isTyped()) {
            throw new MissingSectionException(name, "Section '" + name + "' has no "
                    + classNameOption + " option", List.of(name));
        }
        return types.find(spec.typeId())
                .orElseThrow(() -> MissingSectionException.type(spec.typeId(), name, List.of(name)));
    }

    /**
     * Returns the builder for another application's configuration, created
     * once per owner.
     */
    public InstanceGraphBuilder getApplication(String owner) {
        if (applicationLoader == null) {
            throw new ImportResolutionException(owner, "No application loader configured for '" + owner + "'");
        }
        return applications.computeIfAbsent(owner, applicationLoader::load);
    }

    public Path resolveResource(String owner, String relativePath) {
        if (resourceLocator == null) {
            return Path.of(relativePath);
        }
        return resourceLocator.resolve(owner, relativePath);
    }

    /**
     * Drops the cached instance of one section.
     *
     * @return the dropped instance, if one was cached
     */
    public Optional<Object> clearInstance(String name) {
        return evict(name);
    }

    /**
     * Drops every cached instance.
     */
    public void clear() {
        List<Object> dropped = memory.clear();
        dropped.forEach(i -> metrics.recordEviction());
        metrics.setCachedInstances(0);
        log.debug("Cleared {} cached instance(s)", dropped.size());
    }

    private Optional<Object> evict(String name) {
        Optional<Object> dropped = memory.evict(name);
        if (dropped.isPresent()) {
            metrics.recordEviction();
            metrics.setCachedInstances(memory.size());
        }
        return dropped;
    }

    /**
     * Clears the cache, closing every cached instance that is
     * {@link AutoCloseable}, then closes the application builders and the
     * metrics registry when none was supplied.
     */
    @Override
    public void close() {
        List<Object> instances = memory.clear();
        metrics.setCachedInstances(0);
        for (Object instance : instances) {
            if (instance instanceof AutoCloseable closeable) {
                try {
                    closeable.close();
                } catch (Exception e) {
                    log.warn("Failed to close {}", instance.getClass().getSimpleName(), e);
                }
            }
        }
        applications.values().forEach(InstanceGraphBuilder::close);
        applications.clear();
        if (ownsMetrics) {
            metrics.close();
        }
        log.info("InstanceGraphBuilder closed ({} instance(s) released)", instances.size());
    }

    public SectionStore getStore() {
        return store;
    }

    public TypeRegistry getTypeRegistry() {
        return types;
    }

    public DirectiveParser getParser() {
        return parser;
    }

    public MemorySpaceManager getMemorySpace() {
        return memory;
    }

    public ObjectMapper getObjectMapper() {
        return objectMapper;
    }

    public ExpressionEvaluator getEvaluator() {
        return evaluator;
    }

    public ResolutionMetrics getMetrics() {
        return metrics;
    }

    public String getClassNameOption() {
        return classNameOption;
    }

    public SharingPolicy getDefaultPolicy() {
        return defaultPolicy;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for InstanceGraphBuilder.
     */
    public static final class Builder {
        private SectionStore store;
        private TypeRegistry types;
        private DirectiveParser parser;
        private ObjectMapper objectMapper;
        private ExpressionEvaluator evaluator;
        private ResourceLocator resourceLocator;
        private ApplicationLoader applicationLoader;
        private ResolutionMetrics metrics;
        private String classNameOption = "class_name";
        private SharingPolicy defaultPolicy = SharingPolicy.DEFAULT;

        private Builder() {
        }

        public Builder store(SectionStore store) {
            this.store = store;
            return this;
        }

        public Builder types(TypeRegistry types) {
            this.types = types;
            return this;
        }

        public Builder parser(DirectiveParser parser) {
            this.parser = parser;
            return this;
        }

        public Builder objectMapper(ObjectMapper objectMapper) {
            this.objectMapper = objectMapper;
            return this;
        }

        public Builder evaluator(ExpressionEvaluator evaluator) {
            this.evaluator = evaluator;
            return this;
        }

        public Builder resourceLocator(ResourceLocator resourceLocator) {
            this.resourceLocator = resourceLocator;
            return this;
        }

        public Builder applicationLoader(ApplicationLoader applicationLoader) {
            this.applicationLoader = applicationLoader;
            return this;
        }

        public Builder metrics(ResolutionMetrics metrics) {
            this.metrics = metrics;
            return this;
        }

        public Builder classNameOption(String classNameOption) {
            this.classNameOption = classNameOption;
            return this;
        }

        public Builder defaultPolicy(SharingPolicy defaultPolicy) {
            this.defaultPolicy = defaultPolicy;
            return this;
        }

        public InstanceGraphBuilder build() {
            return new InstanceGraphBuilder(this);
        }
    }
}
