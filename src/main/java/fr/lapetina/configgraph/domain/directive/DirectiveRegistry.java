package fr.lapetina.configgraph.domain.directive;

import fr.lapetina.configgraph.domain.directive.handlers.AliasDirectiveHandler;
import fr.lapetina.configgraph.domain.directive.handlers.ApplicationDirectiveHandler;
import fr.lapetina.configgraph.domain.directive.handlers.AsDictDirectiveHandler;
import fr.lapetina.configgraph.domain.directive.handlers.CallDirectiveHandler;
import fr.lapetina.configgraph.domain.directive.handlers.ClassDirectiveHandler;
import fr.lapetina.configgraph.domain.directive.handlers.CollectionDirectiveHandler;
import fr.lapetina.configgraph.domain.directive.handlers.DataclassDirectiveHandler;
import fr.lapetina.configgraph.domain.directive.handlers.EvalDirectiveHandler;
import fr.lapetina.configgraph.domain.directive.handlers.InstanceDirectiveHandler;
import fr.lapetina.configgraph.domain.directive.handlers.JsonDirectiveHandler;
import fr.lapetina.configgraph.domain.directive.handlers.ObjectDirectiveHandler;
import fr.lapetina.configgraph.domain.directive.handlers.PathDirectiveHandler;
import fr.lapetina.configgraph.domain.directive.handlers.ResourceDirectiveHandler;
import fr.lapetina.configgraph.domain.directive.handlers.StrDirectiveHandler;
import fr.lapetina.configgraph.domain.directive.handlers.TreeDirectiveHandler;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Prefix to handler mapping used by the {@link DirectiveParser}.
 *
 * Custom directives can be added next to the built-in ones.
 */
public final class DirectiveRegistry {

    private final Map<String, DirectiveHandler> registry = new LinkedHashMap<>();

    /**
     * Creates a registry holding the built-in directives.
     */
    public static DirectiveRegistry defaults() {
        DirectiveRegistry registry = new DirectiveRegistry();
        registry.register(new StrDirectiveHandler());
        registry.register(new CollectionDirectiveHandler("list", false));
        registry.register(new CollectionDirectiveHandler("tuple", true));
        registry.register(new JsonDirectiveHandler());
        registry.register(new PathDirectiveHandler());
        registry.register(new ResourceDirectiveHandler());
        registry.register(new EvalDirectiveHandler());
        registry.register(new InstanceDirectiveHandler());
        registry.register(new ObjectDirectiveHandler());
        registry.register(new ClassDirectiveHandler());
        registry.register(new DataclassDirectiveHandler());
        registry.register(new AliasDirectiveHandler());
        registry.register(new CallDirectiveHandler());
        registry.register(new TreeDirectiveHandler());
        registry.register(new ApplicationDirectiveHandler());
        registry.register(new AsDictDirectiveHandler());
        return registry;
    }

    /**
     * Registers a handler under its name, replacing any previous one.
     */
    public DirectiveRegistry register(DirectiveHandler handler) {
        registry.put(handler.getName(), handler);
        return this;
    }

    public Optional<DirectiveHandler> find(String prefix) {
        return Optional.ofNullable(registry.get(prefix));
    }

    public boolean contains(String prefix) {
        return registry.containsKey(prefix);
    }

    /**
     * Returns all registered prefixes.
     */
    public Set<String> getRegisteredNames() {
        return Collections.unmodifiableSet(registry.keySet());
    }
}
