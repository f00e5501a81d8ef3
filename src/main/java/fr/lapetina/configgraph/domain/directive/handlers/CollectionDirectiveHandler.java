package fr.lapetina.configgraph.domain.directive.handlers;

import fr.lapetina.configgraph.domain.directive.Directive;
import fr.lapetina.configgraph.domain.directive.DirectiveContext;
import fr.lapetina.configgraph.domain.directive.DirectiveHandler;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * {@code list:} and {@code tuple:} - comma separated, trimmed string
 * elements. Elements are not classified further.
 */
public final class CollectionDirectiveHandler implements DirectiveHandler {

    private final String name;
    private final boolean immutable;

    public CollectionDirectiveHandler(String name, boolean immutable) {
        this.name = name;
        this.immutable = immutable;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public Object handle(Directive directive, DirectiveContext context) {
        List<String> elements = split(directive.payload());
        return immutable ? Collections.unmodifiableList(elements) : elements;
    }

    /**
     * Splits on commas and trims each element; a blank payload is empty.
     */
    public static List<String> split(String payload) {
        List<String> elements = new ArrayList<>();
        if (payload.isBlank()) {
            return elements;
        }
        for (String element : payload.split(",", -1)) {
            elements.add(element.trim());
        }
        return elements;
    }
}
