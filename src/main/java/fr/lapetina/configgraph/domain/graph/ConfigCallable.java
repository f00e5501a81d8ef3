package fr.lapetina.configgraph.domain.graph;

import java.util.Map;

/**
 * Contract for objects that {@code call:} directives may invoke.
 */
public interface ConfigCallable {

    /**
     * Invokes a named method.
     *
     * @param method the method name, or {@code null} to call the object itself
     * @param kwargs keyword arguments from the directive parameters
     */
    Object call(String method, Map<String, Object> kwargs) throws Exception;

    /**
     * Reads a named attribute.
     */
    default Object attribute(String name) {
        throw new UnsupportedOperationException(getClass().getSimpleName() + " has no attribute '" + name + "'");
    }
}
