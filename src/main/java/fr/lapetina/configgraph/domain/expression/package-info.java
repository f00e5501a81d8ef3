/**
 * Sandboxed expression language used by the {@code eval:} directive.
 */
package fr.lapetina.configgraph.domain.expression;
