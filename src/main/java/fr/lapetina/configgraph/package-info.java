/**
 * Directive-driven configuration to object graph resolution.
 *
 * <p>{@link fr.lapetina.configgraph.ResolverFactory} wires the import
 * resolver, the directive parser and the instance graph builder from a root
 * configuration file. {@link fr.lapetina.configgraph.ConfigGraphApplication}
 * is the command line entry point.
 */
package fr.lapetina.configgraph;
