/**
 * Instance graph construction.
 *
 * <p>The {@link fr.lapetina.configgraph.domain.graph.InstanceGraphBuilder}
 * resolves sections into objects through the
 * {@link fr.lapetina.configgraph.domain.graph.TypeRegistry}, sharing them via
 * the {@link fr.lapetina.configgraph.domain.graph.MemorySpaceManager}.
 */
package fr.lapetina.configgraph.domain.graph;
