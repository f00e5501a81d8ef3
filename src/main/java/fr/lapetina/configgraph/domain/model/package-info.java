/**
 * Core value types of the resolver.
 *
 * <h2>Key Types</h2>
 * <ul>
 *   <li>{@link fr.lapetina.configgraph.domain.model.Section} - Named, ordered option strings</li>
 *   <li>{@link fr.lapetina.configgraph.domain.model.SectionStore} - Merged sections plus their tree view</li>
 *   <li>{@link fr.lapetina.configgraph.domain.model.ObjectSpec} - Type id and raw bindings of a section</li>
 *   <li>{@link fr.lapetina.configgraph.domain.model.InstanceRecord} - Cached instance and its lifecycle state</li>
 *   <li>{@link fr.lapetina.configgraph.domain.model.SharingPolicy} - DEFAULT, EVICT and DEEP sharing</li>
 *   <li>{@link fr.lapetina.configgraph.domain.model.Settings} - Mapping object for untyped sections</li>
 * </ul>
 */
package fr.lapetina.configgraph.domain.model;
