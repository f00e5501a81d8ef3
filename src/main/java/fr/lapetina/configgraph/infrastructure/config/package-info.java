/**
 * Import resolution and configuration loading.
 *
 * <p>A root INI file names, in its {@code [import]} section, the sources to
 * merge. The {@link fr.lapetina.configgraph.infrastructure.config.ImportResolver}
 * loads them in order into a single section store, then substitutes
 * {@code ${section:option}} placeholders against the merged result.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.configgraph.infrastructure.config.ImportManifest} - Ordered import entries</li>
 *   <li>{@link fr.lapetina.configgraph.infrastructure.config.ImportResolver} - Merge and substitution</li>
 *   <li>{@link fr.lapetina.configgraph.infrastructure.config.Substitutor} - Placeholder expansion</li>
 *   <li>{@link fr.lapetina.configgraph.infrastructure.config.ConditionalTreeRewriter} - Conditional YAML</li>
 *   <li>{@link fr.lapetina.configgraph.infrastructure.config.ConfigLoader} - Root file loading and watching</li>
 *   <li>{@link fr.lapetina.configgraph.infrastructure.config.ResolverSettings} - Settings of the resolver itself</li>
 * </ul>
 *
 * <h2>Hot-Reload</h2>
 * <p>When the root file changes, a fresh store is resolved and listeners are
 * notified. Live instance graphs are never patched; they are rebuilt.
 */
package fr.lapetina.configgraph.infrastructure.config;
