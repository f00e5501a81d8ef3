/**
 * Option value classification.
 *
 * <p>The {@link fr.lapetina.configgraph.domain.directive.DirectiveParser}
 * turns raw strings into integers, reals, booleans, collections, paths,
 * evaluated expressions or instances. Prefixed values use the grammar
 * {@code <prefix>[(<params>)]:<payload>}; each prefix is served by a
 * {@link fr.lapetina.configgraph.domain.directive.DirectiveHandler}.
 */
package fr.lapetina.configgraph.domain.directive;
