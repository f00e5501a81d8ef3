/**
 * Resolution failure taxonomy.
 *
 * <p>All exceptions are unchecked and extend
 * {@link fr.lapetina.configgraph.domain.exception.ConfigGraphException}.
 * Only {@link fr.lapetina.configgraph.domain.exception.MalformedDirectiveException}
 * and skipped optional imports are recovered locally; everything else reaches
 * the caller of {@code resolve}.
 */
package fr.lapetina.configgraph.domain.exception;
