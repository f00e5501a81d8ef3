/**
 * Micrometer metrics for instance resolution, exposed in Prometheus format.
 */
package fr.lapetina.configgraph.infrastructure.metrics;
