/**
 * Readers turning one configuration source into sections: INI, YAML, JSON,
 * inline strings and the process environment.
 */
package fr.lapetina.configgraph.infrastructure.source;
