/**
 * Micrometer instrumentation of loads, reloads, file updates and soft warnings.
 */
package fr.lapetina.confkit.infrastructure.metrics;
