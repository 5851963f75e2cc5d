/**
 * File system and classpath access for configuration documents.
 */
package fr.lapetina.confkit.infrastructure.io;
