/**
 * Version-driven reconciliation of an on-disk configuration file with its bundled default.
 *
 * <p>{@link fr.lapetina.confkit.infrastructure.update.UpdateCoordinator} reads both documents
 * with the file's {@link fr.lapetina.confkit.infrastructure.format.ConfigFormat}, compares their
 * root {@code version} keys and, when the file is older, merges and rewrites it. The write goes
 * through a temporary file and a rename, so a crash never leaves a truncated file.
 */
package fr.lapetina.confkit.infrastructure.update;
