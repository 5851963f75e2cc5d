/**
 * Fatal configuration errors.
 *
 * <p>Every type here extends {@link fr.lapetina.confkit.exception.ConfigurationException} and
 * aborts the whole object construction: no partially populated configuration is ever returned.
 * Recoverable conditions are not exceptions; they are reported as
 * {@link fr.lapetina.confkit.domain.resolve.SoftWarning}s.
 */
package fr.lapetina.confkit.exception;
