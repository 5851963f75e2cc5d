/**
 * Field resolution: from a parsed key/value document to a typed configuration record.
 *
 * <p>{@link fr.lapetina.confkit.domain.resolve.FieldResolver} walks the rules of a
 * {@link fr.lapetina.confkit.domain.schema.ConfigSchema} and applies lookup, loading, defaults,
 * required and range checks, then constructs the record and runs validators.
 *
 * <h2>Failure model</h2>
 * <ul>
 *   <li>Hard failures (missing required field, range violation, rejected value) throw a
 *       {@link fr.lapetina.confkit.exception.ConfigurationException} subtype and no object is built.</li>
 *   <li>Soft failures become {@link fr.lapetina.confkit.domain.resolve.SoftWarning}s returned in
 *       the {@link fr.lapetina.confkit.domain.resolve.Resolution} and logged at WARN.</li>
 * </ul>
 *
 * <h2>Defaults</h2>
 * <p>Default values are declared as text and parsed through a
 * {@link fr.lapetina.confkit.domain.resolve.DefaultRegistry}. Each resolver owns its registry;
 * applications add parsers for their own types with
 * {@link fr.lapetina.confkit.domain.resolve.DefaultRegistry#register}.
 */
package fr.lapetina.confkit.domain.resolve;
