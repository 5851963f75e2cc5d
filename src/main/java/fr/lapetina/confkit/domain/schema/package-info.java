/**
 * Declaring what a configuration record expects.
 *
 * <p>A {@link fr.lapetina.confkit.domain.schema.ConfigSchema} lists one
 * {@link fr.lapetina.confkit.domain.schema.FieldRule} per record component. Rules come from the
 * component annotations ({@link fr.lapetina.confkit.domain.schema.Key},
 * {@link fr.lapetina.confkit.domain.schema.Required}, {@link fr.lapetina.confkit.domain.schema.Default},
 * {@link fr.lapetina.confkit.domain.schema.Range}) and can be refined with
 * {@link fr.lapetina.confkit.domain.schema.ConfigSchema#builder(Class)}, which is also where typed
 * loaders, validators and missing-value handlers are attached.
 */
package fr.lapetina.confkit.domain.schema;
