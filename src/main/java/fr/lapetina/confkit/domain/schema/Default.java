package fr.lapetina.confkit.domain.schema;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Raw text used when the document has no value for the component.
 *
 * The text is converted with the {@link fr.lapetina.confkit.domain.resolve.DefaultRegistry}
 * parser registered for the component type.
 *
 * <pre>{@code
 * record Server(@Default("8080") int port) {}
 * }</pre>
 */
@Target({ElementType.RECORD_COMPONENT, ElementType.FIELD})
@Retention(RetentionPolicy.RUNTIME)
public @interface Default {
    String value();
}
