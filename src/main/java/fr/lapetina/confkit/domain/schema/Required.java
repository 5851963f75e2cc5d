package fr.lapetina.confkit.domain.schema;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a component as required.
 *
 * A missing or blank value fails the load. With {@code soft = true} the absence is only reported
 * as a warning and the component is left empty.
 */
@Target({ElementType.RECORD_COMPONENT, ElementType.FIELD})
@Retention(RetentionPolicy.RUNTIME)
public @interface Required {
    boolean soft() default false;
}
