package works.attrbind.annotations;

import java.lang.annotation.Retention;
import java.lang.annotation.Target;

import static java.lang.annotation.ElementType.RECORD_COMPONENT;
import static java.lang.annotation.RetentionPolicy.RUNTIME;

/**
 * Marks a record component whose own {@link Attr}-annotated components
 * are promoted into the enclosing record's attributes.
 * The component's type must itself be a record.
 */
@Retention(RUNTIME)
@Target(RECORD_COMPONENT)
public @interface Embedded {
}
