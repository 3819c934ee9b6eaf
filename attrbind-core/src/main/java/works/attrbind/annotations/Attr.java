package works.attrbind.annotations;

import java.lang.annotation.Retention;
import java.lang.annotation.Target;

import static java.lang.annotation.ElementType.RECORD_COMPONENT;
import static java.lang.annotation.RetentionPolicy.RUNTIME;

/**
 * Names the schema attribute that corresponds to a record component.
 * <p>
 * Every component of a record that is converted to or from an object value
 * must carry either this annotation or {@link Embedded}.
 * Use {@code @Attr(Attr.IGNORE)} for components that are deliberately
 * not part of the schema; they are left at their zero value when decoding.
 */
@Retention(RUNTIME)
@Target(RECORD_COMPONENT)
public @interface Attr {
	/**
	 * The reserved name meaning "this component is not an attribute".
	 */
	String IGNORE = "-";

	String value();
}
