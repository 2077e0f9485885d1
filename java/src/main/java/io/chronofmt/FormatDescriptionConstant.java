package io.chronofmt;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a {@code static final String} constant holding a format description.
 *
 * <p>With {@code io.chronofmt.processor.FormatDescriptionProcessor} on the processor path, an
 * invalid description fails the build:
 *
 * <pre>
 * &#64;FormatDescriptionConstant(version = 2)
 * static final String ISO_DATE = "[year]-[month]-[day]";
 * </pre>
 */
@Documented
@Retention(RetentionPolicy.SOURCE)
@Target(ElementType.FIELD)
public @interface FormatDescriptionConstant {
  /**
   * The grammar version used when the description has no {@code version} directive.
   *
   * @return 1 or 2
   */
  int version() default 1;
}
