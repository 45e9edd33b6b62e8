package typegraph;

import java.lang.annotation.Documented;
import java.lang.annotation.Retention;
import java.lang.annotation.Target;

import static java.lang.annotation.ElementType.CONSTRUCTOR;
import static java.lang.annotation.ElementType.METHOD;
import static java.lang.annotation.ElementType.PACKAGE;
import static java.lang.annotation.ElementType.TYPE;
import static java.lang.annotation.RetentionPolicy.RUNTIME;

/**
 * This represents code that callers are expected to use directly.
 */
@Retention(RUNTIME)
@Target(value = {CONSTRUCTOR, METHOD, TYPE, PACKAGE})
@Documented
public @interface PublicApi {
}
