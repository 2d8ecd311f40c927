package io.jobs4j;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a job method other jobs may invoke through {@link JobProxy#runPublicMethod(String, Object...)}.
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.METHOD)
public @interface PublicJobMethod {

    /**
     * Public name of the method, the Java method name if empty.
     */
    String value() default "";
}
