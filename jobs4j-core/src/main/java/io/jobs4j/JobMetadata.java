package io.jobs4j;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Inherited;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Class-level job metadata.
 *
 * <p>{@link #uuid()} makes a job class schedulable: schedule records reference job classes by
 * this value so they survive a process restart. Output names not declared here are rejected by
 * the output field and queue methods of {@link ManagedJob}.
 */
@Documented
@Inherited
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.TYPE)
public @interface JobMetadata {

    String uuid() default "";

    /**
     * At most one live instance of the class per manager.
     */
    boolean singleton() default false;

    String[] outputFields() default {};

    String[] outputQueues() default {};
}
