package com.oftest.engine;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Inherited;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Optional metadata for an {@link OfTest} class.
 */
@Documented
@Inherited
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.TYPE)
public @interface TestInfo {

    /**
     * Declared priority. Non-negative, or {@link TestDescriptor#SKIP} to keep the
     * test out of default runs.
     */
    int priority() default TestDescriptor.DEFAULT_PRIORITY;

    /**
     * Short one-line description shown in listings and reports.
     */
    String description() default "";
}
