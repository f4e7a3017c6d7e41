package io.github.drompincen.playdeck.runtime.error;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Method form of {@link RaiseContext}. A swallowed exception makes the method return
 * {@code null}, so annotate only void methods or methods returning a reference type.
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.METHOD)
public @interface SuppressErrors {

    /** Exception types that are rethrown instead of swallowed. */
    Class<? extends Throwable>[] propagate() default {};

    boolean verbose() default false;
}
