package io.github.drompincen.playdeck.runtime.lock;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Runs the method while holding a {@link Lock}.
 *
 * <p>The key is {@link #key()} when set, otherwise the value of the parameter annotated
 * with {@link LockKey}. A method called with a null key runs without a lock.
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.METHOD)
public @interface ServiceLock {

    String DEFAULT_ERROR = "Service locked. Wait until the end.";

    /** Fixed lock key, e.g. {@link Lock#GLOBAL}. */
    String key() default "";

    /** Acquisition window in seconds. */
    long repeat() default 1;

    String errorMessage() default DEFAULT_ERROR;
}
