package io.github.drompincen.playdeck.runtime.error;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Runs a block and swallows whatever it throws, except the exception types listed as
 * "propagate". With no propagate types every {@link Exception} is swallowed.
 *
 * <pre>{@code
 * RaiseContext.of(AcquireLockException.class).verbose()
 *         .run(() -> queue.submit(name, args));
 * }</pre>
 *
 * Errors always propagate. A checked exception that must propagate is rethrown wrapped
 * in a {@link PMException}.
 */
public final class RaiseContext {

    private static final Logger log = LoggerFactory.getLogger(RaiseContext.class);

    private final List<Class<? extends Throwable>> propagate;
    private final boolean verbose;

    private RaiseContext(List<Class<? extends Throwable>> propagate, boolean verbose) {
        this.propagate = propagate;
        this.verbose = verbose;
    }

    @SafeVarargs
    public static RaiseContext of(Class<? extends Throwable>... propagate) {
        return new RaiseContext(List.of(propagate), false);
    }

    public RaiseContext verbose() {
        return new RaiseContext(propagate, true);
    }

    public RaiseContext verbose(boolean verbose) {
        return new RaiseContext(propagate, verbose);
    }

    public boolean isVerbose() {
        return verbose;
    }

    /**
     * @return the block's result, or empty when the block returned null or its exception
     *         was swallowed
     */
    public <T> Optional<T> execute(ThrowingSupplier<T> block) {
        try {
            return Optional.ofNullable(block.get());
        } catch (Exception e) {
            handle(e);
            return Optional.empty();
        }
    }

    /**
     * @return {@code true} when the block completed, {@code false} when its exception was swallowed
     */
    public boolean run(ThrowingRunnable block) {
        try {
            block.run();
            return true;
        } catch (Exception e) {
            handle(e);
            return false;
        }
    }

    public boolean propagates(Throwable throwable) {
        for (Class<? extends Throwable> type : propagate) {
            if (type.isInstance(throwable)) {
                return true;
            }
        }
        return false;
    }

    private void handle(Exception e) {
        if (propagates(e)) {
            if (e instanceof RuntimeException re) {
                throw re;
            }
            throw new PMException(e.getMessage(), e);
        }
        if (verbose) {
            log.warn("Suppressed {}: {}", e.getClass().getSimpleName(), e.getMessage(), e);
        } else {
            log.debug("Suppressed {}: {}", e.getClass().getSimpleName(), e.getMessage());
        }
    }
}
