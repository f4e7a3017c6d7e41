package io.github.drompincen.playdeck.runtime.error;

/**
 * Re-raises anything a block throws with its formatted stack trace attached.
 * A {@link PMException} is re-raised as the same instance; any other exception is
 * wrapped in a {@code PMException} whose cause is the original.
 */
public final class ExceptionWithTraceback {

    private ExceptionWithTraceback() {}

    public static <T> T execute(ThrowingSupplier<T> block) {
        try {
            return block.get();
        } catch (Exception e) {
            throw attach(e);
        }
    }

    public static void run(ThrowingRunnable block) {
        execute(() -> {
            block.run();
            return null;
        });
    }

    public static PMException attach(Throwable throwable) {
        String traceback = Tracebacks.format(throwable);
        PMException pm = throwable instanceof PMException existing
                ? existing
                : new PMException(throwable.getMessage(), throwable);
        pm.setTraceback(traceback);
        return pm;
    }
}
