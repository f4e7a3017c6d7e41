package io.github.drompincen.playdeck.runtime.error;

import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

class ExceptionWithTracebackTest {

    @Test
    void returnsResultUntouched() {
        assertThat(ExceptionWithTraceback.execute(() -> 42)).isEqualTo(42);
    }

    @Test
    void reraisesPlatformExceptionAsSameInstance() {
        PMException original = new PMException("handler failed");

        PMException thrown = catchThrowableOfType(
                () -> ExceptionWithTraceback.run(() -> { throw original; }), PMException.class);

        assertThat(thrown).isSameAs(original);
        assertThat(thrown.getTraceback()).contains("PMException: handler failed");
    }

    @Test
    void wrapsOtherExceptionsKeepingCause() {
        IOException io = new IOException("no inventory");

        PMException thrown = catchThrowableOfType(
                () -> ExceptionWithTraceback.run(() -> { throw io; }), PMException.class);

        assertThat(thrown).hasMessage("no inventory").hasCause(io);
        assertThat(thrown.getTraceback())
                .contains("java.io.IOException: no inventory")
                .contains(ExceptionWithTracebackTest.class.getName());
    }

    @Test
    void errorsPassThrough() {
        assertThatThrownBy(() -> ExceptionWithTraceback.run(() -> { throw new StackOverflowError(); }))
                .isInstanceOf(StackOverflowError.class);
    }

    @Test
    void tracebackIncludesCauseChain() {
        Exception nested = new IllegalStateException("outer", new IOException("inner"));

        assertThat(Tracebacks.format(nested))
                .contains("IllegalStateException: outer")
                .contains("Caused by: java.io.IOException: inner");
    }
}
