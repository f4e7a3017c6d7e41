package io.github.drompincen.playdeck.runtime.error;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RaiseContextTest {

    @Test
    void returnsValueWhenBlockSucceeds() {
        Optional<String> result = RaiseContext.of().execute(() -> "ok");

        assertThat(result).contains("ok");
    }

    @Test
    void swallowsEverythingWithoutPropagateTypes() {
        Optional<String> result = RaiseContext.of().execute(() -> {
            throw new IllegalStateException("ignored");
        });

        assertThat(result).isEmpty();
    }

    @Test
    void runReportsWhetherBlockCompleted() {
        RaiseContext context = RaiseContext.of().verbose();

        assertThat(context.run(() -> {})).isTrue();
        assertThat(context.run(() -> { throw new IOException("disk"); })).isFalse();
    }

    @Test
    void rethrowsPropagatedRuntimeExceptionAsIs() {
        IllegalArgumentException boom = new IllegalArgumentException("bad id");

        assertThatThrownBy(() -> RaiseContext.of(IllegalArgumentException.class).run(() -> { throw boom; }))
                .isSameAs(boom);
    }

    @Test
    void propagatesSubclassesOfConfiguredType() {
        assertThatThrownBy(() -> RaiseContext.of(RuntimeException.class)
                .run(() -> { throw new UnsupportedOperationException("nope"); }))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void wrapsPropagatedCheckedException() {
        IOException io = new IOException("disk full");

        assertThatThrownBy(() -> RaiseContext.of(IOException.class).run(() -> { throw io; }))
                .isInstanceOf(PMException.class)
                .hasMessage("disk full")
                .hasCause(io);
    }

    @Test
    void nonMatchingTypesAreSwallowed() {
        boolean completed = RaiseContext.of(IllegalArgumentException.class)
                .run(() -> { throw new IllegalStateException("other"); });

        assertThat(completed).isFalse();
    }

    @Test
    void errorsAreNeverSwallowed() {
        assertThatThrownBy(() -> RaiseContext.of().run(() -> { throw new AssertionError("fatal"); }))
                .isInstanceOf(AssertionError.class);
    }

    @Test
    void verboseFlag() {
        assertThat(RaiseContext.of().isVerbose()).isFalse();
        assertThat(RaiseContext.of().verbose().isVerbose()).isTrue();
        assertThat(RaiseContext.of().verbose(false).isVerbose()).isFalse();
    }
}
