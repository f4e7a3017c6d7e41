package io.github.drompincen.playdeck.runtime.task;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TaskArgumentsTest {

    @Test
    void positionalAndKeywordAccess() {
        TaskArguments arguments = TaskArguments.of("task-1", 3).withKwarg("sync", true);

        assertThat(arguments.stringArg(0)).isEqualTo("task-1");
        assertThat(arguments.arg(1)).isEqualTo(3);
        assertThat(arguments.kwarg("sync")).isEqualTo(true);
        assertThat(arguments.kwarg("missing")).isNull();
    }

    @Test
    void missingPositionalArgumentIsRejected() {
        assertThatThrownBy(() -> TaskArguments.empty().arg(0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("0");
    }

    @Test
    void withKwargDoesNotMutateOriginal() {
        TaskArguments original = TaskArguments.of("a");

        original.withKwarg("k", "v");

        assertThat(original.kwargs()).isEmpty();
    }

    @Test
    void nullPositionalValuesAreKept() {
        TaskArguments arguments = TaskArguments.of("a", null);

        assertThat(arguments.args()).hasSize(2);
        assertThat(arguments.stringArg(1)).isNull();
    }
}
