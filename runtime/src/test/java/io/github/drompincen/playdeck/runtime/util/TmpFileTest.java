package io.github.drompincen.playdeck.runtime.util;

import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class TmpFileTest {

    @Test
    void writeIsVisibleImmediately() throws Exception {
        try (TmpFile file = TmpFile.create("inv-", ".ini")) {
            int written = file.write("[all]\n");

            assertThat(written).isEqualTo(6);
            assertThat(Files.readString(file.path())).isEqualTo("[all]\n");
            assertThat(file.read()).isEqualTo("[all]\n");
            assertThat(file.name()).endsWith(".ini");
        }
    }

    @Test
    void closeDeletesFile() throws Exception {
        TmpFile file = TmpFile.create();
        Path path = file.path();
        assertThat(path).exists();

        file.close();
        file.close();

        assertThat(path).doesNotExist();
        assertThat(file.isClosed()).isTrue();
    }
}
