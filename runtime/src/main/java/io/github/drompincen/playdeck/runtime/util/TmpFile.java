package io.github.drompincen.playdeck.runtime.util;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Named temporary file that is flushed after every write and deleted on close.
 */
public class TmpFile implements AutoCloseable {

    private final Path path;
    private final BufferedWriter writer;
    private boolean closed;

    private TmpFile(Path path) throws IOException {
        this.path = path;
        this.writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8);
    }

    public static TmpFile create() throws IOException {
        return create("playdeck-", ".tmp");
    }

    public static TmpFile create(String prefix, String suffix) throws IOException {
        return new TmpFile(Files.createTempFile(prefix, suffix));
    }

    /**
     * @return number of characters written
     */
    public int write(String text) throws IOException {
        writer.write(text);
        writer.flush();
        return text.length();
    }

    public Path path() {
        return path;
    }

    public String name() {
        return path.toAbsolutePath().toString();
    }

    public String read() throws IOException {
        return Files.readString(path, StandardCharsets.UTF_8);
    }

    public boolean isClosed() {
        return closed;
    }

    @Override
    public void close() throws IOException {
        if (closed) {
            return;
        }
        closed = true;
        try {
            writer.close();
        } finally {
            Files.deleteIfExists(path);
        }
    }
}
