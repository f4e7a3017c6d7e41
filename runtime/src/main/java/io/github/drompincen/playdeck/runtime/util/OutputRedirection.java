package io.github.drompincen.playdeck.runtime.util;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.EnumMap;
import java.util.Map;

/**
 * Points {@code System.out} and/or {@code System.err} at an in-memory buffer until closed,
 * or feeds {@code System.in} from a fixed string.
 *
 * <pre>{@code
 * try (OutputRedirection out = OutputRedirection.redirectStdout()) {
 *     legacyReport.print();
 *     return out.captured();
 * }
 * }</pre>
 *
 * The standard streams are JVM-global; do not nest redirections across threads.
 */
public final class OutputRedirection implements AutoCloseable {

    public enum Stream { STDOUT, STDERR }

    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
    private final Map<Stream, PrintStream> previous = new EnumMap<>(Stream.class);
    private InputStream previousIn;

    private OutputRedirection(Stream... streams) {
        PrintStream target = new PrintStream(buffer, true, StandardCharsets.UTF_8);
        for (Stream stream : streams) {
            switch (stream) {
                case STDOUT -> {
                    previous.put(stream, System.out);
                    System.setOut(target);
                }
                case STDERR -> {
                    previous.put(stream, System.err);
                    System.setErr(target);
                }
            }
        }
    }

    public static OutputRedirection redirectStdout() {
        return new OutputRedirection(Stream.STDOUT);
    }

    public static OutputRedirection redirectStderr() {
        return new OutputRedirection(Stream.STDERR);
    }

    public static OutputRedirection redirectStdany() {
        return new OutputRedirection(Stream.STDOUT, Stream.STDERR);
    }

    /** Serves {@code input} as {@code System.in}; nothing is captured. */
    public static OutputRedirection redirectStdin(String input) {
        OutputRedirection redirection = new OutputRedirection();
        redirection.previousIn = System.in;
        System.setIn(new ByteArrayInputStream(input.getBytes(StandardCharsets.UTF_8)));
        return redirection;
    }

    public String captured() {
        return buffer.toString(StandardCharsets.UTF_8);
    }

    @Override
    public void close() {
        PrintStream out = previous.remove(Stream.STDOUT);
        if (out != null) {
            System.setOut(out);
        }
        PrintStream err = previous.remove(Stream.STDERR);
        if (err != null) {
            System.setErr(err);
        }
        if (previousIn != null) {
            System.setIn(previousIn);
            previousIn = null;
        }
    }
}
