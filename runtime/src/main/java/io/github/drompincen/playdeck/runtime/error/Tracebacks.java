package io.github.drompincen.playdeck.runtime.error;

import java.io.PrintWriter;
import java.io.StringWriter;

public final class Tracebacks {

    private Tracebacks() {}

    public static String format(Throwable throwable) {
        StringWriter sw = new StringWriter();
        try (PrintWriter pw = new PrintWriter(sw)) {
            throwable.printStackTrace(pw);
        }
        return sw.toString();
    }
}
