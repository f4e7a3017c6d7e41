package io.github.drompincen.playdeck.runtime.error;

@FunctionalInterface
public interface ThrowingRunnable {
    void run() throws Exception;
}
