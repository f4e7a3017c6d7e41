package io.github.drompincen.playdeck.runtime.error;

@FunctionalInterface
public interface ThrowingSupplier<T> {
    T get() throws Exception;
}
