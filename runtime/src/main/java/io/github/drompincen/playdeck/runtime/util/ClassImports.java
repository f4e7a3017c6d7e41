package io.github.drompincen.playdeck.runtime.util;

import org.springframework.util.ClassUtils;

public final class ClassImports {

    private ClassImports() {}

    /**
     * Loads a class from its fully-qualified dotted name.
     *
     * @throws ClassNotFoundException if the class cannot be found or linked
     */
    public static Class<?> importClass(String path) throws ClassNotFoundException {
        try {
            return ClassUtils.forName(path, ClassUtils.getDefaultClassLoader());
        } catch (LinkageError e) {
            throw new ClassNotFoundException(path, e);
        }
    }
}
