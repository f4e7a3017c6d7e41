package io.github.drompincen.playdeck.runtime.util;

import java.net.URISyntaxException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.security.CodeSource;

public final class ProjectPaths {

    private ProjectPaths() {}

    /**
     * Installation root: two levels above the location the runtime classes were loaded
     * from (the jar's directory's parent, or {@code target}'s parent in a build tree).
     * Falls back to the working directory.
     */
    public static Path projectPath() {
        Path codeSource = codeSourceOf(ProjectPaths.class);
        if (codeSource == null) {
            return Paths.get("").toAbsolutePath();
        }
        Path parent = codeSource.getParent();
        Path root = parent != null ? parent.getParent() : null;
        return root != null ? root : codeSource;
    }

    static Path codeSourceOf(Class<?> type) {
        CodeSource source = type.getProtectionDomain().getCodeSource();
        if (source == null || source.getLocation() == null) {
            return null;
        }
        try {
            return Paths.get(source.getLocation().toURI()).toAbsolutePath();
        } catch (URISyntaxException | IllegalArgumentException e) {
            return null;
        }
    }
}
