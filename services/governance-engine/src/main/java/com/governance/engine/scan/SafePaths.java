package com.governance.engine.scan;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Guards project-root resolution and keeps relative paths inside the root.
 */
public final class SafePaths {

    private SafePaths() {
    }

    /**
     * Resolves a caller supplied project path to an absolute, normalized directory.
     *
     * @throws IllegalArgumentException when the path is blank or not an existing directory
     */
    public static Path projectRoot(String path) {
        if (path == null || path.isBlank()) {
            throw new IllegalArgumentException("Project path is required");
        }
        Path root = Path.of(path).toAbsolutePath().normalize();
        if (!Files.isDirectory(root)) {
            throw new IllegalArgumentException("Project path is not a directory: " + root);
        }
        return root;
    }

    /**
     * Resolves {@code relative} against {@code root}.
     *
     * @throws IllegalArgumentException on traversal outside the root
     */
    public static Path within(Path root, String relative) {
        Path base = root.toAbsolutePath().normalize();
        Path resolved = base.resolve(relative).normalize();
        if (!resolved.startsWith(base)) {
            throw new IllegalArgumentException("Path traversal detected: " + relative + " is outside " + base);
        }
        return resolved;
    }

    /** Root-relative path with forward slashes. */
    public static String relativize(Path root, Path file) {
        return root.relativize(file).toString().replace('\\', '/');
    }
}
