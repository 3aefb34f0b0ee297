package com.governance.engine.scan;

import com.governance.engine.events.LogSanitizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;

/**
 * Enumerates documentation and config files under a project root.
 * Unreadable entries are skipped; callers must tolerate a partial result.
 */
public class FileScanner {

    private static final Logger log = LoggerFactory.getLogger(FileScanner.class);

    static final Set<String> EXTENSIONS = Set.of(".md", ".json", ".yaml", ".yml");
    static final Set<String> EXCLUDED_DIRECTORIES = Set.of("node_modules", ".git", "dist", "build", "target", ".tmp");

    /**
     * @return root-relative paths (forward slashes), sorted and without duplicates
     */
    public List<String> scan(Path root) {
        TreeSet<String> files = new TreeSet<>();
        try {
            Files.walkFileTree(root, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                    if (!dir.equals(root) && EXCLUDED_DIRECTORIES.contains(dir.getFileName().toString())) {
                        return FileVisitResult.SKIP_SUBTREE;
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                    if (attrs.isRegularFile() && isCandidate(file)) {
                        files.add(SafePaths.relativize(root, file));
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFileFailed(Path file, IOException exc) {
                    log.debug("Skipping unreadable entry {}: {}", file, LogSanitizer.sanitize(exc));
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (IOException e) {
            log.debug("Scan of {} stopped early: {}", root, LogSanitizer.sanitize(e));
        }
        return new ArrayList<>(files);
    }

    static boolean isCandidate(Path file) {
        String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
        int dot = name.lastIndexOf('.');
        return dot >= 0 && EXTENSIONS.contains(name.substring(dot));
    }
}
