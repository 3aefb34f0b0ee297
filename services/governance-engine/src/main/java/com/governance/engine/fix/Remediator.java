package com.governance.engine.fix;

import com.governance.engine.config.GovernanceConfigLoader;
import com.governance.engine.model.IssueFix;
import com.governance.engine.scan.SafePaths;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Performs the file-system remediations behind auto-fixable findings.
 * Every fix is independent: no transaction spans several of them.
 */
public class Remediator {

    public static final String ARCHIVE_DIR = "archive";
    public static final String README = "README.md";
    public static final String MANDATE = "sds/SBEP-MANDATE.md";
    public static final String INDEX = "sds/SBEP-INDEX.yaml";
    public static final String README_SECTION_PREFIX = "Missing recommended section in README.md: ## ";

    static final List<String> OBSOLETE_PATTERNS = List.of("*cheatsheet*.md", "*deprecated*.md", "*old*.md");

    private final GovernanceConfigLoader configLoader;

    public Remediator(GovernanceConfigLoader configLoader) {
        this.configLoader = configLoader;
    }

    /**
     * @param message the finding's message; some fixes read their target from it
     */
    public void apply(Path root, IssueFix fix, String message) throws AutoFixException {
        if (fix == null) {
            throw new AutoFixException("No auto-fix available for: " + message);
        }
        try {
            switch (fix) {
                case CREATE_ARCHIVE_DIRECTORY:
                    Files.createDirectories(root.resolve(ARCHIVE_DIR));
                    break;
                case ARCHIVE_OBSOLETE_FILES:
                    archiveObsoleteFiles(root);
                    break;
                case ADD_README_SECTION:
                    addReadmeSection(root, message);
                    break;
                case ADD_CROSS_REFERENCES:
                    addCrossReferences(root);
                    break;
                case RESTORE_MANIFEST:
                    restore(root, GovernanceConfigLoader.MANIFEST_FILE, configLoader.bundledManifest());
                    break;
                case RESTORE_SCHEMA:
                    restore(root, GovernanceConfigLoader.SCHEMA_FILE, configLoader.bundledSchema());
                    break;
                default:
                    throw new AutoFixException("No auto-fix available for: " + message);
            }
        } catch (IOException e) {
            throw new AutoFixException(fix + " failed: " + e.getMessage(), e);
        }
    }

    /**
     * Root-level files matching one obsolete pattern, sorted by name.
     */
    public static List<String> obsoleteMatches(Path root, String globPattern) throws IOException {
        PathMatcher matcher = FileSystems.getDefault().getPathMatcher("glob:" + globPattern);
        List<String> matches = new ArrayList<>();
        try (DirectoryStream<Path> entries = Files.newDirectoryStream(root)) {
            for (Path entry : entries) {
                if (Files.isRegularFile(entry) && matcher.matches(entry.getFileName())) {
                    matches.add(entry.getFileName().toString());
                }
            }
        }
        matches.sort(null);
        return matches;
    }

    public static List<String> obsoletePatterns() {
        return OBSOLETE_PATTERNS;
    }

    private void archiveObsoleteFiles(Path root) throws IOException {
        Path archive = Files.createDirectories(root.resolve(ARCHIVE_DIR));
        for (String pattern : OBSOLETE_PATTERNS) {
            for (String name : obsoleteMatches(root, pattern)) {
                Path target = archive.resolve(name);
                if (Files.exists(target)) {
                    throw new FileAlreadyExistsException(target.toString());
                }
                Files.move(root.resolve(name), target);
            }
        }
    }

    private void addReadmeSection(Path root, String message) throws IOException, AutoFixException {
        if (message == null || !message.startsWith(README_SECTION_PREFIX)) {
            throw new AutoFixException("Cannot determine README section from: " + message);
        }
        String section = message.substring(README_SECTION_PREFIX.length()).trim();
        Path readme = SafePaths.within(root, README);
        String content = Files.readString(readme, StandardCharsets.UTF_8);
        if (content.contains("## " + section)) {
            return;
        }
        String placeholder = "## " + section + "\n\n[Add " + section.toLowerCase(Locale.ROOT) + " details here]\n";
        if ("Overview".equals(section)) {
            content = placeholder + "\n" + content;
        } else {
            content = content + (content.endsWith("\n") ? "" : "\n") + "\n" + placeholder;
        }
        Files.writeString(readme, content, StandardCharsets.UTF_8);
    }

    private void addCrossReferences(Path root) throws IOException {
        Path mandate = SafePaths.within(root, MANDATE);
        Path index = SafePaths.within(root, INDEX);
        String mandateText = Files.readString(mandate, StandardCharsets.UTF_8);
        if (!mandateText.contains("SBEP-INDEX.yaml")) {
            Files.writeString(mandate, appendLine(mandateText, "See also: `sds/SBEP-INDEX.yaml`"), StandardCharsets.UTF_8);
        }
        String indexText = Files.readString(index, StandardCharsets.UTF_8);
        if (!indexText.contains("SBEP-MANDATE.md")) {
            Files.writeString(index, appendLine(indexText, "# See also: sds/SBEP-MANDATE.md"), StandardCharsets.UTF_8);
        }
    }

    private static String appendLine(String content, String line) {
        return content + (content.isEmpty() || content.endsWith("\n") ? "" : "\n") + "\n" + line + "\n";
    }

    private static void restore(Path root, String fileName, byte[] bundled) throws IOException {
        Path target = root.resolve(fileName);
        if (Files.exists(target)) {
            throw new FileAlreadyExistsException(target.toString());
        }
        Files.write(target, bundled);
    }
}
