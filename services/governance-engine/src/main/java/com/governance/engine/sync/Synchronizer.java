package com.governance.engine.sync;

import com.governance.engine.config.GovernanceConfig;
import com.governance.engine.config.SemanticVersions;
import com.governance.engine.config.VersionManifest;
import com.governance.engine.events.GovernanceEvents;
import com.governance.engine.events.LogSanitizer;
import com.governance.engine.events.TaskProgress;
import com.governance.engine.model.RepositoryStatus;
import com.governance.engine.model.Resolution;
import com.governance.engine.model.SyncOptions;
import com.governance.engine.model.SyncResult;
import com.governance.engine.model.SyncValidation;
import com.governance.engine.model.VersionConflict;
import com.governance.engine.model.VersionReport;
import com.governance.engine.scan.FileScanner;
import com.governance.engine.scan.SafePaths;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Detects and reconciles drift between the version manifest and version strings in
 * project text. Every file is analyzed before anything is written.
 */
public class Synchronizer {

    private static final Logger log = LoggerFactory.getLogger(Synchronizer.class);

    private final FileScanner scanner;
    private final RepositoryStatusProvider repositoryStatus;
    private final GovernanceEvents events;

    public Synchronizer(FileScanner scanner, RepositoryStatusProvider repositoryStatus, GovernanceEvents events) {
        this.scanner = scanner;
        this.repositoryStatus = repositoryStatus;
        this.events = events;
    }

    /**
     * Read-only drift check.
     */
    public SyncValidation validateSync(Path root, GovernanceConfig config) {
        List<VersionConflict> conflicts = analyze(root, scanner.scan(root), config.manifest());
        List<String> issues = conflicts.stream().map(VersionConflict::describe).toList();
        return new SyncValidation(conflicts.isEmpty(), issues, conflicts);
    }

    public SyncResult sync(Path root, GovernanceConfig config, SyncOptions options) {
        TaskProgress progress = TaskProgress.start(events, "Version synchronization");

        if (!options.ignoreRemote()) {
            progress.update("Checking repository status");
            repositoryStatus(root).ifPresent(status -> {
                if (status.hasRemoteUpdates()) {
                    events.notice("Remote updates available: local branch is " + status.commitsBehind()
                            + " commits behind " + status.remoteBranch());
                }
            });
        }

        progress.update("Scanning project files");
        List<String> files = scanner.scan(root);

        progress.update("Analyzing version references");
        List<VersionConflict> conflicts = analyze(root, files, config.manifest());

        if (!conflicts.isEmpty() && !options.force()) {
            progress.complete("found " + conflicts.size() + " conflicts - use force to resolve");
            return new SyncResult(0, files.size(), conflicts);
        }

        progress.update(options.dryRun() ? "Previewing version updates" : "Synchronizing versions");
        Map<String, List<VersionConflict>> byFile = new LinkedHashMap<>();
        for (VersionConflict conflict : conflicts) {
            if (conflict.resolution() == Resolution.UPDATE) {
                byFile.computeIfAbsent(conflict.file(), f -> new ArrayList<>()).add(conflict);
            }
        }

        int updated = 0;
        int rewrittenFiles = 0;
        List<VersionConflict> failed = new ArrayList<>();
        for (Map.Entry<String, List<VersionConflict>> entry : byFile.entrySet()) {
            try {
                applyToFile(root, entry.getKey(), entry.getValue(), options.dryRun());
                updated += entry.getValue().size();
                rewrittenFiles++;
            } catch (IOException | IllegalArgumentException e) {
                events.warning("Failed to update " + entry.getKey() + ": " + LogSanitizer.sanitize(e));
                failed.addAll(entry.getValue());
            }
        }

        progress.complete((options.dryRun() ? "would synchronize " : "synchronized ") + updated + " references");
        return new SyncResult(updated, files.size() - rewrittenFiles, Collections.unmodifiableList(failed));
    }

    public VersionReport versionReport(Path root, GovernanceConfig config) {
        List<String> files = scanner.scan(root);
        List<VersionConflict> conflicts = analyze(root, files, config.manifest());

        VersionManifest manifest = config.manifest();
        Map<String, String> components = new LinkedHashMap<>();
        manifest.components().forEach((name, v) -> components.put(name, v.current()));
        Map<String, Object> versions = new LinkedHashMap<>();
        versions.put("protocol", manifest.protocolVersion());
        versions.put("governance", manifest.governanceVersion());
        versions.put("components", components);

        return new VersionReport(Instant.now(), versions, files.size(), conflicts,
                conflicts.isEmpty(), Math.max(0, 100 - conflicts.size() * 10));
    }

    public Optional<RepositoryStatus> repositoryStatus(Path root) {
        return repositoryStatus.getRepositoryStatus(root);
    }

    List<VersionConflict> analyze(Path root, List<String> files, VersionManifest manifest) {
        List<VersionConflict> conflicts = new ArrayList<>();
        for (String file : files) {
            try {
                String content = Files.readString(SafePaths.within(root, file), StandardCharsets.UTF_8);
                conflicts.addAll(conflictsIn(content, file, manifest));
            } catch (IOException | IllegalArgumentException e) {
                log.debug("Skipping file {}: {}", file, LogSanitizer.sanitize(e));
            }
        }
        return Collections.unmodifiableList(conflicts);
    }

    /**
     * Conflicts in one file's text. Each pattern match is resolved on its own, so two
     * patterns hitting the same token can yield two conflicts.
     */
    static List<VersionConflict> conflictsIn(String content, String file, VersionManifest manifest) {
        List<VersionConflict> conflicts = new ArrayList<>();
        for (String line : content.split("\n", -1)) {
            for (Pattern pattern : VersionPatterns.ORDERED) {
                Matcher m = pattern.matcher(line);
                while (m.find()) {
                    String match = m.group();
                    String found = SemanticVersions.extract(match);
                    if (found == null) {
                        continue;
                    }
                    String expected = ExpectedVersionResolver.expectedVersion(match, manifest);
                    if (expected != null && !found.equals(expected)) {
                        conflicts.add(VersionConflict.update(file, found, expected));
                    }
                }
            }
        }
        return conflicts;
    }

    private void applyToFile(Path root, String file, List<VersionConflict> conflicts, boolean dryRun) throws IOException {
        Path path = SafePaths.within(root, file);
        String content = replaceVersions(Files.readString(path, StandardCharsets.UTF_8), conflicts);
        if (!dryRun) {
            Files.writeString(path, content, StandardCharsets.UTF_8);
            log.debug("Updated {} ({} references)", file, conflicts.size());
        }
    }

    /**
     * Replaces every stale version token in one pass over the original text, so a
     * replacement never feeds into another. A token claimed by several conflicts takes
     * the target of the first.
     */
    static String replaceVersions(String content, List<VersionConflict> conflicts) {
        Map<String, String> targets = new LinkedHashMap<>();
        for (VersionConflict conflict : conflicts) {
            String previous = targets.putIfAbsent(conflict.currentVersion(), conflict.targetVersion());
            if (previous != null && !previous.equals(conflict.targetVersion())) {
                log.debug("{} maps to both {} and {}, using {}", conflict.currentVersion(), previous,
                        conflict.targetVersion(), previous);
            }
        }
        if (targets.isEmpty()) {
            return content;
        }
        String alternation = targets.keySet().stream()
                .sorted(Comparator.comparingInt(String::length).reversed())
                .map(Pattern::quote)
                .collect(Collectors.joining("|"));
        return Pattern.compile(alternation).matcher(content)
                .replaceAll(m -> Matcher.quoteReplacement(targets.get(m.group())));
    }
}
