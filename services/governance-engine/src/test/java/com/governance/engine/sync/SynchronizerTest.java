package com.governance.engine.sync;

import com.governance.engine.config.GovernanceConfig;
import com.governance.engine.config.GovernanceConfigLoader;
import com.governance.engine.config.JsonMappers;
import com.governance.engine.model.RepositoryStatus;
import com.governance.engine.model.SyncOptions;
import com.governance.engine.model.SyncResult;
import com.governance.engine.model.SyncValidation;
import com.governance.engine.model.VersionConflict;
import com.governance.engine.model.VersionReport;
import com.governance.engine.scan.FileScanner;
import com.governance.engine.support.ProjectFixture;
import com.governance.engine.support.RecordingEvents;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

class SynchronizerTest {

    @TempDir
    Path root;

    private final GovernanceConfigLoader loader = new GovernanceConfigLoader(JsonMappers.standard());
    private final RecordingEvents events = new RecordingEvents();
    private Synchronizer synchronizer;
    private GovernanceConfig config;

    @BeforeEach
    void setUp() {
        ProjectFixture.compliant(root);
        synchronizer = new Synchronizer(new FileScanner(), RepositoryStatusProvider.none(), events);
        config = loader.load(root);
    }

    @Test
    void compliantProjectIsInSync() {
        SyncValidation validation = synchronizer.validateSync(root, config);

        assertThat(validation.valid()).isTrue();
        assertThat(validation.issues()).isEmpty();
    }

    @Test
    void staleProtocolReferenceIsDetected() {
        ProjectFixture.write(root, "docs/notes.md", "Protocol v2.1.0 introduced X\n");

        SyncValidation validation = synchronizer.validateSync(root, config);

        assertThat(validation.valid()).isFalse();
        assertThat(validation.conflicts()).containsExactly(VersionConflict.update("docs/notes.md", "2.1.0", "2.2.0"));
        assertThat(validation.issues()).containsExactly("docs/notes.md: 2.1.0 should be 2.2.0");
    }

    @Test
    void conflictsBlockSyncWithoutForce() {
        ProjectFixture.write(root, "docs/notes.md", "Protocol v2.1.0 introduced X\n");
        int scanned = new FileScanner().scan(root).size();

        SyncResult result = synchronizer.sync(root, config, new SyncOptions(false, false, true));

        assertThat(result.updated()).isZero();
        assertThat(result.skipped()).isEqualTo(scanned);
        assertThat(result.conflicts()).hasSize(1);
        assertThat(ProjectFixture.read(root, "docs/notes.md")).isEqualTo("Protocol v2.1.0 introduced X\n");
    }

    @Test
    void dryRunLeavesFilesUntouched() throws Exception {
        ProjectFixture.write(root, "docs/notes.md", "Protocol v2.1.0 introduced X\n");
        String before = hash(root.resolve("docs/notes.md"));

        SyncResult result = synchronizer.sync(root, config, SyncOptions.preview());

        assertThat(result.updated()).isEqualTo(1);
        assertThat(result.conflicts()).isEmpty();
        assertThat(hash(root.resolve("docs/notes.md"))).isEqualTo(before);
    }

    @Test
    void forcedSyncRewritesAndIsIdempotent() {
        ProjectFixture.write(root, "docs/notes.md", "Protocol v2.1.0 introduced X\n");
        int scanned = new FileScanner().scan(root).size();

        SyncResult first = synchronizer.sync(root, config, SyncOptions.forced());

        assertThat(first.updated()).isEqualTo(1);
        assertThat(first.skipped()).isEqualTo(scanned - 1);
        assertThat(ProjectFixture.read(root, "docs/notes.md")).isEqualTo("Protocol v2.2.0 introduced X\n");
        assertThat(synchronizer.validateSync(root, config).valid()).isTrue();

        SyncResult second = synchronizer.sync(root, config, SyncOptions.forced());
        assertThat(second.updated()).isZero();
        assertThat(second.skipped()).isEqualTo(scanned);
    }

    @Test
    void overlappingPatternsYieldOneConflictEach() {
        ProjectFixture.write(root, "docs/notes.md", "SBEP v2.1.0 and Protocol v2.1.0\n");

        List<VersionConflict> conflicts = synchronizer.validateSync(root, config).conflicts();
        assertThat(conflicts).hasSize(2);

        SyncResult result = synchronizer.sync(root, config, SyncOptions.forced());

        assertThat(result.updated()).isEqualTo(2);
        assertThat(ProjectFixture.read(root, "docs/notes.md")).isEqualTo("SBEP v2.2.0 and Protocol v2.2.0\n");
    }

    @Test
    void replacementsDoNotCascade() {
        ProjectFixture.write(root, "docs/notes.md", "Governance v0.9.0 applies\nProtocol v1.0.0 introduced X\n");

        synchronizer.sync(root, config, SyncOptions.forced());

        assertThat(ProjectFixture.read(root, "docs/notes.md"))
                .isEqualTo("Governance v1.0.0 applies\nProtocol v2.2.0 introduced X\n");
        assertThat(synchronizer.validateSync(root, config).valid()).isTrue();
    }

    @Test
    void replaceVersionsPrefersLongestTokenAndFirstTarget() {
        List<VersionConflict> conflicts = List.of(
                VersionConflict.update("a.md", "1.0", "9.9"),
                VersionConflict.update("a.md", "1.0.0", "2.0.0"),
                VersionConflict.update("a.md", "1.0", "7.7"));

        assertThat(Synchronizer.replaceVersions("v1.0.0 and v1.0", conflicts)).isEqualTo("v2.0.0 and v9.9");
        assertThat(Synchronizer.replaceVersions("untouched", List.of())).isEqualTo("untouched");
    }

    @Test
    void governanceKeywordResolvesAndBareKeysAreSkipped() {
        ProjectFixture.write(root, "docs/governance.md", "Governance v0.9.0 applies\n");
        ProjectFixture.write(root, "meta.json", "{\"sbep-version\": \"2.0.0\"}\n");
        ProjectFixture.write(root, "meta.yaml", "sbep_version: 2.0.0\n");

        List<VersionConflict> conflicts = synchronizer.validateSync(root, config).conflicts();

        assertThat(conflicts).extracting(VersionConflict::file, VersionConflict::currentVersion, VersionConflict::targetVersion)
                .containsExactly(tuple("docs/governance.md", "0.9.0", "1.0.0"));
    }

    @Test
    void unattributedVersionsAreLeftAlone() {
        ProjectFixture.write(root, "docs/deps.md", "Requires node v18.0.0 and version 3.4.5 of the client\n");

        assertThat(synchronizer.validateSync(root, config).valid()).isTrue();
    }

    @Test
    void versionReportScoresConflicts() {
        ProjectFixture.write(root, "docs/notes.md", "Protocol v2.1.0 introduced X\n");

        VersionReport report = synchronizer.versionReport(root, config);

        assertThat(report.inSync()).isFalse();
        assertThat(report.score()).isEqualTo(90);
        assertThat(report.conflicts()).hasSize(1);
        assertThat(report.manifestVersions()).containsEntry("protocol", "2.2.0").containsEntry("governance", "1.0.0");
        assertThat(report.filesScanned()).isEqualTo(new FileScanner().scan(root).size());
    }

    @Test
    void remoteUpdatesAreReportedButDoNotBlock() {
        RepositoryStatusProvider behind = projectRoot -> Optional.of(new RepositoryStatus(true, "origin/main", 3, 0));
        Synchronizer withRemote = new Synchronizer(new FileScanner(), behind, events);

        SyncResult result = withRemote.sync(root, config, SyncOptions.defaults());

        assertThat(result.conflicts()).isEmpty();
        assertThat(events.notices).contains("Remote updates available: local branch is 3 commits behind origin/main");
    }

    @Test
    void ignoreRemoteSkipsRepositoryCheck() {
        RepositoryStatusProvider failing = projectRoot -> {
            throw new AssertionError("repository status must not be queried");
        };
        Synchronizer withRemote = new Synchronizer(new FileScanner(), failing, events);

        SyncResult result = withRemote.sync(root, config, new SyncOptions(false, false, true));

        assertThat(result.updated()).isZero();
    }

    private static String hash(Path file) throws IOException, NoSuchAlgorithmException {
        return HexFormat.of().formatHex(MessageDigest.getInstance("SHA-256").digest(Files.readAllBytes(file)));
    }
}
