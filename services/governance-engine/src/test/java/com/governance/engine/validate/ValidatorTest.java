package com.governance.engine.validate;

import com.governance.engine.config.GovernanceConfig;
import com.governance.engine.config.GovernanceConfigLoader;
import com.governance.engine.config.JsonMappers;
import com.governance.engine.config.ValidationSchema;
import com.governance.engine.fix.Remediator;
import com.governance.engine.model.Grade;
import com.governance.engine.model.IssueFix;
import com.governance.engine.model.Severity;
import com.governance.engine.model.ValidationIssue;
import com.governance.engine.model.ValidationResult;
import com.governance.engine.support.ProjectFixture;
import com.governance.engine.support.RecordingEvents;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class ValidatorTest {

    @TempDir
    Path root;

    private final GovernanceConfigLoader loader = new GovernanceConfigLoader(JsonMappers.standard());
    private final RecordingEvents events = new RecordingEvents();
    private Validator validator;

    @BeforeEach
    void setUp() {
        validator = new Validator(JsonMappers.standard(), loader, new Remediator(loader), events);
        ProjectFixture.compliant(root);
    }

    private ValidationResult validate() {
        GovernanceConfig config = loader.load(root);
        return validator.validate(root, config);
    }

    @Test
    void categoryWeightsSumToOne() {
        assertThat(Arrays.stream(ValidationCategory.values()).mapToInt(ValidationCategory::weightPercent).sum())
                .isEqualTo(100);
        assertThat(Arrays.stream(ValidationCategory.values()).mapToDouble(ValidationCategory::weight).sum())
                .isCloseTo(1.0, within(1e-9));
    }

    @Test
    void compliantProjectScoresFullMarks() {
        ValidationResult result = validate();

        assertThat(result.issues()).isEmpty();
        assertThat(result.score()).isEqualTo(100);
        assertThat(result.grade()).isEqualTo(Grade.A);
        assertThat(result.categoryScores()).containsOnlyKeys(
                "document_structure", "version_consistency", "quality_metrics", "safety_compliance", "exception_policies");
        assertThat(result.categoryScores().values()).containsOnly(100);
        assertThat(result.recommendations()).isEmpty();
        assertThat(events.summaries).containsExactly("Validation: 0");
    }

    @Test
    void missingOpsAndArchiveCostSafetyTwentyFivePoints() {
        ProjectFixture.delete(root, "ops");
        ProjectFixture.delete(root, "archive");

        ValidationResult result = validate();

        assertThat(result.categoryScores()).containsEntry("safety_compliance", 75);
        assertThat(75 * ValidationCategory.SAFETY_COMPLIANCE.weight()).isCloseTo(11.25, within(1e-9));
        // 85 + 11.25 = 96.25
        assertThat(result.score()).isEqualTo(96);
        assertThat(result.issues()).extracting(ValidationIssue::severity)
                .containsExactly(Severity.HIGH, Severity.LOW);
        ValidationIssue archive = result.issues().get(1);
        assertThat(archive.autoFixable()).isTrue();
        assertThat(archive.fix()).isEqualTo(IssueFix.CREATE_ARCHIVE_DIRECTORY);
    }

    @Test
    void validationIsDeterministic() {
        ProjectFixture.delete(root, "CHANGELOG.md");
        ProjectFixture.write(root, "old-notes.md", "stale");

        assertThat(validate()).isEqualTo(validate());
    }

    @Test
    void addingRequiredFileNeverLowersDocumentStructure() {
        ProjectFixture.delete(root, "CHANGELOG.md");
        int without = validate().categoryScores().get("document_structure");

        ProjectFixture.write(root, "CHANGELOG.md", "# Changelog\n");
        int with = validate().categoryScores().get("document_structure");

        assertThat(without).isEqualTo(80);
        assertThat(with).isGreaterThanOrEqualTo(without).isEqualTo(100);
    }

    @Test
    void missingMandateSectionsAreHighIssues() {
        ProjectFixture.write(root, "sds/SBEP-MANDATE.md", "# Mandate\n\n## Project Context\n\nSee `sds/SBEP-INDEX.yaml`.\n");

        ValidationResult result = validate();

        assertThat(result.categoryScores()).containsEntry("document_structure", 90);
        assertThat(result.issues()).extracting(ValidationIssue::message).containsExactly(
                "Required section missing: Quick Start for Agents in sds/SBEP-MANDATE.md",
                "Required section missing: Project-Specific Rules in sds/SBEP-MANDATE.md");
        assertThat(result.recommendations()).contains("Fix 2 high-priority issues to achieve basic functionality");
    }

    @Test
    void missingManifestIsCritical() {
        ProjectFixture.delete(root, "VERSION-MANIFEST.json");

        ValidationResult result = validate();

        assertThat(result.categoryScores()).containsEntry("version_consistency", 70);
        assertThat(result.issues()).singleElement()
                .satisfies(issue -> assertThat(issue.severity()).isEqualTo(Severity.CRITICAL));
        assertThat(result.recommendations()).first().asString().startsWith("Address 1 critical issues");
    }

    @Test
    void projectProtocolIsCheckedAgainstBundledManifest() {
        String manifest = ProjectFixture.read(root, "VERSION-MANIFEST.json")
                .replace("\"current\": \"2.2.0\"", "\"current\": \"9.9.9\"");
        ProjectFixture.write(root, "VERSION-MANIFEST.json", manifest);

        ValidationResult result = validate();

        assertThat(result.categoryScores()).containsEntry("version_consistency", 85);
        assertThat(result.issues()).singleElement().satisfies(issue -> {
            assertThat(issue.severity()).isEqualTo(Severity.HIGH);
            assertThat(issue.message()).isEqualTo("Protocol version mismatch: 9.9.9 vs 2.2.0");
        });
    }

    @Test
    void schemaCategoryWeightsDriveOverallScore() {
        ProjectFixture.delete(root, "CHANGELOG.md");
        assertThat(validate().score()).isEqualTo(95);

        String schema = ProjectFixture.read(root, "VALIDATION-SCHEMA.json")
                .replace("\"document_structure\": { \"weight\": 25", "\"document_structure\": { \"weight\": 40")
                .replace("\"quality_metrics\": { \"weight\": 25", "\"quality_metrics\": { \"weight\": 10");
        ProjectFixture.write(root, "VALIDATION-SCHEMA.json", schema);

        ValidationResult result = validate();

        assertThat(result.categoryScores()).containsEntry("document_structure", 80);
        // 80 * 40 + 100 * 60 = 9200
        assertThat(result.score()).isEqualTo(92);
    }

    @Test
    void invalidComponentVersionIsReported() {
        String manifest = ProjectFixture.read(root, "VERSION-MANIFEST.json")
                .replaceFirst("\"current\": \"1\\.0\\.0\",\n        \"status\"", "\"current\": \"1.0\",\n        \"status\"");
        ProjectFixture.write(root, "VERSION-MANIFEST.json", manifest);

        ValidationResult result = validate();

        assertThat(result.issues()).extracting(ValidationIssue::message)
                .anyMatch(m -> m.startsWith("Invalid semantic version for"));
    }

    @Test
    void shortReadmeAndMissingSectionsLowerQuality() {
        ProjectFixture.write(root, "README.md", "# Tiny\n\n## Overview\n\nToo short.\n");

        ValidationResult result = validate();

        // 10 for length, 2 each for Installation and Usage
        assertThat(result.categoryScores()).containsEntry("quality_metrics", 86);
        assertThat(result.issues()).filteredOn(ValidationIssue::autoFixable)
                .extracting(ValidationIssue::message)
                .containsExactly(
                        "Missing recommended section in README.md: ## Installation",
                        "Missing recommended section in README.md: ## Usage");
    }

    @Test
    void obsoleteFilesAreFlaggedOncePerPattern() {
        ProjectFixture.write(root, "api-cheatsheet.md", "x");
        ProjectFixture.write(root, "deprecated-setup.md", "x");

        ValidationResult result = validate();

        assertThat(result.categoryScores()).containsEntry("document_structure", 96);
        assertThat(result.issues()).allSatisfy(issue -> assertThat(issue.fix()).isEqualTo(IssueFix.ARCHIVE_OBSOLETE_FILES));
    }

    @Test
    void exceptionPolicyStructureIsChecked() {
        ProjectFixture.write(root, "SBEP_Core/EXCEPTION-POLICIES/LEGACY-SYSTEMS.md", "# Legacy\n\n## Purpose\n");
        ProjectFixture.delete(root, "SBEP_Core/EXCEPTION-POLICIES/EMERGENCY-BYPASS.md");

        ValidationResult result = validate();

        // 15 for the missing policy, 5 each for conditions and approval
        assertThat(result.categoryScores()).containsEntry("exception_policies", 75);
    }

    @Test
    void gradeBoundariesFollowSchemaThresholds() {
        ValidationSchema schema = loader.load(root).schema();

        assertThat(Validator.grade(90, schema)).isEqualTo(Grade.A);
        assertThat(Validator.grade(89, schema)).isEqualTo(Grade.B);
        assertThat(Validator.grade(70, schema)).isEqualTo(Grade.C);
        assertThat(Validator.grade(60, schema)).isEqualTo(Grade.D);
        assertThat(Validator.grade(59, schema)).isEqualTo(Grade.F);
    }

    @Test
    void autoFixRepairsFixableIssues() {
        ProjectFixture.delete(root, "archive");
        ProjectFixture.write(root, "README.md", ProjectFixture.README.replace("## Usage", "## Running"));
        ProjectFixture.write(root, "sds/SBEP-INDEX.yaml", "title: \"index\"\n");
        ProjectFixture.write(root, "old-guide.md", "stale");

        GovernanceConfig config = loader.load(root);
        ValidationResult before = validator.validate(root, config, true);

        assertThat(before.issues()).filteredOn(ValidationIssue::autoFixable).hasSize(4);
        assertThat(Files.isDirectory(root.resolve("archive"))).isTrue();
        assertThat(Files.exists(root.resolve("archive/old-guide.md"))).isTrue();
        assertThat(Files.exists(root.resolve("old-guide.md"))).isFalse();
        assertThat(ProjectFixture.read(root, "README.md")).endsWith("## Usage\n\n[Add usage details here]\n");
        assertThat(ProjectFixture.read(root, "sds/SBEP-INDEX.yaml")).contains("SBEP-MANDATE.md");

        ValidationResult after = validate();
        assertThat(after.issues()).isEmpty();
        assertThat(after.score()).isEqualTo(100);
    }

    @Test
    void failedFixIsReportedAndOthersContinue() {
        ProjectFixture.write(root, "old-guide.md", "new");
        ProjectFixture.write(root, "archive/old-guide.md", "already archived");
        ProjectFixture.delete(root, "CHANGELOG.md");
        ProjectFixture.write(root, "README.md", ProjectFixture.README.replace("## Usage", "## Running"));

        ValidationResult result = validate();
        int fixed = validator.autoFix(root, result.issues());

        assertThat(fixed).isEqualTo(1);
        assertThat(events.warnings).singleElement().asString().startsWith("Failed to fix: Obsolete files found");
        assertThat(ProjectFixture.read(root, "README.md")).contains("## Usage");
    }
}
