package com.governance.engine.governor;

import com.governance.engine.audit.Auditor;
import com.governance.engine.config.GovernanceConfig;
import com.governance.engine.config.GovernanceConfigLoader;
import com.governance.engine.events.GovernanceEvents;
import com.governance.engine.events.LogSanitizer;
import com.governance.engine.events.TaskProgress;
import com.governance.engine.fix.AutoFixException;
import com.governance.engine.fix.Remediator;
import com.governance.engine.model.AuditResult;
import com.governance.engine.model.AuditType;
import com.governance.engine.model.GovernanceStatus;
import com.governance.engine.model.GovernanceViolation;
import com.governance.engine.model.InitOptions;
import com.governance.engine.model.InitResult;
import com.governance.engine.model.IssueFix;
import com.governance.engine.model.Severity;
import com.governance.engine.model.SyncOptions;
import com.governance.engine.model.SyncResult;
import com.governance.engine.model.SyncValidation;
import com.governance.engine.model.ValidationResult;
import com.governance.engine.model.VersionReport;
import com.governance.engine.sync.Synchronizer;
import com.governance.engine.validate.Validator;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Top-level governance façade. Loads the configuration once per call and hands it to
 * the validator, synchronizer and auditor.
 */
public class Governor {

    static final String SDS_DIR = "sds";
    static final String TMP_DIR = ".tmp";
    static final String EXCEPTION_POLICY_DIR = "SBEP_Core/EXCEPTION-POLICIES";
    static final List<String> GOVERNANCE_DOCS = List.of("GOVERNANCE-LAYER.md", "CONSTITUTION.md", "CHANGE-MANAGEMENT.md");
    static final int STATUS_ISSUE_LIMIT = 10;
    static final String AUDIT_LOG = TMP_DIR + "/governance-audit.log";

    private final GovernanceConfigLoader configLoader;
    private final Validator validator;
    private final Synchronizer synchronizer;
    private final Auditor auditor;
    private final Remediator remediator;
    private final ScaffoldTemplates templates;
    private final GovernanceEvents events;
    private final Clock clock;

    public Governor(GovernanceConfigLoader configLoader,
                    Validator validator,
                    Synchronizer synchronizer,
                    Auditor auditor,
                    Remediator remediator,
                    ScaffoldTemplates templates,
                    GovernanceEvents events,
                    Clock clock) {
        this.configLoader = configLoader;
        this.validator = validator;
        this.synchronizer = synchronizer;
        this.auditor = auditor;
        this.remediator = remediator;
        this.templates = templates;
        this.events = events;
        this.clock = clock;
    }

    /**
     * Runs every read-only check and merges the findings, most severe first.
     *
     * @param strict also flag live exception policies
     * @throws com.governance.engine.config.ConfigurationException when manifest or schema is unusable
     */
    public List<GovernanceViolation> checkCompliance(Path root, boolean strict) {
        GovernanceConfig config = configLoader.load(root);
        List<GovernanceViolation> violations = new ArrayList<>();
        try {
            SyncValidation sync = synchronizer.validateSync(root, config);
            for (String issue : sync.issues()) {
                violations.add(GovernanceViolation.of(Severity.HIGH, "version_sync",
                        "Version synchronization issue: " + issue, null,
                        "Run a forced sync to align versions with " + GovernanceConfigLoader.MANIFEST_FILE));
            }

            ValidationResult validation = validator.validate(root, config);
            validation.issues().forEach(issue -> violations.add(GovernanceViolation.fromIssue(issue)));

            violations.addAll(governanceStructure(root));
            if (strict) {
                violations.addAll(liveExceptionPolicies(root));
            }
        } catch (UncheckedIOException | IllegalArgumentException e) {
            violations.add(GovernanceViolation.of(Severity.CRITICAL, "governance_failure",
                    "Governance check failed: " + LogSanitizer.sanitize(e), null,
                    "Check system logs and retry governance check"));
        }

        violations.sort(Comparator.comparing(GovernanceViolation::severity));
        events.summary("Governance check", violations.size(), countBySeverity(violations));
        return Collections.unmodifiableList(violations);
    }

    /**
     * Cheap snapshot; the compliance score is an approximation from the violation count.
     */
    public GovernanceStatus getStatus(Path root) {
        GovernanceConfig config = configLoader.load(root);
        List<GovernanceViolation> violations = checkCompliance(root, false);
        int score = Math.max(0, 100 - violations.size() * 5);
        List<String> issues = violations.stream()
                .limit(STATUS_ISSUE_LIMIT)
                .map(GovernanceViolation::message)
                .toList();
        return new GovernanceStatus(config.manifest().protocolVersion(), config.manifest().governanceVersion(),
                score, trackedFiles(root), issues, lastAudit(root));
    }

    /**
     * Idempotent scaffolding. Existing documents are left alone unless {@code force} is set.
     */
    public InitResult init(Path root, InitOptions options) throws IOException {
        TaskProgress progress = TaskProgress.start(events, "Initializing governance");
        GovernanceConfig config = configLoader.load(root);
        List<String> created = new ArrayList<>();
        List<String> skipped = new ArrayList<>();
        try {
            ensureDirectory(root, SDS_DIR, created, skipped);
            progress.update("sds/ ready");

            Map<String, String> values = templateValues(root, options, config);
            writeDocument(root, Remediator.MANDATE, templates.mandate(values), options.force(), created, skipped);
            writeDocument(root, Remediator.INDEX, templates.index(values), options.force(), created, skipped);
            progress.update("documentation scaffolded");

            ensureDirectory(root, TMP_DIR, created, skipped);
            ensureDirectory(root, Remediator.ARCHIVE_DIR, created, skipped);
        } catch (IOException e) {
            progress.fail(e.getMessage());
            throw e;
        }
        progress.complete("created " + created.size() + ", kept " + skipped.size());
        return new InitResult(List.copyOf(created), List.copyOf(skipped));
    }

    /**
     * Applies every auto-fixable violation on its own; one failure does not stop the rest.
     *
     * @return number of violations fixed
     */
    public int autoFix(Path root, List<GovernanceViolation> violations) {
        int fixed = 0;
        for (GovernanceViolation violation : violations) {
            if (!violation.autoFixable()) {
                continue;
            }
            try {
                remediator.apply(root, violation.fix(), violation.message());
                events.notice("Auto-fixed: " + violation.message());
                fixed++;
            } catch (AutoFixException e) {
                events.warning("Failed to auto-fix: " + violation.message() + " - " + LogSanitizer.sanitize(e));
            }
        }
        return fixed;
    }

    public ValidationResult validate(Path root, boolean fix) {
        return validator.validate(root, configLoader.load(root), fix);
    }

    public SyncValidation validateSync(Path root) {
        return synchronizer.validateSync(root, configLoader.load(root));
    }

    public SyncResult sync(Path root, SyncOptions options) {
        return synchronizer.sync(root, configLoader.load(root), options);
    }

    public VersionReport versionReport(Path root) {
        return synchronizer.versionReport(root, configLoader.load(root));
    }

    /**
     * Runs the audit and appends a line to {@value #AUDIT_LOG}, which {@link #getStatus} reads back.
     */
    public AuditResult audit(Path root, AuditType type) {
        AuditResult result = auditor.audit(root, configLoader.load(root), type);
        recordAudit(root, result);
        return result;
    }

    public Auditor auditor() {
        return auditor;
    }

    List<GovernanceViolation> governanceStructure(Path root) {
        List<GovernanceViolation> out = new ArrayList<>();
        String manifest = GovernanceConfigLoader.MANIFEST_FILE;
        if (!Files.exists(root.resolve(manifest))) {
            out.add(new GovernanceViolation(Severity.CRITICAL, "governance_core",
                    manifest + " missing - required for version governance", manifest,
                    true, IssueFix.RESTORE_MANIFEST, "Create " + manifest + " with current protocol versions"));
        }
        String schema = GovernanceConfigLoader.SCHEMA_FILE;
        if (!Files.exists(root.resolve(schema))) {
            out.add(new GovernanceViolation(Severity.HIGH, "governance_core",
                    schema + " missing - required for validation rules", schema,
                    true, IssueFix.RESTORE_SCHEMA, "Copy the bundled " + schema + " into the project"));
        }
        for (String doc : GOVERNANCE_DOCS) {
            if (!Files.exists(root.resolve(doc))) {
                out.add(GovernanceViolation.of(Severity.MEDIUM, "governance_docs",
                        "Governance documentation missing: " + doc, doc,
                        "Add " + doc + " from the governance documentation set"));
            }
        }
        return out;
    }

    List<GovernanceViolation> liveExceptionPolicies(Path root) {
        Path dir = root.resolve(EXCEPTION_POLICY_DIR);
        if (!Files.isDirectory(dir)) {
            return List.of();
        }
        List<String> active = new ArrayList<>();
        try (DirectoryStream<Path> entries = Files.newDirectoryStream(dir, "*.active")) {
            for (Path entry : entries) {
                active.add(entry.getFileName().toString());
            }
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        if (active.isEmpty()) {
            return List.of();
        }
        active.sort(null);
        return List.of(GovernanceViolation.of(Severity.MEDIUM, "exception_policy",
                "Active exception policies found: " + String.join(", ", active), null,
                "Review and sunset expired exception policies"));
    }

    int trackedFiles(Path root) {
        Path sds = root.resolve(SDS_DIR);
        if (!Files.isDirectory(sds)) {
            return 0;
        }
        int count = 0;
        try (DirectoryStream<Path> entries = Files.newDirectoryStream(sds, "*.{md,yaml,json}")) {
            for (Path entry : entries) {
                if (Files.isRegularFile(entry)) {
                    count++;
                }
            }
        } catch (IOException e) {
            events.warning("Could not count tracked files: " + LogSanitizer.sanitize(e));
            return 0;
        }
        return count;
    }

    Instant lastAudit(Path root) {
        Path auditLog = root.resolve(AUDIT_LOG);
        if (!Files.isRegularFile(auditLog)) {
            return null;
        }
        try {
            return Files.getLastModifiedTime(auditLog).toInstant();
        } catch (IOException e) {
            events.warning("Could not read audit log time: " + LogSanitizer.sanitize(e));
            return null;
        }
    }

    private void recordAudit(Path root, AuditResult result) {
        Path auditLog = root.resolve(AUDIT_LOG);
        String line = clock.instant() + " " + result.type().code() + " score=" + result.score() + System.lineSeparator();
        try {
            Files.createDirectories(auditLog.getParent());
            Files.writeString(auditLog, line, StandardCharsets.UTF_8, StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        } catch (IOException e) {
            events.warning("Could not write audit log: " + LogSanitizer.sanitize(e));
        }
    }

    private Map<String, String> templateValues(Path root, InitOptions options, GovernanceConfig config) {
        String name = options.projectName();
        if (name == null || name.isBlank()) {
            Path fileName = root.getFileName();
            name = fileName == null ? "project" : fileName.toString();
        }
        LocalDate today = LocalDate.now(clock);
        Map<String, String> values = new LinkedHashMap<>();
        values.put("projectName", name);
        values.put("date", today.toString());
        values.put("nextReview", today.plusDays(30).toString());
        values.put("protocolVersion", config.manifest().protocolVersion());
        values.put("governanceVersion", config.manifest().governanceVersion());
        return values;
    }

    private void writeDocument(Path root, String relative, String content, boolean force,
                               List<String> created, List<String> skipped) throws IOException {
        Path target = root.resolve(relative);
        if (Files.exists(target) && !force) {
            skipped.add(relative);
            return;
        }
        Files.writeString(target, content, StandardCharsets.UTF_8);
        created.add(relative);
    }

    private static void ensureDirectory(Path root, String relative, List<String> created, List<String> skipped)
            throws IOException {
        Path dir = root.resolve(relative);
        if (Files.isDirectory(dir)) {
            skipped.add(relative + "/");
            return;
        }
        Files.createDirectories(dir);
        created.add(relative + "/");
    }

    static Map<Severity, Integer> countBySeverity(List<GovernanceViolation> violations) {
        Map<Severity, Integer> counts = new EnumMap<>(Severity.class);
        for (GovernanceViolation v : violations) {
            counts.merge(v.severity(), 1, Integer::sum);
        }
        return counts;
    }
}
