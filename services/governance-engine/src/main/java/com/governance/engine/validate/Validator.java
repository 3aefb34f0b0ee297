package com.governance.engine.validate;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.governance.engine.config.GovernanceConfig;
import com.governance.engine.config.GovernanceConfigLoader;
import com.governance.engine.config.SemanticVersions;
import com.governance.engine.config.ValidationSchema;
import com.governance.engine.events.GovernanceEvents;
import com.governance.engine.events.LogSanitizer;
import com.governance.engine.fix.AutoFixException;
import com.governance.engine.fix.Remediator;
import com.governance.engine.model.Grade;
import com.governance.engine.model.IssueFix;
import com.governance.engine.model.Severity;
import com.governance.engine.model.ValidationIssue;
import com.governance.engine.model.ValidationResult;
import com.governance.engine.scan.SafePaths;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Weighted compliance validator. Runs the five {@link ValidationCategory} checks in
 * declared order and maps the rounded weighted score to a grade.
 */
public class Validator {

    static final String OPS_DIR = "ops";
    static final String HOUSEKEEPING_SCRIPT = "SBEP_Core/Invoke-ProjectHousekeeping.ps1";
    static final String EXCEPTION_POLICY_DIR = "SBEP_Core/EXCEPTION-POLICIES";

    private final ObjectMapper mapper;
    private final GovernanceConfigLoader configLoader;
    private final Remediator remediator;
    private final GovernanceEvents events;

    public Validator(ObjectMapper mapper, GovernanceConfigLoader configLoader, Remediator remediator,
                     GovernanceEvents events) {
        this.mapper = mapper;
        this.configLoader = configLoader;
        this.remediator = remediator;
        this.events = events;
    }

    public ValidationResult validate(Path root, GovernanceConfig config) {
        return validate(root, config, false);
    }

    /**
     * @param fix run auto-fixes for fixable issues after scoring; the returned result
     *            describes the project as it was before fixing
     */
    public ValidationResult validate(Path root, GovernanceConfig config, boolean fix) {
        events.notice("Starting compliance validation for " + root);

        List<ValidationIssue> issues = new ArrayList<>();
        Map<String, Integer> categoryScores = new LinkedHashMap<>();
        int weighted = 0;
        int totalWeight = 0;
        for (ValidationCategory category : ValidationCategory.values()) {
            CategoryScore result = evaluate(category, root, config);
            int weight = config.schema().categoryWeight(category.id(), category.weightPercent());
            categoryScores.put(category.id(), result.score());
            weighted += result.score() * weight;
            totalWeight += weight;
            issues.addAll(result.issues());
        }

        int score = totalWeight == 0 ? 0 : (int) Math.round(weighted / (double) totalWeight);
        Grade grade = grade(score, config.schema());
        ValidationResult result = new ValidationResult(score, grade,
                Collections.unmodifiableList(issues),
                recommendations(issues),
                Collections.unmodifiableMap(categoryScores));

        events.notice("Validation score: " + score + "/100 (grade " + grade + ")");
        events.summary("Validation", issues.size(), countBySeverity(issues));

        if (fix) {
            autoFix(root, issues);
        }
        return result;
    }

    /**
     * Attempts every auto-fixable issue independently.
     *
     * @return number of issues fixed
     */
    public int autoFix(Path root, List<ValidationIssue> issues) {
        List<ValidationIssue> fixable = issues.stream().filter(ValidationIssue::autoFixable).toList();
        events.notice("Attempting to auto-fix " + fixable.size() + " issues");
        int fixed = 0;
        for (ValidationIssue issue : fixable) {
            try {
                remediator.apply(root, issue.fix(), issue.message());
                events.notice("Fixed: " + issue.message());
                fixed++;
            } catch (AutoFixException e) {
                events.warning("Failed to fix: " + issue.message() + " - " + LogSanitizer.sanitize(e));
            }
        }
        return fixed;
    }

    CategoryScore evaluate(ValidationCategory category, Path root, GovernanceConfig config) {
        switch (category) {
            case DOCUMENT_STRUCTURE:
                return documentStructure(root, config.schema());
            case VERSION_CONSISTENCY:
                return versionConsistency(root);
            case QUALITY_METRICS:
                return qualityMetrics(root, config.schema());
            case SAFETY_COMPLIANCE:
                return safetyCompliance(root);
            case EXCEPTION_POLICIES:
                return exceptionPolicies(root, config.schema());
            default:
                throw new IllegalStateException("Unhandled category " + category);
        }
    }

    CategoryScore documentStructure(Path root, ValidationSchema schema) {
        CategoryScore s = new CategoryScore(ValidationCategory.DOCUMENT_STRUCTURE);

        for (ValidationSchema.RequiredFile required : schema.requiredFiles()) {
            Path file = SafePaths.within(root, required.path());
            if (!Files.exists(file)) {
                s.deduct(20, Severity.CRITICAL, "Required file missing: " + required.path(), required.path());
                continue;
            }
            if (required.requiredSections().isEmpty()) {
                continue;
            }
            String content = read(file);
            if (content == null) {
                s.deduct(20, Severity.CRITICAL, "Required file unreadable: " + required.path(), required.path());
                continue;
            }
            for (String section : required.requiredSections()) {
                if (!content.contains("## " + section)) {
                    s.deduct(5, Severity.HIGH,
                            "Required section missing: " + section + " in " + required.path(), required.path());
                }
            }
        }

        for (String pattern : Remediator.obsoletePatterns()) {
            List<String> matches;
            try {
                matches = Remediator.obsoleteMatches(root, pattern);
            } catch (IOException e) {
                events.warning("Could not list project root for " + pattern + ": " + LogSanitizer.sanitize(e));
                continue;
            }
            if (!matches.isEmpty()) {
                s.deductFixable(2, Severity.MEDIUM,
                        "Obsolete files found: " + String.join(", ", matches) + " - should be archived",
                        null, IssueFix.ARCHIVE_OBSOLETE_FILES);
            }
        }
        return s;
    }

    /**
     * Checks the project's manifest file against the manifest shipped with the engine.
     */
    CategoryScore versionConsistency(Path root) {
        CategoryScore s = new CategoryScore(ValidationCategory.VERSION_CONSISTENCY);
        String manifestFile = GovernanceConfigLoader.MANIFEST_FILE;
        Path manifestPath = root.resolve(manifestFile);

        if (!Files.exists(manifestPath)) {
            s.deduct(30, Severity.CRITICAL,
                    manifestFile + " missing - single source of truth for versions", manifestFile);
            return s;
        }

        JsonNode durable;
        try {
            durable = mapper.readTree(manifestPath.toFile());
        } catch (IOException e) {
            s.deduct(30, Severity.CRITICAL, manifestFile + " unreadable: " + e.getMessage(), manifestFile);
            return s;
        }

        JsonNode versions = durable.path("versions");
        String durableProtocol = versions.path("protocol").path("current").asText(null);
        String expected = configLoader.canonicalManifest().protocolVersion();
        if (!Objects.equals(durableProtocol, expected)) {
            s.deduct(15, Severity.HIGH,
                    "Protocol version mismatch: " + durableProtocol + " vs " + expected, manifestFile);
        }

        Iterator<Map.Entry<String, JsonNode>> components = versions.path("components").fields();
        while (components.hasNext()) {
            Map.Entry<String, JsonNode> component = components.next();
            JsonNode current = component.getValue().path("current");
            if (current.isTextual() && !SemanticVersions.isValid(current.asText())) {
                s.deduct(5, Severity.MEDIUM,
                        "Invalid semantic version for " + component.getKey() + ": " + current.asText(), manifestFile);
            }
        }
        return s;
    }

    CategoryScore qualityMetrics(Path root, ValidationSchema schema) {
        CategoryScore s = new CategoryScore(ValidationCategory.QUALITY_METRICS);
        ValidationSchema.QualityMetrics metrics = schema.qualityMetrics();

        Path readme = root.resolve(Remediator.README);
        if (Files.exists(readme)) {
            String content = read(readme);
            if (content == null) {
                s.deduct(10, Severity.MEDIUM, "README.md unreadable", Remediator.README);
            } else {
                int words = wordCount(content);
                if (words < metrics.minimumWordCount()) {
                    s.deduct(10, Severity.MEDIUM, "README.md too short: " + words
                            + " words (minimum: " + metrics.minimumWordCount() + ")", Remediator.README);
                }
                for (String section : metrics.recommendedSections()) {
                    if (!content.contains("## " + section)) {
                        s.deductFixable(2, Severity.LOW, Remediator.README_SECTION_PREFIX + section,
                                Remediator.README, IssueFix.ADD_README_SECTION);
                    }
                }
            }
        }

        Path mandate = root.resolve(Remediator.MANDATE);
        Path index = root.resolve(Remediator.INDEX);
        if (Files.exists(mandate) && Files.exists(index)) {
            String mandateText = read(mandate);
            String indexText = read(index);
            if (mandateText != null && indexText != null
                    && (!mandateText.contains("SBEP-INDEX.yaml") || !indexText.contains("SBEP-MANDATE.md"))) {
                s.deductFixable(5, Severity.LOW,
                        "Missing cross-references between SBEP-MANDATE.md and SBEP-INDEX.yaml",
                        null, IssueFix.ADD_CROSS_REFERENCES);
            }
        }
        return s;
    }

    CategoryScore safetyCompliance(Path root) {
        CategoryScore s = new CategoryScore(ValidationCategory.SAFETY_COMPLIANCE);
        if (!Files.isDirectory(root.resolve(OPS_DIR))) {
            s.deduct(20, Severity.HIGH,
                    "Missing ops/ directory - required for deployment and rollback procedures", OPS_DIR + "/");
        }
        if (!Files.exists(root.resolve(HOUSEKEEPING_SCRIPT))) {
            s.deduct(10, Severity.MEDIUM,
                    "Housekeeping script missing - required for workspace organization", HOUSEKEEPING_SCRIPT);
        }
        if (!Files.isDirectory(root.resolve(Remediator.ARCHIVE_DIR))) {
            s.deductFixable(5, Severity.LOW,
                    "Missing archive/ directory - required for safe file deprecation",
                    Remediator.ARCHIVE_DIR + "/", IssueFix.CREATE_ARCHIVE_DIRECTORY);
        }
        return s;
    }

    CategoryScore exceptionPolicies(Path root, ValidationSchema schema) {
        CategoryScore s = new CategoryScore(ValidationCategory.EXCEPTION_POLICIES);
        ValidationSchema.ExceptionPolicies policies = schema.exceptionPolicies();

        for (String policy : policies.requiredPolicies()) {
            String relative = EXCEPTION_POLICY_DIR + "/" + policy + ".md";
            Path file = SafePaths.within(root, relative);
            if (!Files.exists(file)) {
                s.deduct(15, Severity.HIGH, "Required exception policy missing: " + policy, relative);
                continue;
            }
            String content = read(file);
            if (content == null) {
                s.deduct(15, Severity.HIGH, "Required exception policy unreadable: " + policy, relative);
                continue;
            }
            for (Map.Entry<String, Boolean> section : policies.policyStructure().entrySet()) {
                if (section.getValue() && !content.contains("## " + capitalize(section.getKey()))) {
                    s.deduct(5, Severity.MEDIUM,
                            "Policy structure incomplete: missing " + section.getKey() + " in " + policy, relative);
                }
            }
        }
        return s;
    }

    static Grade grade(int score, ValidationSchema schema) {
        if (score >= schema.gradeMinimum("A")) {
            return Grade.A;
        }
        if (score >= schema.gradeMinimum("B")) {
            return Grade.B;
        }
        if (score >= schema.gradeMinimum("C")) {
            return Grade.C;
        }
        if (score >= schema.gradeMinimum("D")) {
            return Grade.D;
        }
        return Grade.F;
    }

    static List<String> recommendations(List<ValidationIssue> issues) {
        List<String> out = new ArrayList<>();
        long critical = issues.stream().filter(i -> i.severity() == Severity.CRITICAL).count();
        long high = issues.stream().filter(i -> i.severity() == Severity.HIGH).count();
        if (critical > 0) {
            out.add("Address " + critical + " critical issues immediately - these prevent basic compliance");
        }
        if (high > 0) {
            out.add("Fix " + high + " high-priority issues to achieve basic functionality");
        }
        Set<String> categories = new LinkedHashSet<>();
        for (ValidationIssue issue : issues) {
            categories.add(issue.category());
        }
        for (String id : categories) {
            ValidationCategory category = ValidationCategory.byId(id);
            if (category != null) {
                out.add(category.recommendation());
            }
        }
        return Collections.unmodifiableList(out);
    }

    public static Map<Severity, Integer> countBySeverity(List<ValidationIssue> issues) {
        Map<Severity, Integer> counts = new EnumMap<>(Severity.class);
        for (ValidationIssue issue : issues) {
            counts.merge(issue.severity(), 1, Integer::sum);
        }
        return counts;
    }

    static int wordCount(String content) {
        String trimmed = content.trim();
        return trimmed.isEmpty() ? 0 : trimmed.split("\\s+").length;
    }

    static String capitalize(String key) {
        if (key.isEmpty()) {
            return key;
        }
        return key.substring(0, 1).toUpperCase(Locale.ROOT) + key.substring(1);
    }

    private static String read(Path file) {
        try {
            return Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            return null;
        }
    }
}
