package com.governance.engine.audit;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.governance.engine.config.GovernanceConfig;
import com.governance.engine.config.ValidationSchema;
import com.governance.engine.events.GovernanceEvents;
import com.governance.engine.events.LogSanitizer;
import com.governance.engine.events.TaskProgress;
import com.governance.engine.model.AuditCategory;
import com.governance.engine.model.AuditResult;
import com.governance.engine.model.AuditType;
import com.governance.engine.model.ValidationResult;
import com.governance.engine.validate.Validator;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Exploratory audits. Unlike the validator, categories are not weighted: the overall
 * score is the plain mean of the category scores.
 */
public class Auditor {

    static final String README = "README.md";
    static final String SDS_DIR = "sds";
    static final String MANDATE = "sds/SBEP-MANDATE.md";
    static final String INDEX = "sds/SBEP-INDEX.yaml";
    static final String CORE_DIR = "SBEP_Core/";
    static final String HOUSEKEEPING_SCRIPT = "SBEP_Core/Invoke-ProjectHousekeeping.ps1";
    static final String EXCEPTION_POLICY_DIR = "SBEP_Core/EXCEPTION-POLICIES";

    static final List<String> SECRET_FILES = List.of(".env", "secrets.json");
    static final List<String> SECRET_SUFFIXES = List.of(".key", ".pem");
    static final List<String> DATA_POLICY_DOCS = List.of("data-policy.md", "privacy.md", "data-handling.md");

    private static final List<Pattern> FILE_REFERENCES = List.of(
            Pattern.compile("\\[([^\\]]+)\\]\\(([^)]+)\\)"),
            Pattern.compile("`([^`]+)`"),
            Pattern.compile("file://(\\S+)"));

    private final ObjectMapper mapper;
    private final GovernanceEvents events;
    private final Map<AuditType, List<AuditCheck>> checks = new EnumMap<>(AuditType.class);

    public Auditor(ObjectMapper mapper, GovernanceEvents events) {
        this.mapper = mapper;
        this.events = events;

        List<AuditCheck> quality = List.of(this::documentationCompleteness, this::consistency, this::technicalAccuracy);
        List<AuditCheck> compliance = List.of(this::protocolAdherence, this::safetyCompliance, this::exceptionPolicies);
        List<AuditCheck> security = List.of(this::accessControl, this::dataProtection, this::dependencySecurity);
        List<AuditCheck> comprehensive = new ArrayList<>();
        comprehensive.addAll(quality);
        comprehensive.addAll(compliance);
        comprehensive.addAll(security);

        checks.put(AuditType.QUALITY, quality);
        checks.put(AuditType.COMPLIANCE, compliance);
        checks.put(AuditType.SECURITY, security);
        checks.put(AuditType.COMPREHENSIVE, List.copyOf(comprehensive));
    }

    public AuditResult audit(Path root, GovernanceConfig config, AuditType type) {
        TaskProgress progress = TaskProgress.start(events, type.code() + " audit");
        List<AuditCategory> categories = new ArrayList<>();
        for (AuditCheck check : checks.get(type)) {
            AuditCategory category = check.run(root, config);
            progress.update(category.name() + ": " + category.score());
            categories.add(category);
        }
        AuditResult result = new AuditResult(type, overallScore(categories),
                Collections.unmodifiableList(categories), Instant.now());
        progress.complete("score " + result.score() + "/100, " + categories.size() + " categories, "
                + result.totalIssues() + " issues");
        return result;
    }

    static int overallScore(List<AuditCategory> categories) {
        if (categories.isEmpty()) {
            return 100;
        }
        double total = 0;
        for (AuditCategory c : categories) {
            total += c.score();
        }
        return (int) Math.round(total / categories.size());
    }

    /**
     * Persists an audit report as JSON: timestamp, summary and categories.
     */
    public void saveResults(AuditResult result, Path output) throws IOException {
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("overall_score", result.score());
        summary.put("categories_audited", result.categories().size());
        summary.put("total_issues", result.totalIssues());
        summary.put("total_recommendations", result.totalRecommendations());

        Map<String, Object> report = new LinkedHashMap<>();
        report.put("timestamp", result.timestamp().toString());
        report.put("type", result.type());
        report.put("summary", summary);
        report.put("categories", result.categories());
        write(report, output);
        events.notice("Audit report saved to: " + output);
    }

    /**
     * Persists a validation report as JSON: timestamp, summary, issues and recommendations.
     */
    public void saveValidationReport(ValidationResult result, Path output) throws IOException {
        Map<String, Integer> bySeverity = new TreeMap<>();
        Validator.countBySeverity(result.issues()).forEach((s, n) -> bySeverity.put(s.code(), n));

        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("score", result.score());
        summary.put("grade", result.grade());
        summary.put("totalIssues", result.issues().size());
        summary.put("issuesBySeverity", bySeverity);

        Map<String, Object> report = new LinkedHashMap<>();
        report.put("timestamp", Instant.now().toString());
        report.put("summary", summary);
        report.put("issues", result.issues());
        report.put("recommendations", result.recommendations());
        write(report, output);
        events.notice("Validation report saved to: " + output);
    }

    private void write(Map<String, Object> report, Path output) throws IOException {
        Path parent = output.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        mapper.writerWithDefaultPrettyPrinter().writeValue(output.toFile(), report);
    }

    // quality

    AuditCategory documentationCompleteness(Path root, GovernanceConfig config) {
        Findings f = new Findings("Documentation Completeness");
        ValidationSchema.QualityMetrics metrics = config.schema().qualityMetrics();

        Path readme = root.resolve(README);
        String content = Files.exists(readme) ? read(readme) : null;
        if (content == null) {
            f.penalize(30, "README.md missing",
                    "Create comprehensive README.md with project overview, installation, and usage instructions");
        } else {
            int words = wordCount(content);
            if (words < metrics.minimumWordCount()) {
                f.penalize(20, "README too short: " + words + " words (minimum: " + metrics.minimumWordCount() + ")",
                        "Expand README with detailed project description, setup instructions, and usage examples");
            }
            for (String section : metrics.recommendedSections()) {
                if (!content.contains("## " + section)) {
                    f.penalize(5, "Missing section: ## " + section, null);
                }
            }
        }

        Path mandate = root.resolve(MANDATE);
        if (Files.exists(mandate) && Files.exists(root.resolve(INDEX))) {
            String mandateText = read(mandate);
            if (mandateText != null && !mandateText.contains("SBEP-INDEX.yaml")) {
                f.penalize(10, "SBEP-MANDATE.md missing reference to SBEP-INDEX.yaml",
                        "Add cross-reference to SBEP-INDEX.yaml in mandate document");
            }
        }
        return f.toCategory();
    }

    AuditCategory consistency(Path root, GovernanceConfig config) {
        Findings f = new Findings("Consistency");
        List<String> terms = config.schema().qualityMetrics().terminology();
        for (Path doc : markdownDocs(root.resolve(SDS_DIR))) {
            String content = read(doc);
            if (content == null) {
                continue;
            }
            String name = doc.getFileName().toString();
            for (String term : terms) {
                Set<String> variants = termVariants(content, term);
                if (variants.size() > 1) {
                    f.penalize(5, "Inconsistent terminology in " + name + ": " + String.join(", ", variants),
                            "Standardize on '" + term + "' throughout documentation");
                }
            }
        }
        return f.toCategory();
    }

    AuditCategory technicalAccuracy(Path root, GovernanceConfig config) {
        Findings f = new Findings("Technical Accuracy");
        Path base = root.toAbsolutePath().normalize();
        for (Path doc : markdownDocs(root.resolve(SDS_DIR))) {
            String content = read(doc);
            if (content == null) {
                continue;
            }
            String name = doc.getFileName().toString();
            for (String ref : fileReferences(content)) {
                Path target = base.resolve(ref).normalize();
                if (!target.startsWith(base)) {
                    continue;
                }
                if (!Files.exists(target)) {
                    f.penalize(10, "Broken file reference in " + name + ": " + ref,
                            "Fix or remove broken reference to " + ref);
                }
            }
        }
        return f.toCategory();
    }

    // compliance

    AuditCategory protocolAdherence(Path root, GovernanceConfig config) {
        Findings f = new Findings("Protocol Adherence");
        for (String required : List.of(MANDATE, INDEX, CORE_DIR)) {
            if (!Files.exists(root.resolve(required))) {
                f.penalize(25, "Missing required governance component: " + required,
                        "Create " + required + " following governance standards");
            }
        }
        return f.toCategory();
    }

    AuditCategory safetyCompliance(Path root, GovernanceConfig config) {
        Findings f = new Findings("Safety Compliance");
        if (!Files.isDirectory(root.resolve("ops"))) {
            f.penalize(20, "Missing ops/ directory for deployment and rollback procedures",
                    "Create ops/ directory with deployment scripts and rollback procedures");
        }
        if (!Files.exists(root.resolve(HOUSEKEEPING_SCRIPT))) {
            f.penalize(15, "Missing housekeeping script for workspace organization",
                    "Implement housekeeping procedures");
        }
        return f.toCategory();
    }

    AuditCategory exceptionPolicies(Path root, GovernanceConfig config) {
        Findings f = new Findings("Exception Policies");
        for (String policy : config.schema().exceptionPolicies().requiredPolicies()) {
            if (!Files.exists(root.resolve(EXCEPTION_POLICY_DIR).resolve(policy + ".md"))) {
                f.penalize(20, "Missing required exception policy: " + policy,
                        "Create " + policy + ".md following exception policy standards");
            }
        }
        return f.toCategory();
    }

    // security

    AuditCategory accessControl(Path root, GovernanceConfig config) {
        Findings f = new Findings("Access Control");
        for (String name : sensitiveFiles(root)) {
            String recommendation = ".env".equals(name)
                    ? "Add .env to .gitignore and use .env.example template"
                    : "Remove " + name + " from the repository and add it to .gitignore";
            f.penalize(25, "Sensitive file " + name + " found in repository", recommendation);
        }
        return f.toCategory();
    }

    AuditCategory dataProtection(Path root, GovernanceConfig config) {
        Findings f = new Findings("Data Protection");
        Path docs = root.resolve("docs");
        if (Files.isDirectory(docs)) {
            boolean documented = DATA_POLICY_DOCS.stream().anyMatch(d -> Files.exists(docs.resolve(d)));
            if (!documented) {
                f.penalize(15, "Missing data protection and privacy documentation",
                        "Create data handling policy and privacy documentation");
            }
        }
        return f.toCategory();
    }

    AuditCategory dependencySecurity(Path root, GovernanceConfig config) {
        Findings f = new Findings("Dependency Security");
        dependencyManifest(f, root.resolve("package.json"), "package.json",
                List.of("dependencies", "devDependencies"), "Run npm audit and update vulnerable dependencies");
        dependencyManifest(f, root.resolve("composer.json"), "composer.json",
                List.of("require", "require-dev"), "Run composer audit and update vulnerable dependencies");
        return f.toCategory();
    }

    private void dependencyManifest(Findings f, Path file, String name, List<String> keys, String recommendation) {
        if (!Files.exists(file)) {
            return;
        }
        JsonNode json;
        try {
            json = mapper.readTree(file.toFile());
        } catch (IOException e) {
            f.penalize(20, "Invalid " + name + " format", "Fix the syntax of " + name);
            return;
        }
        boolean declares = keys.stream().anyMatch(k -> json.path(k).size() > 0);
        if (declares) {
            f.penalize(10, "Dependency security audit recommended for " + name, recommendation);
        }
    }

    List<String> sensitiveFiles(Path root) {
        List<String> found = new ArrayList<>();
        for (String name : SECRET_FILES) {
            if (Files.isRegularFile(root.resolve(name))) {
                found.add(name);
            }
        }
        List<String> keyed = new ArrayList<>();
        try (DirectoryStream<Path> entries = Files.newDirectoryStream(root)) {
            for (Path entry : entries) {
                String name = entry.getFileName().toString();
                if (Files.isRegularFile(entry) && SECRET_SUFFIXES.stream().anyMatch(name::endsWith)) {
                    keyed.add(name);
                }
            }
        } catch (IOException e) {
            events.warning("Could not list " + root + ": " + LogSanitizer.sanitize(e));
        }
        keyed.sort(null);
        found.addAll(keyed);
        return found;
    }

    /** Distinct spellings of {@code term} in the text, in order of first appearance. */
    static Set<String> termVariants(String content, String term) {
        Set<String> variants = new LinkedHashSet<>();
        Matcher m = Pattern.compile(Pattern.quote(term), Pattern.CASE_INSENSITIVE).matcher(content);
        while (m.find()) {
            variants.add(m.group());
        }
        return variants;
    }

    static Set<String> fileReferences(String content) {
        Set<String> refs = new LinkedHashSet<>();
        for (Pattern pattern : FILE_REFERENCES) {
            Matcher m = pattern.matcher(content);
            while (m.find()) {
                String ref = m.groupCount() >= 2 && m.group(2) != null ? m.group(2) : m.group(1);
                ref = ref.trim();
                int anchor = ref.indexOf('#');
                if (anchor >= 0) {
                    ref = ref.substring(0, anchor);
                }
                if (ref.isEmpty() || ref.contains("://") || ref.startsWith("/") || ref.contains(" ")
                        || ref.contains("$")) {
                    continue;
                }
                if (ref.contains("/") || ref.endsWith(".md") || ref.endsWith(".json")) {
                    refs.add(ref);
                }
            }
        }
        return refs;
    }

    private List<Path> markdownDocs(Path dir) {
        List<Path> docs = new ArrayList<>();
        if (!Files.isDirectory(dir)) {
            return docs;
        }
        try (DirectoryStream<Path> entries = Files.newDirectoryStream(dir, "*.md")) {
            for (Path entry : entries) {
                if (Files.isRegularFile(entry)) {
                    docs.add(entry);
                }
            }
        } catch (IOException e) {
            events.warning("Could not list " + dir + ": " + LogSanitizer.sanitize(e));
        }
        docs.sort(null);
        return docs;
    }

    private static int wordCount(String content) {
        String trimmed = content.trim();
        return trimmed.isEmpty() ? 0 : trimmed.split("\\s+").length;
    }

    private static String read(Path file) {
        try {
            return Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            return null;
        }
    }
}
