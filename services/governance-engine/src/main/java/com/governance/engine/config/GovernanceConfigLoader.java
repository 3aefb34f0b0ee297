package com.governance.engine.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Loads the version manifest and validation schema for a project.
 * A project-local file beats the bundled classpath default; anything that cannot be
 * parsed or fails shape validation raises {@link ConfigurationException}.
 */
public class GovernanceConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(GovernanceConfigLoader.class);

    public static final String MANIFEST_FILE = "VERSION-MANIFEST.json";
    public static final String SCHEMA_FILE = "VALIDATION-SCHEMA.json";
    public static final String PROJECT_CONFIG_FILE = ".governance/config.json";

    static final String BUNDLED_MANIFEST = "governance/" + MANIFEST_FILE;
    static final String BUNDLED_SCHEMA = "governance/" + SCHEMA_FILE;

    private static final List<String> GRADES = List.of("A", "B", "C", "D");

    private final ObjectMapper mapper;

    public GovernanceConfigLoader(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public GovernanceConfig load(Path projectRoot) {
        Path localManifest = projectRoot.resolve(MANIFEST_FILE);
        VersionManifest manifest;
        String manifestSource;
        if (Files.isRegularFile(localManifest)) {
            manifestSource = localManifest.toString();
            manifest = parseManifest(readFile(localManifest), manifestSource);
        } else {
            manifestSource = "classpath:" + BUNDLED_MANIFEST;
            manifest = parseManifest(readBundled(BUNDLED_MANIFEST), manifestSource);
        }

        Path schemaPath = customSchemaPath(projectRoot);
        ValidationSchema schema;
        String schemaSource;
        if (schemaPath != null) {
            schemaSource = schemaPath.toString();
            schema = parseSchema(readFile(schemaPath), schemaSource);
        } else {
            schemaSource = "classpath:" + BUNDLED_SCHEMA;
            schema = parseSchema(readBundled(BUNDLED_SCHEMA), schemaSource);
        }

        log.debug("Loaded manifest from {} and schema from {}", manifestSource, schemaSource);
        return new GovernanceConfig(manifest, schema, manifestSource, schemaSource);
    }

    /** Bundled default manifest, used when scaffolding a project. */
    public byte[] bundledManifest() {
        return readBundledBytes(BUNDLED_MANIFEST);
    }

    /**
     * The manifest shipped with the engine. Project manifests are checked against it.
     */
    public VersionManifest canonicalManifest() {
        return parseManifest(readBundled(BUNDLED_MANIFEST), "classpath:" + BUNDLED_MANIFEST);
    }

    public byte[] bundledSchema() {
        return readBundledBytes(BUNDLED_SCHEMA);
    }

    /**
     * Resolves the schema override: an explicit path in {@code .governance/config.json},
     * then {@code VALIDATION-SCHEMA.json} at the project root. Null means bundled default.
     */
    Path customSchemaPath(Path projectRoot) {
        Path projectConfig = projectRoot.resolve(PROJECT_CONFIG_FILE);
        if (Files.isRegularFile(projectConfig)) {
            JsonNode config = readFile(projectConfig);
            String custom = config.path("validation").path("schema").asText(null);
            if (custom != null && !custom.isBlank()) {
                Path candidate = Path.of(custom);
                if (!candidate.isAbsolute()) {
                    candidate = projectRoot.resolve(candidate).normalize();
                }
                if (!Files.isRegularFile(candidate)) {
                    throw new ConfigurationException("Custom validation schema not found: " + candidate);
                }
                return candidate;
            }
        }
        Path local = projectRoot.resolve(SCHEMA_FILE);
        return Files.isRegularFile(local) ? local : null;
    }

    VersionManifest parseManifest(JsonNode root, String source) {
        JsonNode versions = root.path("versions");
        if (!versions.isObject()) {
            throw new ConfigurationException("Version manifest has no 'versions' object: " + source);
        }
        String protocol = requireVersion(versions, "protocol", source);
        String governance = requireVersion(versions, "governance", source);

        Map<String, ComponentVersion> components = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> it = versions.path("components").fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> e = it.next();
            JsonNode info = e.getValue();
            if (info.isObject() && info.hasNonNull("current")) {
                components.put(e.getKey(), new ComponentVersion(
                        info.get("current").asText(),
                        info.path("previous").asText(null)));
            }
        }
        return new VersionManifest(protocol, governance, components);
    }

    ValidationSchema parseSchema(JsonNode root, String source) {
        JsonNode rules = root.path("validation_rules");
        if (!rules.isObject()) {
            throw new ConfigurationException("Validation schema has no 'validation_rules' object: " + source);
        }

        List<ValidationSchema.RequiredFile> requiredFiles = new ArrayList<>();
        for (JsonNode f : rules.path("document_structure").path("required_files")) {
            String path = f.path("path").asText(null);
            if (path == null || path.isBlank()) {
                throw new ConfigurationException("Required file entry without 'path' in " + source);
            }
            requiredFiles.add(new ValidationSchema.RequiredFile(
                    path, f.path("description").asText(""), strings(f.path("required_sections"))));
        }

        JsonNode completeness = rules.path("quality_metrics").path("documentation_completeness");
        List<String> recommended = strings(completeness.path("recommended_sections"));
        if (recommended.isEmpty()) {
            recommended = List.of("Overview", "Installation", "Usage");
        }
        ValidationSchema.QualityMetrics quality = new ValidationSchema.QualityMetrics(
                completeness.path("minimum_word_count").asInt(0),
                recommended,
                strings(rules.path("quality_metrics").path("consistency_checks").path("terminology_standardization")));

        JsonNode exceptions = rules.path("exception_policy_compliance");
        Map<String, Boolean> structure = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> sections = exceptions.path("policy_structure").fields();
        while (sections.hasNext()) {
            Map.Entry<String, JsonNode> e = sections.next();
            structure.put(e.getKey(), e.getValue().asBoolean(false));
        }
        ValidationSchema.ExceptionPolicies policies = new ValidationSchema.ExceptionPolicies(
                strings(exceptions.path("required_policies")), Collections.unmodifiableMap(structure));

        JsonNode scoring = root.path("scoring_system");
        Map<String, Integer> thresholds = new LinkedHashMap<>();
        for (String grade : GRADES) {
            JsonNode t = scoring.path("grade_thresholds").path(grade).path("min");
            if (!t.isNumber()) {
                throw new ConfigurationException("Grade threshold " + grade + " missing in " + source);
            }
            thresholds.put(grade, t.asInt());
        }
        for (int i = 1; i < GRADES.size(); i++) {
            if (thresholds.get(GRADES.get(i)) >= thresholds.get(GRADES.get(i - 1))) {
                throw new ConfigurationException("Grade thresholds must be in descending order in " + source);
            }
        }

        Map<String, Integer> weights = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> cats = scoring.path("categories").fields();
        while (cats.hasNext()) {
            Map.Entry<String, JsonNode> e = cats.next();
            weights.put(e.getKey(), e.getValue().path("weight").asInt());
        }
        if (!weights.isEmpty()) {
            int total = weights.values().stream().mapToInt(Integer::intValue).sum();
            if (total != 100) {
                throw new ConfigurationException(
                        "Scoring categories must total 100% (currently " + total + "%) in " + source);
            }
        }

        JsonNode header = root.path("schema");
        return new ValidationSchema(
                header.path("name").asText("unnamed"),
                header.path("version").asText(""),
                Collections.unmodifiableList(requiredFiles),
                quality,
                policies,
                Collections.unmodifiableMap(thresholds),
                Collections.unmodifiableMap(weights));
    }

    private String requireVersion(JsonNode versions, String key, String source) {
        String current = versions.path(key).path("current").asText(null);
        if (!SemanticVersions.isValid(current)) {
            throw new ConfigurationException(
                    "Version manifest field versions." + key + ".current is not a semantic version ("
                            + current + ") in " + source);
        }
        return current;
    }

    private static List<String> strings(JsonNode array) {
        List<String> out = new ArrayList<>();
        for (JsonNode n : array) {
            out.add(n.asText());
        }
        return Collections.unmodifiableList(out);
    }

    private JsonNode readFile(Path file) {
        try {
            return mapper.readTree(file.toFile());
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read " + file + ": " + e.getMessage(), e);
        }
    }

    private JsonNode readBundled(String resource) {
        try {
            return mapper.readTree(readBundledBytes(resource));
        } catch (IOException e) {
            throw new ConfigurationException("Bundled " + resource + " is malformed: " + e.getMessage(), e);
        }
    }

    private byte[] readBundledBytes(String resource) {
        try (InputStream in = GovernanceConfigLoader.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                throw new ConfigurationException("Bundled default missing from classpath: " + resource);
            }
            return in.readAllBytes();
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read bundled " + resource, e);
        }
    }
}
