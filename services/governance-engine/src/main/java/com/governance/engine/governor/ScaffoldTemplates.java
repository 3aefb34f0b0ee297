package com.governance.engine.governor;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * Classpath templates for {@code init}. Placeholders are written as {@code {{name}}}.
 */
public class ScaffoldTemplates {

    static final String MANDATE = "governance/templates/SBEP-MANDATE.md.tmpl";
    static final String INDEX = "governance/templates/SBEP-INDEX.yaml.tmpl";

    public String mandate(Map<String, String> values) {
        return render(load(MANDATE), values);
    }

    public String index(Map<String, String> values) {
        return render(load(INDEX), values);
    }

    static String render(String template, Map<String, String> values) {
        String out = template;
        for (Map.Entry<String, String> e : values.entrySet()) {
            out = out.replace("{{" + e.getKey() + "}}", e.getValue());
        }
        return out;
    }

    private static String load(String resource) {
        try (InputStream in = ScaffoldTemplates.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalStateException("Template missing from classpath: " + resource);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read template " + resource, e);
        }
    }
}
