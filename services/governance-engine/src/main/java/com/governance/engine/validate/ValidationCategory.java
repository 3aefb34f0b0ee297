package com.governance.engine.validate;

/**
 * The five weighted validator categories, in evaluation order. Weights are whole
 * percentages and sum to 100.
 */
public enum ValidationCategory {
    DOCUMENT_STRUCTURE("document_structure", 25,
            "Ensure all required governance documentation files are present and properly structured"),
    VERSION_CONSISTENCY("version_consistency", 20,
            "Synchronize all version references to use VERSION-MANIFEST.json as single source of truth"),
    QUALITY_METRICS("quality_metrics", 25,
            "Improve documentation completeness and cross-referencing"),
    SAFETY_COMPLIANCE("safety_compliance", 15,
            "Implement proper rollback procedures and housekeeping processes"),
    EXCEPTION_POLICIES("exception_policies", 15,
            "Create and maintain required exception policies for edge cases");

    private final String id;
    private final int weightPercent;
    private final String recommendation;

    ValidationCategory(String id, int weightPercent, String recommendation) {
        this.id = id;
        this.weightPercent = weightPercent;
        this.recommendation = recommendation;
    }

    public String id() {
        return id;
    }

    public int weightPercent() {
        return weightPercent;
    }

    public double weight() {
        return weightPercent / 100.0;
    }

    public String recommendation() {
        return recommendation;
    }

    public static ValidationCategory byId(String id) {
        for (ValidationCategory c : values()) {
            if (c.id.equals(id)) {
                return c;
            }
        }
        return null;
    }
}
