package com.governance.engine.config;

import java.util.List;
import java.util.Map;

/**
 * Declarative rule set consumed by the validator and auditor.
 */
public record ValidationSchema(String name,
                               String version,
                               List<RequiredFile> requiredFiles,
                               QualityMetrics qualityMetrics,
                               ExceptionPolicies exceptionPolicies,
                               Map<String, Integer> gradeThresholds,
                               Map<String, Integer> categoryWeights) {

    public record RequiredFile(String path, String description, List<String> requiredSections) {
    }

    public record QualityMetrics(int minimumWordCount,
                                 List<String> recommendedSections,
                                 List<String> terminology) {
    }

    /**
     * @param policyStructure section key to "required" flag, in declaration order
     */
    public record ExceptionPolicies(List<String> requiredPolicies, Map<String, Boolean> policyStructure) {
    }

    /**
     * Weight of a category in whole percent, or {@code fallback} when the schema does not
     * declare one.
     */
    public int categoryWeight(String category, int fallback) {
        return categoryWeights.getOrDefault(category, fallback);
    }

    public int gradeMinimum(String grade) {
        Integer min = gradeThresholds.get(grade);
        if (min == null) {
            throw new ConfigurationException("Grade threshold missing for " + grade);
        }
        return min;
    }
}
