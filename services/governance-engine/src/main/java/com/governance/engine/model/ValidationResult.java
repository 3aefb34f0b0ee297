package com.governance.engine.model;

import java.util.List;
import java.util.Map;

/**
 * @param categoryScores per-category score before weighting, in evaluation order
 */
public record ValidationResult(int score,
                               Grade grade,
                               List<ValidationIssue> issues,
                               List<String> recommendations,
                               Map<String, Integer> categoryScores) {
}
