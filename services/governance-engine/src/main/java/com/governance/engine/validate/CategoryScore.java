package com.governance.engine.validate;

import com.governance.engine.model.IssueFix;
import com.governance.engine.model.Severity;
import com.governance.engine.model.ValidationIssue;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Running score for one category: starts at 100, each finding subtracts its penalty.
 */
final class CategoryScore {

    private final ValidationCategory category;
    private final List<ValidationIssue> issues = new ArrayList<>();
    private int score = 100;

    CategoryScore(ValidationCategory category) {
        this.category = category;
    }

    void deduct(int penalty, Severity severity, String message, String file) {
        issues.add(ValidationIssue.of(severity, category.id(), message, file));
        score -= penalty;
    }

    void deductFixable(int penalty, Severity severity, String message, String file, IssueFix fix) {
        issues.add(ValidationIssue.fixable(severity, category.id(), message, file, fix));
        score -= penalty;
    }

    ValidationCategory category() {
        return category;
    }

    int score() {
        return Math.max(0, score);
    }

    List<ValidationIssue> issues() {
        return Collections.unmodifiableList(issues);
    }
}
