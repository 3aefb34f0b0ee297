package com.governance.engine.audit;

import com.governance.engine.model.AuditCategory;

import java.util.ArrayList;
import java.util.List;

/**
 * Collects findings for one audit category; the score floors at zero.
 */
final class Findings {

    private final String name;
    private final List<String> issues = new ArrayList<>();
    private final List<String> recommendations = new ArrayList<>();
    private int score = 100;

    Findings(String name) {
        this.name = name;
    }

    Findings penalize(int penalty, String issue, String recommendation) {
        issues.add(issue);
        if (recommendation != null) {
            recommendations.add(recommendation);
        }
        score -= penalty;
        return this;
    }

    AuditCategory toCategory() {
        return new AuditCategory(name, Math.max(0, score), List.copyOf(issues), List.copyOf(recommendations));
    }
}
