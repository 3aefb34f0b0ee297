package com.governance.engine.model;

import java.time.Instant;
import java.util.List;

public record AuditResult(AuditType type, int score, List<AuditCategory> categories, Instant timestamp) {

    public int totalIssues() {
        return categories.stream().mapToInt(c -> c.issues().size()).sum();
    }

    public int totalRecommendations() {
        return categories.stream().mapToInt(c -> c.recommendations().size()).sum();
    }
}
