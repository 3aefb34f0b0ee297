package com.governance.engine.model;

import java.util.List;

public record AuditCategory(String name, int score, List<String> issues, List<String> recommendations) {
}
