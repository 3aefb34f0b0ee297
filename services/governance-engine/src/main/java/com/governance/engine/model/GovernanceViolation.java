package com.governance.engine.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Unified finding across validator, synchronizer and governance-structure checks.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record GovernanceViolation(Severity severity,
                                  String category,
                                  String message,
                                  String file,
                                  boolean autoFixable,
                                  IssueFix fix,
                                  String remediation) {

    public static GovernanceViolation of(Severity severity, String category, String message,
                                         String file, String remediation) {
        return new GovernanceViolation(severity, category, message, file, false, null, remediation);
    }

    public static GovernanceViolation fromIssue(ValidationIssue issue) {
        return new GovernanceViolation(issue.severity(), "validation", issue.message(), issue.file(),
                issue.autoFixable(), issue.fix(), null);
    }
}
