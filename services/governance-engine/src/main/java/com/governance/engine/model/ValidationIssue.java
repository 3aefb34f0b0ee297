package com.governance.engine.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * A single validator finding.
 *
 * @param file project-relative path the issue refers to, may be null
 * @param fix  remediation to run when {@code autoFixable}; null otherwise
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ValidationIssue(Severity severity,
                              String category,
                              String message,
                              String file,
                              boolean autoFixable,
                              IssueFix fix) {

    public static ValidationIssue of(Severity severity, String category, String message, String file) {
        return new ValidationIssue(severity, category, message, file, false, null);
    }

    public static ValidationIssue fixable(Severity severity, String category, String message, String file, IssueFix fix) {
        return new ValidationIssue(severity, category, message, file, true, fix);
    }
}
