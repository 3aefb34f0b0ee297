package com.governance.engine.grpc;

import com.governance.engine.model.GovernanceViolation;

import java.util.List;

/**
 * Request and response envelopes of the {@code governance.engine.GovernanceEngine} service.
 * A missing {@code projectPath} means the configured project root.
 */
public final class GovernanceMessages {

    private GovernanceMessages() {
    }

    public record ProjectRequest(String projectPath) {
    }

    /**
     * @param reportPath optional file, relative to the project, receiving the JSON validation report
     */
    public record ValidateRequest(String projectPath, boolean fix, String reportPath) {
    }

    public record SyncRequest(String projectPath, boolean dryRun, boolean force, boolean ignoreRemote) {
    }

    public record AuditRequest(String projectPath, String type, String outputPath) {
    }

    public record ComplianceRequest(String projectPath, boolean strict) {
    }

    public record InitRequest(String projectPath, boolean force, String projectName) {
    }

    public record ComplianceResponse(List<GovernanceViolation> violations) {
    }

    public record RemediationResponse(int found, int fixed, List<GovernanceViolation> remaining) {
    }
}
