package com.governance.engine.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.List;

/**
 * @param lastAudit modification time of the audit log, null when no audit has run
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record GovernanceStatus(String protocolVersion,
                               String governanceVersion,
                               int complianceScore,
                               int trackedFiles,
                               List<String> issues,
                               Instant lastAudit) {
}
