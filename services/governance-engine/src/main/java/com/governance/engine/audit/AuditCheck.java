package com.governance.engine.audit;

import com.governance.engine.config.GovernanceConfig;
import com.governance.engine.model.AuditCategory;

import java.nio.file.Path;

@FunctionalInterface
interface AuditCheck {

    AuditCategory run(Path root, GovernanceConfig config);
}
