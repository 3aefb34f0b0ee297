package com.governance.engine.model;

import java.util.List;

public record SyncValidation(boolean valid, List<String> issues, List<VersionConflict> conflicts) {
}
