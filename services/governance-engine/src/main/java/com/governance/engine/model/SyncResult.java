package com.governance.engine.model;

import java.util.List;

/**
 * @param updated   number of conflicts applied (or that would be applied on a dry run)
 * @param skipped   scanned files that were not rewritten
 * @param conflicts conflicts left for the caller: all of them when not forced, failed ones otherwise
 */
public record SyncResult(int updated, int skipped, List<VersionConflict> conflicts) {
}
