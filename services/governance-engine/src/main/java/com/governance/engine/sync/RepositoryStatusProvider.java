package com.governance.engine.sync;

import com.governance.engine.model.RepositoryStatus;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Narrow capability for the shallow ahead/behind check. Implementations never throw:
 * any failure is reported as an empty result.
 */
public interface RepositoryStatusProvider {

    Optional<RepositoryStatus> getRepositoryStatus(Path projectRoot);

    static RepositoryStatusProvider none() {
        return root -> Optional.empty();
    }
}
