package com.governance.engine.model;

public record RepositoryStatus(boolean hasRemoteUpdates,
                               String remoteBranch,
                               int commitsBehind,
                               int commitsAhead) {
}
