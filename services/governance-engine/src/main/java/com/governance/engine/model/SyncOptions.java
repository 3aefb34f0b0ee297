package com.governance.engine.model;

/**
 * @param dryRun       analyze and count, never write
 * @param force        apply even when conflicts were found
 * @param ignoreRemote skip the repository status check
 */
public record SyncOptions(boolean dryRun, boolean force, boolean ignoreRemote) {

    public static SyncOptions defaults() {
        return new SyncOptions(false, false, false);
    }

    public static SyncOptions forced() {
        return new SyncOptions(false, true, false);
    }

    public static SyncOptions preview() {
        return new SyncOptions(true, true, false);
    }
}
