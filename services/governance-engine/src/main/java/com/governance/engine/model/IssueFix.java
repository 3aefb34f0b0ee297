package com.governance.engine.model;

/**
 * Remediations the engine knows how to perform for an auto-fixable finding.
 */
public enum IssueFix {
    ARCHIVE_OBSOLETE_FILES,
    ADD_README_SECTION,
    ADD_CROSS_REFERENCES,
    CREATE_ARCHIVE_DIRECTORY,
    RESTORE_MANIFEST,
    RESTORE_SCHEMA
}
