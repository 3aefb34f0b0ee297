package com.governance.engine.sync;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Ordered version-reference patterns applied to every line of a candidate file.
 */
final class VersionPatterns {

    private static final String SEMVER = "(\\d+\\.\\d+\\.\\d+)";

    static final List<Pattern> ORDERED = List.of(
            // headings and prose
            Pattern.compile("SBEP v" + SEMVER, Pattern.CASE_INSENSITIVE),
            Pattern.compile("Protocol v" + SEMVER, Pattern.CASE_INSENSITIVE),
            Pattern.compile("Governance v" + SEMVER, Pattern.CASE_INSENSITIVE),
            // JSON keys
            Pattern.compile("\"version\":\\s*\"" + SEMVER + "\""),
            Pattern.compile("\"sbep-version\":\\s*\"" + SEMVER + "\""),
            // YAML keys
            Pattern.compile("^version:\\s*" + SEMVER),
            Pattern.compile("^sbep_version:\\s*" + SEMVER),
            // bare mentions
            Pattern.compile("Version:?\\s*" + SEMVER, Pattern.CASE_INSENSITIVE),
            Pattern.compile("v" + SEMVER));

    private VersionPatterns() {
    }
}
