package com.governance.engine.sync;

import com.governance.engine.config.ComponentVersion;
import com.governance.engine.config.VersionManifest;

import java.util.Locale;
import java.util.Map;

/**
 * Maps a matched version reference to the version the manifest expects for it.
 * Keywords are checked in a fixed order; a reference naming nothing known is not a
 * governed reference and resolves to null rather than to a guess.
 */
final class ExpectedVersionResolver {

    private ExpectedVersionResolver() {
    }

    static String expectedVersion(String matchText, VersionManifest manifest) {
        if (matchText.contains("Protocol") || matchText.contains("SBEP v")) {
            return manifest.protocolVersion();
        }
        if (matchText.contains("Governance")) {
            return manifest.governanceVersion();
        }
        String lower = matchText.toLowerCase(Locale.ROOT);
        for (Map.Entry<String, ComponentVersion> component : manifest.components().entrySet()) {
            if (lower.contains(component.getKey().toLowerCase(Locale.ROOT))) {
                return component.getValue().current();
            }
        }
        return null;
    }
}
