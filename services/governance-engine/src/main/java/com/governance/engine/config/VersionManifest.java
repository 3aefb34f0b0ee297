package com.governance.engine.config;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Canonical record of the protocol, governance and per-component versions.
 * Component iteration order follows the order of the manifest file.
 */
public record VersionManifest(String protocolVersion,
                              String governanceVersion,
                              Map<String, ComponentVersion> components) {

    public VersionManifest {
        components = Collections.unmodifiableMap(new LinkedHashMap<>(components));
    }

    public String componentVersion(String name) {
        ComponentVersion v = components.get(name);
        return v == null ? null : v.current();
    }
}
