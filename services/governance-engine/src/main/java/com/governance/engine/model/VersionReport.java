package com.governance.engine.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * @param manifestVersions protocol, governance and a nested map of component versions
 * @param inSync           true when no conflicts were found
 * @param score            {@code max(0, 100 - 10 * conflicts)}
 */
public record VersionReport(Instant timestamp,
                            Map<String, Object> manifestVersions,
                            int filesScanned,
                            List<VersionConflict> conflicts,
                            @JsonProperty("synchronized") boolean inSync,
                            int score) {
}
