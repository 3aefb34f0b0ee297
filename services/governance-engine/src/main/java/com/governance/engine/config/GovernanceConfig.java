package com.governance.engine.config;

/**
 * Read-only configuration handed to every component for one invocation.
 *
 * @param manifestSource where the manifest was loaded from (a path or {@code classpath:...})
 * @param schemaSource   where the schema was loaded from
 */
public record GovernanceConfig(VersionManifest manifest,
                               ValidationSchema schema,
                               String manifestSource,
                               String schemaSource) {
}
