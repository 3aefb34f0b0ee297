package com.governance.engine.model;

/**
 * @param projectName overrides the name derived from the project directory, may be null
 */
public record InitOptions(boolean force, String projectName) {

    public static InitOptions defaults() {
        return new InitOptions(false, null);
    }
}
