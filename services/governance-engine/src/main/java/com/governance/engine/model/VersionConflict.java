package com.governance.engine.model;

public record VersionConflict(String file,
                              String currentVersion,
                              String targetVersion,
                              Resolution resolution) {

    public static VersionConflict update(String file, String current, String target) {
        return new VersionConflict(file, current, target, Resolution.UPDATE);
    }

    public String describe() {
        return file + ": " + currentVersion + " should be " + targetVersion;
    }
}
