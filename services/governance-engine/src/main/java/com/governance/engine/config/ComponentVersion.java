package com.governance.engine.config;

public record ComponentVersion(String current, String previous) {
}
