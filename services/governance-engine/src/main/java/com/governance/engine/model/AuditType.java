package com.governance.engine.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum AuditType {
    QUALITY,
    COMPLIANCE,
    SECURITY,
    COMPREHENSIVE;

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static AuditType fromCode(String code) {
        for (AuditType t : values()) {
            if (t.code().equalsIgnoreCase(code.trim())) {
                return t;
            }
        }
        throw new IllegalArgumentException("Unknown audit type: " + code);
    }
}
