package com.governance.engine.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum Resolution {
    UPDATE,
    IGNORE;

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
