package com.gdin.inspection.waterleak.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum IndicatorType {
    THERMAL,
    VEGETATION,
    SUBSIDENCE,
    PONDING;

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static IndicatorType fromCode(String code) {
        if (code == null) {
            throw new IllegalArgumentException("indicator type code is null");
        }
        return IndicatorType.valueOf(code.trim().toUpperCase(Locale.ROOT));
    }
}
