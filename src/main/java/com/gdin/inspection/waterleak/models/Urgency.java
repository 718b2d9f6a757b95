package com.gdin.inspection.waterleak.models;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;

import java.util.Locale;

@Getter
public enum Urgency {
    LOW("Monitor for changes"),
    MEDIUM("Schedule inspection within 1 month"),
    HIGH("Schedule inspection within 1 week"),
    CRITICAL("Immediate inspection and repair required");

    private final String recommendedAction;

    Urgency(String recommendedAction) {
        this.recommendedAction = recommendedAction;
    }

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
