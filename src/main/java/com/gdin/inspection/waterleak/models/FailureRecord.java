package com.gdin.inspection.waterleak.models;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.gdin.inspection.waterleak.exception.ErrorKind;
import com.gdin.inspection.waterleak.exception.RiskException;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * 报告中的单条失败记录（检测器或管段）。
 */
@Value
@Jacksonized
@Builder
public class FailureRecord {

    @JsonProperty("kind")
    ErrorKind kind;

    @JsonProperty("message")
    String message;

    public static FailureRecord of(RiskException e) {
        return new FailureRecord(e.getKind(), e.getMessage());
    }
}
