package com.gdin.inspection.waterleak.models;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.Map;

/**
 * 单次检测得到的渗漏迹象。
 * confidence 按检测器类型固定，severity 由异常幅值按类型饱和常数归一化。
 */
@Value
@Jacksonized
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class LeakIndicator {

    @JsonProperty("location")
    Coordinate location;

    @JsonProperty("indicator_type")
    IndicatorType indicatorType;

    @JsonProperty("confidence")
    double confidence;

    @JsonProperty("severity")
    double severity;

    @JsonProperty("timestamp")
    Instant timestamp;

    @JsonProperty("image_source")
    String imageSource;

    @JsonProperty("metadata")
    Map<String, Double> metadata;
}
