package com.gdin.inspection.waterleak.models;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Map;

/**
 * 单个管段的推理结果。每次输入变化都重新生成，不做修改。
 */
@Value
@Jacksonized
@Builder
public class DefectProbability {

    public static final String FACTOR_AGE_YEARS = "age_years";
    public static final String FACTOR_MATERIAL_VULNERABILITY = "material_vulnerability";
    public static final String FACTOR_HISTORICAL_LEAKS = "historical_leaks";
    public static final String FACTOR_INDICATOR_COUNT = "indicator_count";
    public static final String FACTOR_AVG_SEVERITY = "avg_severity";

    @JsonProperty("segment_id")
    String segmentId;

    @JsonProperty("probability")
    double probability;

    @JsonProperty("contributing_factors")
    Map<String, Double> contributingFactors;

    @JsonProperty("recommended_action")
    String recommendedAction;

    @JsonProperty("urgency")
    Urgency urgency;
}
