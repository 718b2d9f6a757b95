package com.gdin.inspection.waterleak.models;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;
import java.util.Map;

/**
 * 一次完整运行的结果。worklist 按概率降序，概率相同保持输入管段顺序。
 */
@Value
@Jacksonized
@Builder
public class RiskReport {

    @JsonProperty("parameter_version")
    String parameterVersion;

    @JsonProperty("worklist")
    List<DefectProbability> worklist;

    @JsonProperty("failed_segments")
    Map<String, FailureRecord> failedSegments;

    @JsonProperty("detector_failures")
    Map<IndicatorType, FailureRecord> detectorFailures;

    // 因缺少波段被跳过的检测器，不视为失败
    @JsonProperty("missing_inputs")
    Map<IndicatorType, FailureRecord> missingInputs;

    @JsonProperty("indicators")
    List<LeakIndicator> indicators;

    @JsonProperty("indicator_counts")
    Map<IndicatorType, Integer> indicatorCounts;

    @JsonProperty("unassociated")
    List<LeakIndicator> unassociated;

    @JsonProperty("association_counts")
    Map<String, Integer> associationCounts;

    @JsonProperty("association_failure")
    FailureRecord associationFailure;

    // 评估时无法从图中读取迹象，相关管段仅按资产属性评分
    @JsonProperty("indicator_lookup_failure")
    FailureRecord indicatorLookupFailure;

    @JsonProperty("workflow_seconds")
    Map<String, Double> workflowSeconds;

    @JsonProperty("total_seconds")
    double totalSeconds;

    // 流水线中途异常时为 false，error 为异常信息
    @JsonProperty("completed")
    boolean completed;

    @JsonProperty("error")
    String error;
}
