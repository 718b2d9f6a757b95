package com.gdin.inspection.waterleak.pipeline.context;

import lombok.Getter;
import lombok.Setter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

@Getter
public class PipelineRunStats {

    // 按执行顺序
    private final Map<String, Double> workflowSeconds = Collections.synchronizedMap(new LinkedHashMap<>());

    @Setter
    private double totalSeconds;
}
