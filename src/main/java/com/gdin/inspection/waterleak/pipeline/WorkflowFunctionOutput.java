package com.gdin.inspection.waterleak.pipeline;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class WorkflowFunctionOutput {
    Object result;
    // true 时后续步骤不再执行
    @Builder.Default
    boolean stop = false;

    public static WorkflowFunctionOutput done(Object result) {
        return WorkflowFunctionOutput.builder().result(result).build();
    }

    public static WorkflowFunctionOutput halt(Object result) {
        return WorkflowFunctionOutput.builder().result(result).stop(true).build();
    }
}
