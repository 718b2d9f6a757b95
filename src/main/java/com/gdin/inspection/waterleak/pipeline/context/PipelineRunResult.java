package com.gdin.inspection.waterleak.pipeline.context;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class PipelineRunResult {
    String workflow;
    Object result;
    PipelineRunContext context;
    List<Exception> errors;

    public boolean failed() {
        return errors != null && !errors.isEmpty();
    }
}
