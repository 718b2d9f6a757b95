package com.gdin.inspection.waterleak.pipeline;

import com.gdin.inspection.waterleak.pipeline.context.PipelineRunContext;

/**
 * 流水线中的一个步骤。config 为本次运行使用的参数集，步骤间通过 context 传递数据。
 */
public interface WorkflowFunction<C> {
    WorkflowFunctionOutput run(C config, PipelineRunContext context) throws Exception;
}
