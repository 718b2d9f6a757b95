package com.gdin.inspection.waterleak.pipeline;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 按名称登记步骤与流水线，运行时再组装。
 */
public class PipelineFactory<C> {

    private final Map<String, WorkflowFunction<C>> workflows = new LinkedHashMap<>();
    private final Map<String, List<String>> pipelines = new LinkedHashMap<>();

    public void register(String name, WorkflowFunction<C> workflow) {
        workflows.put(name, workflow);
    }

    public void registerPipeline(String name, List<String> workflowNames) {
        pipelines.put(name, List.copyOf(workflowNames));
    }

    public boolean hasPipeline(String name) {
        return pipelines.containsKey(name);
    }

    public Pipeline<C> createPipeline(String pipelineName) {
        List<String> names = pipelines.get(pipelineName);
        if (names == null) {
            throw new IllegalStateException("Pipeline not registered: " + pipelineName);
        }
        Pipeline<C> pipeline = new Pipeline<>();
        for (String n : names) {
            WorkflowFunction<C> wf = workflows.get(n);
            if (wf == null) {
                throw new IllegalStateException("Workflow not registered: " + n);
            }
            pipeline.add(n, wf);
        }
        return pipeline;
    }
}
