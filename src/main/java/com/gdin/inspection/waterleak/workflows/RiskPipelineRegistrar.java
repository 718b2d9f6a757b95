package com.gdin.inspection.waterleak.workflows;

import com.gdin.inspection.waterleak.config.properties.RiskProperties;
import com.gdin.inspection.waterleak.detect.IndicatorAggregator;
import com.gdin.inspection.waterleak.models.DefectProbability;
import com.gdin.inspection.waterleak.pipeline.PipelineFactory;
import com.gdin.inspection.waterleak.pipeline.WorkflowFunctionOutput;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.Resource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

@Slf4j
@Component
public class RiskPipelineRegistrar {

    public static final String STANDARD = "standard";
    // 只做检测与关联，不评分
    public static final String DETECT_ONLY = "detect_only";

    @Resource
    private DetectIndicatorsWorkflow detectIndicatorsWorkflow;
    @Resource
    private BuildNetworkWorkflow buildNetworkWorkflow;
    @Resource
    private AssociateIndicatorsWorkflow associateIndicatorsWorkflow;
    @Resource
    private AnalyzeSegmentsWorkflow analyzeSegmentsWorkflow;
    @Resource
    private PrioritizeWorkflow prioritizeWorkflow;

    @Resource
    private PipelineFactory<RiskProperties> factory;

    @PostConstruct
    public void init() {

        // 1) detect_indicators
        factory.register("detect_indicators", (cfg, ctx) -> {
            IndicatorAggregator.Result out = detectIndicatorsWorkflow.run(ctx.get("acquisition_pass"));
            ctx.put("indicators", out.getIndicators());
            ctx.put("indicator_counts", out.getCounts());
            ctx.put("detector_failures", out.getFailures());
            ctx.put("missing_inputs", out.getMissingInputs());
            return WorkflowFunctionOutput.done("detect_indicators_done");
        });

        // 2) build_network：没有任何管段可评估时提前结束
        factory.register("build_network", (cfg, ctx) -> {
            BuildNetworkWorkflow.Result out = buildNetworkWorkflow.run(ctx.get("junctions"), ctx.get("segments"));
            ctx.put("network_segments", out.getSegments());
            ctx.put("failed_segments", out.getFailures());
            if (out.getSegments().isEmpty()) {
                return WorkflowFunctionOutput.halt("build_network_empty");
            }
            return WorkflowFunctionOutput.done("build_network_done");
        });

        // 3) associate_indicators
        factory.register("associate_indicators", (cfg, ctx) -> {
            AssociateIndicatorsWorkflow.Result out = associateIndicatorsWorkflow.run(ctx.get("indicators"));
            ctx.put("association", out.getAssociation());
            ctx.put("association_failure", out.getFailure());
            return WorkflowFunctionOutput.done("associate_indicators_done");
        });

        // 4) analyze_segments
        factory.register("analyze_segments", (cfg, ctx) -> {
            AnalyzeSegmentsWorkflow.Result out = analyzeSegmentsWorkflow.run(
                    ctx.get("network_segments"),
                    cfg.getPipeline().getConcurrency()
            );
            ctx.put("probabilities", out.getProbabilities());
            ctx.put("analysis_failures", out.getFailures());
            ctx.put("indicator_lookup_failure", out.getLookupFailure());
            return WorkflowFunctionOutput.done("analyze_segments_done");
        });

        // 5) prioritize
        factory.register("prioritize", (cfg, ctx) -> {
            List<DefectProbability> worklist = prioritizeWorkflow.run(ctx.get("probabilities"));
            ctx.put("worklist", worklist);
            return WorkflowFunctionOutput.done("prioritize_done");
        });

        factory.registerPipeline(STANDARD, List.of(
                "detect_indicators",
                "build_network",
                "associate_indicators",
                "analyze_segments",
                "prioritize"
        ));

        factory.registerPipeline(DETECT_ONLY, List.of(
                "detect_indicators",
                "build_network",
                "associate_indicators"
        ));
        log.debug("risk pipelines registered: {}, {}", STANDARD, DETECT_ONLY);
    }
}
