package com.gdin.inspection.waterleak.run;

import cn.hutool.core.collection.CollectionUtil;
import com.gdin.inspection.waterleak.config.properties.RiskProperties;
import com.gdin.inspection.waterleak.exception.RiskException;
import com.gdin.inspection.waterleak.feed.AssetFeed;
import com.gdin.inspection.waterleak.graph.AssociationResult;
import com.gdin.inspection.waterleak.models.DefectProbability;
import com.gdin.inspection.waterleak.models.FailureRecord;
import com.gdin.inspection.waterleak.models.IndicatorType;
import com.gdin.inspection.waterleak.models.Junction;
import com.gdin.inspection.waterleak.models.LeakIndicator;
import com.gdin.inspection.waterleak.models.PipelineSegment;
import com.gdin.inspection.waterleak.models.RiskReport;
import com.gdin.inspection.waterleak.pipeline.Pipeline;
import com.gdin.inspection.waterleak.pipeline.PipelineFactory;
import com.gdin.inspection.waterleak.pipeline.context.PipelineRunContext;
import com.gdin.inspection.waterleak.pipeline.context.PipelineRunResult;
import com.gdin.inspection.waterleak.pipeline.context.RunPipeline;
import com.gdin.inspection.waterleak.raster.AcquisitionPass;
import jakarta.annotation.Resource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 风险评估入口：把输入放进上下文，执行流水线，汇总为 {@link RiskReport}。
 * 各次运行共用同一张管网图（建图会先清空），因此整条流水线按运行串行执行。
 */
@Slf4j
@Service
public class RiskPipelineRunner {

    @Resource
    private RiskProperties riskProperties;

    @Resource
    private PipelineFactory<RiskProperties> factory;

    // 建图 -> 关联 -> 评估 期间图中只能有本次运行的拓扑
    private final ReentrantLock runLock = new ReentrantLock(true);

    public RiskReport run(AcquisitionPass pass, AssetFeed feed) {
        return run(pass, feed.junctions(), feed.segments());
    }

    public RiskReport run(AcquisitionPass pass, List<Junction> junctions, List<PipelineSegment> segments) {
        return run(pass, junctions, segments, riskProperties.getPipeline().getName());
    }

    public RiskReport run(AcquisitionPass pass, List<Junction> junctions, List<PipelineSegment> segments,
                          String pipelineName) {
        PipelineRunContext ctx = new PipelineRunContext();
        ctx.put("acquisition_pass", pass == null ? AcquisitionPass.empty() : pass);
        ctx.put("junctions", junctions == null ? Collections.emptyList() : junctions);
        ctx.put("segments", segments == null ? Collections.emptyList() : segments);

        Pipeline<RiskProperties> pipeline = factory.createPipeline(pipelineName);
        log.info("risk pipeline {} start: segments={}, bands={}", pipelineName,
                segments == null ? 0 : segments.size(), ctx.<AcquisitionPass>get("acquisition_pass").bandTypes());
        List<PipelineRunResult> results;
        runLock.lock();
        try {
            results = new RunPipeline<RiskProperties>().run(pipeline, riskProperties, ctx);
        } finally {
            runLock.unlock();
        }

        PipelineRunResult last = CollectionUtil.isEmpty(results) ? null : results.get(results.size() - 1);
        String error = null;
        if (last != null && last.failed()) {
            Exception e = last.getErrors().get(0);
            error = last.getWorkflow() + ": " + (e instanceof RiskException ? e.toString() : String.valueOf(e));
        }

        RiskReport report = toReport(ctx, error);
        log.info("risk pipeline {} finished: worklist={}, failedSegments={}, completed={}, {}s", pipelineName,
                report.getWorklist().size(), report.getFailedSegments().size(), report.isCompleted(),
                report.getTotalSeconds());
        return report;
    }

    private RiskReport toReport(PipelineRunContext ctx, String error) {
        Map<String, FailureRecord> failed = new LinkedHashMap<>();
        Map<String, FailureRecord> buildFailures = ctx.get("failed_segments");
        Map<String, FailureRecord> analysisFailures = ctx.get("analysis_failures");
        if (buildFailures != null) failed.putAll(buildFailures);
        if (analysisFailures != null) failed.putAll(analysisFailures);

        Map<IndicatorType, FailureRecord> detectorFailures = toRecords(ctx.get("detector_failures"));
        Map<IndicatorType, FailureRecord> missingInputs = toRecords(ctx.get("missing_inputs"));

        AssociationResult association = ctx.get("association");
        List<LeakIndicator> indicators = ctx.getOrDefault("indicators", Collections.emptyList());
        List<DefectProbability> worklist = ctx.getOrDefault("worklist", Collections.emptyList());
        Map<IndicatorType, Integer> counts = ctx.getOrDefault("indicator_counts", Collections.emptyMap());

        return RiskReport.builder()
                .parameterVersion(riskProperties.getVersion())
                .worklist(worklist)
                .failedSegments(failed)
                .detectorFailures(detectorFailures)
                .missingInputs(missingInputs)
                .indicators(indicators)
                .indicatorCounts(counts)
                .unassociated(association == null ? indicators : association.getUnassociated())
                .associationCounts(association == null ? Collections.emptyMap() : association.getLinkedCounts())
                .associationFailure(ctx.get("association_failure"))
                .indicatorLookupFailure(ctx.get("indicator_lookup_failure"))
                .workflowSeconds(new LinkedHashMap<>(ctx.getStats().getWorkflowSeconds()))
                .totalSeconds(ctx.getStats().getTotalSeconds())
                .completed(error == null)
                .error(error)
                .build();
    }

    private static Map<IndicatorType, FailureRecord> toRecords(Map<IndicatorType, RiskException> errors) {
        Map<IndicatorType, FailureRecord> out = new EnumMap<>(IndicatorType.class);
        if (errors != null) {
            errors.forEach((type, e) -> out.put(type, FailureRecord.of(e)));
        }
        return out;
    }
}
