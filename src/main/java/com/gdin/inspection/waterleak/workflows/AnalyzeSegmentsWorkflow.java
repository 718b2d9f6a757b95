package com.gdin.inspection.waterleak.workflows;

import cn.hutool.core.collection.CollectionUtil;
import com.gdin.inspection.waterleak.exception.ErrorKind;
import com.gdin.inspection.waterleak.exception.GraphConnectivityException;
import com.gdin.inspection.waterleak.exception.RiskException;
import com.gdin.inspection.waterleak.fuzzy.FuzzyDefectAnalyzer;
import com.gdin.inspection.waterleak.graph.WaterNetworkGraph;
import com.gdin.inspection.waterleak.models.DefectProbability;
import com.gdin.inspection.waterleak.models.FailureRecord;
import com.gdin.inspection.waterleak.models.LeakIndicator;
import com.gdin.inspection.waterleak.models.PipelineSegment;
import jakarta.annotation.Resource;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 并发评估每个管段：从图中取关联迹象 -> 模糊推理。
 * 结果按输入管段顺序返回，单个管段失败记录到 failures。
 * 图存储读不到迹象时按无迹象评估（仅资产属性），并记录 lookupFailure。
 */
@Slf4j
@Service
public class AnalyzeSegmentsWorkflow {

    @Resource
    private WaterNetworkGraph waterNetworkGraph;

    @Resource
    private FuzzyDefectAnalyzer fuzzyDefectAnalyzer;

    public Result run(List<PipelineSegment> segments, Integer concurrency) {
        if (CollectionUtil.isEmpty(segments)) {
            return new Result(Collections.emptyList(), Collections.emptyMap(), null);
        }
        int threads = Math.max(1, Math.min(segments.size(), concurrency == null ? 1 : concurrency));
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        AtomicReference<GraphConnectivityException> lookupFailure = new AtomicReference<>();

        try {
            List<CompletableFuture<DefectProbability>> futures = new ArrayList<>(segments.size());
            for (PipelineSegment segment : segments) {
                futures.add(CompletableFuture.supplyAsync(() -> analyzeOne(segment, lookupFailure), pool));
            }

            List<DefectProbability> out = new ArrayList<>(segments.size());
            Map<String, FailureRecord> failures = new LinkedHashMap<>();
            for (int i = 0; i < segments.size(); i++) {
                String segmentId = segments.get(i).getSegmentId();
                try {
                    out.add(futures.get(i).join());
                } catch (CompletionException e) {
                    RiskException failure = e.getCause() instanceof RiskException
                            ? (RiskException) e.getCause()
                            : new RiskException(ErrorKind.MALFORMED_INPUT, "segment " + segmentId + ": " + e.getCause(), e.getCause());
                    failures.put(segmentId, FailureRecord.of(failure));
                    log.warn("analyze_segments: 管段 {} 评估失败 [{}] {}", segmentId, failure.getKind(), failure.getMessage());
                }
            }
            GraphConnectivityException lookupError = lookupFailure.get();
            if (lookupError != null) {
                log.warn("analyze_segments: 图存储不可读，管段仅按资产属性评估：{}", lookupError.getMessage());
            }
            log.info("analyze_segments done: analyzed={}, failed={}", out.size(), failures.size());
            return new Result(out, failures, lookupError == null ? null : FailureRecord.of(lookupError));
        } finally {
            pool.shutdown();
        }
    }

    private DefectProbability analyzeOne(PipelineSegment segment, AtomicReference<GraphConnectivityException> lookupFailure) {
        List<LeakIndicator> indicators;
        try {
            indicators = waterNetworkGraph.indicatorsFor(segment.getSegmentId());
        } catch (GraphConnectivityException e) {
            lookupFailure.compareAndSet(null, e);
            indicators = Collections.emptyList();
        }
        return fuzzyDefectAnalyzer.analyze(segment, indicators);
    }

    @Value
    public static class Result {
        List<DefectProbability> probabilities;
        Map<String, FailureRecord> failures;
        FailureRecord lookupFailure;
    }
}
