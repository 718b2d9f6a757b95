package com.gdin.inspection.waterleak.workflows;

import cn.hutool.core.collection.CollectionUtil;
import com.gdin.inspection.waterleak.exception.RiskException;
import com.gdin.inspection.waterleak.graph.WaterNetworkGraph;
import com.gdin.inspection.waterleak.models.FailureRecord;
import com.gdin.inspection.waterleak.models.Junction;
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

/**
 * 重建管网拓扑。单个管段写入失败（端点缺失、图存储不可达）只影响该管段。
 */
@Slf4j
@Service
public class BuildNetworkWorkflow {

    @Resource
    private WaterNetworkGraph waterNetworkGraph;

    public Result run(List<Junction> junctions, List<PipelineSegment> segments) {
        List<PipelineSegment> input = segments == null ? Collections.emptyList() : segments;
        Map<String, FailureRecord> failures = new LinkedHashMap<>();

        try {
            waterNetworkGraph.reset();
        } catch (RiskException e) {
            log.warn("build_network: 清空图存储失败 {}", e.getMessage());
            for (PipelineSegment s : input) failures.put(s.getSegmentId(), FailureRecord.of(e));
            return new Result(Collections.emptyList(), failures);
        }

        if (CollectionUtil.isNotEmpty(junctions)) {
            for (Junction j : junctions) {
                try {
                    waterNetworkGraph.addJunction(j);
                } catch (RiskException e) {
                    // 依赖该节点的管段会在下面以拓扑错误失败
                    log.warn("build_network: 节点 {} 写入失败 {}", j.getJunctionId(), e.getMessage());
                }
            }
        }

        List<PipelineSegment> built = new ArrayList<>();
        for (PipelineSegment s : input) {
            try {
                waterNetworkGraph.addSegment(s);
                built.add(s);
            } catch (RiskException e) {
                failures.put(s.getSegmentId(), FailureRecord.of(e));
                log.warn("build_network: 管段 {} 写入失败 [{}] {}", s.getSegmentId(), e.getKind(), e.getMessage());
            }
        }
        log.info("build_network done: junctions={}, segments={}, failed={}",
                junctions == null ? 0 : junctions.size(), built.size(), failures.size());
        return new Result(Collections.unmodifiableList(built), failures);
    }

    @Value
    public static class Result {
        List<PipelineSegment> segments;
        Map<String, FailureRecord> failures;
    }
}
