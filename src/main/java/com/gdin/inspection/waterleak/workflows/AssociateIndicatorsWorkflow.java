package com.gdin.inspection.waterleak.workflows;

import com.gdin.inspection.waterleak.exception.GraphConnectivityException;
import com.gdin.inspection.waterleak.graph.AssociationResult;
import com.gdin.inspection.waterleak.graph.WaterNetworkGraph;
import com.gdin.inspection.waterleak.models.FailureRecord;
import com.gdin.inspection.waterleak.models.LeakIndicator;
import jakarta.annotation.Resource;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Collections;
import java.util.List;

@Slf4j
@Service
public class AssociateIndicatorsWorkflow {

    @Resource
    private WaterNetworkGraph waterNetworkGraph;

    public Result run(List<LeakIndicator> indicators) {
        AssociationResult association;
        try {
            association = waterNetworkGraph.associateIndicators(indicators);
        } catch (GraphConnectivityException e) {
            // 图存储不可达时迹象全部视为未关联，管段仍按资产属性评估
            log.warn("associate_indicators: {}", e.getMessage());
            AssociationResult none = new AssociationResult(Collections.emptyMap(),
                    indicators == null ? Collections.emptyList() : List.copyOf(indicators), FailureRecord.of(e));
            return new Result(none, none.getFailure());
        }
        if (association.getFailure() != null) {
            log.warn("associate_indicators: 写入中断，保留关联 {} 条，未关联 {} 条",
                    association.linkedTotal(), association.getUnassociated().size());
        }
        return new Result(association, association.getFailure());
    }

    @Value
    public static class Result {
        AssociationResult association;
        FailureRecord failure;
    }
}
