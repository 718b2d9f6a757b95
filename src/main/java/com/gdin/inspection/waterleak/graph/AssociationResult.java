package com.gdin.inspection.waterleak.graph;

import com.gdin.inspection.waterleak.models.FailureRecord;
import com.gdin.inspection.waterleak.models.LeakIndicator;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * 一次关联批次的结果。linkedCounts 按管段写入顺序，只含至少关联到一个迹象的管段。
 * failure 非空表示写入中途失败：linkedCounts 只统计最终留在图中的关联。
 */
@Value
public class AssociationResult {
    Map<String, Integer> linkedCounts;
    List<LeakIndicator> unassociated;
    FailureRecord failure;

    public static AssociationResult of(Map<String, Integer> linkedCounts, List<LeakIndicator> unassociated) {
        return new AssociationResult(linkedCounts, unassociated, null);
    }

    public int linkedTotal() {
        return linkedCounts.values().stream().mapToInt(Integer::intValue).sum();
    }
}
