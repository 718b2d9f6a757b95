package com.gdin.inspection.waterleak.util;

import com.gdin.inspection.waterleak.models.DefectProbability;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * 巡检工单导出为 CSV，列顺序固定，行顺序与工单一致。
 */
public final class WorklistCsvExporter {
    private WorklistCsvExporter() {}

    public static final List<String> HEADERS = List.of(
            "rank",
            "segment_id",
            "probability",
            "urgency",
            "recommended_action",
            DefectProbability.FACTOR_AGE_YEARS,
            DefectProbability.FACTOR_MATERIAL_VULNERABILITY,
            DefectProbability.FACTOR_HISTORICAL_LEAKS,
            DefectProbability.FACTOR_INDICATOR_COUNT,
            DefectProbability.FACTOR_AVG_SEVERITY
    );

    public static String export(List<DefectProbability> worklist) {
        List<Map<String, Object>> rows = new ArrayList<>();
        int rank = 1;
        for (DefectProbability p : worklist) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("rank", rank++);
            row.put("segment_id", p.getSegmentId());
            row.put("probability", String.format(Locale.ROOT, "%.4f", p.getProbability()));
            row.put("urgency", p.getUrgency().code());
            row.put("recommended_action", p.getRecommendedAction());
            Map<String, Double> factors = p.getContributingFactors();
            for (String key : HEADERS.subList(5, HEADERS.size())) {
                row.put(key, factors == null ? null : factors.get(key));
            }
            rows.add(row);
        }
        return CsvUtil.toCsv(rows, HEADERS);
    }
}
