package com.gdin.inspection.waterleak.fuzzy;

import cn.hutool.core.collection.CollectionUtil;
import cn.hutool.core.util.StrUtil;
import com.gdin.inspection.waterleak.config.properties.RiskProperties;
import com.gdin.inspection.waterleak.models.DefectProbability;
import com.gdin.inspection.waterleak.models.LeakIndicator;
import com.gdin.inspection.waterleak.models.PipelineSegment;
import com.gdin.inspection.waterleak.models.Urgency;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * 模糊推理：年龄/迹象数量模糊化 -> 规则库 (min × weight) -> 取最大值去模糊 -> 材质与历史渗漏修正 -> 紧急程度。
 * 无状态，可并发调用。
 */
@Slf4j
@Component
public class FuzzyDefectAnalyzer {

    private final RiskProperties riskProperties;

    public FuzzyDefectAnalyzer(RiskProperties riskProperties) {
        this.riskProperties = riskProperties;
    }

    public Map<String, Double> fuzzifyAge(double ageYears) {
        return fuzzify(riskProperties.getFuzzy().getAgeSets(), ageYears);
    }

    public Map<String, Double> fuzzifyIndicatorCount(int count) {
        return fuzzify(riskProperties.getFuzzy().getIndicatorCountSets(), count);
    }

    /**
     * 材质易损度，大小写不敏感，空格和连字符视为下划线。未登记材质取 unknown 值。
     */
    public double materialVulnerability(String material) {
        RiskProperties.Fuzzy fuzzy = riskProperties.getFuzzy();
        if (StrUtil.isBlank(material)) {
            return fuzzy.getUnknownMaterialVulnerability();
        }
        String key = material.trim().toLowerCase(Locale.ROOT).replaceAll("[\\s\\-]+", "_");
        Double v = fuzzy.getMaterialVulnerability().get(key);
        return v != null ? v : fuzzy.getUnknownMaterialVulnerability();
    }

    /**
     * 规则库输出的最大值；所有规则强度为 0 时返回默认基准概率。
     */
    public double applyRules(Map<String, Double> ageFuzzy, Map<String, Double> indicatorFuzzy) {
        RiskProperties.Fuzzy fuzzy = riskProperties.getFuzzy();
        double best = 0.0;
        for (RiskProperties.Rule rule : fuzzy.getRules()) {
            double strength = Math.min(
                    ageFuzzy.getOrDefault(rule.getAge(), 0.0),
                    indicatorFuzzy.getOrDefault(rule.getIndicators(), 0.0)) * rule.getWeight();
            best = Math.max(best, strength);
        }
        return best > 0 ? best : fuzzy.getDefaultBaseProbability();
    }

    public double finalProbability(double base, double materialVulnerability, int historicalLeaks) {
        RiskProperties.Fuzzy fuzzy = riskProperties.getFuzzy();
        double leakBoost = Math.min(historicalLeaks * fuzzy.getLeakBoostPerLeak(), fuzzy.getLeakBoostCap());
        return Math.min(base * (1 + materialVulnerability) + leakBoost, 1.0);
    }

    /**
     * 按顺序匹配：critical（概率或平均严重度超阈值）> high > medium > low
     */
    public Urgency classify(double probability, double avgSeverity) {
        RiskProperties.UrgencyBands bands = riskProperties.getFuzzy().getUrgency();
        if (probability > bands.getCritical() || avgSeverity > bands.getCriticalSeverity()) {
            return Urgency.CRITICAL;
        }
        if (probability > bands.getHigh()) return Urgency.HIGH;
        if (probability > bands.getMedium()) return Urgency.MEDIUM;
        return Urgency.LOW;
    }

    public DefectProbability analyze(PipelineSegment segment, List<LeakIndicator> indicators) {
        if (segment == null) {
            throw new IllegalArgumentException("segment is required");
        }
        List<LeakIndicator> list = indicators == null ? Collections.emptyList() : indicators;

        Map<String, Double> ageFuzzy = fuzzifyAge(segment.getAgeYears());
        Map<String, Double> countFuzzy = fuzzifyIndicatorCount(list.size());
        double material = materialVulnerability(segment.getPipeMaterial());
        double base = applyRules(ageFuzzy, countFuzzy);
        double probability = finalProbability(base, material, segment.getHistoricalLeaks());

        double avgSeverity = CollectionUtil.isEmpty(list)
                ? 0.0
                : list.stream().mapToDouble(LeakIndicator::getSeverity).average().orElse(0.0);
        Urgency urgency = classify(probability, avgSeverity);

        Map<String, Double> factors = new LinkedHashMap<>();
        factors.put(DefectProbability.FACTOR_AGE_YEARS, segment.getAgeYears());
        factors.put(DefectProbability.FACTOR_MATERIAL_VULNERABILITY, material);
        factors.put(DefectProbability.FACTOR_HISTORICAL_LEAKS, (double) segment.getHistoricalLeaks());
        factors.put(DefectProbability.FACTOR_INDICATOR_COUNT, (double) list.size());
        factors.put(DefectProbability.FACTOR_AVG_SEVERITY, avgSeverity);

        log.debug("管段 {}: base={}, probability={}, urgency={}", segment.getSegmentId(), base, probability, urgency);

        return DefectProbability.builder()
                .segmentId(segment.getSegmentId())
                .probability(probability)
                .contributingFactors(Collections.unmodifiableMap(factors))
                .recommendedAction(urgency.getRecommendedAction())
                .urgency(urgency)
                .build();
    }

    private static Map<String, Double> fuzzify(Map<String, RiskProperties.Trapezoid> sets, double x) {
        Map<String, Double> out = new LinkedHashMap<>();
        for (Map.Entry<String, RiskProperties.Trapezoid> e : sets.entrySet()) {
            out.put(e.getKey(), TrapezoidMembership.degree(e.getValue(), x));
        }
        return out;
    }
}
