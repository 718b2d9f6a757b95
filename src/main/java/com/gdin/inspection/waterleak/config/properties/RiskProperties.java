package com.gdin.inspection.waterleak.config.properties;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 推理参数表：检测阈值、模糊隶属度断点、规则权重、紧急度分档。
 * 进程启动时加载一次，各组件只读依赖；测试可以 new 一份再改。
 */
@Data
@ConfigurationProperties(prefix = "gdin.water.risk")
@Component
public class RiskProperties implements Serializable {
    // 参数表版本，随结果一起记录
    private String version = "1.0";

    private Detectors detectors = new Detectors();
    private Fuzzy fuzzy = new Fuzzy();
    private Association association = new Association();
    private Pipeline pipeline = new Pipeline();

    public enum Morphology {
        NONE,
        CLOSE,
        OPEN
    }

    @Data
    public static class DetectorParams implements Serializable {
        // 异常判定阈值（严格大于）
        private double threshold;
        // severity = min((max - offset) / saturation, 1)
        private double saturation;
        private double severityOffset = 0.0;
        // 检测器可靠度，固定值
        private double confidence;
        // 连通域面积下限（严格大于）
        private int minArea;
        // 连通域面积上限（严格小于），null 表示不限
        private Integer maxArea;
        private Morphology morphology = Morphology.NONE;
        private int kernelSize = 1;

        public static DetectorParams of(double threshold, double saturation, double confidence, int minArea) {
            DetectorParams p = new DetectorParams();
            p.setThreshold(threshold);
            p.setSaturation(saturation);
            p.setConfidence(confidence);
            p.setMinArea(minArea);
            return p;
        }

        public DetectorParams morphology(Morphology morphology, int kernelSize) {
            this.morphology = morphology;
            this.kernelSize = kernelSize;
            return this;
        }
    }

    @Data
    public static class Detectors implements Serializable {
        private DetectorParams thermal = DetectorParams.of(2.0, 10.0, 0.8, 10);

        private DetectorParams vegetation = DetectorParams.of(0.15, 0.3, 0.7, 20)
                .morphology(Morphology.CLOSE, 5);

        private DetectorParams subsidence = DetectorParams.of(0.10, 0.5, 0.75, 30)
                .morphology(Morphology.CLOSE, 7);

        private DetectorParams ponding = initPonding();

        // 分母为 0 时的替代值
        private double indexEpsilon = 1e-10;
        // 灰度影像满量程，用于把差值归一化到 [0,1]
        private double grayscaleFullScale = 255.0;

        private static DetectorParams initPonding() {
            DetectorParams p = DetectorParams.of(0.30, 0.5, 0.85, 15).morphology(Morphology.OPEN, 15);
            p.setMaxArea(500);
            p.setSeverityOffset(0.30);
            return p;
        }
    }

    /**
     * 梯形隶属度 (a, b, c, d)。左肩 a=b=-Infinity，右肩 c=d=+Infinity。
     */
    @Data
    public static class Trapezoid implements Serializable {
        private double a;
        private double b;
        private double c;
        private double d;

        public static Trapezoid of(double a, double b, double c, double d) {
            Trapezoid t = new Trapezoid();
            t.setA(a);
            t.setB(b);
            t.setC(c);
            t.setD(d);
            return t;
        }
    }

    @Data
    public static class Rule implements Serializable {
        private String age;
        private String indicators;
        private double weight;

        public static Rule of(String age, String indicators, double weight) {
            Rule r = new Rule();
            r.setAge(age);
            r.setIndicators(indicators);
            r.setWeight(weight);
            return r;
        }
    }

    @Data
    public static class Fuzzy implements Serializable {
        private Map<String, Trapezoid> ageSets = defaultAgeSets();
        private Map<String, Trapezoid> indicatorCountSets = defaultIndicatorCountSets();
        private Map<String, Double> materialVulnerability = defaultMaterials();
        private double unknownMaterialVulnerability = 0.5;
        private List<Rule> rules = defaultRules();

        // 没有任何规则被激活时的中性概率
        private double defaultBaseProbability = 0.5;
        private double leakBoostPerLeak = 0.1;
        private double leakBoostCap = 0.3;

        private UrgencyBands urgency = new UrgencyBands();

        private static Map<String, Trapezoid> defaultAgeSets() {
            Map<String, Trapezoid> m = new LinkedHashMap<>();
            m.put("new", Trapezoid.of(Double.NEGATIVE_INFINITY, Double.NEGATIVE_INFINITY, 0, 10));
            m.put("moderate", Trapezoid.of(5, 10, 20, 25));
            m.put("old", Trapezoid.of(20, 30, 40, 50));
            m.put("ancient", Trapezoid.of(40, 60, Double.POSITIVE_INFINITY, Double.POSITIVE_INFINITY));
            return m;
        }

        private static Map<String, Trapezoid> defaultIndicatorCountSets() {
            Map<String, Trapezoid> m = new LinkedHashMap<>();
            m.put("few", Trapezoid.of(Double.NEGATIVE_INFINITY, Double.NEGATIVE_INFINITY, 0, 2));
            m.put("several", Trapezoid.of(1, 2, 3, 4));
            m.put("many", Trapezoid.of(3, 5, Double.POSITIVE_INFINITY, Double.POSITIVE_INFINITY));
            return m;
        }

        private static Map<String, Double> defaultMaterials() {
            Map<String, Double> m = new LinkedHashMap<>();
            m.put("pvc", 0.3);
            m.put("steel", 0.5);
            m.put("concrete", 0.6);
            m.put("cast_iron", 0.7);
            m.put("asbestos", 0.9);
            m.put("unknown", 0.5);
            return m;
        }

        private static List<Rule> defaultRules() {
            List<Rule> rules = new ArrayList<>();
            rules.add(Rule.of("ancient", "many", 0.95));
            rules.add(Rule.of("ancient", "several", 0.85));
            rules.add(Rule.of("old", "many", 0.85));
            rules.add(Rule.of("old", "several", 0.70));
            rules.add(Rule.of("moderate", "many", 0.65));
            rules.add(Rule.of("moderate", "several", 0.50));
            rules.add(Rule.of("new", "few", 0.20));
            return rules;
        }
    }

    @Data
    public static class UrgencyBands implements Serializable {
        // 各档位均为严格大于
        private double critical = 0.8;
        private double criticalSeverity = 0.8;
        private double high = 0.6;
        private double medium = 0.4;
    }

    @Data
    public static class Association implements Serializable {
        // 迹象到管线的最大关联距离，0 表示不限制
        private double maxDistance = 0.0;
    }

    @Data
    public static class Pipeline implements Serializable {
        // 检测器/管段分析的并发数
        private Integer concurrency = 4;
        private String name = "standard";
    }
}
