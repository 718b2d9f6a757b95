package com.gdin.inspection.waterleak.detect;

import com.gdin.inspection.waterleak.config.properties.RiskProperties;
import com.gdin.inspection.waterleak.models.LeakIndicator;
import com.gdin.inspection.waterleak.raster.AcquisitionPass;
import com.gdin.inspection.waterleak.raster.BandType;
import com.gdin.inspection.waterleak.raster.BinaryMask;
import com.gdin.inspection.waterleak.raster.ConnectedComponent;
import com.gdin.inspection.waterleak.raster.Raster;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 四类检测器共用的流程：
 * 1. 逐像素异常分值；
 * 2. 按类型阈值二值化；
 * 3. 形态学清理（闭运算补洞 / 开运算去掉大片水体）；
 * 4. 8 邻域连通域，按面积区间过滤；
 * 5. 每个连通域取质心为位置，区域内最大异常值归一化为 severity。
 */
@Slf4j
public abstract class AbstractSignalDetector implements SignalDetector {

    public static final String META_AREA = "area";

    protected abstract RiskProperties.DetectorParams params();

    /**
     * 计算异常分值栅格。bands 顺序与 {@link #requiredBands()} 一致且尺寸已校验。
     */
    protected abstract Raster anomalyScore(Raster[] bands, AcquisitionPass pass);

    /**
     * metadata 中记录原始幅值的键名
     */
    protected abstract String magnitudeKey();

    protected abstract String defaultImageSource();

    @Override
    public List<LeakIndicator> detect(AcquisitionPass pass) {
        List<BandType> required = requiredBands();
        if (pass == null || !pass.has(required.toArray(new BandType[0]))) {
            log.debug("{} 检测跳过：缺少波段 {}", type(), required);
            return Collections.emptyList();
        }

        RiskProperties.DetectorParams p = params();
        Raster[] bands = pass.require(required.toArray(new BandType[0]));
        Raster score = anomalyScore(bands, pass);

        double threshold = p.getThreshold();
        BinaryMask mask = BinaryMask.threshold(score, v -> v > threshold);
        if (mask.count() == 0) {
            return Collections.emptyList();
        }
        mask = cleanup(mask, p);

        List<LeakIndicator> indicators = new ArrayList<>();
        for (ConnectedComponent component : mask.components()) {
            int area = component.area();
            if (area <= p.getMinArea()) continue;
            if (p.getMaxArea() != null && area >= p.getMaxArea()) continue;

            double magnitude = component.max(score);
            double severity = clamp01((magnitude - p.getSeverityOffset()) / p.getSaturation());

            Map<String, Double> metadata = new LinkedHashMap<>();
            metadata.put(magnitudeKey(), magnitude);
            metadata.put(META_AREA, (double) area);

            indicators.add(LeakIndicator.builder()
                    .location(component.centroid())
                    .indicatorType(type())
                    .confidence(clamp01(p.getConfidence()))
                    .severity(severity)
                    .timestamp(pass.getCapturedAt())
                    .imageSource(pass.getImageSource() == null ? defaultImageSource() : pass.getImageSource())
                    .metadata(Collections.unmodifiableMap(metadata))
                    .build());
        }
        return indicators;
    }

    private static BinaryMask cleanup(BinaryMask mask, RiskProperties.DetectorParams p) {
        switch (p.getMorphology()) {
            case CLOSE:
                return mask.close(p.getKernelSize());
            case OPEN:
                return mask.open(p.getKernelSize());
            default:
                return mask;
        }
    }

    static double clamp01(double v) {
        if (v < 0.0) return 0.0;
        return Math.min(v, 1.0);
    }

    /**
     * 归一化差值指数 (a - b) / (a + b)，分母恰为 0 时替换为 epsilon。
     */
    static Raster normalizedDifference(Raster a, Raster b, double epsilon) {
        return a.combine(b, (x, y) -> {
            double denominator = x + y;
            if (denominator == 0) {
                denominator = epsilon;
            }
            return (x - y) / denominator;
        });
    }
}
