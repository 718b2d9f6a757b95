package com.gdin.inspection.waterleak.detect;

import com.gdin.inspection.waterleak.config.properties.RiskProperties;
import com.gdin.inspection.waterleak.exception.MalformedInputException;
import com.gdin.inspection.waterleak.models.IndicatorType;
import com.gdin.inspection.waterleak.raster.AcquisitionPass;
import com.gdin.inspection.waterleak.raster.BandType;
import com.gdin.inspection.waterleak.raster.Raster;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * 植被指数：渗漏区域植被异常茂盛，NDVI 高于基线。
 * 基线优先使用 NDVI_BASELINE 波段，否则取本次 NDVI 的中位数。
 */
@Component
public class VegetationLeakDetector extends AbstractSignalDetector {

    private final RiskProperties riskProperties;

    public VegetationLeakDetector(RiskProperties riskProperties) {
        this.riskProperties = riskProperties;
    }

    @Override
    public IndicatorType type() {
        return IndicatorType.VEGETATION;
    }

    @Override
    public List<BandType> requiredBands() {
        return List.of(BandType.NIR, BandType.RED);
    }

    @Override
    protected RiskProperties.DetectorParams params() {
        return riskProperties.getDetectors().getVegetation();
    }

    public Raster ndvi(Raster nir, Raster red) {
        return normalizedDifference(nir, red, riskProperties.getDetectors().getIndexEpsilon());
    }

    @Override
    protected Raster anomalyScore(Raster[] bands, AcquisitionPass pass) {
        Raster ndvi = ndvi(bands[0], bands[1]);
        if (pass.has(BandType.NDVI_BASELINE)) {
            Raster baseline = pass.require(BandType.NDVI_BASELINE)[0];
            if (!baseline.sameShape(ndvi)) {
                throw new MalformedInputException("NDVI baseline " + baseline + " does not match " + ndvi);
            }
            return ndvi.combine(baseline, (v, b) -> v - b);
        }
        double median = ndvi.median();
        return ndvi.map(v -> v - median);
    }

    @Override
    protected String magnitudeKey() {
        return "ndvi_diff";
    }

    @Override
    protected String defaultImageSource() {
        return "multispectral";
    }
}
