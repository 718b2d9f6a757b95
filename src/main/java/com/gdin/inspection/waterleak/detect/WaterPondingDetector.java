package com.gdin.inspection.waterleak.detect;

import com.gdin.inspection.waterleak.config.properties.RiskProperties;
import com.gdin.inspection.waterleak.models.IndicatorType;
import com.gdin.inspection.waterleak.raster.AcquisitionPass;
import com.gdin.inspection.waterleak.raster.BandType;
import com.gdin.inspection.waterleak.raster.Raster;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * 地表积水：NDWI = (Green - NIR) / (Green + NIR)。
 * 开运算去掉大片水体，面积上限再排除河流湖泊，只保留中小积水。
 */
@Component
public class WaterPondingDetector extends AbstractSignalDetector {

    private final RiskProperties riskProperties;

    public WaterPondingDetector(RiskProperties riskProperties) {
        this.riskProperties = riskProperties;
    }

    @Override
    public IndicatorType type() {
        return IndicatorType.PONDING;
    }

    @Override
    public List<BandType> requiredBands() {
        return List.of(BandType.GREEN, BandType.NIR);
    }

    @Override
    protected RiskProperties.DetectorParams params() {
        return riskProperties.getDetectors().getPonding();
    }

    @Override
    protected Raster anomalyScore(Raster[] bands, AcquisitionPass pass) {
        return normalizedDifference(bands[0], bands[1], riskProperties.getDetectors().getIndexEpsilon());
    }

    @Override
    protected String magnitudeKey() {
        return "ndwi";
    }

    @Override
    protected String defaultImageSource() {
        return "multispectral";
    }
}
