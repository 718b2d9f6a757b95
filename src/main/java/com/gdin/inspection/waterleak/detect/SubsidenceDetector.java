package com.gdin.inspection.waterleak.detect;

import com.gdin.inspection.waterleak.config.properties.RiskProperties;
import com.gdin.inspection.waterleak.models.IndicatorType;
import com.gdin.inspection.waterleak.raster.AcquisitionPass;
import com.gdin.inspection.waterleak.raster.BandType;
import com.gdin.inspection.waterleak.raster.Raster;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * 地面沉降：渗漏冲刷土体导致沉降，用前后两期灰度影像差分检测。
 */
@Component
public class SubsidenceDetector extends AbstractSignalDetector {

    private final RiskProperties riskProperties;

    public SubsidenceDetector(RiskProperties riskProperties) {
        this.riskProperties = riskProperties;
    }

    @Override
    public IndicatorType type() {
        return IndicatorType.SUBSIDENCE;
    }

    @Override
    public List<BandType> requiredBands() {
        return List.of(BandType.BEFORE, BandType.AFTER);
    }

    @Override
    protected RiskProperties.DetectorParams params() {
        return riskProperties.getDetectors().getSubsidence();
    }

    @Override
    protected Raster anomalyScore(Raster[] bands, AcquisitionPass pass) {
        double fullScale = riskProperties.getDetectors().getGrayscaleFullScale();
        return bands[0].combine(bands[1], (before, after) -> Math.abs(after - before) / fullScale);
    }

    @Override
    protected String magnitudeKey() {
        return "change";
    }

    @Override
    protected String defaultImageSource() {
        return "drone";
    }
}
