package com.gdin.inspection.waterleak.detect;

import com.gdin.inspection.waterleak.config.properties.RiskProperties;
import com.gdin.inspection.waterleak.models.IndicatorType;
import com.gdin.inspection.waterleak.raster.AcquisitionPass;
import com.gdin.inspection.waterleak.raster.BandType;
import com.gdin.inspection.waterleak.raster.Raster;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * 热异常：渗漏水体白天比周围土壤凉、夜间更暖，取与参考温度差的绝对值。
 * 参考温度未给出时取热红外栅格的中位数。
 */
@Component
public class ThermalLeakDetector extends AbstractSignalDetector {

    private final RiskProperties riskProperties;

    public ThermalLeakDetector(RiskProperties riskProperties) {
        this.riskProperties = riskProperties;
    }

    @Override
    public IndicatorType type() {
        return IndicatorType.THERMAL;
    }

    @Override
    public List<BandType> requiredBands() {
        return List.of(BandType.THERMAL);
    }

    @Override
    protected RiskProperties.DetectorParams params() {
        return riskProperties.getDetectors().getThermal();
    }

    @Override
    protected Raster anomalyScore(Raster[] bands, AcquisitionPass pass) {
        Raster thermal = bands[0];
        double reference = pass.getReferenceTemperature() != null
                ? pass.getReferenceTemperature()
                : thermal.median();
        return thermal.map(t -> Math.abs(t - reference));
    }

    @Override
    protected String magnitudeKey() {
        return "temp_diff";
    }

    @Override
    protected String defaultImageSource() {
        return "thermal";
    }
}
