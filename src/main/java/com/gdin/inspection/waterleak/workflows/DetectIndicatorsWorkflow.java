package com.gdin.inspection.waterleak.workflows;

import com.gdin.inspection.waterleak.detect.IndicatorAggregator;
import com.gdin.inspection.waterleak.raster.AcquisitionPass;
import jakarta.annotation.Resource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Slf4j
@Service
public class DetectIndicatorsWorkflow {

    @Resource
    private IndicatorAggregator indicatorAggregator;

    public IndicatorAggregator.Result run(AcquisitionPass pass) {
        AcquisitionPass input = pass == null ? AcquisitionPass.empty() : pass;
        if (input.bandTypes().isEmpty()) {
            log.info("detect_indicators: 本次采集没有任何波段，仅按资产属性评估");
        }
        IndicatorAggregator.Result result = indicatorAggregator.aggregate(input);
        log.info("detect_indicators done: indicators={}, failedDetectors={}",
                result.getIndicators().size(), result.getFailures().size());
        return result;
    }
}
