package com.gdin.inspection.waterleak.detect;

import com.gdin.inspection.waterleak.models.IndicatorType;
import com.gdin.inspection.waterleak.models.LeakIndicator;
import com.gdin.inspection.waterleak.raster.AcquisitionPass;
import com.gdin.inspection.waterleak.raster.BandType;

import java.util.List;

/**
 * 检测器契约：波段 -> 渗漏迹象。实现必须无状态、不修改输入。
 */
public interface SignalDetector {

    IndicatorType type();

    /**
     * 必需波段，任何一个缺失时检测器跳过并返回空列表。
     */
    List<BandType> requiredBands();

    /**
     * @throws com.gdin.inspection.waterleak.exception.MalformedInputException 波段非法或尺寸不一致
     */
    List<LeakIndicator> detect(AcquisitionPass pass);
}
