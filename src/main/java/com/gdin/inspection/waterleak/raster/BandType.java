package com.gdin.inspection.waterleak.raster;

public enum BandType {
    /**
     * 温度（摄氏度）
     */
    THERMAL,
    NIR,
    RED,
    GREEN,
    /**
     * 变化检测的前后两期灰度影像，取值 0-255
     */
    BEFORE,
    AFTER,
    /**
     * 可选的 NDVI 基线栅格
     */
    NDVI_BASELINE
}
