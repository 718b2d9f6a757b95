package com.gdin.inspection.waterleak.detect;

import com.gdin.inspection.waterleak.config.properties.RiskProperties;
import com.gdin.inspection.waterleak.models.LeakIndicator;
import com.gdin.inspection.waterleak.raster.AcquisitionPass;
import com.gdin.inspection.waterleak.raster.BandType;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.gdin.inspection.waterleak.detect.DetectorFixtures.grid;
import static com.gdin.inspection.waterleak.detect.DetectorFixtures.withBlock;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class WaterPondingDetectorTest {

    private final WaterPondingDetector detector = new WaterPondingDetector(new RiskProperties());

    private static AcquisitionPass pond(int size) {
        return AcquisitionPass.builder()
                .band(BandType.GREEN, withBlock(grid(40, 40, 0.2), 5, 5, size, 0.8))
                .band(BandType.NIR, withBlock(grid(40, 40, 0.6), 5, 5, size, 0.2))
                .build();
    }

    @Test
    public void testPondInsideAreaBand() {
        List<LeakIndicator> found = detector.detect(pond(16));

        assertEquals(1, found.size());
        LeakIndicator li = found.get(0);
        assertEquals(256.0, li.getMetadata().get("area"), 1e-12);
        assertEquals(0.6, li.getMetadata().get("ndwi"), 1e-9);
        assertEquals(0.6, li.getSeverity(), 1e-9);
        assertEquals(0.85, li.getConfidence(), 1e-12);
        assertEquals(12.5, li.getLocation().getRow(), 1e-12);
    }

    @Test
    public void testLargeWaterBodyIsExcluded() {
        assertTrue(detector.detect(pond(25)).isEmpty());
    }

    @Test
    public void testSmallPuddleIsOpenedAway() {
        assertTrue(detector.detect(pond(10)).isEmpty());
    }
}
