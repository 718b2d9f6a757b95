package com.gdin.inspection.waterleak.raster;

import com.gdin.inspection.waterleak.exception.MalformedInputException;
import lombok.Getter;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Set;

/**
 * 一次采集的全部配准波段。缺失波段直接不放入，而不是用 0 填充。
 * 波段在被检测器取用时才校验，单个波段损坏只影响用到它的检测器。
 */
public final class AcquisitionPass {

    private final Map<BandType, double[][]> bands;
    @Getter
    private final Double referenceTemperature;
    @Getter
    private final String imageSource;
    @Getter
    private final Instant capturedAt;

    private AcquisitionPass(Builder builder) {
        this.bands = Collections.unmodifiableMap(new EnumMap<>(builder.bands));
        this.referenceTemperature = builder.referenceTemperature;
        this.imageSource = builder.imageSource;
        this.capturedAt = builder.capturedAt == null ? Instant.now() : builder.capturedAt;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static AcquisitionPass empty() {
        return builder().build();
    }

    public Set<BandType> bandTypes() {
        return bands.keySet();
    }

    public boolean has(BandType... types) {
        for (BandType t : types) {
            if (!bands.containsKey(t)) {
                return false;
            }
        }
        return true;
    }

    /**
     * 取同一次检测需要的多个波段，校验数值合法且尺寸一致。
     */
    public Raster[] require(BandType... types) {
        Raster[] out = new Raster[types.length];
        for (int i = 0; i < types.length; i++) {
            double[][] values = bands.get(types[i]);
            if (values == null) {
                throw new IllegalStateException("band " + types[i] + " is not present");
            }
            try {
                out[i] = Raster.of(values);
            } catch (MalformedInputException e) {
                throw new MalformedInputException("band " + types[i] + ": " + e.getMessage());
            }
            if (i > 0 && !out[0].sameShape(out[i])) {
                throw new MalformedInputException(String.format("band %s is %dx%d but %s is %dx%d",
                        types[i], out[i].rows(), out[i].cols(), types[0], out[0].rows(), out[0].cols()));
            }
        }
        return out;
    }

    public static final class Builder {
        private final Map<BandType, double[][]> bands = new EnumMap<>(BandType.class);
        private Double referenceTemperature;
        private String imageSource;
        private Instant capturedAt;

        public Builder band(BandType type, double[][] values) {
            if (values != null) {
                bands.put(type, values);
            }
            return this;
        }

        public Builder referenceTemperature(Double referenceTemperature) {
            this.referenceTemperature = referenceTemperature;
            return this;
        }

        public Builder imageSource(String imageSource) {
            this.imageSource = imageSource;
            return this;
        }

        public Builder capturedAt(Instant capturedAt) {
            this.capturedAt = capturedAt;
            return this;
        }

        public AcquisitionPass build() {
            return new AcquisitionPass(this);
        }
    }
}
