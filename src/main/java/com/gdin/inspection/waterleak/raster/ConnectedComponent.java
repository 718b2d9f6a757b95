package com.gdin.inspection.waterleak.raster;

import com.gdin.inspection.waterleak.models.Coordinate;
import lombok.Getter;

@Getter
public final class ConnectedComponent {

    private final int label;
    private final int[] pixelIndices;
    private final int cols;
    private final double centroidRow;
    private final double centroidCol;

    ConnectedComponent(int label, int[] pixelIndices, int cols, double centroidRow, double centroidCol) {
        this.label = label;
        this.pixelIndices = pixelIndices;
        this.cols = cols;
        this.centroidRow = centroidRow;
        this.centroidCol = centroidCol;
    }

    public int area() {
        return pixelIndices.length;
    }

    public Coordinate centroid() {
        return Coordinate.of(centroidRow, centroidCol);
    }

    /**
     * 连通域内某栅格的最大值。
     */
    public double max(Raster values) {
        double[] v = values.values();
        double max = Double.NEGATIVE_INFINITY;
        for (int i : pixelIndices) {
            max = Math.max(max, v[i]);
        }
        return max;
    }
}
