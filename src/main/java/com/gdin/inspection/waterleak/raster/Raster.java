package com.gdin.inspection.waterleak.raster;

import com.gdin.inspection.waterleak.exception.MalformedInputException;

import java.util.Arrays;
import java.util.function.DoubleBinaryOperator;
import java.util.function.DoubleUnaryOperator;

/**
 * 单波段栅格，按行存储。构造时复制输入，之后不可变。
 */
public final class Raster {

    private final int rows;
    private final int cols;
    private final double[] data;

    private Raster(int rows, int cols, double[] data) {
        this.rows = rows;
        this.cols = cols;
        this.data = data;
    }

    /**
     * 从二维数组构造，拒绝空数组、锯齿数组以及 NaN/Infinity。
     */
    public static Raster of(double[][] values) {
        if (values == null || values.length == 0 || values[0] == null || values[0].length == 0) {
            throw new MalformedInputException("raster must have at least one row and one column");
        }
        int rows = values.length;
        int cols = values[0].length;
        double[] data = new double[rows * cols];
        for (int r = 0; r < rows; r++) {
            double[] row = values[r];
            if (row == null || row.length != cols) {
                throw new MalformedInputException(
                        "raster row " + r + " has " + (row == null ? 0 : row.length) + " columns, expected " + cols);
            }
            for (int c = 0; c < cols; c++) {
                double v = row[c];
                if (!Double.isFinite(v)) {
                    throw new MalformedInputException("raster value at (" + r + "," + c + ") is not a finite number: " + v);
                }
                data[r * cols + c] = v;
            }
        }
        return new Raster(rows, cols, data);
    }

    public Raster map(DoubleUnaryOperator fn) {
        double[] out = new double[data.length];
        for (int i = 0; i < data.length; i++) {
            out[i] = fn.applyAsDouble(data[i]);
        }
        return new Raster(rows, cols, out);
    }

    /**
     * 逐像素组合两个同尺寸栅格。
     */
    public Raster combine(Raster other, DoubleBinaryOperator fn) {
        if (!sameShape(other)) {
            throw new MalformedInputException("raster " + this + " does not match " + other);
        }
        double[] out = new double[data.length];
        for (int i = 0; i < data.length; i++) {
            out[i] = fn.applyAsDouble(data[i], other.data[i]);
        }
        return new Raster(rows, cols, out);
    }

    public int rows() {
        return rows;
    }

    public int cols() {
        return cols;
    }

    public double get(int row, int col) {
        return data[row * cols + col];
    }

    double[] values() {
        return data;
    }

    public boolean sameShape(Raster other) {
        return other != null && rows == other.rows && cols == other.cols;
    }

    public double median() {
        double[] sorted = data.clone();
        Arrays.sort(sorted);
        int n = sorted.length;
        if (n % 2 == 1) {
            return sorted[n / 2];
        }
        return (sorted[n / 2 - 1] + sorted[n / 2]) / 2.0;
    }

    @Override
    public String toString() {
        return "Raster{" + rows + "x" + cols + "}";
    }
}
