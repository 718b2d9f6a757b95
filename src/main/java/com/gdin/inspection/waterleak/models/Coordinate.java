package com.gdin.inspection.waterleak.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

/**
 * 二维坐标。像素坐标时为 (row, col)，地理坐标时为 (lat, lon)，单位由调用方统一。
 */
@Value
public class Coordinate {

    @JsonProperty("row")
    double row;

    @JsonProperty("col")
    double col;

    @JsonCreator
    public Coordinate(@JsonProperty("row") double row, @JsonProperty("col") double col) {
        this.row = row;
        this.col = col;
    }

    public static Coordinate of(double row, double col) {
        return new Coordinate(row, col);
    }

    public double distanceTo(Coordinate other) {
        return Math.hypot(row - other.row, col - other.col);
    }
}
