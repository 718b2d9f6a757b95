package com.gdin.inspection.waterleak.models;

import cn.hutool.core.util.StrUtil;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.gdin.inspection.waterleak.exception.MalformedInputException;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * 两个节点之间的一段管线，属性来自资产管理数据。
 */
@Value
@Jacksonized
@Builder
public class PipelineSegment {

    @JsonProperty("segment_id")
    String segmentId;

    @JsonProperty("start_node")
    String startNode;

    @JsonProperty("end_node")
    String endNode;

    @JsonProperty("pipe_material")
    String pipeMaterial;

    @JsonProperty("diameter_mm")
    double diameterMm;

    @JsonProperty("age_years")
    double ageYears;

    @JsonProperty("length_meters")
    double lengthMeters;

    @JsonProperty("coordinates")
    List<Coordinate> coordinates;

    @JsonProperty("historical_leaks")
    int historicalLeaks;

    private PipelineSegment(String segmentId, String startNode, String endNode, String pipeMaterial,
                            double diameterMm, double ageYears, double lengthMeters,
                            List<Coordinate> coordinates, int historicalLeaks) {
        if (StrUtil.isBlank(segmentId)) {
            throw new MalformedInputException("segment_id must not be blank");
        }
        if (StrUtil.isBlank(startNode) || StrUtil.isBlank(endNode)) {
            throw new MalformedInputException("segment " + segmentId + " must have start_node and end_node");
        }
        if (startNode.equals(endNode)) {
            throw new MalformedInputException("segment " + segmentId + " starts and ends at " + startNode);
        }
        if (!(ageYears >= 0)) {
            throw new MalformedInputException("segment " + segmentId + " has negative age_years: " + ageYears);
        }
        if (historicalLeaks < 0) {
            throw new MalformedInputException("segment " + segmentId + " has negative historical_leaks: " + historicalLeaks);
        }
        this.segmentId = segmentId;
        this.startNode = startNode;
        this.endNode = endNode;
        this.pipeMaterial = pipeMaterial;
        this.diameterMm = diameterMm;
        this.ageYears = ageYears;
        this.lengthMeters = lengthMeters;
        this.coordinates = coordinates == null ? List.of() : List.copyOf(coordinates);
        this.historicalLeaks = historicalLeaks;
    }
}
