package com.gdin.inspection.waterleak.graph;

import com.gdin.inspection.waterleak.models.Coordinate;
import com.gdin.inspection.waterleak.models.IndicatorType;
import com.gdin.inspection.waterleak.models.Junction;
import com.gdin.inspection.waterleak.models.LeakIndicator;
import com.gdin.inspection.waterleak.models.PipelineSegment;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 领域对象 <-> 图属性表。属性只使用 JSON 友好的类型（数字、字符串、列表、Map），
 * 以便 HTTP 图存储原样往返。
 */
public final class NetworkGraphMapper {
    private NetworkGraphMapper() {}

    public static final String LABEL_JUNCTION = "junction";
    public static final String LABEL_PIPELINE = "pipeline";
    public static final String LABEL_LEAK_INDICATOR = "leak_indicator";
    public static final String LABEL_INDICATES_DEFECT = "indicates_defect";

    public static final String P_JUNCTION_ID = "junction_id";
    public static final String P_ROW = "row";
    public static final String P_COL = "col";
    public static final String P_ELEVATION_M = "elevation_m";

    public static final String P_SEGMENT_ID = "segment_id";
    public static final String P_START_NODE = "start_node";
    public static final String P_END_NODE = "end_node";
    public static final String P_MATERIAL = "material";
    public static final String P_DIAMETER_MM = "diameter_mm";
    public static final String P_AGE_YEARS = "age_years";
    public static final String P_LENGTH_M = "length_m";
    public static final String P_HISTORICAL_LEAKS = "historical_leaks";
    public static final String P_COORDINATES = "coordinates";

    public static final String P_INDICATOR_ID = "indicator_id";
    public static final String P_TYPE = "type";
    public static final String P_CONFIDENCE = "confidence";
    public static final String P_SEVERITY = "severity";
    public static final String P_TIMESTAMP = "timestamp";
    public static final String P_IMAGE_SOURCE = "image_source";
    public static final String P_METADATA = "metadata";
    public static final String P_DISTANCE = "distance";

    public static GraphVertex toVertex(Junction junction) {
        Map<String, Object> props = new LinkedHashMap<>();
        props.put(P_JUNCTION_ID, junction.getJunctionId());
        if (junction.getLocation() != null) {
            props.put(P_ROW, junction.getLocation().getRow());
            props.put(P_COL, junction.getLocation().getCol());
        }
        props.put(P_ELEVATION_M, junction.getElevationM());
        return GraphVertex.builder()
                .id(junction.getJunctionId())
                .label(LABEL_JUNCTION)
                .properties(props)
                .build();
    }

    public static Coordinate locationOf(GraphVertex vertex) {
        Map<String, Object> props = vertex.getProperties();
        if (props == null || !(props.get(P_ROW) instanceof Number) || !(props.get(P_COL) instanceof Number)) {
            return null;
        }
        return Coordinate.of(num(props.get(P_ROW)), num(props.get(P_COL)));
    }

    public static GraphEdge toEdge(PipelineSegment segment) {
        Map<String, Object> props = new LinkedHashMap<>();
        props.put(P_SEGMENT_ID, segment.getSegmentId());
        props.put(P_START_NODE, segment.getStartNode());
        props.put(P_END_NODE, segment.getEndNode());
        props.put(P_MATERIAL, segment.getPipeMaterial());
        props.put(P_DIAMETER_MM, segment.getDiameterMm());
        props.put(P_AGE_YEARS, segment.getAgeYears());
        props.put(P_LENGTH_M, segment.getLengthMeters());
        props.put(P_HISTORICAL_LEAKS, segment.getHistoricalLeaks());
        List<List<Double>> coords = new ArrayList<>();
        for (Coordinate c : segment.getCoordinates()) {
            coords.add(List.of(c.getRow(), c.getCol()));
        }
        props.put(P_COORDINATES, coords);
        return GraphEdge.builder()
                .id(segment.getSegmentId())
                .label(LABEL_PIPELINE)
                .fromId(segment.getStartNode())
                .toId(segment.getEndNode())
                .properties(props)
                .build();
    }

    public static PipelineSegment toSegment(GraphEdge edge) {
        Map<String, Object> props = edge.getProperties();
        return PipelineSegment.builder()
                .segmentId(edge.getId())
                .startNode(edge.getFromId())
                .endNode(edge.getToId())
                .pipeMaterial((String) props.get(P_MATERIAL))
                .diameterMm(num(props.get(P_DIAMETER_MM)))
                .ageYears(num(props.get(P_AGE_YEARS)))
                .lengthMeters(num(props.get(P_LENGTH_M)))
                .historicalLeaks((int) num(props.get(P_HISTORICAL_LEAKS)))
                .coordinates(polylineOf(edge))
                .build();
    }

    public static List<Coordinate> polylineOf(GraphEdge edge) {
        Object raw = edge.getProperties() == null ? null : edge.getProperties().get(P_COORDINATES);
        if (!(raw instanceof List)) return Collections.emptyList();
        List<Coordinate> out = new ArrayList<>();
        for (Object point : (List<?>) raw) {
            if (point instanceof List && ((List<?>) point).size() >= 2) {
                List<?> pair = (List<?>) point;
                out.add(Coordinate.of(num(pair.get(0)), num(pair.get(1))));
            }
        }
        return out;
    }

    public static GraphVertex toVertex(String indicatorId, LeakIndicator indicator) {
        Map<String, Object> props = new LinkedHashMap<>();
        props.put(P_INDICATOR_ID, indicatorId);
        props.put(P_ROW, indicator.getLocation().getRow());
        props.put(P_COL, indicator.getLocation().getCol());
        props.put(P_TYPE, indicator.getIndicatorType().code());
        props.put(P_CONFIDENCE, indicator.getConfidence());
        props.put(P_SEVERITY, indicator.getSeverity());
        if (indicator.getTimestamp() != null) {
            props.put(P_TIMESTAMP, indicator.getTimestamp().toString());
        }
        if (indicator.getImageSource() != null) {
            props.put(P_IMAGE_SOURCE, indicator.getImageSource());
        }
        props.put(P_METADATA, indicator.getMetadata() == null
                ? Collections.emptyMap()
                : new LinkedHashMap<>(indicator.getMetadata()));
        return GraphVertex.builder()
                .id(indicatorId)
                .label(LABEL_LEAK_INDICATOR)
                .properties(props)
                .build();
    }

    public static LeakIndicator toIndicator(GraphVertex vertex) {
        Map<String, Object> props = vertex.getProperties();
        Map<String, Double> metadata = new LinkedHashMap<>();
        Object rawMeta = props.get(P_METADATA);
        if (rawMeta instanceof Map) {
            for (Map.Entry<?, ?> e : ((Map<?, ?>) rawMeta).entrySet()) {
                if (e.getValue() instanceof Number) {
                    metadata.put(String.valueOf(e.getKey()), ((Number) e.getValue()).doubleValue());
                }
            }
        }
        Object ts = props.get(P_TIMESTAMP);
        return LeakIndicator.builder()
                .location(Coordinate.of(num(props.get(P_ROW)), num(props.get(P_COL))))
                .indicatorType(IndicatorType.fromCode((String) props.get(P_TYPE)))
                .confidence(num(props.get(P_CONFIDENCE)))
                .severity(num(props.get(P_SEVERITY)))
                .timestamp(ts == null ? null : Instant.parse(ts.toString()))
                .imageSource((String) props.get(P_IMAGE_SOURCE))
                .metadata(Collections.unmodifiableMap(metadata))
                .build();
    }

    public static GraphEdge toDefectEdge(String indicatorId, GraphEdge segmentEdge, double distance) {
        Map<String, Object> props = new LinkedHashMap<>();
        props.put(P_SEGMENT_ID, segmentEdge.getId());
        props.put(P_DISTANCE, distance);
        return GraphEdge.builder()
                .id("defect-" + indicatorId)
                .label(LABEL_INDICATES_DEFECT)
                .fromId(indicatorId)
                .toId(segmentEdge.getFromId())
                .properties(props)
                .build();
    }

    private static double num(Object value) {
        return value instanceof Number ? ((Number) value).doubleValue() : 0.0;
    }
}
