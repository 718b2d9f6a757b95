package com.gdin.inspection.waterleak.graph;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Map;

/**
 * 有向边 from -> to。
 */
@Value
@Jacksonized
@Builder
public class GraphEdge {

    @JsonProperty("id")
    String id;

    @JsonProperty("label")
    String label;

    @JsonProperty("from_id")
    String fromId;

    @JsonProperty("to_id")
    String toId;

    @JsonProperty("properties")
    Map<String, Object> properties;
}
