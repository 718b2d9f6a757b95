package com.gdin.inspection.waterleak.graph;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Map;

@Value
@Jacksonized
@Builder
public class GraphVertex {

    @JsonProperty("id")
    String id;

    @JsonProperty("label")
    String label;

    @JsonProperty("properties")
    Map<String, Object> properties;
}
