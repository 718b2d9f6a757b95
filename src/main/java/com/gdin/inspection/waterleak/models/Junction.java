package com.gdin.inspection.waterleak.models;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Jacksonized
@Builder
public class Junction {

    @JsonProperty("junction_id")
    String junctionId;

    @JsonProperty("location")
    Coordinate location;

    @JsonProperty("elevation_m")
    @Builder.Default
    double elevationM = 0.0;
}
