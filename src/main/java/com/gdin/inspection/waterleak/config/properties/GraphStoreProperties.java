package com.gdin.inspection.waterleak.config.properties;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.io.Serializable;

@Data
@ConfigurationProperties(prefix = "gdin.water.graph")
@Component
public class GraphStoreProperties implements Serializable {
    // memory | http
    private String type = "memory";
    private Http http = new Http();

    @Data
    public static class Http implements Serializable {
        private String baseUrl = "http://localhost:8182";
        private Integer connectTimeoutMs = 3000;
        private Integer readTimeoutMs = 10000;
    }
}
