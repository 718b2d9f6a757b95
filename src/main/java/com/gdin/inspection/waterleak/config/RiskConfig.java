package com.gdin.inspection.waterleak.config;

import com.gdin.inspection.waterleak.config.properties.GraphStoreProperties;
import com.gdin.inspection.waterleak.config.properties.RiskProperties;
import com.gdin.inspection.waterleak.graph.GraphStore;
import com.gdin.inspection.waterleak.graph.HttpGraphStore;
import com.gdin.inspection.waterleak.graph.InMemoryGraphStore;
import com.gdin.inspection.waterleak.pipeline.PipelineFactory;
import jakarta.annotation.Resource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;

@Slf4j
@Configuration
public class RiskConfig {
    @Resource
    private GraphStoreProperties graphStoreProperties;

    @Bean
    protected PipelineFactory<RiskProperties> pipelineFactory() {
        return new PipelineFactory<>();
    }

    @Bean
    @ConditionalOnMissingBean
    public RestTemplate restTemplate() {
        GraphStoreProperties.Http http = graphStoreProperties.getHttp();
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(http.getConnectTimeoutMs());
        requestFactory.setReadTimeout(http.getReadTimeoutMs());
        return new RestTemplate(requestFactory);
    }

    @Bean
    @ConditionalOnMissingBean
    public GraphStore graphStore(RestTemplate restTemplate) {
        String type = graphStoreProperties.getType();
        if ("http".equalsIgnoreCase(type)) {
            log.info("graph store: http {}", graphStoreProperties.getHttp().getBaseUrl());
            return new HttpGraphStore(restTemplate, graphStoreProperties.getHttp().getBaseUrl());
        }
        if (!"memory".equalsIgnoreCase(type)) {
            throw new IllegalStateException("unknown gdin.water.graph.type: " + type);
        }
        log.info("graph store: in-memory");
        return new InMemoryGraphStore();
    }
}
