package com.gdin.inspection.waterleak.graph;

import cn.hutool.core.util.StrUtil;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.gdin.inspection.waterleak.exception.GraphConnectivityException;
import com.gdin.inspection.waterleak.exception.MalformedInputException;
import com.gdin.inspection.waterleak.exception.TopologyIntegrityException;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * 通过 REST 网关访问远程图数据库。
 * 网关约定：
 * <pre>
 *   PUT    /vertices            upsert 顶点
 *   PUT    /edges               upsert 边（端点缺失返回 409）
 *   GET    /vertices/{id}       GET /edges/{id}（不存在返回 404）
 *   DELETE /vertices/{id}       DELETE /edges/{id}（删除顶点时级联删除关联边）
 *   POST   /vertices/query      POST /edges/query
 *   GET    /vertices/{id}/out?label=
 *   POST   /traversals
 *   DELETE /graph
 * </pre>
 */
@Slf4j
public class HttpGraphStore implements GraphStore {

    private final RestTemplate restTemplate;
    private final String baseUrl;

    public HttpGraphStore(RestTemplate restTemplate, String baseUrl) {
        this.restTemplate = restTemplate;
        this.baseUrl = StrUtil.removeSuffix(baseUrl, "/");
    }

    @Override
    public GraphVertex upsertVertex(GraphVertex vertex) {
        return call("upsert vertex " + vertex.getId(), () -> {
            restTemplate.put(baseUrl + "/vertices", vertex);
            return vertex;
        });
    }

    @Override
    public GraphEdge upsertEdge(GraphEdge edge) {
        return call("upsert edge " + edge.getId(), () -> {
            restTemplate.put(baseUrl + "/edges", edge);
            return edge;
        });
    }

    @Override
    public void removeVertex(String id) {
        delete("remove vertex " + id, baseUrl + "/vertices/{id}", id);
    }

    @Override
    public void removeEdge(String id) {
        delete("remove edge " + id, baseUrl + "/edges/{id}", id);
    }

    @Override
    public Optional<GraphVertex> findVertex(String id) {
        return call("find vertex " + id, () -> {
            try {
                return Optional.ofNullable(restTemplate.getForObject(baseUrl + "/vertices/{id}", GraphVertex.class, id));
            } catch (HttpClientErrorException.NotFound e) {
                return Optional.empty();
            }
        });
    }

    @Override
    public Optional<GraphEdge> findEdge(String id) {
        return call("find edge " + id, () -> {
            try {
                return Optional.ofNullable(restTemplate.getForObject(baseUrl + "/edges/{id}", GraphEdge.class, id));
            } catch (HttpClientErrorException.NotFound e) {
                return Optional.empty();
            }
        });
    }

    @Override
    public List<GraphVertex> queryVertices(String label, List<PropertyPredicate> predicates) {
        QueryRequest request = new QueryRequest(label, predicates == null ? Collections.emptyList() : predicates);
        GraphVertex[] result = call("query vertices " + label,
                () -> restTemplate.postForObject(baseUrl + "/vertices/query", request, GraphVertex[].class));
        return result == null ? Collections.emptyList() : Arrays.asList(result);
    }

    @Override
    public List<GraphEdge> queryEdges(String label, List<PropertyPredicate> predicates) {
        QueryRequest request = new QueryRequest(label, predicates == null ? Collections.emptyList() : predicates);
        GraphEdge[] result = call("query edges " + label,
                () -> restTemplate.postForObject(baseUrl + "/edges/query", request, GraphEdge[].class));
        return result == null ? Collections.emptyList() : Arrays.asList(result);
    }

    @Override
    public List<GraphEdge> outEdges(String vertexId, String edgeLabel) {
        GraphEdge[] result = call("out edges of " + vertexId,
                () -> restTemplate.getForObject(baseUrl + "/vertices/{id}/out?label={label}",
                        GraphEdge[].class, vertexId, StrUtil.nullToEmpty(edgeLabel)));
        return result == null ? Collections.emptyList() : Arrays.asList(result);
    }

    @Override
    public List<String> traverseOut(String startVertexId, String edgeLabel, int maxHops) {
        TraversalRequest request = new TraversalRequest(startVertexId, edgeLabel, maxHops);
        TraversalResponse response = call("traverse from " + startVertexId,
                () -> restTemplate.postForObject(baseUrl + "/traversals", request, TraversalResponse.class));
        if (response == null || response.getVertexIds() == null) {
            return Collections.emptyList();
        }
        return response.getVertexIds();
    }

    @Override
    public void clear() {
        call("clear graph", () -> {
            restTemplate.delete(baseUrl + "/graph");
            return null;
        });
    }

    private void delete(String action, String url, String id) {
        call(action, () -> {
            try {
                restTemplate.delete(url, id);
            } catch (HttpClientErrorException.NotFound e) {
                log.debug("{}: 已不存在", action);
            }
            return null;
        });
    }

    private <T> T call(String action, Supplier<T> body) {
        try {
            return body.get();
        } catch (ResourceAccessException e) {
            log.warn("图存储不可达：{} -> {}", action, e.getMessage());
            throw new GraphConnectivityException("graph store unreachable during " + action, e);
        } catch (HttpServerErrorException e) {
            log.warn("图存储异常：{} -> {}", action, e.getStatusCode());
            throw new GraphConnectivityException("graph store failed during " + action + ": " + e.getStatusCode(), e);
        } catch (HttpClientErrorException e) {
            if (e.getStatusCode().value() == HttpStatus.CONFLICT.value()) {
                throw new TopologyIntegrityException(action + " rejected: " + e.getResponseBodyAsString());
            }
            // 其余 4xx 视为请求本身不合法
            throw new MalformedInputException(
                    action + " rejected with " + e.getStatusCode() + ": " + e.getResponseBodyAsString(), e);
        }
    }

    @Value
    @AllArgsConstructor
    private static class QueryRequest {
        String label;
        List<PropertyPredicate> predicates;
    }

    @Value
    @AllArgsConstructor
    private static class TraversalRequest {
        @JsonProperty("start_id")
        String startId;

        @JsonProperty("edge_label")
        String edgeLabel;

        @JsonProperty("max_hops")
        int maxHops;
    }

    @Data
    public static class TraversalResponse {
        @JsonProperty("vertex_ids")
        private List<String> vertexIds;
    }
}
