package com.gdin.inspection.waterleak.graph;

import cn.hutool.core.collection.CollectionUtil;
import com.gdin.inspection.waterleak.exception.TopologyIntegrityException;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 内存邻接表实现，线程安全。仅用于测试/本地开发。
 */
public class InMemoryGraphStore implements GraphStore {

    private final Map<String, GraphVertex> vertices = new LinkedHashMap<>();
    private final Map<String, GraphEdge> edges = new LinkedHashMap<>();
    // vertexId -> 出边 id（写入顺序）
    private final Map<String, LinkedHashSet<String>> outIndex = new LinkedHashMap<>();

    @Override
    public synchronized GraphVertex upsertVertex(GraphVertex vertex) {
        if (vertex == null || vertex.getId() == null) {
            throw new IllegalArgumentException("vertex id is required");
        }
        vertices.put(vertex.getId(), vertex);
        return vertex;
    }

    @Override
    public synchronized GraphEdge upsertEdge(GraphEdge edge) {
        if (edge == null || edge.getId() == null) {
            throw new IllegalArgumentException("edge id is required");
        }
        if (!vertices.containsKey(edge.getFromId())) {
            throw new TopologyIntegrityException("edge " + edge.getId() + " references missing vertex " + edge.getFromId());
        }
        if (!vertices.containsKey(edge.getToId())) {
            throw new TopologyIntegrityException("edge " + edge.getId() + " references missing vertex " + edge.getToId());
        }
        GraphEdge previous = edges.put(edge.getId(), edge);
        if (previous != null && !previous.getFromId().equals(edge.getFromId())) {
            LinkedHashSet<String> old = outIndex.get(previous.getFromId());
            if (old != null) old.remove(edge.getId());
        }
        outIndex.computeIfAbsent(edge.getFromId(), _k -> new LinkedHashSet<>()).add(edge.getId());
        return edge;
    }

    @Override
    public synchronized void removeVertex(String id) {
        if (vertices.remove(id) == null) return;
        List<String> incident = edges.values().stream()
                .filter(e -> id.equals(e.getFromId()) || id.equals(e.getToId()))
                .map(GraphEdge::getId)
                .collect(Collectors.toList());
        incident.forEach(this::removeEdge);
        outIndex.remove(id);
    }

    @Override
    public synchronized void removeEdge(String id) {
        GraphEdge removed = edges.remove(id);
        if (removed == null) return;
        LinkedHashSet<String> out = outIndex.get(removed.getFromId());
        if (out != null) out.remove(id);
    }

    @Override
    public synchronized Optional<GraphVertex> findVertex(String id) {
        return Optional.ofNullable(vertices.get(id));
    }

    @Override
    public synchronized Optional<GraphEdge> findEdge(String id) {
        return Optional.ofNullable(edges.get(id));
    }

    @Override
    public synchronized List<GraphVertex> queryVertices(String label, List<PropertyPredicate> predicates) {
        return vertices.values().stream()
                .filter(v -> label == null || label.equals(v.getLabel()))
                .filter(v -> matches(v.getProperties(), predicates))
                .collect(Collectors.toList());
    }

    @Override
    public synchronized List<GraphEdge> queryEdges(String label, List<PropertyPredicate> predicates) {
        return edges.values().stream()
                .filter(e -> label == null || label.equals(e.getLabel()))
                .filter(e -> matches(e.getProperties(), predicates))
                .collect(Collectors.toList());
    }

    @Override
    public synchronized List<GraphEdge> outEdges(String vertexId, String edgeLabel) {
        LinkedHashSet<String> ids = outIndex.get(vertexId);
        if (CollectionUtil.isEmpty(ids)) return Collections.emptyList();
        List<GraphEdge> out = new ArrayList<>();
        for (String id : ids) {
            GraphEdge e = edges.get(id);
            if (e != null && (edgeLabel == null || edgeLabel.equals(e.getLabel()))) {
                out.add(e);
            }
        }
        return out;
    }

    @Override
    public synchronized List<String> traverseOut(String startVertexId, String edgeLabel, int maxHops) {
        if (maxHops <= 0 || !vertices.containsKey(startVertexId)) return Collections.emptyList();

        Set<String> visited = new LinkedHashSet<>();
        visited.add(startVertexId);
        List<String> reached = new ArrayList<>();
        Deque<String> frontier = new ArrayDeque<>();
        frontier.add(startVertexId);

        for (int hop = 0; hop < maxHops && !frontier.isEmpty(); hop++) {
            Deque<String> next = new ArrayDeque<>();
            for (String vertexId : frontier) {
                for (GraphEdge e : outEdges(vertexId, edgeLabel)) {
                    if (visited.add(e.getToId())) {
                        reached.add(e.getToId());
                        next.add(e.getToId());
                    }
                }
            }
            frontier = next;
        }
        return reached;
    }

    @Override
    public synchronized void clear() {
        vertices.clear();
        edges.clear();
        outIndex.clear();
    }

    public synchronized int vertexCount() {
        return vertices.size();
    }

    public synchronized int edgeCount() {
        return edges.size();
    }

    private static boolean matches(Map<String, Object> properties, List<PropertyPredicate> predicates) {
        if (CollectionUtil.isEmpty(predicates)) return true;
        for (PropertyPredicate p : predicates) {
            if (!p.test(properties)) return false;
        }
        return true;
    }
}
