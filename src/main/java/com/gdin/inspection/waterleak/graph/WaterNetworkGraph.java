package com.gdin.inspection.waterleak.graph;

import cn.hutool.core.collection.CollectionUtil;
import cn.hutool.core.util.IdUtil;
import cn.hutool.core.util.StrUtil;
import com.gdin.inspection.waterleak.config.properties.RiskProperties;
import com.gdin.inspection.waterleak.exception.RiskException;
import com.gdin.inspection.waterleak.models.Coordinate;
import com.gdin.inspection.waterleak.models.FailureRecord;
import com.gdin.inspection.waterleak.models.Junction;
import com.gdin.inspection.waterleak.models.LeakIndicator;
import com.gdin.inspection.waterleak.models.PipelineSegment;
import com.gdin.inspection.waterleak.util.GeometryUtil;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.stream.Collectors;

import static com.gdin.inspection.waterleak.graph.NetworkGraphMapper.LABEL_INDICATES_DEFECT;
import static com.gdin.inspection.waterleak.graph.NetworkGraphMapper.LABEL_JUNCTION;
import static com.gdin.inspection.waterleak.graph.NetworkGraphMapper.LABEL_PIPELINE;
import static com.gdin.inspection.waterleak.graph.NetworkGraphMapper.P_AGE_YEARS;
import static com.gdin.inspection.waterleak.graph.NetworkGraphMapper.P_HISTORICAL_LEAKS;
import static com.gdin.inspection.waterleak.graph.NetworkGraphMapper.P_SEGMENT_ID;

/**
 * 管网拓扑图：节点为 junction，管段为有向 pipeline 边（start -> end，即水流方向）。
 *
 * 写路径（建图、迹象关联）单写者，一次关联批次占用一次写锁；
 * 读路径（脆弱管段、下游追踪、迹象查询）共享读锁。
 */
@Slf4j
@Service
public class WaterNetworkGraph {

    private final GraphStore graphStore;
    private final RiskProperties riskProperties;
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    public WaterNetworkGraph(GraphStore graphStore, RiskProperties riskProperties) {
        this.graphStore = graphStore;
        this.riskProperties = riskProperties;
    }

    /**
     * 清空当前拓扑及已关联的迹象
     */
    public void reset() {
        lock.writeLock().lock();
        try {
            graphStore.clear();
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * 全量建图，先写节点再写管段。任一管段引用缺失节点即失败（TOPOLOGY_INTEGRITY）。
     */
    public void buildNetwork(List<Junction> junctions, List<PipelineSegment> segments) {
        lock.writeLock().lock();
        try {
            if (CollectionUtil.isNotEmpty(junctions)) {
                for (Junction j : junctions) addJunction(j);
            }
            if (CollectionUtil.isNotEmpty(segments)) {
                for (PipelineSegment s : segments) addSegment(s);
            }
            log.info("管网建图完成：junctions={}, segments={}",
                    junctions == null ? 0 : junctions.size(),
                    segments == null ? 0 : segments.size());
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void addJunction(Junction junction) {
        if (junction == null || StrUtil.isBlank(junction.getJunctionId())) {
            throw new IllegalArgumentException("junction id is required");
        }
        lock.writeLock().lock();
        try {
            graphStore.upsertVertex(NetworkGraphMapper.toVertex(junction));
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void addSegment(PipelineSegment segment) {
        if (segment == null) {
            throw new IllegalArgumentException("segment is required");
        }
        lock.writeLock().lock();
        try {
            graphStore.upsertEdge(NetworkGraphMapper.toEdge(segment));
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * 将迹象关联到最近的管段（点到折线最短距离）。
     * 折线点数不足 2 的管段以两端节点坐标代替；所有管段都没有几何时退化为最近节点的首条管段。
     * maxDistance > 0 时超出距离的迹象不关联，进入 unassociated。
     *
     * 先算完全部匹配再写入。写入中途失败时回滚本批已写入的顶点和边，
     * 回滚也失败则如实返回仍留在图中的关联。读取阶段失败直接抛出 GraphConnectivityException。
     */
    public AssociationResult associateIndicators(List<LeakIndicator> indicators) {
        if (CollectionUtil.isEmpty(indicators)) {
            return AssociationResult.of(Collections.emptyMap(), Collections.emptyList());
        }
        double maxDistance = riskProperties.getAssociation().getMaxDistance();

        lock.writeLock().lock();
        try {
            List<GraphEdge> pipelines = graphStore.queryEdges(LABEL_PIPELINE, Collections.emptyList());
            if (pipelines.isEmpty()) {
                log.warn("管网中没有管段，{} 条迹象全部未关联", indicators.size());
                return AssociationResult.of(Collections.emptyMap(), new ArrayList<>(indicators));
            }

            Map<String, Coordinate> junctionLocations = new LinkedHashMap<>();
            for (GraphVertex v : graphStore.queryVertices(LABEL_JUNCTION, Collections.emptyList())) {
                Coordinate c = NetworkGraphMapper.locationOf(v);
                if (c != null) junctionLocations.put(v.getId(), c);
            }
            Map<String, List<Coordinate>> geometries = new LinkedHashMap<>();
            for (GraphEdge e : pipelines) {
                List<Coordinate> line = geometryOf(e, junctionLocations);
                if (!line.isEmpty()) geometries.put(e.getId(), line);
            }
            Map<String, GraphEdge> pipelineById = pipelines.stream()
                    .collect(Collectors.toMap(GraphEdge::getId, e -> e, (a, b) -> a, LinkedHashMap::new));

            // 1) 匹配，不写图
            List<Link> links = new ArrayList<>();
            List<LeakIndicator> unassociated = new ArrayList<>();
            for (LeakIndicator indicator : indicators) {
                Nearest nearest = geometries.isEmpty()
                        ? nearestByJunction(indicator.getLocation(), junctionLocations, pipelines)
                        : nearestByGeometry(indicator.getLocation(), geometries);
                if (nearest == null || (maxDistance > 0 && nearest.distance > maxDistance)) {
                    unassociated.add(indicator);
                    continue;
                }
                links.add(new Link("leak-" + IdUtil.getSnowflakeNextIdStr(), indicator, nearest));
            }
            if (!unassociated.isEmpty()) {
                log.warn("{} 条迹象超出关联距离 {}，未关联到管段", unassociated.size(), maxDistance);
            }

            // 2) 写入
            List<Link> written = new ArrayList<>();
            RiskException failure = null;
            for (Link link : links) {
                try {
                    graphStore.upsertVertex(NetworkGraphMapper.toVertex(link.indicatorId, link.indicator));
                    written.add(link);
                    graphStore.upsertEdge(NetworkGraphMapper.toDefectEdge(
                            link.indicatorId, pipelineById.get(link.nearest.segmentId), link.nearest.distance));
                    link.edgeWritten = true;
                } catch (RiskException e) {
                    failure = e;
                    break;
                }
            }

            if (failure != null) {
                log.warn("迹象关联写入失败，回滚本批 {} 个迹象顶点：{}", written.size(), failure.getMessage());
                List<Link> remaining = rollback(written);
                Set<LeakIndicator> stillLinked = Collections.newSetFromMap(new IdentityHashMap<>());
                for (Link link : remaining) stillLinked.add(link.indicator);
                List<LeakIndicator> notLinked = new ArrayList<>();
                for (LeakIndicator indicator : indicators) {
                    if (!stillLinked.contains(indicator)) notLinked.add(indicator);
                }
                return new AssociationResult(countBySegment(remaining, pipelineById),
                        Collections.unmodifiableList(notLinked), FailureRecord.of(failure));
            }

            Map<String, Integer> ordered = countBySegment(links, pipelineById);
            log.info("迹象关联完成：linked={}, segments={}, unassociated={}",
                    links.size(), ordered.size(), unassociated.size());
            return AssociationResult.of(ordered, Collections.unmodifiableList(unassociated));
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * age_years >= minAge 且 historical_leaks >= minLeaks 的管段 id
     */
    public List<String> findVulnerableSegments(double minAge, int minLeaks) {
        lock.readLock().lock();
        try {
            return graphStore.queryEdges(LABEL_PIPELINE, List.of(
                            PropertyPredicate.gte(P_AGE_YEARS, minAge),
                            PropertyPredicate.gte(P_HISTORICAL_LEAKS, minLeaks)))
                    .stream()
                    .map(GraphEdge::getId)
                    .collect(Collectors.toList());
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * 从管段下游节点沿 pipeline 出边广度优先追踪，返回可达节点 id（发现顺序，不含下游起点）。
     */
    public List<String> traceDownstream(String segmentId, int maxHops) {
        lock.readLock().lock();
        try {
            Optional<GraphEdge> segment = graphStore.findEdge(segmentId)
                    .filter(e -> LABEL_PIPELINE.equals(e.getLabel()));
            if (segment.isEmpty()) {
                log.warn("下游追踪：未知管段 {}", segmentId);
                return Collections.emptyList();
            }
            return graphStore.traverseOut(segment.get().getToId(), LABEL_PIPELINE, maxHops);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * 从图中还原关联到该管段的迹象，按关联顺序
     */
    public List<LeakIndicator> indicatorsFor(String segmentId) {
        lock.readLock().lock();
        try {
            List<GraphEdge> links = graphStore.queryEdges(LABEL_INDICATES_DEFECT,
                    List.of(PropertyPredicate.eq(P_SEGMENT_ID, segmentId)));
            List<LeakIndicator> out = new ArrayList<>(links.size());
            for (GraphEdge link : links) {
                graphStore.findVertex(link.getFromId())
                        .map(NetworkGraphMapper::toIndicator)
                        .ifPresent(out::add);
            }
            return out;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * 删除已写入的迹象顶点（连同其 indicates_defect 边），返回未能删除、仍完整关联在图中的部分
     */
    private List<Link> rollback(List<Link> written) {
        List<Link> remaining = new ArrayList<>();
        for (Link link : written) {
            try {
                graphStore.removeVertex(link.indicatorId);
            } catch (RiskException e) {
                log.warn("回滚迹象 {} 失败：{}", link.indicatorId, e.getMessage());
                if (link.edgeWritten) remaining.add(link);
            }
        }
        return remaining;
    }

    private static Map<String, Integer> countBySegment(List<Link> links, Map<String, GraphEdge> pipelineById) {
        Map<String, Integer> linked = new LinkedHashMap<>();
        for (Link link : links) linked.merge(link.nearest.segmentId, 1, Integer::sum);
        Map<String, Integer> ordered = new LinkedHashMap<>();
        for (String id : pipelineById.keySet()) {
            if (linked.containsKey(id)) ordered.put(id, linked.get(id));
        }
        return Collections.unmodifiableMap(ordered);
    }

    private static List<Coordinate> geometryOf(GraphEdge edge, Map<String, Coordinate> junctionLocations) {
        List<Coordinate> polyline = NetworkGraphMapper.polylineOf(edge);
        if (polyline.size() >= 2) return polyline;
        Coordinate from = junctionLocations.get(edge.getFromId());
        Coordinate to = junctionLocations.get(edge.getToId());
        if (from != null && to != null) return List.of(from, to);
        return polyline;
    }

    private static Nearest nearestByGeometry(Coordinate p, Map<String, List<Coordinate>> geometries) {
        Nearest best = null;
        for (Map.Entry<String, List<Coordinate>> e : geometries.entrySet()) {
            double d = GeometryUtil.distanceToPolyline(p, e.getValue());
            // 距离相同取先写入的管段
            if (best == null || d < best.distance) {
                best = new Nearest(e.getKey(), d);
            }
        }
        return best;
    }

    private static Nearest nearestByJunction(Coordinate p, Map<String, Coordinate> junctionLocations,
                                             List<GraphEdge> pipelines) {
        String nearestJunction = null;
        double best = Double.POSITIVE_INFINITY;
        for (Map.Entry<String, Coordinate> e : junctionLocations.entrySet()) {
            double d = p.distanceTo(e.getValue());
            if (d < best) {
                best = d;
                nearestJunction = e.getKey();
            }
        }
        if (nearestJunction == null) return null;
        for (GraphEdge e : pipelines) {
            if (nearestJunction.equals(e.getFromId()) || nearestJunction.equals(e.getToId())) {
                return new Nearest(e.getId(), best);
            }
        }
        return null;
    }

    private static final class Link {
        final String indicatorId;
        final LeakIndicator indicator;
        final Nearest nearest;
        boolean edgeWritten;

        Link(String indicatorId, LeakIndicator indicator, Nearest nearest) {
            this.indicatorId = indicatorId;
            this.indicator = indicator;
            this.nearest = nearest;
        }
    }

    private static final class Nearest {
        final String segmentId;
        final double distance;

        Nearest(String segmentId, double distance) {
            this.segmentId = segmentId;
            this.distance = distance;
        }
    }
}
