package com.gdin.inspection.waterleak.graph;

import com.gdin.inspection.waterleak.config.properties.RiskProperties;
import com.gdin.inspection.waterleak.exception.ErrorKind;
import com.gdin.inspection.waterleak.exception.GraphConnectivityException;
import com.gdin.inspection.waterleak.exception.TopologyIntegrityException;
import com.gdin.inspection.waterleak.models.Coordinate;
import com.gdin.inspection.waterleak.models.IndicatorType;
import com.gdin.inspection.waterleak.models.Junction;
import com.gdin.inspection.waterleak.models.LeakIndicator;
import com.gdin.inspection.waterleak.models.PipelineSegment;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class WaterNetworkGraphTest {

    private RiskProperties props;
    private InMemoryGraphStore store;
    private WaterNetworkGraph graph;

    static Junction junction(String id, Coordinate location) {
        return Junction.builder().junctionId(id).location(location).build();
    }

    static PipelineSegment segment(String id, String from, String to, double age, int leaks) {
        return PipelineSegment.builder()
                .segmentId(id)
                .startNode(from)
                .endNode(to)
                .pipeMaterial("steel")
                .diameterMm(150)
                .ageYears(age)
                .lengthMeters(200)
                .historicalLeaks(leaks)
                .build();
    }

    static LeakIndicator indicator(double row, double col, double severity) {
        return LeakIndicator.builder()
                .location(Coordinate.of(row, col))
                .indicatorType(IndicatorType.PONDING)
                .confidence(0.85)
                .severity(severity)
                .timestamp(Instant.parse("2024-06-01T04:30:00Z"))
                .imageSource("multispectral")
                .metadata(Map.of("ndwi", 0.6, "area", 256.0))
                .build();
    }

    @BeforeEach
    public void setUp() {
        props = new RiskProperties();
        store = new InMemoryGraphStore();
        graph = new WaterNetworkGraph(store, props);
        graph.buildNetwork(
                List.of(junction("J1", Coordinate.of(0, 0)),
                        junction("J2", Coordinate.of(0, 20)),
                        junction("J3", Coordinate.of(20, 20)),
                        junction("J4", Coordinate.of(20, 40))),
                List.of(segment("S1", "J1", "J2", 30, 3),
                        segment("S2", "J2", "J3", 50, 1),
                        segment("S3", "J3", "J4", 10, 5)));
    }

    @Test
    public void testVulnerabilityRequiresBothConditions() {
        assertEquals(List.of("S1"), graph.findVulnerableSegments(20, 2));
        assertEquals(List.of("S1", "S2", "S3"), graph.findVulnerableSegments(0, 0));
        assertTrue(graph.findVulnerableSegments(60, 0).isEmpty());
    }

    @Test
    public void testDownstreamTrace() {
        assertEquals(List.of("J3", "J4"), graph.traceDownstream("S1", 10));
        assertEquals(List.of("J3"), graph.traceDownstream("S1", 1));
        assertTrue(graph.traceDownstream("S3", 10).isEmpty());
        assertTrue(graph.traceDownstream("nope", 10).isEmpty());
    }

    @Test
    public void testDownstreamTraceTerminatesOnLoop() {
        graph.addSegment(segment("S4", "J4", "J2", 5, 0));
        assertEquals(List.of("J3", "J4"), graph.traceDownstream("S1", 50));
    }

    @Test
    public void testSegmentWithMissingJunctionIsRejected() {
        TopologyIntegrityException e = assertThrows(TopologyIntegrityException.class,
                () -> graph.addSegment(segment("S9", "J4", "J9", 5, 0)));
        assertEquals(ErrorKind.TOPOLOGY_INTEGRITY, e.getKind());
        assertTrue(store.findEdge("S9").isEmpty());
    }

    @Test
    public void testIndicatorsLinkToNearestSegment() {
        AssociationResult result = graph.associateIndicators(List.of(
                indicator(10, 21, 0.6),
                indicator(1, 5, 0.4),
                indicator(11, 19, 0.2)));

        assertEquals(Map.of("S1", 1, "S2", 2), result.getLinkedCounts());
        assertEquals(List.of("S1", "S2"), List.copyOf(result.getLinkedCounts().keySet()));
        assertTrue(result.getUnassociated().isEmpty());
        assertEquals(3, result.linkedTotal());

        List<LeakIndicator> onS2 = graph.indicatorsFor("S2");
        assertEquals(2, onS2.size());
        LeakIndicator first = onS2.get(0);
        assertEquals(IndicatorType.PONDING, first.getIndicatorType());
        assertEquals(10.0, first.getLocation().getRow(), 1e-12);
        assertEquals(0.6, first.getSeverity(), 1e-12);
        assertEquals(0.6, first.getMetadata().get("ndwi"), 1e-12);
        assertEquals(Instant.parse("2024-06-01T04:30:00Z"), first.getTimestamp());
        assertTrue(graph.indicatorsFor("S3").isEmpty());

        // indicates_defect 边记录管段和距离
        List<GraphEdge> links = store.queryEdges(NetworkGraphMapper.LABEL_INDICATES_DEFECT,
                List.of(PropertyPredicate.eq(NetworkGraphMapper.P_SEGMENT_ID, "S2")));
        assertEquals(2, links.size());
        assertEquals(1.0, ((Number) links.get(0).getProperties().get(NetworkGraphMapper.P_DISTANCE)).doubleValue(), 1e-12);
    }

    @Test
    public void testPolylineTakesPrecedenceOverJunctions() {
        graph.addSegment(PipelineSegment.builder()
                .segmentId("S5").startNode("J1").endNode("J4")
                .pipeMaterial("pvc").ageYears(1)
                .coordinates(List.of(Coordinate.of(0, 0), Coordinate.of(40, 0), Coordinate.of(40, 40)))
                .build());
        AssociationResult result = graph.associateIndicators(List.of(indicator(39, 30, 0.5)));
        assertEquals(Map.of("S5", 1), result.getLinkedCounts());
    }

    @Test
    public void testFarIndicatorsAreReportedNotDropped() {
        props.getAssociation().setMaxDistance(5.0);
        LeakIndicator far = indicator(100, 100, 0.9);
        AssociationResult result = graph.associateIndicators(List.of(indicator(2, 10, 0.3), far));

        assertEquals(Map.of("S1", 1), result.getLinkedCounts());
        assertEquals(List.of(far), result.getUnassociated());
    }

    @Test
    public void testNearestJunctionFallbackWithoutGeometry() {
        InMemoryGraphStore bare = new InMemoryGraphStore();
        WaterNetworkGraph g = new WaterNetworkGraph(bare, props);
        g.buildNetwork(
                List.of(junction("A", Coordinate.of(0, 0)), junction("B", null), junction("C", Coordinate.of(50, 50))),
                List.of(segment("AB", "A", "B", 10, 0), segment("BC", "B", "C", 10, 0)));

        AssociationResult result = g.associateIndicators(List.of(indicator(45, 45, 0.5), indicator(3, 3, 0.5)));
        assertEquals(Map.of("AB", 1, "BC", 1), result.getLinkedCounts());
    }

    @Test
    public void testUnreachableStoreSurfacesConnectivityError() {
        InMemoryGraphStore broken = new InMemoryGraphStore() {
            @Override
            public synchronized List<GraphEdge> queryEdges(String label, List<PropertyPredicate> predicates) {
                throw new GraphConnectivityException("connection refused", new java.io.IOException("refused"));
            }
        };
        WaterNetworkGraph g = new WaterNetworkGraph(broken, props);

        GraphConnectivityException e = assertThrows(GraphConnectivityException.class,
                () -> g.associateIndicators(List.of(indicator(1, 1, 0.5))));
        assertEquals(ErrorKind.GRAPH_CONNECTIVITY, e.getKind());
        assertThrows(GraphConnectivityException.class, () -> g.findVulnerableSegments(20, 2));
    }

    @Test
    public void testSegmentRoundTripsThroughGraphProperties() {
        PipelineSegment original = PipelineSegment.builder()
                .segmentId("S7").startNode("J1").endNode("J3")
                .pipeMaterial("cast_iron").diameterMm(300).ageYears(42.5).lengthMeters(88)
                .historicalLeaks(4)
                .coordinates(List.of(Coordinate.of(0, 0), Coordinate.of(20, 20)))
                .build();
        graph.addSegment(original);
        PipelineSegment restored = NetworkGraphMapper.toSegment(store.findEdge("S7").orElseThrow());
        assertEquals(original, restored);
    }

    /**
     * 第 failOnDefectEdge 条 indicates_defect 边写入时断连；removable=false 时删除也失败
     */
    private static InMemoryGraphStore flakyStore(int failOnDefectEdge, boolean removable) {
        return new InMemoryGraphStore() {
            private int defectEdges;

            @Override
            public synchronized GraphEdge upsertEdge(GraphEdge edge) {
                if (NetworkGraphMapper.LABEL_INDICATES_DEFECT.equals(edge.getLabel()) && ++defectEdges == failOnDefectEdge) {
                    throw new GraphConnectivityException("connection reset", new java.io.IOException("reset"));
                }
                return super.upsertEdge(edge);
            }

            @Override
            public synchronized void removeVertex(String id) {
                if (!removable) {
                    throw new GraphConnectivityException("connection reset", new java.io.IOException("reset"));
                }
                super.removeVertex(id);
            }
        };
    }

    private WaterNetworkGraph networkOn(InMemoryGraphStore s) {
        WaterNetworkGraph g = new WaterNetworkGraph(s, props);
        g.buildNetwork(
                List.of(junction("J1", Coordinate.of(0, 0)),
                        junction("J2", Coordinate.of(0, 20)),
                        junction("J3", Coordinate.of(20, 20))),
                List.of(segment("S1", "J1", "J2", 30, 3),
                        segment("S2", "J2", "J3", 50, 1)));
        return g;
    }

    @Test
    public void testInterruptedBatchIsRolledBack() {
        InMemoryGraphStore flaky = flakyStore(2, true);
        WaterNetworkGraph g = networkOn(flaky);
        List<LeakIndicator> batch = List.of(indicator(10, 21, 0.6), indicator(1, 5, 0.4), indicator(11, 19, 0.2));

        AssociationResult result = g.associateIndicators(batch);

        assertEquals(ErrorKind.GRAPH_CONNECTIVITY, result.getFailure().getKind());
        assertTrue(result.getLinkedCounts().isEmpty());
        assertEquals(batch, result.getUnassociated());
        assertTrue(flaky.queryVertices(NetworkGraphMapper.LABEL_LEAK_INDICATOR, List.of()).isEmpty());
        assertTrue(flaky.queryEdges(NetworkGraphMapper.LABEL_INDICATES_DEFECT, List.of()).isEmpty());
        assertTrue(g.indicatorsFor("S2").isEmpty());
        assertEquals(5, flaky.vertexCount() + flaky.edgeCount());
    }

    @Test
    public void testFailedRollbackReportsLinksLeftInGraph() {
        InMemoryGraphStore flaky = flakyStore(2, false);
        WaterNetworkGraph g = networkOn(flaky);
        LeakIndicator kept = indicator(10, 21, 0.6);
        LeakIndicator failed = indicator(1, 5, 0.4);
        LeakIndicator pending = indicator(11, 19, 0.2);

        AssociationResult result = g.associateIndicators(List.of(kept, failed, pending));

        assertEquals(ErrorKind.GRAPH_CONNECTIVITY, result.getFailure().getKind());
        assertEquals(Map.of("S2", 1), result.getLinkedCounts());
        assertEquals(List.of(failed, pending), result.getUnassociated());
        assertEquals(1, g.indicatorsFor("S2").size());
        assertTrue(g.indicatorsFor("S1").isEmpty());
    }

    @Test
    public void testSuccessfulBatchHasNoFailure() {
        AssociationResult result = graph.associateIndicators(List.of(indicator(1, 5, 0.4)));
        assertNull(result.getFailure());
    }
}
