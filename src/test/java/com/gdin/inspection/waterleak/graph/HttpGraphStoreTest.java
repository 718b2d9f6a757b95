package com.gdin.inspection.waterleak.graph;

import com.gdin.inspection.waterleak.config.properties.RiskProperties;
import com.gdin.inspection.waterleak.exception.ErrorKind;
import com.gdin.inspection.waterleak.exception.GraphConnectivityException;
import com.gdin.inspection.waterleak.exception.MalformedInputException;
import com.gdin.inspection.waterleak.exception.TopologyIntegrityException;
import com.gdin.inspection.waterleak.models.Junction;
import com.gdin.inspection.waterleak.models.PipelineSegment;
import com.gdin.inspection.waterleak.workflows.BuildNetworkWorkflow;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.util.ReflectionTestUtils;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

public class HttpGraphStoreTest {

    private MockRestServiceServer server;
    private HttpGraphStore store;

    @BeforeEach
    public void setUp() {
        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        store = new HttpGraphStore(restTemplate, "http://graph.local/");
    }

    @Test
    public void testTraversalRequestAndResponse() {
        server.expect(requestTo("http://graph.local/traversals"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(jsonPath("$.start_id").value("J2"))
                .andExpect(jsonPath("$.edge_label").value("pipeline"))
                .andExpect(jsonPath("$.max_hops").value(10))
                .andRespond(withSuccess("{\"vertex_ids\":[\"J3\",\"J4\"]}", MediaType.APPLICATION_JSON));

        assertEquals(List.of("J3", "J4"), store.traverseOut("J2", "pipeline", 10));
        server.verify();
    }

    @Test
    public void testQueryEdgesSendsPredicates() {
        server.expect(requestTo("http://graph.local/edges/query"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(jsonPath("$.label").value("pipeline"))
                .andExpect(jsonPath("$.predicates[0].key").value("age_years"))
                .andExpect(jsonPath("$.predicates[0].op").value("GTE"))
                .andRespond(withSuccess("[{\"id\":\"S1\",\"label\":\"pipeline\",\"from_id\":\"J1\",\"to_id\":\"J2\","
                        + "\"properties\":{\"age_years\":30,\"historical_leaks\":3}}]", MediaType.APPLICATION_JSON));

        List<GraphEdge> edges = store.queryEdges("pipeline", List.of(PropertyPredicate.gte("age_years", 20)));
        assertEquals(1, edges.size());
        assertEquals("J1", edges.get(0).getFromId());
        assertEquals(30, ((Number) edges.get(0).getProperties().get("age_years")).intValue());
    }

    @Test
    public void testMissingVertexIsEmpty() {
        server.expect(requestTo("http://graph.local/vertices/J9"))
                .andRespond(withStatus(HttpStatus.NOT_FOUND));
        assertTrue(store.findVertex("J9").isEmpty());
    }

    @Test
    public void testConflictMapsToTopologyError() {
        server.expect(requestTo("http://graph.local/edges"))
                .andExpect(method(HttpMethod.PUT))
                .andRespond(withStatus(HttpStatus.CONFLICT).body("missing endpoint J9"));

        GraphEdge edge = GraphEdge.builder().id("S9").label("pipeline").fromId("J1").toId("J9").properties(Map.of()).build();
        TopologyIntegrityException e = assertThrows(TopologyIntegrityException.class, () -> store.upsertEdge(edge));
        assertEquals(ErrorKind.TOPOLOGY_INTEGRITY, e.getKind());
    }

    @Test
    public void testServerFailureMapsToConnectivityError() {
        server.expect(requestTo("http://graph.local/graph"))
                .andExpect(method(HttpMethod.DELETE))
                .andRespond(withServerError());

        GraphConnectivityException e = assertThrows(GraphConnectivityException.class, () -> store.clear());
        assertEquals(ErrorKind.GRAPH_CONNECTIVITY, e.getKind());
    }

    @Test
    public void testOtherClientErrorMapsToMalformedInput() {
        server.expect(requestTo("http://graph.local/edges"))
                .andExpect(method(HttpMethod.PUT))
                .andRespond(withStatus(HttpStatus.BAD_REQUEST).body("diameter_mm must be numeric"));

        GraphEdge edge = GraphEdge.builder().id("S1").label("pipeline").fromId("J1").toId("J2").properties(Map.of()).build();
        MalformedInputException e = assertThrows(MalformedInputException.class, () -> store.upsertEdge(edge));
        assertEquals(ErrorKind.MALFORMED_INPUT, e.getKind());
        assertTrue(e.getMessage().contains("400"));
        assertTrue(e.getMessage().contains("diameter_mm must be numeric"));
    }

    @Test
    public void testBadRequestFailsOnlyThatSegment() {
        server.expect(requestTo("http://graph.local/graph")).andExpect(method(HttpMethod.DELETE))
                .andRespond(withSuccess());
        server.expect(requestTo("http://graph.local/vertices")).andExpect(method(HttpMethod.PUT))
                .andRespond(withSuccess());
        server.expect(requestTo("http://graph.local/vertices")).andExpect(method(HttpMethod.PUT))
                .andRespond(withSuccess());
        server.expect(requestTo("http://graph.local/edges")).andExpect(method(HttpMethod.PUT))
                .andExpect(jsonPath("$.id").value("BAD"))
                .andRespond(withStatus(HttpStatus.BAD_REQUEST));
        server.expect(requestTo("http://graph.local/edges")).andExpect(method(HttpMethod.PUT))
                .andExpect(jsonPath("$.id").value("OK"))
                .andRespond(withSuccess());

        BuildNetworkWorkflow workflow = new BuildNetworkWorkflow();
        ReflectionTestUtils.setField(workflow, "waterNetworkGraph", new WaterNetworkGraph(store, new RiskProperties()));
        BuildNetworkWorkflow.Result result = workflow.run(
                List.of(Junction.builder().junctionId("J1").build(), Junction.builder().junctionId("J2").build()),
                List.of(segment("BAD"), segment("OK")));

        server.verify();
        assertEquals(List.of("OK"), result.getSegments().stream().map(PipelineSegment::getSegmentId).collect(Collectors.toList()));
        assertEquals(ErrorKind.MALFORMED_INPUT, result.getFailures().get("BAD").getKind());
    }

    @Test
    public void testRemoveIgnoresMissingEntity() {
        server.expect(requestTo("http://graph.local/vertices/leak-1"))
                .andExpect(method(HttpMethod.DELETE))
                .andRespond(withStatus(HttpStatus.NOT_FOUND));
        server.expect(requestTo("http://graph.local/edges/defect-leak-1"))
                .andExpect(method(HttpMethod.DELETE))
                .andRespond(withSuccess());

        store.removeVertex("leak-1");
        store.removeEdge("defect-leak-1");
        server.verify();
    }

    private static PipelineSegment segment(String id) {
        return PipelineSegment.builder().segmentId(id).startNode("J1").endNode("J2")
                .pipeMaterial("steel").diameterMm(150).ageYears(20).lengthMeters(100).build();
    }
}
