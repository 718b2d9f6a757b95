package com.gdin.inspection.waterleak.run;

import com.gdin.inspection.waterleak.exception.ErrorKind;
import com.gdin.inspection.waterleak.feed.JsonAssetFeed;
import com.gdin.inspection.waterleak.graph.WaterNetworkGraph;
import com.gdin.inspection.waterleak.models.Coordinate;
import com.gdin.inspection.waterleak.models.DefectProbability;
import com.gdin.inspection.waterleak.models.IndicatorType;
import com.gdin.inspection.waterleak.models.Junction;
import com.gdin.inspection.waterleak.models.PipelineSegment;
import com.gdin.inspection.waterleak.models.RiskReport;
import com.gdin.inspection.waterleak.models.Urgency;
import com.gdin.inspection.waterleak.raster.AcquisitionPass;
import com.gdin.inspection.waterleak.raster.BandType;
import com.gdin.inspection.waterleak.util.IOUtil;
import com.gdin.inspection.waterleak.workflows.RiskPipelineRegistrar;
import jakarta.annotation.Resource;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.core.io.ResourceLoader;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.TestPropertySource;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

@Slf4j
@SpringBootTest
@ActiveProfiles("dev")
@TestPropertySource(properties = "environment.test=true")
public class RiskPipelineRunnerTest {

    @Resource
    private RiskPipelineRunner riskPipelineRunner;

    @Resource
    private WaterNetworkGraph waterNetworkGraph;

    @Resource
    private ResourceLoader resourceLoader;

    private static Junction junction(String id, double row, double col) {
        return Junction.builder().junctionId(id).location(Coordinate.of(row, col)).build();
    }

    private static PipelineSegment segment(String id, String from, String to, double age, String material, int leaks) {
        return PipelineSegment.builder()
                .segmentId(id).startNode(from).endNode(to)
                .pipeMaterial(material).diameterMm(150).ageYears(age).lengthMeters(100)
                .historicalLeaks(leaks)
                .build();
    }

    private static List<String> ids(RiskReport report) {
        return report.getWorklist().stream().map(DefectProbability::getSegmentId).collect(Collectors.toList());
    }

    @Test
    public void testAssetOnlyRunFromJsonFeed() throws Exception {
        JsonAssetFeed feed = new JsonAssetFeed(resourceLoader.getResource("classpath:network.json"));

        RiskReport report = riskPipelineRunner.run(AcquisitionPass.empty(), feed);
        log.info("report: {}", IOUtil.jsonSerialize(report, true));

        assertTrue(report.isCompleted());
        assertNull(report.getError());
        assertEquals("test-1.0", report.getParameterVersion());
        assertEquals(List.of("S1", "S2", "S3"), ids(report));
        assertEquals(1.0, report.getWorklist().get(0).getProbability(), 1e-9);
        assertEquals(0.95, report.getWorklist().get(1).getProbability(), 1e-9);
        assertEquals(Urgency.CRITICAL, report.getWorklist().get(1).getUrgency());
        assertEquals(0.13, report.getWorklist().get(2).getProbability(), 1e-9);
        assertEquals(Urgency.LOW, report.getWorklist().get(2).getUrgency());
        assertTrue(report.getIndicators().isEmpty());
        assertTrue(report.getFailedSegments().isEmpty());
        assertEquals(4, report.getMissingInputs().size());
        assertEquals(List.of("detect_indicators", "build_network", "associate_indicators", "analyze_segments", "prioritize"),
                List.copyOf(report.getWorkflowSeconds().keySet()));
    }

    @Test
    public void testThermalIndicatorRaisesNearestSegment() {
        double[][] thermal = new double[30][45];
        for (double[] row : thermal) Arrays.fill(row, 15.0);
        for (int r = 8; r < 12; r++) {
            for (int c = 18; c < 22; c++) thermal[r][c] = 20.0;
        }
        AcquisitionPass pass = AcquisitionPass.builder().band(BandType.THERMAL, thermal).imageSource("uav-01").build();

        RiskReport report = riskPipelineRunner.run(pass,
                List.of(junction("J1", 0, 0), junction("J2", 0, 20), junction("J3", 20, 20), junction("J4", 20, 40)),
                List.of(segment("S1", "J1", "J2", 5, "pvc", 0),
                        segment("S2", "J2", "J3", 35, "steel", 2),
                        segment("S3", "J3", "J4", 5, "pvc", 0)));

        assertEquals(1, report.getIndicators().size());
        assertEquals(1, report.getIndicatorCounts().get(IndicatorType.THERMAL));
        assertEquals(Map.of("S2", 1), report.getAssociationCounts());
        assertTrue(report.getUnassociated().isEmpty());

        DefectProbability top = report.getWorklist().get(0);
        assertEquals("S2", top.getSegmentId());
        assertEquals(1.0, top.getContributingFactors().get(DefectProbability.FACTOR_INDICATOR_COUNT), 1e-12);
        assertEquals(0.5, top.getContributingFactors().get(DefectProbability.FACTOR_AVG_SEVERITY), 1e-12);

        // 关联结果在运行后仍可查询
        assertEquals(1, waterNetworkGraph.indicatorsFor("S2").size());
        assertEquals(List.of("J3", "J4"), waterNetworkGraph.traceDownstream("S1", 10));
        assertEquals(List.of("S2"), waterNetworkGraph.findVulnerableSegments(20, 2));
    }

    @Test
    public void testTiesKeepInputOrder() {
        RiskReport report = riskPipelineRunner.run(null,
                List.of(junction("A", 0, 0), junction("B", 0, 10), junction("C", 10, 10)),
                List.of(segment("later", "A", "B", 15, "concrete", 0),
                        segment("earlier", "B", "C", 15, "concrete", 0),
                        segment("worst", "C", "A", 60, "asbestos", 3)));

        assertEquals(List.of("worst", "later", "earlier"), ids(report));
        assertEquals(report.getWorklist().get(1).getProbability(), report.getWorklist().get(2).getProbability(), 0.0);
    }

    @Test
    public void testBrokenSegmentsAndBandsAreIsolated() {
        AcquisitionPass pass = AcquisitionPass.builder()
                .band(BandType.GREEN, new double[][]{{0.1, 0.2}, {0.3}})
                .band(BandType.NIR, new double[][]{{0.1, 0.2}, {0.3, 0.4}})
                .build();

        RiskReport report = riskPipelineRunner.run(pass,
                List.of(junction("A", 0, 0), junction("B", 0, 10)),
                List.of(segment("ok", "A", "B", 35, "steel", 2),
                        segment("dangling", "B", "Z", 40, "steel", 1)));

        assertTrue(report.isCompleted());
        assertEquals(List.of("ok"), ids(report));
        assertEquals(ErrorKind.TOPOLOGY_INTEGRITY, report.getFailedSegments().get("dangling").getKind());
        assertNotNull(report.getDetectorFailures().get(IndicatorType.PONDING));
        assertEquals(ErrorKind.MALFORMED_INPUT, report.getDetectorFailures().get(IndicatorType.PONDING).getKind());
        assertFalse(report.getDetectorFailures().containsKey(IndicatorType.THERMAL));
        assertEquals(ErrorKind.MISSING_INPUT, report.getMissingInputs().get(IndicatorType.THERMAL).getKind());
    }

    @Test
    public void testNoSegmentsHaltsAfterNetworkBuild() {
        RiskReport report = riskPipelineRunner.run(AcquisitionPass.empty(), List.of(), List.of());

        assertTrue(report.isCompleted());
        assertTrue(report.getWorklist().isEmpty());
        assertEquals(List.of("detect_indicators", "build_network"), List.copyOf(report.getWorkflowSeconds().keySet()));
    }

    @Test
    public void testDetectOnlyPipelineSkipsScoring() {
        RiskReport report = riskPipelineRunner.run(AcquisitionPass.empty(),
                List.of(junction("A", 0, 0), junction("B", 0, 10)),
                List.of(segment("ok", "A", "B", 35, "steel", 2)),
                RiskPipelineRegistrar.DETECT_ONLY);

        assertTrue(report.isCompleted());
        assertTrue(report.getWorklist().isEmpty());
        assertEquals(3, report.getWorkflowSeconds().size());
    }

    private static double[][] thermalWithHotSpot(int row, int col) {
        double[][] thermal = new double[30][45];
        for (double[] r : thermal) Arrays.fill(r, 15.0);
        for (int r = row; r < row + 4; r++) {
            for (int c = col; c < col + 4; c++) thermal[r][c] = 20.0;
        }
        return thermal;
    }

    @Test
    public void testConcurrentRunsSeeOnlyTheirOwnNetwork() throws Exception {
        // A: 热点靠近 A-2；B: 热点靠近 B-1
        Callable<RiskReport> runA = () -> riskPipelineRunner.run(
                AcquisitionPass.builder().band(BandType.THERMAL, thermalWithHotSpot(8, 18)).build(),
                List.of(junction("A1", 0, 0), junction("A2", 0, 20), junction("A3", 20, 20)),
                List.of(segment("A-1", "A1", "A2", 35, "steel", 2),
                        segment("A-2", "A2", "A3", 5, "pvc", 0)));
        Callable<RiskReport> runB = () -> riskPipelineRunner.run(
                AcquisitionPass.builder().band(BandType.THERMAL, thermalWithHotSpot(8, 0)).build(),
                List.of(junction("B1", 0, 0), junction("B2", 20, 0), junction("B3", 20, 20)),
                List.of(segment("B-1", "B1", "B2", 35, "steel", 2),
                        segment("B-2", "B2", "B3", 5, "pvc", 0)));

        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Future<RiskReport>> as = new ArrayList<>();
            List<Future<RiskReport>> bs = new ArrayList<>();
            for (int i = 0; i < 4; i++) {
                as.add(pool.submit(runA));
                bs.add(pool.submit(runB));
            }
            for (Future<RiskReport> f : as) {
                assertOwnNetwork(f.get(60, TimeUnit.SECONDS), Set.of("A-1", "A-2"), "A-2");
            }
            for (Future<RiskReport> f : bs) {
                assertOwnNetwork(f.get(60, TimeUnit.SECONDS), Set.of("B-1", "B-2"), "B-1");
            }
        } finally {
            pool.shutdown();
        }
    }

    private static void assertOwnNetwork(RiskReport report, Set<String> segmentIds, String linkedSegment) {
        assertTrue(report.isCompleted());
        assertTrue(report.getFailedSegments().isEmpty());
        assertEquals(segmentIds, Set.copyOf(ids(report)));
        assertEquals(Map.of(linkedSegment, 1), report.getAssociationCounts());
        for (DefectProbability p : report.getWorklist()) {
            double expected = p.getSegmentId().equals(linkedSegment) ? 1.0 : 0.0;
            assertEquals(expected, p.getContributingFactors().get(DefectProbability.FACTOR_INDICATOR_COUNT), 1e-12);
        }
    }
}
