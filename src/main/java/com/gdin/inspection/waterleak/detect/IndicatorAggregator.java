package com.gdin.inspection.waterleak.detect;

import com.gdin.inspection.waterleak.config.properties.RiskProperties;
import com.gdin.inspection.waterleak.exception.ErrorKind;
import com.gdin.inspection.waterleak.exception.MissingInputException;
import com.gdin.inspection.waterleak.exception.RiskException;
import com.gdin.inspection.waterleak.models.IndicatorType;
import com.gdin.inspection.waterleak.models.LeakIndicator;
import com.gdin.inspection.waterleak.raster.AcquisitionPass;
import com.gdin.inspection.waterleak.raster.BandType;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * 对一次采集并发运行全部检测器并合并结果。
 * 检测器按 IndicatorType 固定注册，单个检测器失败不影响其他检测器。
 */
@Slf4j
@Service
public class IndicatorAggregator {

    private final Map<IndicatorType, SignalDetector> detectors = new EnumMap<>(IndicatorType.class);
    private final RiskProperties riskProperties;

    public IndicatorAggregator(List<SignalDetector> detectors, RiskProperties riskProperties) {
        for (SignalDetector detector : detectors) {
            SignalDetector previous = this.detectors.put(detector.type(), detector);
            if (previous != null) {
                throw new IllegalStateException("duplicate detector for " + detector.type());
            }
        }
        this.riskProperties = riskProperties;
    }

    public Result aggregate(AcquisitionPass pass) {
        int threads = Math.max(1, Math.min(detectors.size(), concurrency()));
        ExecutorService pool = Executors.newFixedThreadPool(threads);

        Map<IndicatorType, CompletableFuture<List<LeakIndicator>>> futures = new EnumMap<>(IndicatorType.class);
        Map<IndicatorType, Integer> counts = new EnumMap<>(IndicatorType.class);
        Map<IndicatorType, RiskException> missing = new EnumMap<>(IndicatorType.class);
        try {
            for (Map.Entry<IndicatorType, SignalDetector> e : detectors.entrySet()) {
                SignalDetector detector = e.getValue();
                List<BandType> required = detector.requiredBands();
                if (pass == null || !pass.has(required.toArray(new BandType[0]))) {
                    // 缺波段不算失败，该类型按 0 条迹象计
                    missing.put(e.getKey(), new MissingInputException(
                            e.getKey().code() + " detector skipped, required bands " + required));
                    counts.put(e.getKey(), 0);
                    continue;
                }
                futures.put(e.getKey(), CompletableFuture.supplyAsync(() -> detector.detect(pass), pool));
            }

            List<LeakIndicator> all = new ArrayList<>();
            Map<IndicatorType, RiskException> failures = new LinkedHashMap<>();

            // 按类型顺序合并，保证同一输入的结果顺序稳定
            for (Map.Entry<IndicatorType, CompletableFuture<List<LeakIndicator>>> e : futures.entrySet()) {
                IndicatorType type = e.getKey();
                try {
                    List<LeakIndicator> found = e.getValue().join();
                    all.addAll(found);
                    counts.put(type, found.size());
                    log.info("{} 检测完成：indicators={}", type.code(), found.size());
                } catch (CompletionException ex) {
                    RiskException failure = toRiskException(type, ex.getCause());
                    failures.put(type, failure);
                    log.warn("{} 检测失败：{}", type.code(), failure.getMessage());
                }
            }
            if (!missing.isEmpty()) {
                log.info("缺少波段，跳过检测器：{}", missing.keySet());
            }
            return new Result(Collections.unmodifiableList(all), counts, failures, missing);
        } finally {
            pool.shutdown();
        }
    }

    private int concurrency() {
        Integer c = riskProperties.getPipeline().getConcurrency();
        return c == null ? 1 : c;
    }

    private static RiskException toRiskException(IndicatorType type, Throwable cause) {
        if (cause instanceof RiskException) {
            return (RiskException) cause;
        }
        return new RiskException(ErrorKind.MALFORMED_INPUT,
                type.code() + " detector failed: " + cause, cause);
    }

    @Value
    public static class Result {
        List<LeakIndicator> indicators;
        Map<IndicatorType, Integer> counts;
        Map<IndicatorType, RiskException> failures;
        Map<IndicatorType, RiskException> missingInputs;
    }
}
