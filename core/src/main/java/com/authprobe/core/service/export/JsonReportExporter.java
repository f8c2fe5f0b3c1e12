package com.authprobe.core.service.export;

import static com.authprobe.core.service.export.ReportNaming.*;

import com.authprobe.core.model.DegradedSignatureWarning;
import com.authprobe.core.model.FailureSignature;
import com.authprobe.core.model.ProbeConfig;
import com.authprobe.core.model.ProbeStats;
import com.authprobe.core.model.RunSummary;
import com.authprobe.core.model.Verdict;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;

/**
 * 실행 종료 후 JSON 보고서(v1).
 * - meta / signature / warnings / summary / runtime / suspects
 * - 비밀번호는 보고서에 싣지 않는다(hits 파일에만 기록)
 */
public class JsonReportExporter {

    public static final String REPORT_VERSION = "1";

    private final ObjectMapper om = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(SerializationFeature.INDENT_OUTPUT);

    /** @return 생성된 파일 경로 */
    public Path export(Path baseDir, ProbeConfig cfg, ProbeReport report) throws IOException {
        var ctx = context(baseDir, cfg.getTarget(), report.startedAt());
        Files.createDirectories(reportsDir(ctx));
        Path outFile = jsonPath(ctx);
        om.writeValue(outFile.toFile(), build(cfg, report));
        return outFile;
    }

    ObjectNode build(ProbeConfig cfg, ProbeReport report) {
        ObjectNode root = om.createObjectNode();

        ObjectNode meta = root.putObject("meta");
        meta.put("reportVersion", REPORT_VERSION);
        meta.putPOJO("generatedAt", Instant.now());
        meta.putPOJO("startedAt", report.startedAt());
        meta.put("target", cfg.getTarget());
        ObjectNode settings = meta.putObject("settings");
        settings.put("workers", cfg.getWorkerCount());
        settings.put("requestPacingMs", cfg.getRequestPacing().toMillis());
        settings.put("maxRps", cfg.getMaxRps());
        settings.put("calibrationCount", cfg.getCalibrationCount());
        settings.put("scoreThreshold", cfg.getScoreThreshold());
        settings.put("toleranceRatio", cfg.getToleranceRatio());
        ObjectNode weights = settings.putObject("weights");
        weights.put("status", cfg.getWeightStatus());
        weights.put("length", cfg.getWeightLength());
        weights.put("url", cfg.getWeightUrl());

        FailureSignature sig = report.signature();
        ObjectNode s = root.putObject("signature");
        s.put("expectedStatus", sig.getExpectedStatus());
        s.put("lengthLow", sig.getLengthLow());
        s.put("lengthHigh", sig.getLengthHigh());
        s.put("expectedUrl", sig.getExpectedUrl());
        s.put("statusReliable", sig.isStatusReliable());
        s.put("urlReliable", sig.isUrlReliable());
        s.put("quality", sig.quality().name());
        s.put("sampleSize", sig.getSampleSize());

        ArrayNode warnings = root.putArray("warnings");
        for (DegradedSignatureWarning w : sig.getWarnings()) {
            ObjectNode wn = warnings.addObject();
            wn.put("dimension", w.getDimension().name());
            wn.put("message", w.message());
            ArrayNode obs = wn.putArray("observed");
            w.getObserved().forEach(obs::add);
        }

        RunSummary sum = report.summary();
        ObjectNode summary = root.putObject("summary");
        summary.put("tested", sum.tested());
        summary.put("suspect", sum.suspect());
        summary.put("transportErrors", sum.transportErrors());
        summary.put("faults", sum.faults());
        summary.put("listenerFailures", sum.listenerFailures());
        summary.put("elapsedMs", sum.elapsed().toMillis());
        summary.put("throughputPerSecond", Math.round(sum.throughputPerSecond() * 100.0) / 100.0);

        ProbeStats.Snapshot rt = report.runtime();
        if (rt != null) {
            ObjectNode runtime = root.putObject("runtime");
            runtime.put("credentialsTotal", rt.credentialsTotal());
            runtime.put("requestsTotal", rt.requestsTotal());
            runtime.put("retriesTotal", rt.retriesTotal());
            runtime.put("rateLimitedTotal", rt.rateLimitedTotal());
            runtime.put("maxObservedConcurrency", rt.maxObservedConcurrency());
            runtime.put("avgLatencyMs", rt.avgLatencyMs());
        }

        ArrayNode suspects = root.putArray("suspects");
        for (Verdict v : report.suspects()) {
            ObjectNode n = suspects.addObject();
            n.put("username", v.getUsername());
            n.put("score", v.getScore());
            ArrayNode reasons = n.putArray("reasons");
            v.getReasons().forEach(reasons::add);
            if (v.getSummary() != null) {
                n.put("status", v.getSummary().getStatusCode());
                n.put("bodyLength", v.getSummary().getBodyLength());
                n.put("finalUrl", v.getSummary().getFinalUrl());
                ArrayNode cookies = n.putArray("cookies");
                v.getSummary().getCookieNames().forEach(cookies::add);
            }
            n.putPOJO("decidedAt", v.getDecidedAt());
        }
        return root;
    }
}
