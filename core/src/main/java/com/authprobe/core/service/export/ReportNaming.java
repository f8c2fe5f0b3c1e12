package com.authprobe.core.service.export;

import java.net.URI;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/** 보고서 경로 규칙: &lt;out&gt;/reports/probe_&lt;host&gt;_&lt;yyyyMMdd-HHmmss&gt;.json */
public final class ReportNaming {

    public static final DateTimeFormatter TS_FMT =
            DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss").withZone(ZoneId.systemDefault());

    private ReportNaming() {}

    public static ReportContext context(Path baseDir, String target, Instant startedAt) {
        Path out = (baseDir == null ? Paths.get("out") : baseDir);
        return new ReportContext(out, extractHost(target), startedAt == null ? Instant.now() : startedAt);
    }

    public static String timestamp(ReportContext ctx) { return TS_FMT.format(ctx.startedAt()); }
    public static Path reportsDir(ReportContext ctx) { return ctx.baseDir().resolve("reports"); }
    public static Path jsonPath(ReportContext ctx) { return reportsDir(ctx).resolve(filePrefix(ctx) + ".json"); }

    public static String filePrefix(ReportContext ctx) {
        return "probe_" + ctx.host() + "_" + timestamp(ctx);
    }

    public record ReportContext(Path baseDir, String host, Instant startedAt) {}

    static String extractHost(String target) {
        if (target == null || target.isBlank()) return "unknown-host";
        try {
            String h = URI.create(target.trim()).getHost();
            return (h == null ? "unknown-host" : h.toLowerCase(Locale.ROOT)).replaceAll("[^a-z0-9._-]", "-");
        } catch (IllegalArgumentException e) {
            return "unknown-host";
        }
    }
}
