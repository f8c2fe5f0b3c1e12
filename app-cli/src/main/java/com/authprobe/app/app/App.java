package com.authprobe.app.app;

import com.authprobe.app.logging.LogSetup;
import com.authprobe.core.detector.CalibrationException;
import com.authprobe.core.model.FailureSignature;
import com.authprobe.core.model.ProbeConfig;
import com.authprobe.core.model.RunSummary;
import com.authprobe.core.model.Verdict;
import com.authprobe.core.service.HitFileWriter;
import com.authprobe.core.service.ProbeService;
import com.authprobe.core.service.export.JsonReportExporter;
import com.authprobe.core.service.export.ProbeReport;
import com.authprobe.core.service.pipeline.ProbeRun;
import com.authprobe.core.source.ComboFileSource;
import com.authprobe.core.util.YamlConfigLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/** CLI 진입점. 종료 코드: 0 완료, 1 설정/입력 오류, 2 보정 실패 */
public final class App {
    private static final Logger LOG = LoggerFactory.getLogger(App.class);

    public static final int EXIT_OK = 0;
    public static final int EXIT_BAD_INPUT = 1;
    public static final int EXIT_CALIBRATION = 2;

    private App() {}

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    static int run(String[] args, PrintStream out, PrintStream err) {
        CliArgs cli;
        try {
            cli = CliArgs.parse(args);
        } catch (IllegalArgumentException e) {
            err.println("error: " + e.getMessage());
            err.println(CliArgs.USAGE);
            return EXIT_BAD_INPUT;
        }
        if (cli.help()) {
            out.println(CliArgs.USAGE);
            return EXIT_OK;
        }

        ProbeConfig cfg;
        try {
            cfg = loadConfig(cli);
            cli.applyTo(cfg);
            cfg.validate();
        } catch (NoSuchFileException e) {
            err.println("error: config file not found: " + e.getFile());
            return EXIT_BAD_INPUT;
        } catch (IOException | RuntimeException e) {
            err.println("error: invalid configuration: " + e.getMessage());
            return EXIT_BAD_INPUT;
        }

        LogSetup.configure(cfg.getOutputDir());
        Thread.setDefaultUncaughtExceptionHandler((t, e) ->
                LOG.error("Uncaught exception in thread {}", t.getName(), e));

        ComboFileSource source = new ComboFileSource(cfg.getComboFile(), cfg.getDelimiter());
        try {
            source.checkReadable();
        } catch (IOException e) {
            err.println("error: cannot read combo file: " + cfg.getComboFile());
            return EXIT_BAD_INPUT;
        }

        ProbeService service;
        try {
            service = new ProbeService(cfg);
        } catch (IllegalArgumentException e) {
            err.println("error: " + e.getMessage());
            return EXIT_BAD_INPUT;
        }
        HitFileWriter hits = new HitFileWriter(cfg.getHitsPath());
        List<Verdict> suspects = Collections.synchronizedList(new ArrayList<>());
        service.addListener(hits);
        service.addListener(v -> { if (v.isSuspect()) suspects.add(v); });

        Instant startedAt = Instant.now();
        out.println("[*] Target: " + cfg.getTarget());
        out.println("[*] Calibrating with " + cfg.getCalibrationCount() + " fake credentials...");

        FailureSignature sig;
        try {
            sig = service.calibrate();
        } catch (CalibrationException e) {
            err.println("error: calibration failed: " + e.getMessage());
            LOG.error("Calibration failed", e);
            return EXIT_CALIBRATION;
        }
        out.println("[*] Failure signature: " + sig);
        sig.getWarnings().forEach(w -> out.println("[!] " + w.message()));

        ProbeRun run;
        try {
            run = service.start(source, sig);
        } catch (IOException e) {
            err.println("error: cannot open combo file: " + e.getMessage());
            return EXIT_BAD_INPUT;
        }

        // Ctrl-C: 새 쌍은 꺼내지 않고 진행 중 요청만 마무리
        Thread hook = new Thread(() -> {
            run.stop();
            try {
                run.awaitCompletion(Duration.ofSeconds(30));
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
            }
        }, "probe-shutdown");
        Runtime.getRuntime().addShutdownHook(hook);

        out.println("[*] Testing credentials with " + cfg.getWorkerCount() + " worker(s)...");
        for (Verdict v : run) {
            if (v.isSuspect()) {
                out.println("[+] SUSPECT " + v.getUsername() + ":" + v.getPassword()
                        + " (score " + v.getScore() + ") " + v.getReasons());
            }
        }

        RunSummary summary;
        try {
            summary = run.awaitCompletion();
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            summary = run.summary();
        }
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            LOG.debug("Shutdown already in progress; hook stays registered");
        }

        if (cfg.isWriteReport()) {
            try {
                List<Verdict> snapshot;
                synchronized (suspects) { snapshot = List.copyOf(suspects); }
                Path report = new JsonReportExporter().export(cfg.getOutputDir(), cfg,
                        new ProbeReport(startedAt, sig, summary, service.getRuntimeSnapshot(), snapshot));
                out.println("[*] Report: " + report.toAbsolutePath());
            } catch (IOException e) {
                LOG.warn("Report export failed: {}", e.getMessage());
                err.println("warning: report export failed: " + e.getMessage());
            }
        }

        out.println(String.format(Locale.ROOT,
                "[*] Done. tested=%d, hits=%d, transportErrors=%d, faults=%d, elapsed=%.1fs, avg=%.2f/s",
                summary.tested(), summary.suspect(), summary.transportErrors(), summary.faults(),
                summary.elapsed().toMillis() / 1000.0, summary.throughputPerSecond()));
        if (summary.suspect() > 0) {
            out.println("[*] Hits saved to " + hits.getFile().toAbsolutePath());
        }
        if (summary.listenerFailures() > 0) {
            err.println(String.format(Locale.ROOT,
                    "warning: %d verdict(s) could not be recorded; %s may be incomplete (see log)",
                    summary.listenerFailures(), hits.getFile().toAbsolutePath()));
        }
        return EXIT_OK;
    }

    static ProbeConfig loadConfig(CliArgs cli) throws IOException {
        if (cli.config() != null) return YamlConfigLoader.load(cli.config());
        Path def = Path.of(YamlConfigLoader.DEFAULT_FILE);
        return Files.exists(def) ? YamlConfigLoader.load(def) : ProbeConfig.defaults();
    }
}
