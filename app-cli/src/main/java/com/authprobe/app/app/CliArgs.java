package com.authprobe.app.app;

import com.authprobe.core.model.ProbeConfig;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;

/**
 * 커맨드라인 플래그. 지정된 값만 설정 파일 값을 덮어쓴다.
 * --flag value 와 --flag=value 둘 다 허용.
 */
public final class CliArgs {

    static final String USAGE = String.join(System.lineSeparator(),
            "Usage: authprobe [options]",
            "  --config <file>      probe.yml path (default: ./probe.yml when present)",
            "  --target <url>       login form URL",
            "  --combo <file>       credential file (user:pass per line)",
            "  --workers <n>        concurrent workers (1..20)",
            "  --pacing-ms <ms>     minimum delay between requests of one worker",
            "  --threshold <n>      score needed for SUSPECT",
            "  --out <dir>          output directory",
            "  -h, --help           show this help");

    private Path config;
    private String target;
    private Path combo;
    private Integer workers;
    private Long pacingMs;
    private Integer threshold;
    private Path out;
    private boolean help;

    private CliArgs() {}

    public static CliArgs parse(String... args) {
        Objects.requireNonNull(args, "args");
        CliArgs a = new CliArgs();
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if ("-h".equals(arg) || "--help".equals(arg)) {
                a.help = true;
                continue;
            }
            if (!arg.startsWith("--")) {
                throw new IllegalArgumentException("unexpected argument: " + arg);
            }
            String name = arg;
            String value;
            int eq = arg.indexOf('=');
            if (eq > 0) {
                name = arg.substring(0, eq);
                value = arg.substring(eq + 1);
            } else {
                if (i + 1 >= args.length) throw new IllegalArgumentException("missing value for " + arg);
                value = args[++i];
            }
            switch (name) {
                case "--config" -> a.config = Path.of(value);
                case "--target" -> a.target = value;
                case "--combo" -> a.combo = Path.of(value);
                case "--workers" -> a.workers = parseInt(name, value);
                case "--pacing-ms" -> a.pacingMs = (long) parseInt(name, value);
                case "--threshold" -> a.threshold = parseInt(name, value);
                case "--out" -> a.out = Path.of(value);
                default -> throw new IllegalArgumentException("unknown option: " + name);
            }
        }
        return a;
    }

    /** 지정된 플래그만 cfg 에 반영 */
    public ProbeConfig applyTo(ProbeConfig cfg) {
        if (target != null) cfg.setTarget(target);
        if (combo != null) cfg.setComboFile(combo);
        if (workers != null) cfg.setWorkerCount(workers);
        if (pacingMs != null) cfg.setRequestPacing(Duration.ofMillis(pacingMs));
        if (threshold != null) cfg.setScoreThreshold(threshold);
        if (out != null) cfg.setOutputDir(out);
        return cfg;
    }

    public Path config() { return config; }
    public boolean help() { return help; }

    private static int parseInt(String name, String v) {
        try {
            return Integer.parseInt(v.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(name + " expects an integer, got '" + v + "'", e);
        }
    }
}
