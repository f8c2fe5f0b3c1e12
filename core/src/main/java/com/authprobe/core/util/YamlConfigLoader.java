package com.authprobe.core.util;

import com.authprobe.core.model.ProbeConfig;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.DoubleConsumer;
import java.util.function.IntConsumer;

/**
 * probe.yml을 읽어 ProbeConfig로 변환.
 * validate()는 CLI 덮어쓰기까지 끝난 뒤 호출자가 한다.
 *
 * 예상 YAML 키:
 * target: "http://localhost:8080/login"
 * form:
 *   usernameField: username
 *   passwordField: password
 *   extraFields: { remember: "0" }
 * calibration:
 *   count: 5
 *   pacingMs: 2000
 *   minLengthMargin: 0
 * pipeline:
 *   workers: 5
 *   pacingMs: 2000
 *   maxRps: 0
 * scoring:
 *   threshold: 3
 *   toleranceRatio: 0.01
 *   weights: { status: 3, length: 2, url: 3 }
 * http:
 *   timeoutMs: 10000
 *   followRedirects: true
 *   userAgent: "authprobe/0.1"
 *   maxAttempts: 3
 * input:
 *   comboFile: "combo.txt"
 *   delimiter: ":"
 * output:
 *   dir: "out"
 *   hitsFile: "hits.txt"
 *   report: true
 */
public final class YamlConfigLoader {

    public static final String DEFAULT_FILE = "probe.yml";

    private YamlConfigLoader() {}

    public static ProbeConfig loadDefault() throws IOException {
        return load(Path.of(DEFAULT_FILE));
    }

    public static ProbeConfig load(Path yamlPath) throws IOException {
        Objects.requireNonNull(yamlPath, "yamlPath");
        if (!Files.exists(yamlPath)) {
            throw new NoSuchFileException(yamlPath.toAbsolutePath().toString(), null, "config file not found");
        }
        try (InputStream in = Files.newInputStream(yamlPath)) {
            return fromStream(in);
        }
    }

    public static ProbeConfig fromStream(InputStream in) {
        LoaderOptions opts = new LoaderOptions();
        Yaml yaml = new Yaml(new SafeConstructor(opts));
        Object root = yaml.load(in);

        ProbeConfig cfg = ProbeConfig.defaults();
        if (!(root instanceof Map<?, ?> map)) {
            // 비어있거나 단순 스칼라면 defaults 유지
            return cfg;
        }

        setString(map, "target", cfg::setTarget);

        Map<String, Object> form = getMap(map, "form");
        if (form != null) {
            setString(form, "usernameField", cfg::setUsernameField);
            setString(form, "passwordField", cfg::setPasswordField);
            Map<String, Object> extra = getMap(form, "extraFields");
            if (extra != null) {
                Map<String, String> out = new LinkedHashMap<>();
                extra.forEach((k, v) -> out.put(String.valueOf(k), v == null ? "" : String.valueOf(v)));
                cfg.setExtraFormFields(out);
            }
        }

        Map<String, Object> calibration = getMap(map, "calibration");
        if (calibration != null) {
            setInt(calibration, "count", cfg::setCalibrationCount);
            setDurationMs(calibration, "pacingMs", cfg::setCalibrationPacing);
            setInt(calibration, "minLengthMargin", cfg::setMinLengthMargin);
        }

        Map<String, Object> pipeline = getMap(map, "pipeline");
        if (pipeline != null) {
            setInt(pipeline, "workers", cfg::setWorkerCount);
            setDurationMs(pipeline, "pacingMs", cfg::setRequestPacing);
            setInt(pipeline, "maxRps", cfg::setMaxRps);
        }

        Map<String, Object> scoring = getMap(map, "scoring");
        if (scoring != null) {
            setInt(scoring, "threshold", cfg::setScoreThreshold);
            setDouble(scoring, "toleranceRatio", cfg::setToleranceRatio);
            Map<String, Object> weights = getMap(scoring, "weights");
            if (weights != null) {
                setInt(weights, "status", cfg::setWeightStatus);
                setInt(weights, "length", cfg::setWeightLength);
                setInt(weights, "url", cfg::setWeightUrl);
            }
        }

        Map<String, Object> http = getMap(map, "http");
        if (http != null) {
            setDurationMs(http, "timeoutMs", d -> { if (!d.isZero()) cfg.setTimeout(d); });
            setBoolean(http, "followRedirects", cfg::setFollowRedirects);
            setString(http, "userAgent", cfg::setUserAgent);
            setInt(http, "maxAttempts", cfg::setMaxAttempts);
        }

        Map<String, Object> input = getMap(map, "input");
        if (input != null) {
            setPath(input, "comboFile", cfg::setComboFile);
            setString(input, "delimiter", cfg::setDelimiter);
        }

        Map<String, Object> output = getMap(map, "output");
        if (output != null) {
            setPath(output, "dir", cfg::setOutputDir);
            setString(output, "hitsFile", cfg::setHitsFile);
            setBoolean(output, "report", cfg::setWriteReport);
        }
        return cfg;
    }

    // ------------ helpers ------------
    @SuppressWarnings("unchecked")
    private static Map<String, Object> getMap(Map<?, ?> map, String key) {
        Object v = map.get(key);
        if (v instanceof Map<?, ?> m) return (Map<String, Object>) m;
        return null;
    }

    private static void setString(Map<?, ?> map, String key, Consumer<String> setter) {
        Object v = map.get(key);
        if (v != null) setter.accept(String.valueOf(v));
    }

    private static void setBoolean(Map<?, ?> map, String key, Consumer<Boolean> setter) {
        Object v = map.get(key);
        if (v instanceof Boolean b) setter.accept(b);
        else if (v != null) setter.accept(Boolean.parseBoolean(String.valueOf(v)));
    }

    private static void setInt(Map<?, ?> map, String key, IntConsumer setter) {
        Object v = map.get(key);
        if (v instanceof Number n) setter.accept(n.intValue());
        else if (v != null) setter.accept(parse(key, String.valueOf(v)));
    }

    private static void setDouble(Map<?, ?> map, String key, DoubleConsumer setter) {
        Object v = map.get(key);
        if (v instanceof Number n) setter.accept(n.doubleValue());
        else if (v != null) {
            try {
                setter.accept(Double.parseDouble(String.valueOf(v).trim()));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(key + " must be a number, was '" + v + "'", e);
            }
        }
    }

    private static void setDurationMs(Map<?, ?> map, String key, Consumer<Duration> setter) {
        Object v = map.get(key);
        if (v == null) return;
        long ms = (v instanceof Number n) ? n.longValue() : parse(key, String.valueOf(v));
        setter.accept(Duration.ofMillis(Math.max(0, ms)));
    }

    private static void setPath(Map<?, ?> map, String key, Consumer<Path> setter) {
        Object v = map.get(key);
        if (v != null) setter.accept(Path.of(String.valueOf(v)));
    }

    private static int parse(String key, String s) {
        try {
            return Integer.parseInt(s.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " must be an integer, was '" + s + "'", e);
        }
    }
}
