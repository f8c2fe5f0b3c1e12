package com.authprobe.core.model;

import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * 프로브 설정 (probe.yml 매핑 대상). 순수 설정 보관용.
 * 스코어링 가중치/임계값은 대상마다 경험적으로 조정하는 값이므로 전부 노출한다.
 */
public final class ProbeConfig {

    public static final int MIN_WORKERS = 1;
    public static final int MAX_WORKERS = 20;

    // ---------- 대상/폼 ----------
    private String target;                          // 로그인 엔드포인트(POST)
    private String usernameField = "username";
    private String passwordField = "password";
    private Map<String, String> extraFormFields = new LinkedHashMap<>();

    // ---------- 캘리브레이션 ----------
    private int calibrationCount = 5;
    private Duration calibrationPacing = Duration.ofSeconds(2);
    private int minLengthMargin = 0;                // 길이 밴드 고정 여유(바이트)

    // ---------- 파이프라인 ----------
    private int workerCount = 5;
    private Duration requestPacing = Duration.ofSeconds(2); // 워커별 요청 시작 간 최소 간격
    private int maxRps = 0;                                 // 전역 상한(0 = 끔)

    // ---------- 스코어링 ----------
    private int scoreThreshold = 3;
    private double toleranceRatio = 0.01;
    private int weightStatus = 3;
    private int weightLength = 2;
    private int weightUrl = 3;

    // ---------- HTTP ----------
    private Duration timeout = Duration.ofSeconds(10);
    private boolean followRedirects = true;
    private String userAgent = "authprobe/0.1";
    private int maxAttempts = 3;

    // ---------- 입출력 ----------
    private Path comboFile = Path.of("combo.txt");
    private String delimiter;                       // null이면 자동(: , ; |)
    private Path outputDir = Path.of("out");
    private String hitsFile = "hits.txt";
    private boolean writeReport = true;

    // ---------- getters ----------
    public String getTarget() { return target; }
    public String getUsernameField() { return usernameField; }
    public String getPasswordField() { return passwordField; }
    public Map<String, String> getExtraFormFields() { return extraFormFields; }
    public int getCalibrationCount() { return calibrationCount; }
    public Duration getCalibrationPacing() { return calibrationPacing; }
    public int getMinLengthMargin() { return minLengthMargin; }
    public int getWorkerCount() { return workerCount; }
    public Duration getRequestPacing() { return requestPacing; }
    public int getMaxRps() { return maxRps; }
    public int getScoreThreshold() { return scoreThreshold; }
    public double getToleranceRatio() { return toleranceRatio; }
    public int getWeightStatus() { return weightStatus; }
    public int getWeightLength() { return weightLength; }
    public int getWeightUrl() { return weightUrl; }
    public Duration getTimeout() { return timeout; }
    public boolean isFollowRedirects() { return followRedirects; }
    public String getUserAgent() { return userAgent; }
    public int getMaxAttempts() { return maxAttempts; }
    public Path getComboFile() { return comboFile; }
    public String getDelimiter() { return delimiter; }
    public Path getOutputDir() { return outputDir; }
    public String getHitsFile() { return hitsFile; }
    public boolean isWriteReport() { return writeReport; }

    // ---------- fluent setters ----------
    public ProbeConfig setTarget(String target) { this.target = target; return this; }
    public ProbeConfig setUsernameField(String v) { this.usernameField = v; return this; }
    public ProbeConfig setPasswordField(String v) { this.passwordField = v; return this; }
    public ProbeConfig setExtraFormFields(Map<String, String> v) {
        this.extraFormFields = (v == null) ? new LinkedHashMap<>() : new LinkedHashMap<>(v);
        return this;
    }
    public ProbeConfig setCalibrationCount(int v) { this.calibrationCount = v; return this; }
    public ProbeConfig setCalibrationPacing(Duration v) { this.calibrationPacing = v; return this; }
    public ProbeConfig setMinLengthMargin(int v) { this.minLengthMargin = v; return this; }
    public ProbeConfig setWorkerCount(int v) { this.workerCount = v; return this; }
    public ProbeConfig setRequestPacing(Duration v) { this.requestPacing = v; return this; }
    public ProbeConfig setMaxRps(int v) { this.maxRps = v; return this; }
    public ProbeConfig setScoreThreshold(int v) { this.scoreThreshold = v; return this; }
    public ProbeConfig setToleranceRatio(double v) { this.toleranceRatio = v; return this; }
    public ProbeConfig setWeightStatus(int v) { this.weightStatus = v; return this; }
    public ProbeConfig setWeightLength(int v) { this.weightLength = v; return this; }
    public ProbeConfig setWeightUrl(int v) { this.weightUrl = v; return this; }
    public ProbeConfig setTimeout(Duration v) { this.timeout = v; return this; }
    public ProbeConfig setFollowRedirects(boolean v) { this.followRedirects = v; return this; }
    public ProbeConfig setUserAgent(String v) { this.userAgent = v; return this; }
    public ProbeConfig setMaxAttempts(int v) { this.maxAttempts = Math.max(1, v); return this; }
    public ProbeConfig setComboFile(Path v) { this.comboFile = v; return this; }
    public ProbeConfig setDelimiter(String v) { this.delimiter = (v == null || v.isEmpty()) ? null : v; return this; }
    public ProbeConfig setOutputDir(Path v) { this.outputDir = v; return this; }
    public ProbeConfig setHitsFile(String v) { this.hitsFile = v; return this; }
    public ProbeConfig setWriteReport(boolean v) { this.writeReport = v; return this; }

    // ---------- validate ----------
    public void validate() {
        Objects.requireNonNull(target, "target");
        if (target.isBlank()) throw new IllegalArgumentException("target must not be blank");
        if (usernameField == null || usernameField.isBlank())
            throw new IllegalArgumentException("usernameField must not be blank");
        if (passwordField == null || passwordField.isBlank())
            throw new IllegalArgumentException("passwordField must not be blank");
        if (calibrationCount < 1) throw new IllegalArgumentException("calibrationCount must be >= 1");
        if (workerCount < MIN_WORKERS || workerCount > MAX_WORKERS)
            throw new IllegalArgumentException("workerCount must be within " + MIN_WORKERS + ".." + MAX_WORKERS);
        requireNonNegative(calibrationPacing, "calibrationPacing");
        requireNonNegative(requestPacing, "requestPacing");
        if (minLengthMargin < 0) throw new IllegalArgumentException("minLengthMargin must be >= 0");
        if (maxRps < 0) throw new IllegalArgumentException("maxRps must be >= 0");
        if (scoreThreshold < 1) throw new IllegalArgumentException("scoreThreshold must be >= 1");
        if (!(toleranceRatio >= 0 && toleranceRatio < 1)) // NaN 도 여기서 걸린다
            throw new IllegalArgumentException("toleranceRatio must be within [0, 1), was " + toleranceRatio);
        if (weightStatus < 0 || weightLength < 0 || weightUrl < 0)
            throw new IllegalArgumentException("weights must be >= 0");
        if (weightStatus + weightLength + weightUrl == 0)
            throw new IllegalArgumentException("at least one weight must be > 0");
        if (timeout == null || timeout.isNegative() || timeout.isZero())
            throw new IllegalArgumentException("timeout must be > 0");
        if (maxAttempts < 1) throw new IllegalArgumentException("maxAttempts must be >= 1");
        Objects.requireNonNull(outputDir, "outputDir");
        Objects.requireNonNull(extraFormFields, "extraFormFields");
    }

    private static void requireNonNegative(Duration d, String name) {
        if (d == null || d.isNegative()) throw new IllegalArgumentException(name + " must be >= 0");
    }

    // ---------- helpers ----------
    public static ProbeConfig defaults() { return new ProbeConfig(); }

    public long getTimeoutMs() { return timeout.toMillis(); }

    public ProbeConfig setTimeoutMs(long ms) {
        this.timeout = Duration.ofMillis(Math.max(1, ms));
        return this;
    }

    public Path getHitsPath() {
        return outputDir.resolve(hitsFile);
    }
}
