package com.authprobe.core.service;

import com.authprobe.core.api.ICredentialSource;
import com.authprobe.core.api.ILoginTransport;
import com.authprobe.core.detector.CalibrationException;
import com.authprobe.core.detector.Calibrator;
import com.authprobe.core.detector.DeviationScorer;
import com.authprobe.core.detector.PatternAnalyzer;
import com.authprobe.core.detector.ScoringPolicy;
import com.authprobe.core.http.FormLoginTransport;
import com.authprobe.core.http.RetryingTransport;
import com.authprobe.core.model.DegradedSignatureWarning;
import com.authprobe.core.model.FailureSignature;
import com.authprobe.core.model.ProbeConfig;
import com.authprobe.core.model.ProbeStats;
import com.authprobe.core.model.ResponseSummary;
import com.authprobe.core.service.pipeline.ExecutionPipeline;
import com.authprobe.core.service.pipeline.ProbeRun;
import com.authprobe.core.service.pipeline.VerdictListener;
import com.authprobe.core.util.DefaultSleeper;
import com.authprobe.core.util.ProgressListener;
import com.authprobe.core.util.Sleeper;
import com.authprobe.core.util.StructuredLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;
import java.util.Objects;
import java.util.function.LongSupplier;

/**
 * 실행 오케스트레이터:
 *  - calibrate → analyze → (degraded 경고 1회) → pipeline 시작
 *  - 보정 실패 시 후보는 하나도 테스트하지 않는다
 *  - DI 생성자는 테스트용
 */
public final class ProbeService {

    private static final Logger LOG = LoggerFactory.getLogger(ProbeService.class);
    private static final StructuredLog SLOG = StructuredLog.get(ProbeService.class);

    private final ProbeConfig config;
    private final ILoginTransport transport;
    private final Sleeper sleeper;
    private final ExecutionPipeline pipeline;

    private volatile ProgressListener progress = ProgressListener.NONE;
    private volatile FailureSignature signature;

    /** 기본 구현: 폼 로그인 전송 */
    public ProbeService(ProbeConfig config) {
        this(config, new FormLoginTransport(validated(config)), DefaultSleeper.INSTANCE, System::nanoTime);
    }

    /** DI/테스트용 */
    public ProbeService(ProbeConfig config, ILoginTransport transport, Sleeper sleeper, LongSupplier nanoClock) {
        this.config = validated(config);
        this.transport = Objects.requireNonNull(transport, "transport");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
        this.pipeline = new ExecutionPipeline(config, transport,
                new DeviationScorer(ScoringPolicy.from(config)), sleeper, nanoClock);
    }

    private static ProbeConfig validated(ProbeConfig cfg) {
        Objects.requireNonNull(cfg, "config");
        cfg.validate();
        return cfg;
    }

    public ProbeService addListener(VerdictListener l) {
        pipeline.addListener(l);
        return this;
    }

    public ProbeService progress(ProgressListener pl) {
        this.progress = (pl != null) ? pl : ProgressListener.NONE;
        pipeline.progress(this.progress);
        return this;
    }

    /** 보정 후 바로 파이프라인 시작 */
    public ProbeRun run(ICredentialSource source) throws CalibrationException, IOException {
        Objects.requireNonNull(source, "source");
        FailureSignature sig = calibrate();
        return start(source, sig);
    }

    /** 보정만 수행해 실패 시그니처를 만든다. */
    public FailureSignature calibrate() throws CalibrationException {
        int count = config.getCalibrationCount();
        LOG.info("Calibrating against {} with {} synthetic credential(s)", config.getTarget(), count);
        safeProgress("calibrate", 0, count);

        Calibrator calibrator = new Calibrator(config.getCalibrationPacing(), sleeper, Calibrator::synthesize);
        List<ResponseSummary> samples = calibrator.calibrate(retrying(), count);
        FailureSignature sig = PatternAnalyzer.from(config).analyze(samples);

        LOG.info("Failure signature: {}", sig);
        SLOG.info("signature-built",
                "status", sig.getExpectedStatus(),
                "lengthLow", sig.getLengthLow(),
                "lengthHigh", sig.getLengthHigh(),
                "url", String.valueOf(sig.getExpectedUrl()),
                "quality", sig.quality().name(),
                "samples", sig.getSampleSize());
        for (DegradedSignatureWarning w : sig.getWarnings()) {
            LOG.warn("Degraded calibration: {}", w.message());
        }
        safeProgress("calibrate", count, count);
        this.signature = sig;
        return sig;
    }

    /** 이미 가진 시그니처로 파이프라인 시작 */
    public ProbeRun start(ICredentialSource source, FailureSignature sig) throws IOException {
        this.signature = Objects.requireNonNull(sig, "signature");
        return pipeline.run(source, sig);
    }

    public FailureSignature getSignature() {
        return signature;
    }

    public ProbeConfig getConfig() {
        return config;
    }

    public ProbeStats.Snapshot getRuntimeSnapshot() {
        return pipeline.getRuntimeSnapshot();
    }

    /** 보정 요청도 429/503/전송 실패는 재시도한다. */
    private ILoginTransport retrying() {
        return RetryingTransport.from(config, transport, sleeper, RetryingTransport.RetryListener.NONE);
    }

    private void safeProgress(String phase, long done, long total) {
        try {
            progress.onProgress(phase, done, total);
        } catch (RuntimeException e) {
            LOG.debug("Progress listener failed: {}", e.toString());
        }
    }
}
