package com.authprobe.core.detector;

import com.authprobe.core.api.ILoginTransport;
import com.authprobe.core.api.TransportException;
import com.authprobe.core.model.Credential;
import com.authprobe.core.model.LoginResponse;
import com.authprobe.core.model.ResponseSummary;
import com.authprobe.core.util.DefaultSleeper;
import com.authprobe.core.util.Sleeper;
import com.authprobe.core.util.StructuredLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.security.SecureRandom;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * 존재할 수 없는 자격증명으로 N회 순차 요청을 보내 "실패 응답"의 모양을 수집한다.
 * 단일 스레드/블로킹: 시그니처가 있어야 후보 테스트를 시작할 수 있다.
 */
public final class Calibrator {

    private static final Logger LOG = LoggerFactory.getLogger(Calibrator.class);
    private static final StructuredLog SLOG = StructuredLog.get(Calibrator.class);

    static final String PREFIX = "calib-";
    private static final char[] ALPHABET = "abcdefghijklmnopqrstuvwxyz0123456789".toCharArray();
    private static final SecureRandom RND = new SecureRandom();

    private final Duration pacing;
    private final Sleeper sleeper;
    private final Supplier<Credential> synthesizer;

    public Calibrator(Duration pacing, Sleeper sleeper, Supplier<Credential> synthesizer) {
        this.pacing = (pacing == null || pacing.isNegative()) ? Duration.ZERO : pacing;
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
        this.synthesizer = Objects.requireNonNull(synthesizer, "synthesizer");
    }

    public Calibrator(Duration pacing) {
        this(pacing, DefaultSleeper.INSTANCE, Calibrator::synthesize);
    }

    /**
     * @return 성공한 프로브의 요약(요청 순서). 일부 실패는 표본에서 제외된다.
     * @throws CalibrationException count &lt; 1, 모든 프로브가 전송 실패, 또는 인터럽트
     */
    public List<ResponseSummary> calibrate(ILoginTransport transport, int count) throws CalibrationException {
        Objects.requireNonNull(transport, "transport");
        if (count < 1) throw new CalibrationException("calibration count must be >= 1, was " + count);

        LOG.info("Calibration start: probes={}, pacing={}ms", count, pacing.toMillis());
        SLOG.info("calibration-start", "count", count, "pacingMs", pacing);

        List<ResponseSummary> out = new ArrayList<>(count);
        TransportException last = null;

        for (int i = 0; i < count; i++) {
            if (i > 0) pause();
            Credential fake = synthesizer.get();
            long t0 = System.nanoTime();
            try {
                LoginResponse resp = transport.submit(fake.username(), fake.password());
                long ms = (System.nanoTime() - t0) / 1_000_000;
                ResponseSummary s = ResponseSummary.of(resp, ms);
                out.add(s);
                LOG.info("Calibration {}/{}: status={}, length={}, url={}",
                        i + 1, count, s.getStatusCode(), s.getBodyLength(), s.getFinalUrl());
            } catch (TransportException e) {
                last = e;
                LOG.warn("Calibration {}/{} failed: {}", i + 1, count, e.getMessage());
                SLOG.warn("calibration-probe-failed", "probe", i + 1, "cause", e.getMessage());
            }
        }

        if (out.isEmpty()) {
            throw new CalibrationException("all " + count + " calibration probes failed at transport level", last);
        }
        SLOG.info("calibration-done", "collected", out.size(), "requested", count);
        return out;
    }

    private void pause() throws CalibrationException {
        try {
            sleeper.sleep(pacing);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new CalibrationException("calibration interrupted", ie);
        }
    }

    /** calib-xxxxxxxxxxxx / 16자 랜덤 비밀번호. 실계정과 겹칠 수 없는 형태. */
    public static Credential synthesize() {
        return new Credential(PREFIX + random(12), random(16));
    }

    private static String random(int n) {
        char[] cs = new char[n];
        for (int i = 0; i < n; i++) cs[i] = ALPHABET[RND.nextInt(ALPHABET.length)];
        return new String(cs);
    }
}
