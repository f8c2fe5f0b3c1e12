package com.authprobe.core.service.pipeline;

import com.authprobe.core.model.Credential;
import com.authprobe.core.model.RunSummary;
import com.authprobe.core.model.Verdict;
import com.authprobe.core.util.ProgressListener;
import com.authprobe.core.util.StructuredLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.function.LongSupplier;

/**
 * 실행 1회의 결과 싱크: 카운터 소유 + 판정 큐(소비자 쪽) + 리스너 통지.
 * record/recordFault/complete/snapshot 은 같은 락으로 상호배제된다.
 */
public final class ResultSink {

    private static final Logger LOG = LoggerFactory.getLogger(ResultSink.class);
    private static final StructuredLog SLOG = StructuredLog.get(ResultSink.class);

    static final int PROGRESS_EVERY = 10;

    /** 큐 항목. verdict == null 이면 종료 표식. */
    private record Envelope(Verdict verdict) {
        static final Envelope END = new Envelope(null);
    }

    private final BlockingQueue<Envelope> queue = new LinkedBlockingQueue<>();
    private final List<VerdictListener> listeners = new CopyOnWriteArrayList<>();
    private final ProgressListener progress;
    private final LongSupplier nanoClock;
    private final long startNanos;

    private long tested;
    private long suspect;
    private long transportErrors;
    private long faults;
    private long listenerFailures;
    private long endNanos = -1;

    public ResultSink(ProgressListener progress, LongSupplier nanoClock) {
        this.progress = (progress != null) ? progress : ProgressListener.NONE;
        this.nanoClock = Objects.requireNonNull(nanoClock, "nanoClock");
        this.startNanos = nanoClock.getAsLong();
    }

    public ResultSink() {
        this(ProgressListener.NONE, System::nanoTime);
    }

    public void addListener(VerdictListener l) {
        listeners.add(Objects.requireNonNull(l, "listener"));
    }

    public synchronized void record(Verdict v) {
        Objects.requireNonNull(v, "verdict");
        if (endNanos >= 0) throw new IllegalStateException("sink already completed");

        tested++;
        if (v.isSuspect()) suspect++;
        if (v.isTransportFailure()) transportErrors++;

        for (VerdictListener l : listeners) {
            try {
                l.onVerdict(v);
            } catch (RuntimeException e) {
                listenerFailures++;
                if (v.isSuspect()) {
                    LOG.error("Verdict listener {} failed for SUSPECT user '{}': {}",
                            l.getClass().getSimpleName(), v.getUsername(), e.toString());
                    SLOG.error("listener-failed", e, "user", v.getUsername(), "listenerFailures", listenerFailures);
                } else {
                    LOG.warn("Verdict listener {} failed: {}", l.getClass().getSimpleName(), e.toString());
                }
            }
        }
        queue.add(new Envelope(v));

        if (tested % PROGRESS_EVERY == 0) {
            LOG.info("Progress: tested={}, suspect={}, transportErrors={}", tested, suspect, transportErrors);
            SLOG.info("progress", "tested", tested, "suspect", suspect, "transportErrors", transportErrors);
        }
        try {
            progress.onProgress("probe", tested, -1);
        } catch (RuntimeException e) {
            LOG.debug("Progress listener failed: {}", e.toString());
        }
    }

    /** 워커 결함: 해당 쌍은 판정 없이 faults 로만 집계된다. */
    public synchronized void recordFault(Credential c, Throwable cause) {
        faults++;
        String user = (c == null) ? "?" : c.username();
        LOG.error("Worker fault while testing user '{}': {}", user, String.valueOf(cause));
        SLOG.error("worker-fault", cause, "user", user, "faults", faults);
    }

    /** 종료 표식을 넣는다. 두 번째 호출부터는 no-op. */
    public synchronized void complete() {
        if (endNanos >= 0) return;
        endNanos = nanoClock.getAsLong();
        queue.add(Envelope.END);
    }

    public synchronized boolean isCompleted() {
        return endNanos >= 0;
    }

    public synchronized RunSummary snapshot() {
        long end = (endNanos >= 0) ? endNanos : nanoClock.getAsLong();
        return new RunSummary(tested, suspect, transportErrors, faults, listenerFailures,
                Duration.ofNanos(Math.max(0, end - startNanos)));
    }

    /**
     * 다음 판정을 꺼낸다(블로킹). 종료 후에는 null.
     * 종료 표식은 다시 넣어 두어 이후 호출도 즉시 null 을 받는다.
     */
    Verdict take() throws InterruptedException {
        Envelope e = queue.take();
        if (e.verdict() == null) {
            queue.add(Envelope.END);
            return null;
        }
        return e.verdict();
    }
}
