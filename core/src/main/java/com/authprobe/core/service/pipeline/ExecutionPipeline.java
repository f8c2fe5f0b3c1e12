package com.authprobe.core.service.pipeline;

import com.authprobe.core.api.ICredentialSource;
import com.authprobe.core.api.ILoginTransport;
import com.authprobe.core.api.TransportException;
import com.authprobe.core.detector.DeviationScore;
import com.authprobe.core.detector.DeviationScorer;
import com.authprobe.core.detector.ScoringPolicy;
import com.authprobe.core.http.RetryingTransport;
import com.authprobe.core.model.AttemptState;
import com.authprobe.core.model.Classification;
import com.authprobe.core.model.Credential;
import com.authprobe.core.model.DegradedSignatureWarning;
import com.authprobe.core.model.FailureSignature;
import com.authprobe.core.model.LoginResponse;
import com.authprobe.core.model.ProbeConfig;
import com.authprobe.core.model.ProbeStats;
import com.authprobe.core.model.ResponseSummary;
import com.authprobe.core.model.RunSummary;
import com.authprobe.core.model.Verdict;
import com.authprobe.core.util.DefaultSleeper;
import com.authprobe.core.util.ProgressListener;
import com.authprobe.core.util.RateLimiter;
import com.authprobe.core.util.Sleeper;
import com.authprobe.core.util.StructuredLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletionService;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.LongSupplier;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * 후보 자격증명 동시 테스트 파이프라인:
 *  - 고정 워커 N개(1..20)가 하나의 커서에서 쌍을 꺼내 전송 → 요약 → 채점 → 싱크 기록
 *  - 워커별 페이싱(요청 시작 간 최소 간격) + 선택적 전역 RateLimiter
 *  - 전송은 ILoginTransport.submit 만 부른다. 재시도는 워커마다 RetryingTransport 로 감싼다
 *  - 코디네이터 스레드가 워커 결함을 감지해 슬롯을 재시작
 *  - 호출자는 ProbeRun 으로 판정을 도착 순서대로 소비
 */
public final class ExecutionPipeline {

    private static final Logger LOG = LoggerFactory.getLogger(ExecutionPipeline.class);
    private static final StructuredLog SLOG = StructuredLog.get(ExecutionPipeline.class);

    static final String TRANSPORT_ERROR_PREFIX = "transport error: ";

    private final ProbeConfig config;
    private final ILoginTransport transport;
    private final DeviationScorer scorer;
    private final Sleeper retrySleeper;
    private final LongSupplier nanoClock;
    private final RateLimiter rateLimiter; // null → 전역 상한 없음
    private final ProbeStats stats = new ProbeStats();
    private final List<VerdictListener> listeners = new CopyOnWriteArrayList<>();
    private volatile ProgressListener progress = ProgressListener.NONE;

    public ExecutionPipeline(ProbeConfig config, ILoginTransport transport) {
        this(config, transport, new DeviationScorer(ScoringPolicy.from(config)),
                DefaultSleeper.INSTANCE, System::nanoTime);
    }

    /** DI/테스트용 */
    public ExecutionPipeline(ProbeConfig config, ILoginTransport transport, DeviationScorer scorer,
                             Sleeper retrySleeper, LongSupplier nanoClock) {
        this.config = Objects.requireNonNull(config, "config");
        this.transport = Objects.requireNonNull(transport, "transport");
        this.scorer = Objects.requireNonNull(scorer, "scorer");
        this.retrySleeper = Objects.requireNonNull(retrySleeper, "retrySleeper");
        this.nanoClock = Objects.requireNonNull(nanoClock, "nanoClock");
        this.rateLimiter = RateLimiter.perSecondOrNull(config.getMaxRps());
    }

    public ExecutionPipeline addListener(VerdictListener l) {
        listeners.add(Objects.requireNonNull(l, "listener"));
        return this;
    }

    public ExecutionPipeline progress(ProgressListener pl) {
        this.progress = (pl != null) ? pl : ProgressListener.NONE;
        return this;
    }

    public ProbeStats.Snapshot getRuntimeSnapshot() {
        return stats.snapshot();
    }

    /** 설정의 workerCount / requestPacing 으로 실행 */
    public ProbeRun run(ICredentialSource source, FailureSignature signature) throws IOException {
        return run(source, signature, config.getWorkerCount(), config.getRequestPacing());
    }

    /**
     * 실행을 시작하고 즉시 핸들을 돌려준다.
     * @throws IllegalArgumentException workerCount 가 1..20 밖
     * @throws IOException 소스를 열 수 없음(아무 요청도 나가기 전)
     */
    public ProbeRun run(ICredentialSource source, FailureSignature signature,
                        int workerCount, Duration requestPacing) throws IOException {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(signature, "signature");
        if (workerCount < ProbeConfig.MIN_WORKERS || workerCount > ProbeConfig.MAX_WORKERS) {
            throw new IllegalArgumentException("workerCount must be in "
                    + ProbeConfig.MIN_WORKERS + ".." + ProbeConfig.MAX_WORKERS + ", was " + workerCount);
        }
        final Duration pacing = (requestPacing == null || requestPacing.isNegative()) ? Duration.ZERO : requestPacing;

        Stream<Credential> stream = source.open();
        final CredentialCursor cursor = new CredentialCursor(stream);
        final ResultSink sink = new ResultSink(progress, nanoClock);
        listeners.forEach(sink::addListener);
        final StopSignal stop = new StopSignal();
        final CountDownLatch finished = new CountDownLatch(1);
        final List<String> warnings = signature.getWarnings().stream()
                .map(DegradedSignatureWarning::message)
                .collect(Collectors.toUnmodifiableList());

        LOG.info("Pipeline start: workers={}, pacing={}ms, maxRps={}, signature={}",
                workerCount, pacing.toMillis(), config.getMaxRps(), signature);
        SLOG.info("pipeline-start",
                "workers", workerCount,
                "pacingMs", pacing,
                "maxRps", config.getMaxRps(),
                "quality", String.valueOf(signature.quality()));

        // 고정 스레드풀: 워커 N개. 작업 큐에는 재시작된 워커만 잠깐 머문다.
        ThreadPoolExecutor exec = new ThreadPoolExecutor(
                workerCount, workerCount,
                0L, TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(),
                new NamedThreadFactory("probe-worker"));

        Runnable coordinator = () -> coordinate(exec, workerCount, cursor, sink, stop, signature, warnings, pacing);
        Thread t = new Thread(() -> {
            try {
                coordinator.run();
            } finally {
                finished.countDown();
            }
        }, "probe-coordinator");
        t.setDaemon(true);
        t.start();

        return new ProbeRun(sink, stop, finished, stats);
    }

    private void coordinate(ThreadPoolExecutor exec, int workerCount, CredentialCursor cursor,
                            ResultSink sink, StopSignal stop, FailureSignature signature,
                            List<String> warnings, Duration pacing) {
        CompletionService<Void> ecs = new ExecutorCompletionService<>(exec);
        Map<Future<Void>, Integer> slots = new HashMap<>();
        int live = 0;
        int restarts = 0;
        // 슬롯별 페이서: 재시작된 워커도 직전 요청 시작 시각을 이어받는다
        RequestPacer[] pacers = new RequestPacer[workerCount + 1];
        try {
            for (int slot = 1; slot <= workerCount; slot++) {
                pacers[slot] = new RequestPacer(pacing, nanoClock);
                slots.put(ecs.submit(new Worker(slot, cursor, sink, stop, signature, warnings, pacers[slot])), slot);
                live++;
            }
            while (live > 0) {
                Future<Void> f = ecs.take();
                live--;
                Integer slot = slots.remove(f);
                try {
                    f.get();
                } catch (ExecutionException e) {
                    Throwable cause = (e.getCause() != null) ? e.getCause() : e;
                    if (stop.isRaised() || cursor.isExhausted()) {
                        LOG.warn("Worker slot {} faulted after stop/exhaustion; not restarting", slot);
                        continue;
                    }
                    restarts++;
                    LOG.warn("Worker slot {} faulted ({}); restarting", slot, cause.toString());
                    SLOG.warn("worker-restart", "slot", slot, "cause", cause.toString(), "restarts", restarts);
                    slots.put(ecs.submit(new Worker(slot, cursor, sink, stop, signature, warnings, pacers[slot])), slot);
                    live++;
                }
            }
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            stop.raise();
            LOG.warn("Coordinator interrupted; stopping workers");
        } finally {
            exec.shutdown();
            try {
                if (!exec.awaitTermination(30, TimeUnit.SECONDS)) exec.shutdownNow();
            } catch (InterruptedException ie) {
                exec.shutdownNow();
                Thread.currentThread().interrupt();
            }
            cursor.close();
            sink.complete();

            RunSummary s = sink.snapshot();
            ProbeStats.Snapshot snap = stats.snapshot();
            try {
                progress.onProgress("done", s.tested(), s.tested());
            } catch (RuntimeException e) {
                LOG.debug("Progress listener failed: {}", e.toString());
            }
            LOG.info("Pipeline done. tested={}, suspect={}, transportErrors={}, faults={}, elapsed={}ms, maxObservedCC={}",
                    s.tested(), s.suspect(), s.transportErrors(), s.faults(), s.elapsed().toMillis(),
                    snap.maxObservedConcurrency());
            SLOG.info("run-done",
                    "tested", s.tested(),
                    "suspect", s.suspect(),
                    "transportErrors", s.transportErrors(),
                    "faults", s.faults(),
                    "elapsedMs", s.elapsed(),
                    "stopped", stop.isRaised(),
                    "requestsTotal", snap.requestsTotal(),
                    "retriesTotal", snap.retriesTotal(),
                    "rateLimitedTotal", snap.rateLimitedTotal(),
                    "maxObservedCC", snap.maxObservedConcurrency());
        }
    }

    /** 워커 1개 = 슬롯 1개. 커서가 소진되거나 중단 신호가 오면 정상 종료. */
    private final class Worker implements Callable<Void> {
        private final int slot;
        private final CredentialCursor cursor;
        private final ResultSink sink;
        private final StopSignal stop;
        private final FailureSignature signature;
        private final List<String> warnings;
        private final RequestPacer pacer;
        private final ILoginTransport link;
        private int retries;
        private int rateLimited;

        Worker(int slot, CredentialCursor cursor, ResultSink sink, StopSignal stop,
               FailureSignature signature, List<String> warnings, RequestPacer pacer) {
            this.slot = slot;
            this.cursor = cursor;
            this.sink = sink;
            this.stop = stop;
            this.signature = signature;
            this.warnings = warnings;
            this.pacer = pacer;
            this.link = RetryingTransport.from(config, transport, retrySleeper, this::onRetry);
        }

        private void onRetry(String username, int status, int attempt, Duration wait) {
            retries++;
            if (status == 429) rateLimited++;
        }

        @Override
        public Void call() {
            try {
                while (!Thread.currentThread().isInterrupted()) {
                    if (!pacer.awaitTurn(stop)) return null;
                    if (rateLimiter != null && !rateLimiter.acquire(stop::isRaised)) return null;
                    Credential c = cursor.next();
                    if (c == null) return null;
                    try {
                        process(c);
                    } catch (RuntimeException | Error t) {
                        sink.recordFault(c, t);
                        throw t;
                    }
                }
                return null;
            } catch (InterruptedException ie) {
                // shutdownNow 경로: 응답 없는 쌍은 판정하지 않는다
                Thread.currentThread().interrupt();
                return null;
            }
        }

        private void process(Credential c) throws InterruptedException {
            AttemptState state = AttemptState.QUEUED.next(AttemptState.IN_FLIGHT);
            String worker = Thread.currentThread().getName();
            stats.enter();
            long t0 = nanoClock.getAsLong();
            retries = 0;
            rateLimited = 0;
            Verdict verdict;
            try {
                LoginResponse resp;
                try {
                    resp = link.submit(c.username(), c.password());
                } finally {
                    if (rateLimited > 0) {
                        SLOG.warn("rate-limited", "user", c.username(), "count", rateLimited, "worker", worker);
                    }
                }
                long ms = TimeUnit.NANOSECONDS.toMillis(nanoClock.getAsLong() - t0);
                ResponseSummary summary = ResponseSummary.of(resp, ms);
                state = state.next(AttemptState.SCORED);

                DeviationScore ds = scorer.score(summary, signature);
                Classification cls = scorer.classify(ds);
                state = state.next(AttemptState.of(cls));

                verdict = Verdict.builder()
                        .credential(c)
                        .score(ds.points())
                        .reasons(ds.reasons())
                        .summary(summary)
                        .classification(cls)
                        .warnings(warnings)
                        .worker(worker)
                        .build();
            } catch (TransportException e) {
                if (Thread.currentThread().isInterrupted()) {
                    throw new InterruptedException("interrupted while testing '" + c.username() + "'");
                }
                state = state.next(AttemptState.REJECTED);
                String msg = String.valueOf(e.getMessage());
                LOG.debug("Transport failure for user '{}' on slot {}: {}", c.username(), slot, msg);
                verdict = Verdict.builder()
                        .credential(c)
                        .score(0)
                        .reasons(List.of(TRANSPORT_ERROR_PREFIX + msg))
                        .classification(Classification.REJECTED)
                        .warnings(warnings)
                        .transportError(msg)
                        .worker(worker)
                        .build();
            } finally {
                stats.recordCredential(retries, rateLimited,
                        TimeUnit.NANOSECONDS.toMillis(nanoClock.getAsLong() - t0));
                stats.exit();
            }

            sink.record(verdict);
            if (verdict.isSuspect()) {
                LOG.info("SUSPECT user '{}' score={} reasons={}", c.username(), verdict.getScore(), verdict.getReasons());
            }
            SLOG.debug("verdict",
                    "user", c.username(),
                    "state", state.name(),
                    "score", verdict.getScore(),
                    "status", verdict.getSummary() == null ? -1 : verdict.getSummary().getStatusCode(),
                    "worker", worker);
        }
    }

    static final class NamedThreadFactory implements ThreadFactory {
        private final String prefix;
        private final AtomicInteger seq = new AtomicInteger(1);
        NamedThreadFactory(String prefix) { this.prefix = prefix; }
        @Override public Thread newThread(Runnable r) {
            Thread t = new Thread(r, prefix + "-" + seq.getAndIncrement());
            t.setDaemon(true);
            return t;
        }
    }
}
