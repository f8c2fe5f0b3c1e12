package com.authprobe.core.service.pipeline;

import com.authprobe.core.model.ProbeStats;
import com.authprobe.core.model.RunSummary;
import com.authprobe.core.model.Verdict;

import java.time.Duration;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * 진행 중인 실행 핸들. 판정을 도착 순서대로 내주는 단일 패스 Iterator 이며,
 * hasNext()는 다음 판정 또는 실행 종료까지 블로킹한다.
 */
public final class ProbeRun implements Iterator<Verdict>, Iterable<Verdict>, AutoCloseable {

    private final ResultSink sink;
    private final StopSignal stop;
    private final CountDownLatch finished;
    private final ProbeStats stats;

    private Verdict lookahead;
    private boolean drained = false;

    ProbeRun(ResultSink sink, StopSignal stop, CountDownLatch finished, ProbeStats stats) {
        this.sink = Objects.requireNonNull(sink, "sink");
        this.stop = Objects.requireNonNull(stop, "stop");
        this.finished = Objects.requireNonNull(finished, "finished");
        this.stats = Objects.requireNonNull(stats, "stats");
    }

    @Override
    public boolean hasNext() {
        if (lookahead != null) return true;
        if (drained) return false;
        try {
            lookahead = sink.take();
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new CancellationException("Interrupted while waiting for verdicts");
        }
        if (lookahead == null) drained = true;
        return lookahead != null;
    }

    @Override
    public Verdict next() {
        if (!hasNext()) throw new NoSuchElementException();
        Verdict v = lookahead;
        lookahead = null;
        return v;
    }

    /** 단일 패스: 항상 자기 자신을 돌려준다. */
    @Override
    public Iterator<Verdict> iterator() {
        return this;
    }

    /** 중단 신호: 진행 중 요청은 끝까지 처리되고, 새 쌍은 꺼내지 않는다. */
    public void stop() {
        stop.raise();
    }

    public boolean isStopRequested() {
        return stop.isRaised();
    }

    public boolean isDone() {
        return finished.getCount() == 0;
    }

    /** 모든 워커가 끝날 때까지 기다린 뒤 요약을 돌려준다. */
    public RunSummary awaitCompletion() throws InterruptedException {
        finished.await();
        return sink.snapshot();
    }

    /** @return 시간 안에 끝났으면 true */
    public boolean awaitCompletion(Duration timeout) throws InterruptedException {
        return finished.await(timeout.toNanos(), TimeUnit.NANOSECONDS);
    }

    /** 현재까지의 요약(실행 중에도 호출 가능) */
    public RunSummary summary() {
        return sink.snapshot();
    }

    public ProbeStats.Snapshot stats() {
        return stats.snapshot();
    }

    @Override
    public void close() {
        stop();
        try {
            finished.await();
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
        }
    }
}
