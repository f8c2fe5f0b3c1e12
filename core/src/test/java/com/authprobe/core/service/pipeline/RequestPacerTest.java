package com.authprobe.core.service.pipeline;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.*;

class RequestPacerTest {

    @Test
    void first_request_starts_immediately() throws Exception {
        RequestPacer p = new RequestPacer(Duration.ofHours(1), () -> 0L);
        long t0 = System.nanoTime();
        assertThat(p.awaitTurn(new StopSignal())).isTrue();
        assertThat(Duration.ofNanos(System.nanoTime() - t0)).isLessThan(Duration.ofSeconds(1));
    }

    @Test
    void no_wait_when_interval_already_elapsed() throws Exception {
        AtomicLong clock = new AtomicLong(0);
        RequestPacer p = new RequestPacer(Duration.ofSeconds(10), clock::get);
        StopSignal stop = new StopSignal();

        assertThat(p.awaitTurn(stop)).isTrue();
        clock.addAndGet(Duration.ofSeconds(11).toNanos());
        long t0 = System.nanoTime();
        assertThat(p.awaitTurn(stop)).isTrue();
        assertThat(Duration.ofNanos(System.nanoTime() - t0)).isLessThan(Duration.ofSeconds(1));
    }

    @Test
    void consecutive_starts_are_spaced_by_the_interval() throws Exception {
        RequestPacer p = new RequestPacer(Duration.ofMillis(100), System::nanoTime);
        StopSignal stop = new StopSignal();
        long t0 = System.nanoTime();
        for (int i = 0; i < 3; i++) assertThat(p.awaitTurn(stop)).isTrue();
        long ms = (System.nanoTime() - t0) / 1_000_000;
        assertThat(ms).isGreaterThanOrEqualTo(190);
    }

    @Test
    void stop_wakes_a_pacing_wait_immediately() throws Exception {
        RequestPacer p = new RequestPacer(Duration.ofSeconds(30), () -> 0L);
        StopSignal stop = new StopSignal();
        assertThat(p.awaitTurn(stop)).isTrue();

        Thread raiser = new Thread(() -> {
            try { Thread.sleep(50); } catch (InterruptedException ignored) { Thread.currentThread().interrupt(); }
            stop.raise();
        });
        raiser.start();

        long t0 = System.nanoTime();
        assertThat(p.awaitTurn(stop)).isFalse();
        assertThat(Duration.ofNanos(System.nanoTime() - t0)).isLessThan(Duration.ofSeconds(5));
        raiser.join();
    }

    @Test
    void raised_signal_refuses_even_the_first_turn() throws Exception {
        StopSignal stop = new StopSignal();
        stop.raise();
        assertThat(new RequestPacer(Duration.ZERO, System::nanoTime).awaitTurn(stop)).isFalse();
    }

    @Test
    void negative_interval_is_treated_as_zero() {
        assertThat(new RequestPacer(Duration.ofMillis(-5), System::nanoTime).intervalNanos()).isZero();
    }
}
