package com.authprobe.core.detector;

import com.authprobe.core.api.ILoginTransport;
import com.authprobe.core.api.TransportException;
import com.authprobe.core.model.Credential;
import com.authprobe.core.model.LoginResponse;
import com.authprobe.core.model.ResponseSummary;
import com.authprobe.core.util.Sleeper;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;

class CalibratorTest {

    /** sleep(Duration) 호출만 기록 */
    static class TestSleeper implements Sleeper {
        final List<Duration> sleeps = new ArrayList<>();
        @Override public void sleep(Duration d) { sleeps.add(d); }
    }

    static LoginResponse failurePage(int length) {
        return LoginResponse.builder()
                .finalUrl(URI.create("http://t/login"))
                .statusCode(422)
                .body("x".repeat(length))
                .build();
    }

    @Test
    void collects_one_summary_per_probe_with_pacing_between() throws Exception {
        TestSleeper sleeper = new TestSleeper();
        List<String> users = new ArrayList<>();
        ILoginTransport t = (u, p) -> { users.add(u); return failurePage(100 + users.size()); };

        Calibrator c = new Calibrator(Duration.ofSeconds(2), sleeper, Calibrator::synthesize);
        List<ResponseSummary> out = c.calibrate(t, 5);

        assertThat(out).hasSize(5);
        assertThat(out).extracting(ResponseSummary::getBodyLength).containsExactly(101, 102, 103, 104, 105);
        assertThat(out).allSatisfy(s -> {
            assertThat(s.getStatusCode()).isEqualTo(422);
            assertThat(s.getFinalUrl()).isEqualTo("http://t/login");
        });
        // 첫 프로브 전에는 쉬지 않는다
        assertThat(sleeper.sleeps).hasSize(4).containsOnly(Duration.ofSeconds(2));
        assertThat(users).allMatch(u -> u.startsWith(Calibrator.PREFIX));
        assertThat(new HashSet<>(users)).hasSize(5);
    }

    @Test
    void failed_probes_are_dropped_from_the_sample() throws Exception {
        AtomicInteger n = new AtomicInteger();
        ILoginTransport t = (u, p) -> {
            if (n.incrementAndGet() == 2) throw new TransportException("connection reset");
            return failurePage(50);
        };
        List<ResponseSummary> out = new Calibrator(Duration.ZERO, new TestSleeper(), Calibrator::synthesize)
                .calibrate(t, 3);
        assertThat(out).hasSize(2);
    }

    @Test
    void all_probes_failing_is_fatal() {
        TransportException boom = new TransportException("connection refused");
        ILoginTransport t = (u, p) -> { throw boom; };
        Calibrator c = new Calibrator(Duration.ZERO, new TestSleeper(), Calibrator::synthesize);

        assertThatThrownBy(() -> c.calibrate(t, 3))
                .isInstanceOf(CalibrationException.class)
                .hasMessageContaining("all 3 calibration probes failed")
                .hasCause(boom);
    }

    @Test
    void count_below_one_is_rejected() {
        Calibrator c = new Calibrator(Duration.ZERO, new TestSleeper(), Calibrator::synthesize);
        assertThatThrownBy(() -> c.calibrate((u, p) -> failurePage(1), 0))
                .isInstanceOf(CalibrationException.class);
    }

    @Test
    void interruption_during_pacing_aborts_calibration() {
        Sleeper interrupting = d -> { throw new InterruptedException("stop"); };
        Calibrator c = new Calibrator(Duration.ofSeconds(1), interrupting, Calibrator::synthesize);
        try {
            assertThatThrownBy(() -> c.calibrate((u, p) -> failurePage(10), 3))
                    .isInstanceOf(CalibrationException.class)
                    .hasMessageContaining("interrupted");
            assertThat(Thread.currentThread().isInterrupted()).isTrue();
        } finally {
            Thread.interrupted(); // 다음 테스트를 위해 플래그 정리
        }
    }

    @Test
    void synthesized_credentials_are_random_and_recognisable() {
        Set<String> seen = new HashSet<>();
        for (int i = 0; i < 100; i++) {
            Credential c = Calibrator.synthesize();
            assertThat(c.username()).startsWith("calib-").hasSize(18);
            assertThat(c.password()).hasSize(16);
            seen.add(c.username());
        }
        assertThat(seen).hasSize(100);
    }
}
