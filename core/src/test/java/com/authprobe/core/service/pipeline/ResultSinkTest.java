package com.authprobe.core.service.pipeline;

import com.authprobe.core.model.Classification;
import com.authprobe.core.model.Credential;
import com.authprobe.core.model.ResponseSummary;
import com.authprobe.core.model.RunSummary;
import com.authprobe.core.model.Verdict;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.*;

class ResultSinkTest {

    static Verdict verdict(String user, Classification c) {
        return Verdict.builder()
                .credential(new Credential(user, "pw"))
                .score(c == Classification.SUSPECT ? 6 : 0)
                .summary(ResponseSummary.builder().statusCode(200).bodyLength(10).finalUrl("/x").build())
                .classification(c)
                .build();
    }

    static Verdict transportFailure(String user) {
        return Verdict.builder()
                .credential(new Credential(user, "pw"))
                .classification(Classification.REJECTED)
                .transportError("timeout")
                .build();
    }

    @Test
    void counters_follow_recorded_verdicts() {
        AtomicLong clock = new AtomicLong(0);
        ResultSink sink = new ResultSink(null, clock::get);

        sink.record(verdict("a", Classification.REJECTED));
        sink.record(verdict("b", Classification.SUSPECT));
        sink.record(transportFailure("c"));
        sink.recordFault(new Credential("d", "pw"), new IllegalStateException("bug"));
        clock.set(Duration.ofSeconds(3).toNanos());
        sink.complete();
        clock.set(Duration.ofSeconds(99).toNanos());

        RunSummary s = sink.snapshot();
        assertThat(s.tested()).isEqualTo(3);
        assertThat(s.suspect()).isEqualTo(1);
        assertThat(s.transportErrors()).isEqualTo(1);
        assertThat(s.faults()).isEqualTo(1);
        // 종료 시각에서 고정
        assertThat(s.elapsed()).isEqualTo(Duration.ofSeconds(3));
        assertThat(s.throughputPerSecond()).isEqualTo(1.0);
    }

    @Test
    void failing_listener_is_counted_and_does_not_lose_the_verdict() throws Exception {
        ResultSink sink = new ResultSink();
        List<String> delivered = new ArrayList<>();
        sink.addListener(v -> {
            if (v.isSuspect()) throw new java.io.UncheckedIOException(new java.io.IOException("disk full"));
        });
        sink.addListener(v -> delivered.add(v.getUsername()));

        sink.record(verdict("a", Classification.REJECTED));
        sink.record(verdict("b", Classification.SUSPECT));
        sink.complete();

        RunSummary s = sink.snapshot();
        assertThat(s.suspect()).isEqualTo(1);
        assertThat(s.listenerFailures()).isEqualTo(1);
        // 다음 리스너와 소비자 큐는 그대로 받는다
        assertThat(delivered).containsExactly("a", "b");
        assertThat(sink.take().getUsername()).isEqualTo("a");
        assertThat(sink.take().getUsername()).isEqualTo("b");
        assertThat(sink.take()).isNull();
    }

    @Test
    void verdicts_come_out_in_record_order_then_end_marker_repeats() throws Exception {
        ResultSink sink = new ResultSink();
        sink.record(verdict("a", Classification.REJECTED));
        sink.record(verdict("b", Classification.SUSPECT));
        sink.complete();
        sink.complete(); // no-op

        assertThat(sink.take().getUsername()).isEqualTo("a");
        assertThat(sink.take().getUsername()).isEqualTo("b");
        assertThat(sink.take()).isNull();
        assertThat(sink.take()).isNull();
        assertThat(sink.isCompleted()).isTrue();
    }

    @Test
    void recording_after_completion_is_a_bug() {
        ResultSink sink = new ResultSink();
        sink.complete();
        assertThatIllegalStateException().isThrownBy(() -> sink.record(verdict("late", Classification.REJECTED)));
    }

    @Test
    void progress_listener_sees_running_count() {
        List<Long> done = new ArrayList<>();
        ResultSink sink = new ResultSink((phase, d, t) -> {
            assertThat(phase).isEqualTo("probe");
            done.add(d);
        }, System::nanoTime);
        for (int i = 0; i < 12; i++) sink.record(verdict("u" + i, Classification.REJECTED));
        assertThat(done).hasSize(12).endsWith(12L);
    }
}
