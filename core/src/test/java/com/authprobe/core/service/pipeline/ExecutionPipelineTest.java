package com.authprobe.core.service.pipeline;

import com.authprobe.core.api.ICredentialSource;
import com.authprobe.core.api.ILoginTransport;
import com.authprobe.core.api.TransportException;
import com.authprobe.core.detector.DeviationScorer;
import com.authprobe.core.model.Classification;
import com.authprobe.core.model.Credential;
import com.authprobe.core.model.DegradedSignatureWarning;
import com.authprobe.core.model.FailureSignature;
import com.authprobe.core.model.LoginResponse;
import com.authprobe.core.model.ProbeConfig;
import com.authprobe.core.model.ProbeStats;
import com.authprobe.core.model.RunSummary;
import com.authprobe.core.model.Verdict;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import java.util.*;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.*;

@Timeout(value = 60, unit = TimeUnit.SECONDS)
class ExecutionPipelineTest {

    static final FailureSignature SIG = FailureSignature.builder()
            .expectedStatus(422)
            .lengthRange(90, 110)
            .expectedUrl("http://t/login")
            .build();

    static LoginResponse failurePage() {
        return LoginResponse.builder()
                .finalUrl(URI.create("http://t/login"))
                .statusCode(422)
                .body("x".repeat(100))
                .build();
    }

    static LoginResponse dashboard() {
        return LoginResponse.builder()
                .finalUrl(URI.create("http://t/dashboard"))
                .statusCode(200)
                .body("welcome")
                .cookieNames(Set.of("sid"))
                .build();
    }

    static List<Credential> creds(int n) {
        return IntStream.range(0, n)
                .mapToObj(i -> new Credential("user" + i, "pw" + i))
                .collect(Collectors.toList());
    }

    static ICredentialSource source(List<Credential> xs) {
        return () -> xs.stream();
    }

    static ProbeConfig cfg() {
        return ProbeConfig.defaults()
                .setTarget("http://t/login")
                .setRequestPacing(Duration.ZERO);
    }

    static ExecutionPipeline pipeline(ProbeConfig cfg, ILoginTransport t) {
        return new ExecutionPipeline(cfg, t, new DeviationScorer(), d -> { }, System::nanoTime);
    }

    static List<Verdict> drain(ProbeRun run) {
        List<Verdict> out = new ArrayList<>();
        for (Verdict v : run) out.add(v);
        return out;
    }

    @Test
    void ten_workers_against_consensus_responses_reject_everything_exactly_once() throws Exception {
        List<Credential> input = creds(200);
        ProbeRun run = pipeline(cfg(), (u, p) -> failurePage())
                .run(source(input), SIG, 10, Duration.ZERO);

        List<Verdict> verdicts = drain(run);
        RunSummary s = run.awaitCompletion();

        assertThat(s.tested()).isEqualTo(200);
        assertThat(s.suspect()).isZero();
        assertThat(s.faults()).isZero();
        assertThat(verdicts).hasSize(200)
                .allMatch(v -> v.getClassification() == Classification.REJECTED && v.getScore() == 0);
        assertThat(verdicts).extracting(Verdict::getUsername)
                .doesNotHaveDuplicates()
                .containsExactlyInAnyOrderElementsOf(input.stream().map(Credential::username).collect(Collectors.toList()));
        assertThat(run.isDone()).isTrue();
    }

    @Test
    void deviating_response_is_flagged_suspect() throws Exception {
        ILoginTransport t = (u, p) -> ("user7".equals(u) && "pw7".equals(p)) ? dashboard() : failurePage();
        ProbeRun run = pipeline(cfg(), t).run(source(creds(20)), SIG, 4, Duration.ZERO);

        List<Verdict> suspects = drain(run).stream().filter(Verdict::isSuspect).collect(Collectors.toList());
        RunSummary s = run.awaitCompletion();

        assertThat(s.tested()).isEqualTo(20);
        assertThat(s.suspect()).isEqualTo(1);
        assertThat(suspects).singleElement().satisfies(v -> {
            assertThat(v.getUsername()).isEqualTo("user7");
            assertThat(v.getPassword()).isEqualTo("pw7");
            assertThat(v.getScore()).isEqualTo(8);
            assertThat(v.getSummary().getCookieNames()).containsExactly("sid");
            assertThat(v.getWorker()).startsWith("probe-worker-");
        });
    }

    @Test
    void transport_failure_becomes_rejected_verdict_and_worker_carries_on() throws Exception {
        ILoginTransport t = (u, p) -> {
            if ("user3".equals(u)) throw new TransportException("read timed out");
            return failurePage();
        };
        ProbeRun run = pipeline(cfg(), t).run(source(creds(10)), SIG, 1, Duration.ZERO);

        List<Verdict> verdicts = drain(run);
        RunSummary s = run.awaitCompletion();

        assertThat(s.tested()).isEqualTo(10);
        assertThat(s.transportErrors()).isEqualTo(1);
        Verdict failed = verdicts.stream().filter(v -> v.getUsername().equals("user3")).findFirst().orElseThrow();
        assertThat(failed.getClassification()).isEqualTo(Classification.REJECTED);
        assertThat(failed.getScore()).isZero();
        assertThat(failed.getReasons()).containsExactly("transport error: read timed out");
        assertThat(failed.isTransportFailure()).isTrue();
        assertThat(failed.getSummary()).isNull();
    }

    @Test
    void worker_fault_is_isolated_and_slot_restarted() throws Exception {
        ILoginTransport t = (u, p) -> {
            if ("user5".equals(u) || "user11".equals(u)) throw new IllegalStateException("parser bug");
            return failurePage();
        };
        // 워커 1개: 재시작이 없으면 나머지 쌍이 처리되지 않는다
        ProbeRun run = pipeline(cfg(), t).run(source(creds(20)), SIG, 1, Duration.ZERO);

        List<Verdict> verdicts = drain(run);
        RunSummary s = run.awaitCompletion();

        assertThat(s.faults()).isEqualTo(2);
        assertThat(s.tested()).isEqualTo(18);
        assertThat(verdicts).extracting(Verdict::getUsername).doesNotContain("user5", "user11").hasSize(18);
    }

    @Test
    void stop_finishes_in_flight_requests_and_pulls_nothing_new() throws Exception {
        List<String> submitted = new CopyOnWriteArrayList<>();
        ILoginTransport slow = (u, p) -> {
            submitted.add(u);
            try {
                Thread.sleep(20);
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                throw new TransportException("interrupted", ie);
            }
            return failurePage();
        };
        ProbeRun run = pipeline(cfg(), slow).run(source(creds(1000)), SIG, 3, Duration.ZERO);

        int seen = 0;
        for (Verdict v : run) {
            if (++seen == 5) run.stop();
        }
        RunSummary s = run.awaitCompletion();

        assertThat(run.isStopRequested()).isTrue();
        assertThat(s.tested()).isGreaterThanOrEqualTo(5).isLessThan(1000);
        // 제출된 모든 요청은 판정을 받는다(진행 중 요청 마무리)
        assertThat(s.tested()).isEqualTo(submitted.size());
        assertThat((long) seen).isEqualTo(s.tested());
    }

    @Test
    void stop_wakes_workers_waiting_on_pacing() throws Exception {
        ProbeRun run = pipeline(cfg(), (u, p) -> failurePage())
                .run(source(creds(100)), SIG, 2, Duration.ofMinutes(5));

        // 각 워커의 첫 요청은 즉시, 두 번째는 5분 뒤
        Iterator<Verdict> it = run.iterator();
        assertThat(it.hasNext()).isTrue();
        it.next();
        run.stop();
        assertThat(run.awaitCompletion(Duration.ofSeconds(10))).isTrue();
        assertThat(run.summary().tested()).isLessThanOrEqualTo(2);
    }

    @Test
    void observed_concurrency_never_exceeds_worker_count() throws Exception {
        final int workers = 4;
        ILoginTransport t = (u, p) -> {
            try { Thread.sleep(20); } catch (InterruptedException ie) { Thread.currentThread().interrupt(); }
            return failurePage();
        };
        ExecutionPipeline pl = pipeline(cfg(), t);
        ProbeRun run = pl.run(source(creds(40)), SIG, workers, Duration.ZERO);
        drain(run);
        run.awaitCompletion();

        ProbeStats.Snapshot rt = pl.getRuntimeSnapshot();
        assertThat(rt.maxObservedConcurrency()).isBetween(1, workers);
        assertThat(rt.requestsTotal()).isEqualTo(40);
        assertThat(run.stats().credentialsTotal()).isEqualTo(40);
    }

    @Test
    void pacing_spaces_requests_of_one_worker() throws Exception {
        List<Long> starts = new CopyOnWriteArrayList<>();
        ILoginTransport t = (u, p) -> { starts.add(System.nanoTime()); return failurePage(); };

        ProbeRun run = pipeline(cfg(), t).run(source(creds(3)), SIG, 1, Duration.ofMillis(100));
        drain(run);
        run.awaitCompletion();

        assertThat(starts).hasSize(3);
        for (int i = 1; i < starts.size(); i++) {
            long gapMs = (starts.get(i) - starts.get(i - 1)) / 1_000_000;
            assertThat(gapMs).isGreaterThanOrEqualTo(95);
        }
    }

    @Test
    void restarted_slot_keeps_the_pacing_of_the_faulted_worker() throws Exception {
        List<Long> starts = new CopyOnWriteArrayList<>();
        ILoginTransport t = (u, p) -> {
            starts.add(System.nanoTime());
            if ("user1".equals(u)) throw new IllegalStateException("parser bug");
            return failurePage();
        };

        ProbeRun run = pipeline(cfg(), t).run(source(creds(3)), SIG, 1, Duration.ofMillis(300));
        drain(run);
        RunSummary s = run.awaitCompletion();

        assertThat(s.faults()).isEqualTo(1);
        assertThat(s.tested()).isEqualTo(2);
        // 결함 난 요청도 시작으로 친다: 재시작된 워커의 첫 요청은 그 뒤 300ms 를 기다린다
        assertThat(starts).hasSize(3);
        for (int i = 1; i < starts.size(); i++) {
            long gapMs = (starts.get(i) - starts.get(i - 1)) / 1_000_000;
            assertThat(gapMs).as("gap before request %d", i).isGreaterThanOrEqualTo(290);
        }
    }

    @Test
    void source_that_keeps_throwing_ends_the_run_instead_of_restarting_forever() throws Exception {
        ICredentialSource broken = () -> Stream.<Credential>generate(() -> {
            throw new IllegalStateException("corrupt row");
        });
        List<String> submitted = new CopyOnWriteArrayList<>();
        ProbeRun run = pipeline(cfg(), (u, p) -> { submitted.add(u); return failurePage(); })
                .run(broken, SIG, 2, Duration.ZERO);

        assertThat(run.awaitCompletion(Duration.ofSeconds(10))).isTrue();
        assertThat(drain(run)).isEmpty();
        assertThat(run.summary().tested()).isZero();
        assertThat(run.summary().faults()).isZero();
        assertThat(submitted).isEmpty();
    }

    @Test
    void source_failing_midway_keeps_the_verdicts_already_pulled() throws Exception {
        ICredentialSource halfBroken = () -> Stream.concat(creds(4).stream(),
                Stream.<Credential>generate(() -> { throw new IllegalArgumentException("bad encoding"); }));
        ProbeRun run = pipeline(cfg(), (u, p) -> failurePage()).run(halfBroken, SIG, 3, Duration.ZERO);

        List<Verdict> verdicts = drain(run);
        RunSummary s = run.awaitCompletion();

        assertThat(s.tested()).isEqualTo(4);
        assertThat(verdicts).extracting(Verdict::getUsername)
                .containsExactlyInAnyOrder("user0", "user1", "user2", "user3");
    }

    @Test
    void any_transport_gets_retried_on_rate_limit() throws Exception {
        List<String> submitted = new CopyOnWriteArrayList<>();
        ILoginTransport t = (u, p) -> {
            submitted.add(u);
            if ("user2".equals(u) && submitted.stream().filter("user2"::equals).count() == 1) {
                return LoginResponse.builder()
                        .finalUrl(URI.create("http://t/login"))
                        .statusCode(429)
                        .headers(Map.of("Retry-After", List.of("0")))
                        .body("slow down")
                        .build();
            }
            return failurePage();
        };
        ProbeRun run = pipeline(cfg(), t).run(source(creds(4)), SIG, 1, Duration.ZERO);

        List<Verdict> verdicts = drain(run);
        run.awaitCompletion();

        assertThat(submitted).containsExactly("user0", "user1", "user2", "user2", "user3");
        assertThat(verdicts).hasSize(4).allMatch(v -> v.getClassification() == Classification.REJECTED);
        ProbeStats.Snapshot st = run.stats();
        assertThat(st.retriesTotal()).isEqualTo(1);
        assertThat(st.rateLimitedTotal()).isEqualTo(1);
    }

    @Test
    void degraded_signature_warnings_travel_with_every_verdict() throws Exception {
        FailureSignature degraded = FailureSignature.builder()
                .expectedStatus(422).lengthRange(90, 110).expectedUrl("http://t/login")
                .statusReliable(false)
                .warning(new DegradedSignatureWarning(DegradedSignatureWarning.Dimension.STATUS, List.of("422", "500")))
                .build();
        ProbeRun run = pipeline(cfg(), (u, p) -> failurePage()).run(source(creds(5)), degraded, 2, Duration.ZERO);

        assertThat(drain(run)).hasSize(5).allSatisfy(v ->
                assertThat(v.getWarnings()).singleElement().asString().contains("status varied"));
    }

    @Test
    void listeners_see_every_verdict() throws Exception {
        List<String> seen = new CopyOnWriteArrayList<>();
        ExecutionPipeline pl = pipeline(cfg(), (u, p) -> failurePage()).addListener(v -> seen.add(v.getUsername()));
        ProbeRun run = pl.run(source(creds(25)), SIG, 5, Duration.ZERO);
        run.awaitCompletion();
        assertThat(seen).hasSize(25).doesNotHaveDuplicates();
    }

    @Test
    void empty_source_completes_with_zero_summary() throws Exception {
        ProbeRun run = pipeline(cfg(), (u, p) -> failurePage()).run(source(List.of()), SIG, 3, Duration.ZERO);
        assertThat(drain(run)).isEmpty();
        RunSummary s = run.awaitCompletion();
        assertThat(s.tested()).isZero();
    }

    @Test
    void worker_count_outside_range_is_rejected() {
        ExecutionPipeline pl = pipeline(cfg(), (u, p) -> failurePage());
        assertThatIllegalArgumentException().isThrownBy(() -> pl.run(source(creds(1)), SIG, 0, Duration.ZERO));
        assertThatIllegalArgumentException().isThrownBy(() -> pl.run(source(creds(1)), SIG, 21, Duration.ZERO));
    }

    @Test
    void unreadable_source_fails_before_any_request() {
        List<String> submitted = new ArrayList<>();
        ExecutionPipeline pl = pipeline(cfg(), (u, p) -> { submitted.add(u); return failurePage(); });
        ICredentialSource broken = () -> { throw new IOException("disk gone"); };

        assertThatThrownBy(() -> pl.run(broken, SIG)).isInstanceOf(IOException.class).hasMessage("disk gone");
        assertThat(submitted).isEmpty();
    }

    @Test
    void close_stops_and_waits() throws Exception {
        ProbeRun run = pipeline(cfg(), (u, p) -> failurePage()).run(source(creds(100)), SIG, 2, Duration.ofMinutes(1));
        run.close();
        assertThat(run.isDone()).isTrue();
    }
}
