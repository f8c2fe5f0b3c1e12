package com.authprobe.core.http;

import com.authprobe.core.api.ILoginTransport;
import com.authprobe.core.api.TransportException;
import com.authprobe.core.model.LoginResponse;
import com.authprobe.core.model.ProbeConfig;
import com.authprobe.core.util.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * 어떤 ILoginTransport 든 감싸는 재시도 데코레이터.
 * 429/503/전송 실패만 재시도하고, 서버가 준 Retry-After 를 우선한다.
 * submit 1건마다 정책을 새로 받으므로 시도 번호는 자격증명 단위로 센다.
 */
public final class RetryingTransport implements ILoginTransport {

    /** 재시도가 허용될 때마다 호출(대기 직전, submit 을 부른 스레드에서). */
    @FunctionalInterface
    public interface RetryListener {
        RetryListener NONE = (username, status, attempt, wait) -> { };

        void onRetry(String username, int status, int attempt, Duration wait);
    }

    private static final Logger LOG = LoggerFactory.getLogger(RetryingTransport.class);

    private final ILoginTransport delegate;
    private final Supplier<? extends RetryPolicy> policies;
    private final Sleeper sleeper;
    private final RetryListener listener;

    public RetryingTransport(ILoginTransport delegate, Supplier<? extends RetryPolicy> policies, Sleeper sleeper) {
        this(delegate, policies, sleeper, RetryListener.NONE);
    }

    public RetryingTransport(ILoginTransport delegate, Supplier<? extends RetryPolicy> policies,
                             Sleeper sleeper, RetryListener listener) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
        this.policies = Objects.requireNonNull(policies, "policies");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
        this.listener = (listener != null) ? listener : RetryListener.NONE;
    }

    /** 설정의 maxAttempts 로 DefaultRetryPolicy 를 쓰는 기본 조합 */
    public static RetryingTransport from(ProbeConfig cfg, ILoginTransport delegate,
                                         Sleeper sleeper, RetryListener listener) {
        Objects.requireNonNull(cfg, "config");
        return new RetryingTransport(delegate, () -> DefaultRetryPolicy.from(cfg), sleeper, listener);
    }

    @Override
    public LoginResponse submit(String username, String password) throws TransportException {
        RetryPolicy policy = policies.get();
        int attempt = 1;
        while (true) {
            LoginResponse data = null;
            TransportException failure = null;
            try {
                data = delegate.submit(username, password);
            } catch (TransportException e) {
                failure = e;
            }
            int status = (data == null) ? RetryPolicy.TRANSPORT_FAILURE : data.getStatusCode();

            // 인터럽트된 스레드는 더 기다리지 않는다
            if (Thread.currentThread().isInterrupted() || !policy.shouldRetry(status, attempt)) {
                if (failure != null) throw failure;
                return data;
            }
            Duration wait = policy.delayFor(attempt, data == null ? null : data.header("Retry-After"));
            LOG.debug("Retrying user '{}' after status {} (attempt {}/{}), waiting {}ms",
                    username, status, attempt, policy.maxAttempts(), wait.toMillis());
            listener.onRetry(username, status, attempt, wait);
            try {
                sleeper.sleep(wait);
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                throw new TransportException("interrupted while backing off after status " + status, ie);
            }
            attempt++;
        }
    }

    @Override
    public void close() throws Exception {
        delegate.close();
    }
}
