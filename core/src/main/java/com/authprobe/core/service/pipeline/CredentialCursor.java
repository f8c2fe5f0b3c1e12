package com.authprobe.core.service.pipeline;

import com.authprobe.core.model.Credential;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Iterator;
import java.util.Objects;
import java.util.stream.Stream;

/** 모든 워커가 공유하는 단일 추출 지점. next()는 상호배제: 한 번에 한 쌍, 중복/유실/재정렬 없음. */
final class CredentialCursor implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(CredentialCursor.class);

    private final Stream<Credential> stream;
    private final Iterator<Credential> it;
    private boolean exhausted = false;
    private long pulled = 0;

    CredentialCursor(Stream<Credential> stream) {
        this.stream = Objects.requireNonNull(stream, "stream");
        this.it = stream.iterator();
    }

    /** @return 다음 쌍, 소진되었으면 null */
    synchronized Credential next() {
        if (exhausted) return null;
        try {
            if (it.hasNext()) {
                pulled++;
                return it.next();
            }
        } catch (RuntimeException e) {
            // 읽기 오류든 소스 버그든 이후의 쌍은 신뢰할 수 없으므로 소진으로 처리.
            LOG.warn("Credential source failed after {} pairs: {}", pulled, e.toString());
        }
        exhausted = true;
        return null;
    }

    synchronized boolean isExhausted() { return exhausted; }

    synchronized long pulled() { return pulled; }

    @Override
    public synchronized void close() {
        exhausted = true;
        try {
            stream.close();
        } catch (RuntimeException e) {
            LOG.warn("Closing credential source failed: {}", e.getMessage());
        }
    }
}
