package com.authprobe.core.service.pipeline;

import com.authprobe.core.model.Verdict;

/** 판정이 기록될 때마다 싱크 락 안에서 호출된다. 빠르게 끝나야 한다. */
@FunctionalInterface
public interface VerdictListener {
    void onVerdict(Verdict verdict);
}
