package com.authprobe.core.util;

@FunctionalInterface
public interface ProgressListener {
    /**
     * @param phase    "calibrate" | "probe" | "done"
     * @param done     처리 수
     * @param total    전체 수(lazy 소스라 모르면 -1)
     */
    void onProgress(String phase, long done, long total);

    ProgressListener NONE = (phase, d, t) -> {};
}
