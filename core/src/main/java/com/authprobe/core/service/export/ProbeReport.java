package com.authprobe.core.service.export;

import com.authprobe.core.model.FailureSignature;
import com.authprobe.core.model.ProbeStats;
import com.authprobe.core.model.RunSummary;
import com.authprobe.core.model.Verdict;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/** 보고서 입력 묶음. runtime 은 없을 수 있다. */
public record ProbeReport(Instant startedAt,
                          FailureSignature signature,
                          RunSummary summary,
                          ProbeStats.Snapshot runtime,
                          List<Verdict> suspects) {
    public ProbeReport {
        Objects.requireNonNull(startedAt, "startedAt");
        Objects.requireNonNull(signature, "signature");
        Objects.requireNonNull(summary, "summary");
        suspects = (suspects == null) ? List.of() : List.copyOf(suspects);
    }
}
