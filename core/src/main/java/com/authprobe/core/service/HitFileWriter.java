package com.authprobe.core.service;

import com.authprobe.core.model.Verdict;
import com.authprobe.core.service.pipeline.VerdictListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Objects;

/**
 * SUSPECT 판정을 즉시 hits 파일에 한 줄씩 추가한다.
 * 형식: [yyyy-MM-dd HH:mm:ss] user:pass (score N)
 */
public final class HitFileWriter implements VerdictListener {

    private static final Logger LOG = LoggerFactory.getLogger(HitFileWriter.class);

    static final DateTimeFormatter TS_FMT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss").withZone(ZoneId.systemDefault());

    private final Path file;
    private long written = 0;

    public HitFileWriter(Path file) {
        this.file = Objects.requireNonNull(file, "file");
    }

    public Path getFile() { return file; }

    public synchronized long getWritten() { return written; }

    @Override
    public synchronized void onVerdict(Verdict v) {
        if (!v.isSuspect()) return;
        String line = format(v) + System.lineSeparator();
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) Files.createDirectories(parent);
            Files.writeString(file, line, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND);
            written++;
        } catch (IOException e) {
            throw new UncheckedIOException("failed to append hit to " + file, e);
        }
        LOG.debug("Hit recorded for user '{}' in {}", v.getUsername(), file);
    }

    static String format(Verdict v) {
        return "[" + TS_FMT.format(v.getDecidedAt()) + "] "
                + v.getUsername() + ":" + v.getPassword()
                + " (score " + v.getScore() + ")";
    }
}
