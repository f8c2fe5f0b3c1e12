package com.authprobe.core.source;

import com.authprobe.core.api.ICredentialSource;
import com.authprobe.core.model.Credential;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Stream;

/**
 * user:pass 형식의 콤보 파일을 한 줄씩 lazy 하게 읽는 자격증명 소스.
 * - UTF-8, 깨진 바이트는 무시
 * - 구분자 미지정 시 ':' ',' ';' '|' 중 줄에 처음 등장하는(우선순위 순) 것을 사용
 * - 한 번만 분할(비밀번호에 구분자가 있어도 됨), 양쪽 trim, 빈 쪽이 있으면 skip
 */
public final class ComboFileSource implements ICredentialSource {

    private static final Logger LOG = LoggerFactory.getLogger(ComboFileSource.class);

    public static final List<String> AUTO_DELIMITERS = List.of(":", ",", ";", "|");

    private final Path file;
    private final String delimiter; // null → 자동

    public ComboFileSource(Path file) { this(file, null); }

    public ComboFileSource(Path file, String delimiter) {
        this.file = Objects.requireNonNull(file, "file");
        this.delimiter = (delimiter == null || delimiter.isEmpty()) ? null : delimiter;
    }

    public Path getFile() { return file; }

    /** 실행 전에 파일 존재 확인(없으면 NoSuchFileException). */
    public void checkReadable() throws IOException {
        if (!Files.isRegularFile(file)) throw new NoSuchFileException(file.toString());
        if (!Files.isReadable(file)) throw new IOException("combo file not readable: " + file);
    }

    @Override
    public Stream<Credential> open() throws IOException {
        checkReadable();
        CharsetDecoder dec = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.IGNORE)
                .onUnmappableCharacter(CodingErrorAction.IGNORE);
        BufferedReader br = new BufferedReader(new InputStreamReader(Files.newInputStream(file), dec));

        AtomicLong lineNo = new AtomicLong();
        AtomicLong skipped = new AtomicLong();
        return br.lines()
                .map(line -> {
                    long n = lineNo.incrementAndGet();
                    Optional<Credential> c = parseLine(line, delimiter);
                    if (c.isEmpty() && !line.isBlank()) {
                        skipped.incrementAndGet();
                        LOG.debug("Skipping malformed line #{} in {}", n, file.getFileName());
                    }
                    return c;
                })
                .flatMap(Optional::stream)
                .onClose(() -> {
                    if (skipped.get() > 0) {
                        LOG.info("Combo file {}: skipped {} malformed line(s)", file.getFileName(), skipped.get());
                    }
                    try {
                        br.close();
                    } catch (IOException e) {
                        throw new UncheckedIOException(e);
                    }
                });
    }

    /** 한 줄 파싱. 구분자 없음/빈 사용자명/빈 비밀번호는 empty. */
    public static Optional<Credential> parseLine(String line, String delimiter) {
        if (line == null) return Optional.empty();
        String s = line.strip();
        if (s.startsWith("\uFEFF")) s = s.substring(1).strip(); // BOM
        if (s.isEmpty()) return Optional.empty();

        String d = (delimiter != null && !delimiter.isEmpty()) ? delimiter : detect(s);
        if (d == null) return Optional.empty();

        int i = s.indexOf(d);
        if (i < 0) return Optional.empty();
        String user = s.substring(0, i).trim();
        String pass = s.substring(i + d.length()).trim();
        if (user.isEmpty() || pass.isEmpty()) return Optional.empty();
        return Optional.of(new Credential(user, pass));
    }

    static String detect(String line) {
        for (String d : AUTO_DELIMITERS) {
            if (line.contains(d)) return d;
        }
        return null;
    }

    @Override
    public String toString() {
        return "ComboFileSource{" + file + (delimiter == null ? "" : ", delimiter='" + delimiter + "'") + "}";
    }
}
