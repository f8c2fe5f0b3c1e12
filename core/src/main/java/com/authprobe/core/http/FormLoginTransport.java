package com.authprobe.core.http;

import com.authprobe.core.api.ILoginTransport;
import com.authprobe.core.api.TransportException;
import com.authprobe.core.model.LoginResponse;
import com.authprobe.core.model.ProbeConfig;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.StringJoiner;

/**
 * 폼 로그인 전송: application/x-www-form-urlencoded POST 후 LoginResponse로 매핑.
 *
 * 리다이렉트는 직접 추적한다(클라이언트는 항상 Redirect.NEVER). 시도마다 새 쿠키 저장소를
 * 쓰므로 워커/시도 간 세션이 섞이지 않고, 체인 전체의 Set-Cookie 이름을 수집할 수 있다.
 */
public class FormLoginTransport implements ILoginTransport {

    /** 테스트/모킹용 송신 훅 */
    @FunctionalInterface
    public interface HttpSender {
        HttpResponse<String> send(HttpRequest req) throws IOException, InterruptedException;
    }

    static final int MAX_REDIRECTS = 10;

    private final ProbeConfig config;
    private final URI target;
    private final HttpClient client;   // 프로덕션 경로
    private final HttpSender sender;   // 테스트 경로(있으면 이걸 사용)

    public FormLoginTransport(ProbeConfig config) {
        this.config = Objects.requireNonNull(config, "config");
        this.target = parseTarget(config.getTarget());
        this.client = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .followRedirects(HttpClient.Redirect.NEVER)
                .connectTimeout(config.getTimeout())
                .build();
        this.sender = null;
    }

    /** 테스트용 생성자(송신 훅 주입) */
    public FormLoginTransport(ProbeConfig config, HttpSender testSender) {
        this.config = Objects.requireNonNull(config, "config");
        this.target = parseTarget(config.getTarget());
        this.client = null;
        this.sender = Objects.requireNonNull(testSender, "testSender");
    }

    public URI getTarget() { return target; }

    @Override
    public LoginResponse submit(String username, String password) throws TransportException {
        Objects.requireNonNull(username, "username");
        Objects.requireNonNull(password, "password");

        final String form = formBody(username, password);
        final Map<String, String> jar = new LinkedHashMap<>(); // 시도 단위 쿠키 저장소
        final Set<String> cookieNames = new LinkedHashSet<>();

        URI uri = target;
        String method = "POST";
        try {
            for (int hop = 0; ; hop++) {
                HttpResponse<String> resp = send(buildRequest(uri, method, form, jar));
                collectCookies(resp, uri, jar, cookieNames);

                int sc = resp.statusCode();
                String location = resp.headers().firstValue("Location").orElse(null);
                if (!config.isFollowRedirects() || !isRedirect(sc) || location == null || location.isBlank()) {
                    return LoginResponse.builder()
                            .finalUrl(uri)
                            .statusCode(sc)
                            .headers(resp.headers().map())
                            .body(resp.body() == null ? "" : resp.body())
                            .cookieNames(cookieNames)
                            .build();
                }
                if (hop >= MAX_REDIRECTS) {
                    throw new TransportException("too many redirects (>" + MAX_REDIRECTS + ") from " + target);
                }
                uri = uri.resolve(location.trim());
                // 301/302/303 → GET(본문 제거), 307/308 → 메서드/본문 유지
                if (sc != 307 && sc != 308) method = "GET";
            }
        } catch (IOException e) {
            throw new TransportException(describe(e) + " (" + uri + ")", e);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new TransportException("interrupted while waiting for " + uri, ie);
        } catch (IllegalArgumentException e) {
            throw new TransportException("invalid redirect target: " + e.getMessage(), e);
        }
    }

    // ---------- 요청 구성 ----------

    private HttpRequest buildRequest(URI uri, String method, String form, Map<String, String> jar) {
        HttpRequest.Builder b = HttpRequest.newBuilder(uri)
                .timeout(config.getTimeout())
                .header("User-Agent", config.getUserAgent())
                .header("Accept", "text/html,application/xhtml+xml,application/xml;q=0.9,*/*;q=0.8");
        if (!jar.isEmpty() && sameHost(uri, target)) {
            b.header("Cookie", cookieHeader(jar));
        }
        if ("POST".equals(method)) {
            b.header("Content-Type", "application/x-www-form-urlencoded")
             .POST(HttpRequest.BodyPublishers.ofString(form, StandardCharsets.UTF_8));
        } else {
            b.GET();
        }
        return b.build();
    }

    String formBody(String username, String password) {
        StringJoiner sj = new StringJoiner("&");
        sj.add(enc(config.getUsernameField()) + "=" + enc(username));
        sj.add(enc(config.getPasswordField()) + "=" + enc(password));
        for (var e : config.getExtraFormFields().entrySet()) {
            sj.add(enc(e.getKey()) + "=" + enc(e.getValue() == null ? "" : e.getValue()));
        }
        return sj.toString();
    }

    private HttpResponse<String> send(HttpRequest req) throws IOException, InterruptedException {
        return (sender != null)
                ? sender.send(req)
                : client.send(req, HttpResponse.BodyHandlers.ofString());
    }

    // ---------- 쿠키 ----------

    private static void collectCookies(HttpResponse<String> resp, URI uri,
                                       Map<String, String> jar, Set<String> names) {
        List<String> setCookies = resp.headers().allValues("Set-Cookie");
        for (String sc : setCookies) {
            String first = sc.split(";", 2)[0];
            int eq = first.indexOf('=');
            if (eq <= 0) continue;
            String name = first.substring(0, eq).trim();
            String value = first.substring(eq + 1).trim();
            if (name.isEmpty()) continue;
            names.add(name);
            jar.put(name, value);
        }
    }

    private static String cookieHeader(Map<String, String> jar) {
        StringJoiner sj = new StringJoiner("; ");
        jar.forEach((k, v) -> sj.add(k + "=" + v));
        return sj.toString();
    }

    private static boolean sameHost(URI a, URI b) {
        String ha = a.getHost() == null ? "" : a.getHost().toLowerCase(Locale.ROOT);
        String hb = b.getHost() == null ? "" : b.getHost().toLowerCase(Locale.ROOT);
        return ha.equals(hb);
    }

    // ---------- helpers ----------

    private static boolean isRedirect(int sc) {
        return sc == 301 || sc == 302 || sc == 303 || sc == 307 || sc == 308;
    }

    private static String enc(String s) {
        return URLEncoder.encode(s, StandardCharsets.UTF_8);
    }

    private static URI parseTarget(String target) {
        Objects.requireNonNull(target, "target");
        URI u = URI.create(target.trim());
        String scheme = u.getScheme() == null ? "" : u.getScheme().toLowerCase(Locale.ROOT);
        if (!scheme.equals("http") && !scheme.equals("https")) {
            throw new IllegalArgumentException("target must be an http(s) URL: " + target);
        }
        return u;
    }

    private static String describe(IOException e) {
        String kind = e.getClass().getSimpleName();
        String msg = e.getMessage();
        return (msg == null || msg.isBlank()) ? kind : kind + ": " + msg;
    }
}
