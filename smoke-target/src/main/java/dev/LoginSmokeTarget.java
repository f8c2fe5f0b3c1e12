package dev;

import com.sun.net.httpserver.*;

import java.io.*;
import java.net.*;
import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.util.*;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 수동 실행/통합 테스트용 로컬 로그인 엔드포인트.
 *  - GET  /login      : 로그인 폼(200)
 *  - POST /login      : 틀리면 422 + 폼(요청마다 nonce 길이가 달라짐), 맞으면 302 → /dashboard + 세션 쿠키
 *  - GET  /dashboard  : 세션 쿠키 있으면 200, 없으면 302 → /login
 *
 * 데모 계정: -Dsmoke.user=admin -Dsmoke.pass=hunter2 (기본값)
 * 포트: 첫 번째 인자 또는 8080
 */
public class LoginSmokeTarget {

  static final String SESSION_COOKIE = "SMOKESESSID";
  private static final SecureRandom RND = new SecureRandom();

  private final HttpServer server;
  private final ExecutorService pool;
  private final String user;
  private final String pass;
  private final Set<String> sessions = Collections.synchronizedSet(new HashSet<>());
  private final AtomicLong loginAttempts = new AtomicLong();

  private LoginSmokeTarget(HttpServer server, ExecutorService pool, String user, String pass) {
    this.server = server;
    this.pool = pool;
    this.user = user;
    this.pass = pass;
  }

  public static void main(String[] args) throws Exception {
    int port = (args.length > 0) ? Integer.parseInt(args[0]) : 8080;
    LoginSmokeTarget t = start(port,
        System.getProperty("smoke.user", "admin"),
        System.getProperty("smoke.pass", "hunter2"));
    System.out.println("[SMOKE] login target on http://localhost:" + t.port() + "/login");
  }

  /** port 0 이면 임의 포트 */
  public static LoginSmokeTarget start(int port, String user, String pass) throws IOException {
    HttpServer http = HttpServer.create(new InetSocketAddress(InetAddress.getLoopbackAddress(), port), 0);
    ExecutorService pool = Executors.newFixedThreadPool(8);
    LoginSmokeTarget t = new LoginSmokeTarget(http, pool, user, pass);
    t.wireEndpoints();
    http.setExecutor(pool);
    http.start();
    return t;
  }

  public int port() { return server.getAddress().getPort(); }

  public String loginUrl() { return "http://127.0.0.1:" + port() + "/login"; }

  public long loginAttempts() { return loginAttempts.get(); }

  public void stop() {
    server.stop(0);
    pool.shutdownNow();
  }

  void wireEndpoints() {
    server.createContext("/login", ex -> {
      if ("POST".equalsIgnoreCase(ex.getRequestMethod())) {
        loginAttempts.incrementAndGet();
        Map<String, String> form = parseForm(readBody(ex));
        if (user.equals(form.get("username")) && pass.equals(form.get("password"))) {
          String sid = newToken(24);
          sessions.add(sid);
          ex.getResponseHeaders().add("Set-Cookie", SESSION_COOKIE + "=" + sid + "; Path=/; HttpOnly");
          ex.getResponseHeaders().set("Location", "/dashboard");
          ex.sendResponseHeaders(302, -1);
          ex.close();
          return;
        }
        resp(ex, 422, "text/html", loginPage("Invalid username or password."));
        return;
      }
      resp(ex, 200, "text/html", loginPage(null));
    });

    server.createContext("/dashboard", ex -> {
      String sid = cookie(ex.getRequestHeaders(), SESSION_COOKIE);
      if (sid == null || !sessions.contains(sid)) {
        ex.getResponseHeaders().set("Location", "/login");
        ex.sendResponseHeaders(302, -1);
        ex.close();
        return;
      }
      resp(ex, 200, "text/html",
          "<html><body><h3>Dashboard</h3><p>Welcome back, " + user + ".</p>"
          + "<a href=\"/logout\">Sign out</a></body></html>");
    });
  }

  // 요청마다 nonce 길이를 8..24자로 바꿔 본문 길이에 작은 흔들림을 준다
  static String loginPage(String error) {
    String nonce = newToken(8 + RND.nextInt(17));
    StringBuilder sb = new StringBuilder(2048);
    sb.append("<html><head><title>Sign in</title></head><body>");
    sb.append("<h3>Sign in</h3>");
    if (error != null) sb.append("<p class=\"error\">").append(error).append("</p>");
    sb.append("<form method=\"post\" action=\"/login\">")
      .append("<input type=\"hidden\" name=\"nonce\" value=\"").append(nonce).append("\">")
      .append("<label>Username <input name=\"username\"></label>")
      .append("<label>Password <input name=\"password\" type=\"password\"></label>")
      .append("<button type=\"submit\">Sign in</button>")
      .append("</form>");
    // 실제 로그인 페이지 크기에 가깝도록 고정 푸터
    for (int i = 0; i < 20; i++) {
      sb.append("<p class=\"legal\">By signing in you agree to the acceptable use policy, section ")
        .append(i + 1).append(".</p>");
    }
    sb.append("</body></html>");
    return sb.toString();
  }

  static String newToken(int len) {
    final String abc = "0123456789abcdef";
    char[] cs = new char[len];
    for (int i = 0; i < len; i++) cs[i] = abc.charAt(RND.nextInt(abc.length()));
    return new String(cs);
  }

  static String readBody(HttpExchange ex) throws IOException {
    try (InputStream in = ex.getRequestBody()) {
      return new String(in.readAllBytes(), StandardCharsets.UTF_8);
    }
  }

  static Map<String,String> parseForm(String body){
    Map<String,String> m = new LinkedHashMap<>();
    if (body == null || body.isEmpty()) return m;
    for (String p: body.split("&")) {
      int i = p.indexOf('=');
      String k = i<0? p : p.substring(0,i);
      String v = i<0? "" : p.substring(i+1);
      m.put(urlDecode(k), urlDecode(v));
    }
    return m;
  }

  static String cookie(Headers h, String name) {
    for (String line : h.getOrDefault("Cookie", List.of())) {
      for (String part : line.split(";")) {
        String[] kv = part.trim().split("=", 2);
        if (kv.length == 2 && kv[0].equals(name)) return kv[1];
      }
    }
    return null;
  }

  static String urlDecode(String s){
    try { return URLDecoder.decode(s, StandardCharsets.UTF_8); } catch(IllegalArgumentException e){ return s; }
  }

  static void resp(HttpExchange ex, int code, String ct, String body) throws IOException {
    byte[] b = body.getBytes(StandardCharsets.UTF_8);
    ex.getResponseHeaders().set("Content-Type", ct+"; charset=utf-8");
    ex.sendResponseHeaders(code, b.length);
    try (OutputStream os = ex.getResponseBody()) { os.write(b); }
  }
}
