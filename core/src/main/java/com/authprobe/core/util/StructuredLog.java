package com.authprobe.core.util;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.Locale;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * JSON 라인 기반 구조화 로거(JUL 위에서 동작, 직렬화는 Jackson 트리).
 * 이벤트 이름 + key/value 쌍. Duration 은 밀리초, Collection 은 문자열 배열.
 * 비밀번호 계열 키는 값과 상관없이 마스킹된다.
 */
public final class StructuredLog {

    private static final ObjectMapper OM = new ObjectMapper();
    private static final Set<String> SECRET_KEYS = Set.of("password", "pass", "passwd", "secret");
    static final String MASK = "***";

    private final Logger jul;
    private final String comp;

    private StructuredLog(Class<?> cls) {
        this.jul = Logger.getLogger(cls.getName());
        this.comp = cls.getSimpleName();
    }

    public static StructuredLog get(Class<?> cls) {
        return new StructuredLog(cls);
    }

    public void debug(String event, Object... kvs) { log(Level.FINE,   event, null, kvs); }
    public void info (String event, Object... kvs) { log(Level.INFO,   event, null, kvs); }
    public void warn (String event, Object... kvs) { log(Level.WARNING,event, null, kvs); }
    public void error(String event, Throwable t, Object... kvs) { log(Level.SEVERE, event, t, kvs); }

    private void log(Level lvl, String event, Throwable t, Object... kvs) {
        if (!jul.isLoggable(lvl)) return;
        String line = buildJson(lvl, event, t, kvs);
        if (t == null) jul.log(lvl, line); else jul.log(lvl, line, t);
    }

    String buildJson(Level lvl, String event, Throwable t, Object... kvs) {
        ObjectNode n = OM.createObjectNode();
        n.put("ts", Instant.now().toString());
        n.put("lvl", lvl.getName());
        n.put("comp", comp);
        n.put("thread", Thread.currentThread().getName());
        n.put("event", event);

        if (kvs != null) {
            for (int i = 0; i + 1 < kvs.length; i += 2) {
                String key = String.valueOf(kvs[i]);
                put(n, key, isSecret(key) ? MASK : kvs[i + 1]);
            }
            if (kvs.length % 2 == 1) n.put("_kv_mismatch", true);
        }
        if (t != null) {
            n.put("error", t.getClass().getSimpleName());
            n.put("message", t.getMessage());
        }
        return n.toString();
    }

    private static boolean isSecret(String key) {
        return SECRET_KEYS.contains(key.toLowerCase(Locale.ROOT));
    }

    private static void put(ObjectNode n, String key, Object v) {
        if (v == null) {
            n.putNull(key);
        } else if (v instanceof Integer i) {
            n.put(key, i);
        } else if (v instanceof Long l) {
            n.put(key, l);
        } else if (v instanceof Number num) {
            n.put(key, num.doubleValue());
        } else if (v instanceof Boolean b) {
            n.put(key, b);
        } else if (v instanceof Duration d) {
            n.put(key, d.toMillis());
        } else if (v instanceof Collection<?> c) {
            ArrayNode arr = n.putArray(key);
            for (Object o : c) arr.add(String.valueOf(o));
        } else {
            n.put(key, String.valueOf(v));
        }
    }
}
