package com.wikicrawler.core.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.time.Instant;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * JSON 라인 기반 구조화 로거.
 * LoggingConfigurator(콘솔/파일 핸들러) 세팅 후 여기서 호출하면 JSON 문자열로 찍힘.
 */
public final class StructuredLogger {
    private static final ObjectMapper OM = new ObjectMapper();

    private final Logger jul;
    private final String comp;

    private StructuredLogger(Class<?> cls) {
        this.jul = Logger.getLogger(cls.getName());
        this.comp = cls.getSimpleName();
    }
    public static StructuredLogger get(Class<?> cls) { return new StructuredLogger(cls); }

    public void debug(String event, Object... kvs) { log(Level.FINE, event, null, kvs); }
    public void info (String event, Object... kvs) { log(Level.INFO, event, null, kvs); }
    public void warn (String event, Object... kvs) { log(Level.WARNING, event, null, kvs); }
    public void error(String event, Throwable t, Object... kvs) { log(Level.SEVERE, event, t, kvs); }

    private void log(Level lvl, String event, Throwable t, Object... kvs) {
        if (!jul.isLoggable(lvl)) return;
        String line = format(lvl, event, t, kvs);
        if (t == null) jul.log(lvl, line); else jul.log(lvl, line, t);
    }

    String format(Level lvl, String event, Throwable t, Object... kvs) {
        ObjectNode node = OM.createObjectNode();
        node.put("ts", Instant.now().toString());
        node.put("lvl", lvl.getName());
        node.put("comp", comp);
        node.put("thread", Thread.currentThread().getName());
        node.put("event", event);

        // kvs: "key", value, ...
        if (kvs != null && kvs.length > 0) {
            for (int i = 0; i < kvs.length - 1; i += 2) {
                String k = String.valueOf(kvs[i]);
                Object v = kvs[i + 1];
                if (v == null) node.putNull(k);
                else if (v instanceof Integer n) node.put(k, n);
                else if (v instanceof Long n) node.put(k, n);
                else if (v instanceof Number n) node.put(k, n.doubleValue());
                else if (v instanceof Boolean b) node.put(k, b);
                else node.put(k, String.valueOf(v));
            }
            if (kvs.length % 2 == 1) { // 홀수 방지용
                node.put("_kv_mismatch", true);
            }
        }
        if (t != null) {
            node.put("error", t.getClass().getSimpleName());
            node.put("message", String.valueOf(t.getMessage()));
        }
        try {
            return OM.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            return "{\"event\":\"" + event + "\",\"_format_error\":true}";
        }
    }
}
