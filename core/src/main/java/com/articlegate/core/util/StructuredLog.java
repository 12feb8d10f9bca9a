package com.articlegate.core.util;

import java.net.URI;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 수집 경로 이벤트(거부/스킵/실패/리다이렉트)를 JSON 한 줄로 남기는 로거. JUL 위에 얹는다.
 *
 * 고정 필드: ts, lvl, comp, thread, event. 나머지는 호출 측 key/value 쌍.
 * URI 값, 그리고 키가 url/link/feed/from/to 인 값은 UrlLogSanitizer 를 한 번 더 거친다.
 * 문자열 값은 MAX_VALUE_CHARS 에서 자른다.
 */
public final class StructuredLog {

    static final int MAX_VALUE_CHARS = 300;

    private final Logger jul;
    private final String comp;

    private StructuredLog(Class<?> cls) {
        this.jul = Logger.getLogger(cls.getName());
        this.comp = cls.getSimpleName();
    }

    public static StructuredLog get(Class<?> cls) {
        return new StructuredLog(cls);
    }

    public void debug(String event, Object... kvs) { emit(Level.FINE, event, kvs); }
    public void info(String event, Object... kvs)  { emit(Level.INFO, event, kvs); }
    public void warn(String event, Object... kvs)  { emit(Level.WARNING, event, kvs); }

    private void emit(Level lvl, String event, Object... kvs) {
        if (!jul.isLoggable(lvl)) return;
        jul.log(lvl, format(lvl, event, kvs));
    }

    /** 한 줄 JSON. 테스트에서 포맷 확인용으로도 쓴다 */
    public String format(Level lvl, String event, Object... kvs) {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("ts", Instant.now().toString());
        fields.put("lvl", lvl.getName());
        fields.put("comp", comp);
        fields.put("thread", Thread.currentThread().getName());
        fields.put("event", event);

        int n = (kvs == null) ? 0 : kvs.length;
        for (int i = 0; i + 1 < n; i += 2) {
            String key = String.valueOf(kvs[i]);
            fields.put(key, render(key, kvs[i + 1]));
        }
        if (n % 2 == 1) fields.put("dangling_key", String.valueOf(kvs[n - 1]));

        StringBuilder sb = new StringBuilder(160).append('{');
        boolean first = true;
        for (Map.Entry<String, Object> e : fields.entrySet()) {
            if (!first) sb.append(',');
            first = false;
            quote(sb, e.getKey());
            sb.append(':');
            value(sb, e.getValue());
        }
        return sb.append('}').toString();
    }

    static Object render(String key, Object v) {
        if (v == null || v instanceof Number || v instanceof Boolean) return v;
        if (v instanceof URI || isUrlKey(key)) return UrlLogSanitizer.sanitize(v);
        String s = (v instanceof Enum<?> en) ? en.name() : String.valueOf(v);
        return s.length() > MAX_VALUE_CHARS ? s.substring(0, MAX_VALUE_CHARS) + "…" : s;
    }

    private static boolean isUrlKey(String key) {
        switch (key.toLowerCase(Locale.ROOT)) {
            case "url": case "link": case "feed": case "from": case "to": return true;
            default: return false;
        }
    }

    private static void value(StringBuilder sb, Object v) {
        if (v == null) sb.append("null");
        else if (v instanceof Number || v instanceof Boolean) sb.append(v);
        else quote(sb, String.valueOf(v));
    }

    private static void quote(StringBuilder sb, String s) {
        sb.append('"');
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c == '"' || c == '\\') sb.append('\\').append(c);
            else if (c == '\n') sb.append("\\n");
            else if (c == '\r') sb.append("\\r");
            else if (c == '\t') sb.append("\\t");
            else if (c < 0x20) sb.append(String.format(Locale.ROOT, "\\u%04x", (int) c));
            else sb.append(c);
        }
        sb.append('"');
    }
}
