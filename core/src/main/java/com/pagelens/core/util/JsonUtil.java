package com.pagelens.core.util;

import java.util.Collection;

/** 로그 한 줄용 최소 JSON 인코딩 */
final class JsonUtil {
    private JsonUtil() {}

    static String quote(String s) {
        if (s == null) return "null";
        StringBuilder sb = new StringBuilder(s.length() + 16);
        sb.append('"');
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '"': sb.append("\\\""); break;
                case '\\': sb.append("\\\\"); break;
                case '\n': sb.append("\\n"); break;
                case '\r': sb.append("\\r"); break;
                case '\t': sb.append("\\t"); break;
                default:
                    if (c < 0x20) sb.append(String.format("\\u%04x", (int) c));
                    else sb.append(c);
            }
        }
        sb.append('"');
        return sb.toString();
    }

    /** 숫자/불리언은 그대로, 컬렉션은 배열, 나머지는 문자열 */
    static String value(Object v) {
        if (v == null) return "null";
        if (v instanceof Number || v instanceof Boolean) return String.valueOf(v);
        if (v instanceof Collection<?> c) {
            StringBuilder sb = new StringBuilder("[");
            boolean first = true;
            for (Object o : c) {
                if (!first) sb.append(',');
                sb.append(value(o));
                first = false;
            }
            return sb.append(']').toString();
        }
        return quote(String.valueOf(v));
    }

    static String kv(String k, Object v) {
        return quote(k) + ":" + value(v);
    }
}
