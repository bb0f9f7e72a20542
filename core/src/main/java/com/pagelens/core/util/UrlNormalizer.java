package com.pagelens.core.util;

import java.net.URI;
import java.net.URISyntaxException;

/**
 * Canonical 자기참조 비교용 URL 축약: scheme/query/fragment 제거, authority + path(끝 슬래시 제거).
 * scheme 없는 문자열은 전체가 path로 취급되므로 결과에 다시 적용해도 같은 값(멱등).
 */
public final class UrlNormalizer {
    private UrlNormalizer() {}

    public static String normalize(String url) {
        if (url == null) return "";
        String s = url.trim();
        String authority;
        String path;
        try {
            URI u = new URI(s);
            if (u.isOpaque()) {
                // "host:port/path" 처럼 scheme으로 오인되는 값은 통째로 path
                authority = null;
                path = cutQueryAndFragment(s);
            } else {
                authority = u.getRawAuthority();
                path = u.getRawPath();
            }
        } catch (URISyntaxException e) {
            // 공백/비ASCII 등으로 URI 파싱 실패 → 느슨한 수동 분해
            String[] parts = splitLenient(s);
            authority = parts[0];
            path = parts[1];
        }
        return nz(authority) + stripTrailingSlashes(nz(path));
    }

    /** 두 URL이 정규화 후 같은지 */
    public static boolean sameResource(String a, String b) {
        return normalize(a).equals(normalize(b));
    }

    static String[] splitLenient(String s) {
        String rest = s;
        int sep = rest.indexOf("://");
        if (sep > 0 && rest.substring(0, sep).matches("[A-Za-z][A-Za-z0-9+.-]*")) {
            rest = rest.substring(sep + 1);
        }
        rest = cutQueryAndFragment(rest);

        if (rest.startsWith("//")) {
            rest = rest.substring(2);
            int slash = rest.indexOf('/');
            if (slash < 0) return new String[]{rest, ""};
            return new String[]{rest.substring(0, slash), rest.substring(slash)};
        }
        return new String[]{"", rest};
    }

    private static String cutQueryAndFragment(String s) {
        int cut = indexOfAny(s, '?', '#');
        return (cut >= 0) ? s.substring(0, cut) : s;
    }

    private static int indexOfAny(String s, char a, char b) {
        int i = s.indexOf(a);
        int j = s.indexOf(b);
        if (i < 0) return j;
        if (j < 0) return i;
        return Math.min(i, j);
    }

    private static String stripTrailingSlashes(String p) {
        int end = p.length();
        while (end > 0 && p.charAt(end - 1) == '/') end--;
        return p.substring(0, end);
    }

    private static String nz(String s) { return (s == null) ? "" : s; }
}
