package com.pagelens.core.util;

import java.net.URI;
import java.util.List;
import java.util.Locale;

/** URL 정규화 + same-domain 판정 유틸 */
public final class UrlUtils {
    private UrlUtils() {}

    /**
     * 정규화 규칙:
     * - fragment 제거
     * - scheme/host 소문자
     * - 기본 포트 제거(http:80, https:443)
     * - 빈 경로를 "/"로, 중복 슬래시 축소
     * - path/query의 퍼센트 인코딩은 그대로 둔다
     */
    public static URI normalize(URI u) {
        if (u == null) return null;

        String scheme = (u.getScheme() == null ? "http" : u.getScheme()).toLowerCase(Locale.ROOT);
        String host = u.getHost() != null ? u.getHost() : u.getAuthority();
        if (host == null) host = "";
        host = host.toLowerCase(Locale.ROOT);

        int port = u.getPort();
        if ((scheme.equals("http") && port == 80) || (scheme.equals("https") && port == 443)) {
            port = -1;
        }

        // raw 값으로 조립해 퍼센트 인코딩 유지
        String rawPath = u.getRawPath();
        String path = (rawPath == null || rawPath.isEmpty()) ? "/" : rawPath.replaceAll("/{2,}", "/");

        StringBuilder sb = new StringBuilder(scheme).append("://").append(host);
        if (port != -1) sb.append(':').append(port);
        sb.append(path);
        if (u.getRawQuery() != null) sb.append('?').append(u.getRawQuery());

        try {
            return URI.create(sb.toString());
        } catch (IllegalArgumentException e) {
            return u; // 파싱 실패 시 원본 유지
        }
    }

    /** 문자열 → 정규화 URI. http(s)가 아니거나 깨진 값이면 null. */
    public static URI parseHttp(String raw) {
        if (raw == null || raw.isBlank()) return null;
        try {
            URI u = URI.create(raw.trim());
            String s = u.getScheme();
            if (s == null || !(s.equalsIgnoreCase("http") || s.equalsIgnoreCase("https"))) return null;
            if (u.getHost() == null) return null;
            return normalize(u);
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    /** host 기준 동일 도메인 판정(소문자 비교, www. 무시) */
    public static boolean sameDomain(URI a, URI b) {
        if (a == null || b == null) return false;
        return stripWww(a.getHost()).equals(stripWww(b.getHost()));
    }

    /** 경로 접두 목록 중 하나라도 걸리면 제외 */
    public static boolean isExcluded(URI u, List<String> pathPrefixes) {
        if (u == null || pathPrefixes == null || pathPrefixes.isEmpty()) return false;
        String path = (u.getPath() == null || u.getPath().isEmpty()) ? "/" : u.getPath();
        for (String p : pathPrefixes) {
            if (p != null && !p.isBlank() && path.startsWith(p.trim())) return true;
        }
        return false;
    }

    private static String stripWww(String host) {
        String h = (host == null) ? "" : host.toLowerCase(Locale.ROOT);
        return h.startsWith("www.") ? h.substring(4) : h;
    }
}
