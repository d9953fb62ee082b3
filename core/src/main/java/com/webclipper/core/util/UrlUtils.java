package com.webclipper.core.util;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;

/** 주소 정규화 + 도메인 추출 + 비문서(자산) 판정 유틸 */
public final class UrlUtils {
    private UrlUtils(){}

    /** 문서가 아닌 확장자. 프런티어에서 잘라내지 못해도 치명적이진 않지만 페이지 예산을 낭비한다. */
    private static final List<String> ASSET_EXTENSIONS = List.of(
            ".pdf", ".doc", ".docx", ".xls", ".xlsx", ".ppt", ".pptx",
            ".zip", ".rar", ".tar", ".gz",
            ".jpg", ".jpeg", ".png", ".gif", ".webp", ".svg",
            ".mp3", ".mp4", ".avi", ".mov",
            ".css", ".js", ".json", ".xml"
    );

    /**
     * 정규화 규칙(중복 판정 키):
     * - scheme/host/path 소문자
     * - 기본 포트 제거(http:80, https:443)
     * - 빈 경로는 "/", 중복 슬래시 축소
     * - 끝 슬래시 1개 제거(경로가 "/"면 유지)
     * - fragment, query 제거
     * - 경로의 비ASCII/금지 문자는 퍼센트 인코딩 후 비교("/문서" 와 "/%EB%AC%B8%EC%84%9C" 는 같은 키)
     * 파싱 실패 시 원문 소문자 그대로(멱등성 유지).
     */
    public static String normalize(String address) {
        if (address == null) return "";
        String raw = address.trim();
        URI u;
        try {
            u = new URI(toFetchAddress(raw));
        } catch (Exception e) {
            return raw.toLowerCase(Locale.ROOT);
        }
        if (u.getScheme() == null || u.getHost() == null) {
            return raw.toLowerCase(Locale.ROOT);
        }

        String scheme = u.getScheme().toLowerCase(Locale.ROOT);
        String host = u.getHost().toLowerCase(Locale.ROOT);
        int port = u.getPort();
        if ((scheme.equals("http") && port == 80) || (scheme.equals("https") && port == 443)) {
            port = -1;
        }

        String path = u.getRawPath();
        if (path == null || path.isEmpty()) path = "/";
        path = path.replaceAll("/{2,}", "/");
        if (path.length() > 1 && path.endsWith("/")) {
            path = path.substring(0, path.length() - 1);
        }

        StringBuilder sb = new StringBuilder(scheme.length() + host.length() + path.length() + 8);
        sb.append(scheme).append("://").append(host);
        if (port != -1) sb.append(':').append(port);
        sb.append(path);
        return sb.toString().toLowerCase(Locale.ROOT);
    }

    /** 소문자 호스트. 파싱 실패나 호스트 없음이면 "" (범위 판정 불가로 취급). */
    public static String domainOf(String address) {
        if (address == null || address.isBlank()) return "";
        try {
            String host = new URI(address.trim()).getHost();
            return host == null ? "" : host.toLowerCase(Locale.ROOT);
        } catch (Exception e) {
            return "";
        }
    }

    /** host 완전 일치(소문자). 한쪽이라도 비어 있으면 false. 서브도메인은 접지 않는다. */
    public static boolean sameDomain(String a, String b) {
        String ha = domainOf(a);
        String hb = domainOf(b);
        return !ha.isEmpty() && ha.equals(hb);
    }

    /** 경로가 문서가 아닌 확장자로 끝나면 true */
    public static boolean isAssetAddress(String address) {
        if (address == null) return false;
        String path;
        try {
            path = new URI(address.trim()).getRawPath();
        } catch (Exception e) {
            path = stripFragmentAndQuery(address);
        }
        if (path == null || path.isEmpty()) return false;
        String lower = path.toLowerCase(Locale.ROOT);
        for (String ext : ASSET_EXTENSIONS) {
            if (lower.endsWith(ext)) return true;
        }
        return false;
    }

    /**
     * 실제 요청에 쓸 주소: fragment/query 제거 후 경로를 ASCII 로 만든다(대소문자 유지).
     * 공백, 비ASCII, URI 에 못 쓰는 문자는 UTF-8 퍼센트 인코딩. 이미 있는 %XX 는 그대로.
     * scheme://authority 는 건드리지 않는다. 멱등.
     */
    public static String toFetchAddress(String address) {
        if (address == null) return null;
        String s = stripFragmentAndQuery(address.trim());
        int schemeEnd = s.indexOf("://");
        int pathStart = (schemeEnd < 0) ? 0 : s.indexOf('/', schemeEnd + 3);
        if (pathStart < 0) return s;

        byte[] path = s.substring(pathStart).getBytes(StandardCharsets.UTF_8);
        StringBuilder sb = new StringBuilder(s.length() + 16).append(s, 0, pathStart);
        for (int i = 0; i < path.length; i++) {
            int b = path[i] & 0xff;
            if (b == '%' && i + 2 < path.length && isHex(path[i + 1]) && isHex(path[i + 2])) {
                sb.append('%');
            } else if (b < 0x80 && isPathChar((char) b)) {
                sb.append((char) b);
            } else {
                sb.append('%').append(HEX[b >> 4]).append(HEX[b & 0x0f]);
            }
        }
        return sb.toString();
    }

    private static final char[] HEX = "0123456789ABCDEF".toCharArray();

    private static boolean isHex(byte b) {
        return (b >= '0' && b <= '9') || (b >= 'a' && b <= 'f') || (b >= 'A' && b <= 'F');
    }

    /** RFC 3986 pchar + "/" (퍼센트 제외) */
    private static boolean isPathChar(char c) {
        if ((c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9')) return true;
        return "-._~!$&'()*+,;=:@/".indexOf(c) >= 0;
    }

    /** "#..." 와 "?..." 를 잘라낸 원문(대소문자 유지) */
    public static String stripFragmentAndQuery(String address) {
        if (address == null) return null;
        String s = address;
        int hash = s.indexOf('#');
        if (hash >= 0) s = s.substring(0, hash);
        int q = s.indexOf('?');
        if (q >= 0) s = s.substring(0, q);
        return s;
    }

    /** http/https 만 허용 */
    public static boolean isHttpLike(String address) {
        if (address == null) return false;
        String u = address.trim().toLowerCase(Locale.ROOT);
        return u.startsWith("http://") || u.startsWith("https://");
    }
}
