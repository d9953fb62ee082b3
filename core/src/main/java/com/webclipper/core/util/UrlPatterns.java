package com.webclipper.core.util;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * 포함/제외 주소 패턴 매칭.
 * <ul>
 *   <li>접두(prefix): {@code "/login"} 또는 {@code "https://host/path"}</li>
 *   <li>glob: {@code '*'}, {@code '?'} 포함 (예: {@code "/docs/*"})</li>
 *   <li>정규식: {@code "re:"} 접두 (예: {@code re:\?print=1})</li>
 * </ul>
 * 대소문자 무시, 전체 주소에 대해 find 의미론.
 */
public final class UrlPatterns {
    private UrlPatterns(){}

    public static boolean matchesAny(String address, List<String> patterns) {
        if (address == null || patterns == null || patterns.isEmpty()) return false;
        for (String p : patterns) {
            if (matches(address, p)) return true;
        }
        return false;
    }

    public static boolean matches(String address, String p) {
        if (address == null || p == null || p.isBlank()) return false;

        if (p.startsWith("re:")) {
            return Pattern.compile(p.substring(3), Pattern.CASE_INSENSITIVE).matcher(address).find();
        }
        if (p.indexOf('*') >= 0 || p.indexOf('?') >= 0) {
            return Pattern.compile(globToRegex(p), Pattern.CASE_INSENSITIVE).matcher(address).find();
        }

        String s = address.toLowerCase(Locale.ROOT);
        String prefix = p.toLowerCase(Locale.ROOT);
        if (s.startsWith(prefix)) return true;

        // 호스트 상대 prefix: "/login" 같은 경우
        if (prefix.startsWith("/") && s.contains("://")) {
            int i = s.indexOf('/', s.indexOf("://") + 3);
            String pathAndMore = (i > 0) ? s.substring(i) : "/";
            return pathAndMore.startsWith(prefix);
        }
        return false;
    }

    /** 설정 로드 시점에 잘못된 정규식을 미리 걸러낸다. */
    public static void validate(List<String> patterns) {
        if (patterns == null) return;
        for (String p : patterns) {
            if (p == null || !p.startsWith("re:")) continue;
            try {
                Pattern.compile(p.substring(3), Pattern.CASE_INSENSITIVE);
            } catch (PatternSyntaxException e) {
                throw new IllegalArgumentException("invalid pattern: " + p + " (" + e.getDescription() + ")", e);
            }
        }
    }

    private static String globToRegex(String glob){
        StringBuilder r = new StringBuilder();
        for (int i = 0; i < glob.length(); i++){
            char c = glob.charAt(i);
            switch(c){
                case '*': r.append(".*"); break;
                case '?': r.append('.'); break;
                case '.': case '\\': case '+': case '(': case ')':
                case '^': case '$': case '|': case '{': case '}':
                case '[': case ']': r.append('\\').append(c); break;
                default: r.append(c);
            }
        }
        return r.toString();
    }
}
