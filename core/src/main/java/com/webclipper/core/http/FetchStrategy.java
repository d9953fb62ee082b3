package com.webclipper.core.http;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** 순서대로 시도하는 요청 프로필(고정 5종). 이름은 실패 기록에 그대로 남는다. */
public enum FetchStrategy {
    DEFAULT("default",
            "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/120.0.0.0 Safari/537.36"),
    CHROME_MAC("chrome-mac",
            "Mozilla/5.0 (Macintosh; Intel Mac OS X 10_15_7) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/120.0.0.0 Safari/537.36"),
    FIREFOX("firefox",
            "Mozilla/5.0 (Windows NT 10.0; Win64; x64; rv:121.0) Gecko/20100101 Firefox/121.0"),
    MOBILE("mobile",
            "Mozilla/5.0 (Linux; Android 10; SM-G981B) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/120.0.0.0 Mobile Safari/537.36"),
    GOOGLEBOT("googlebot",
            "Mozilla/5.0 (compatible; Googlebot/2.1; +http://www.google.com/bot.html)");

    static final String ACCEPT = "text/html,application/xhtml+xml,application/xml;q=0.9,*/*;q=0.8";
    static final String ACCEPT_LANGUAGE = "ko-KR,ko;q=0.9,en-US;q=0.8,en;q=0.7";

    private final String strategyName;
    private final String userAgent;

    FetchStrategy(String strategyName, String userAgent) {
        this.strategyName = strategyName;
        this.userAgent = userAgent;
    }

    public String strategyName() { return strategyName; }
    public String userAgent() { return userAgent; }

    /** 전략 고유 헤더. Accept-Encoding/Connection 은 HttpClient가 관리하므로 넣지 않는다. */
    public Map<String, String> headers() {
        Map<String, String> h = new LinkedHashMap<>();
        h.put("User-Agent", userAgent);
        h.put("Accept", ACCEPT);
        h.put("Accept-Language", ACCEPT_LANGUAGE);
        h.put("Upgrade-Insecure-Requests", "1");
        return h;
    }

    /** 폴백 비활성화 시 DEFAULT 하나만 */
    public static List<FetchStrategy> ordered(boolean useFallback) {
        return useFallback ? List.of(values()) : List.of(DEFAULT);
    }
}
