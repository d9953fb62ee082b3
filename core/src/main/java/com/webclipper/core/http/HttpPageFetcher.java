package com.webclipper.core.http;

import com.webclipper.core.model.FetchedPage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * 단일 GET 시도. 전송 오류는 예외로 던지지 않고 실패 값으로 매핑한다.
 * InterruptedException 만 그대로 올린다(실행 중단 신호).
 */
public class HttpPageFetcher {
    private static final Logger LOG = LoggerFactory.getLogger(HttpPageFetcher.class);

    /** JDK HttpClient가 직접 관리해서 설정하면 IllegalArgumentException 나는 헤더 */
    static final Set<String> RESTRICTED_HEADERS = Set.of("connection", "host", "content-length", "expect", "upgrade");

    /** 테스트/모킹용 송신 훅 */
    @FunctionalInterface
    public interface HttpSender {
        HttpResponse<byte[]> send(HttpRequest req) throws IOException, InterruptedException;
    }

    private final Duration timeout;
    private final HttpSender sender;

    public HttpPageFetcher(Duration timeout, boolean followRedirects) {
        this(timeout, clientSender(timeout, followRedirects));
    }

    /** 테스트용 생성자(송신 훅 주입) */
    public HttpPageFetcher(Duration timeout, HttpSender sender) {
        this.timeout = Objects.requireNonNull(timeout, "timeout");
        this.sender = Objects.requireNonNull(sender, "sender");
    }

    private static HttpSender clientSender(Duration timeout, boolean followRedirects) {
        HttpClient client = HttpClient.newBuilder()
                .followRedirects(followRedirects ? HttpClient.Redirect.NORMAL : HttpClient.Redirect.NEVER)
                .connectTimeout(timeout)
                .build();
        return req -> client.send(req, HttpResponse.BodyHandlers.ofByteArray());
    }

    public Duration getTimeout() { return timeout; }

    /**
     * strategy 헤더 위에 extraHeaders를 덮어써서 GET.
     * 2xx + HTML 계열 Content-Type 이어야 성공.
     */
    public AttemptResult<FetchedPage> fetch(URI uri, FetchStrategy strategy, Map<String, String> extraHeaders)
            throws InterruptedException {
        Objects.requireNonNull(uri, "uri");
        Objects.requireNonNull(strategy, "strategy");

        HttpRequest req;
        try {
            HttpRequest.Builder b = HttpRequest.newBuilder(uri).timeout(timeout).GET();
            mergeHeaders(strategy, extraHeaders).forEach(b::header);
            req = b.build();
        } catch (IllegalArgumentException e) {
            return AttemptResult.failed("invalid request: " + e.getMessage());
        }

        long start = System.nanoTime();
        HttpResponse<byte[]> resp;
        try {
            resp = sender.send(req);
        } catch (HttpTimeoutException e) {
            return AttemptResult.failed("timeout after " + timeout.toMillis() + " ms");
        } catch (IOException e) {
            return AttemptResult.failed(describe(e));
        } catch (IllegalArgumentException | SecurityException e) {
            return AttemptResult.failed(describe(e));
        }
        long elapsedMs = (System.nanoTime() - start) / 1_000_000;

        int status = resp.statusCode();
        if (status < 200 || status > 299) {
            return AttemptResult.failed("HTTP " + status);
        }
        String contentType = resp.headers().firstValue("Content-Type").orElse("");
        if (!isHtml(contentType)) {
            return AttemptResult.failed("not HTML: " + (contentType.isBlank() ? "(none)" : contentType));
        }

        return AttemptResult.ok(FetchedPage.builder()
                .requestedUri(uri)
                .finalUri(resp.uri() != null ? resp.uri() : uri)
                .statusCode(status)
                .headers(resp.headers().map())
                .body(resp.body())
                .contentType(contentType)
                .responseTimeMs(elapsedMs)
                .build());
    }

    static boolean isHtml(String contentType) {
        if (contentType == null) return false;
        String ct = contentType.toLowerCase(Locale.ROOT);
        return ct.contains("text/html") || ct.contains("application/xhtml");
    }

    /** 호출자 헤더가 이긴다(이름 대소문자 무시). 제한 헤더는 버린다. */
    static Map<String, String> mergeHeaders(FetchStrategy strategy, Map<String, String> extra) {
        Map<String, String> byLower = new LinkedHashMap<>();
        Map<String, String> names = new LinkedHashMap<>();
        strategy.headers().forEach((k, v) -> put(byLower, names, k, v));
        if (extra != null) {
            extra.forEach((k, v) -> {
                if (k == null || k.isBlank() || v == null) return;
                if (RESTRICTED_HEADERS.contains(k.trim().toLowerCase(Locale.ROOT))) {
                    LOG.debug("Ignoring restricted header: {}", k);
                    return;
                }
                put(byLower, names, k.trim(), v);
            });
        }
        Map<String, String> out = new LinkedHashMap<>();
        byLower.forEach((lower, v) -> out.put(names.get(lower), v));
        return out;
    }

    private static void put(Map<String, String> byLower, Map<String, String> names, String k, String v) {
        String lower = k.toLowerCase(Locale.ROOT);
        byLower.put(lower, v);
        names.put(lower, k);
    }

    private static String describe(Exception e) {
        String msg = e.getMessage();
        return e.getClass().getSimpleName() + (msg == null || msg.isBlank() ? "" : ": " + msg);
    }
}
