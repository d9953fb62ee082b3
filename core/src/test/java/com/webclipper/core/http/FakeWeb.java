package com.webclipper.core.http;

import javax.net.ssl.SSLSession;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpHeaders;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 테스트용 가짜 웹: 주소 → 응답 맵 기반 HttpSender.
 * 등록 안 된 주소는 404. 모든 요청은 순서대로 기록된다.
 */
public class FakeWeb implements HttpPageFetcher.HttpSender {

    public record Page(int status, String contentType, String body, String finalAddress) {}

    private final Map<String, Page> pages = new LinkedHashMap<>();
    private final Map<String, String> requiredAgent = new LinkedHashMap<>();
    public final List<HttpRequest> requests = new ArrayList<>();

    public FakeWeb page(String address, String html) {
        pages.put(address, new Page(200, "text/html; charset=utf-8", html, null));
        return this;
    }

    public FakeWeb respond(String address, int status, String contentType, String body) {
        pages.put(address, new Page(status, contentType, body, null));
        return this;
    }

    public FakeWeb redirected(String address, String finalAddress, String html) {
        pages.put(address, new Page(200, "text/html", html, finalAddress));
        return this;
    }

    /** User-Agent 에 fragment 가 없으면 403 (봇 차단 흉내) */
    public FakeWeb requireAgent(String address, String fragment) {
        requiredAgent.put(address, fragment);
        return this;
    }

    @Override
    public HttpResponse<byte[]> send(HttpRequest req) {
        requests.add(req);
        String key = req.uri().toString();
        Page p = pages.getOrDefault(key, new Page(404, "text/html", "<p>not found</p>", null));
        String fragment = requiredAgent.get(key);
        if (fragment != null && !req.headers().firstValue("User-Agent").orElse("").contains(fragment)) {
            p = new Page(403, "text/html", "<p>forbidden</p>", null);
        }
        URI finalUri = (p.finalAddress() != null) ? URI.create(p.finalAddress()) : req.uri();
        return new Resp(req, finalUri, p.status(),
                p.contentType() == null ? Map.of() : Map.of("Content-Type", List.of(p.contentType())),
                p.body().getBytes(StandardCharsets.UTF_8));
    }

    public List<String> requestedAddresses() {
        List<String> out = new ArrayList<>();
        for (HttpRequest r : requests) out.add(r.uri().toString());
        return out;
    }

    /** 본문 길이 게이트를 넉넉히 넘는 기사형 페이지 + 링크 목록 */
    public static String article(String title, String... links) {
        StringBuilder sb = new StringBuilder();
        sb.append("<html><head><title>").append(title).append("</title></head><body>")
          .append("<article><h1>").append(title).append("</h1>")
          .append("<p>This is a long paragraph about ").append(title)
          .append(", written with commas, clauses, and enough words to pass the minimum content length gate.</p>")
          .append("<p>A second paragraph keeps the reader busy, adds more words, and makes the article look real.</p>")
          .append("</article><div class=\"links\">");
        for (String l : links) sb.append("<a href=\"").append(l).append("\">").append(l).append("</a> ");
        sb.append("</div></body></html>");
        return sb.toString();
    }

    /** 테스트용 HttpResponse<byte[]> */
    static final class Resp implements HttpResponse<byte[]> {
        private final HttpRequest req;
        private final URI uri;
        private final int code;
        private final Map<String, List<String>> headers;
        private final byte[] body;

        Resp(HttpRequest req, URI uri, int code, Map<String, List<String>> headers, byte[] body) {
            this.req = req; this.uri = uri; this.code = code; this.headers = headers; this.body = body;
        }
        @Override public int statusCode() { return code; }
        @Override public HttpRequest request() { return req; }
        @Override public Optional<HttpResponse<byte[]>> previousResponse() { return Optional.empty(); }
        @Override public HttpHeaders headers() { return HttpHeaders.of(headers, (a, b) -> true); }
        @Override public byte[] body() { return body; }
        @Override public Optional<SSLSession> sslSession() { return Optional.empty(); }
        @Override public URI uri() { return uri; }
        @Override public HttpClient.Version version() { return HttpClient.Version.HTTP_1_1; }
    }
}
