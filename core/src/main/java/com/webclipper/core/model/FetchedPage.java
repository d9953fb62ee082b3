package com.webclipper.core.model;

import java.net.URI;
import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.UnsupportedCharsetException;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/** 성공한 페치 1건의 캡처(본문은 원본 바이트 그대로). */
public final class FetchedPage {
    private final URI requestedUri;
    private final URI finalUri;          // 리다이렉트 이후
    private final int statusCode;
    private final Map<String, List<String>> headers;
    private final byte[] body;
    private final String contentType;
    private final long responseTimeMs;

    private FetchedPage(Builder b) {
        this.requestedUri = b.requestedUri;
        this.finalUri = (b.finalUri == null) ? b.requestedUri : b.finalUri;
        this.statusCode = b.statusCode;
        this.headers = (b.headers == null) ? Map.of() : Collections.unmodifiableMap(b.headers);
        this.body = (b.body == null) ? new byte[0] : b.body;
        this.contentType = b.contentType;
        this.responseTimeMs = b.responseTimeMs;
    }

    public URI getRequestedUri() { return requestedUri; }
    public URI getFinalUri() { return finalUri; }
    public int getStatusCode() { return statusCode; }
    public Map<String, List<String>> getHeaders() { return headers; }
    public byte[] getBody() { return body; }
    public String getContentType() { return contentType; }
    public long getResponseTimeMs() { return responseTimeMs; }

    /** Content-Type의 charset 파라미터. 없거나 모르는 이름이면 null (파서가 meta로 판단). */
    public String charsetName() {
        if (contentType == null) return null;
        for (String part : contentType.split(";")) {
            String p = part.trim();
            if (p.toLowerCase(Locale.ROOT).startsWith("charset=")) {
                String name = p.substring(8).trim().replace("\"", "").replace("'", "");
                try {
                    return Charset.forName(name).name();
                } catch (IllegalCharsetNameException | UnsupportedCharsetException e) {
                    return null;
                }
            }
        }
        return null;
    }

    public static Builder builder() { return new Builder(); }

    public static final class Builder {
        private URI requestedUri;
        private URI finalUri;
        private int statusCode;
        private Map<String, List<String>> headers;
        private byte[] body;
        private String contentType;
        private long responseTimeMs;

        public Builder requestedUri(URI uri) { this.requestedUri = uri; return this; }
        public Builder finalUri(URI uri) { this.finalUri = uri; return this; }
        public Builder statusCode(int statusCode) { this.statusCode = statusCode; return this; }
        public Builder headers(Map<String, List<String>> headers) { this.headers = headers; return this; }
        public Builder body(byte[] body) { this.body = body; return this; }
        public Builder contentType(String contentType) { this.contentType = contentType; return this; }
        public Builder responseTimeMs(long responseTimeMs) { this.responseTimeMs = responseTimeMs; return this; }

        public FetchedPage build() {
            Objects.requireNonNull(requestedUri, "requestedUri");
            return new FetchedPage(this);
        }
    }
}
