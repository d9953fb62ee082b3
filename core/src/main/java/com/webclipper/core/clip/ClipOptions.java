package com.webclipper.core.clip;

import com.webclipper.core.model.CrawlConfig;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/** 단일/배치 클리핑 옵션. 크롤 설정과 달리 기본 타임아웃이 10초. */
public final class ClipOptions {
    private Duration timeout = Duration.ofMillis(10_000);
    private boolean includeImages = false;
    private int minContentLength = CrawlConfig.DEFAULT_MIN_CONTENT_LENGTH;
    private Duration batchDelay = Duration.ofMillis(1000);
    private boolean followRedirects = true;
    private Map<String, String> headers = Map.of();

    public static ClipOptions defaults() { return new ClipOptions(); }

    public Duration getTimeout() { return timeout; }
    public boolean isIncludeImages() { return includeImages; }
    public int getMinContentLength() { return minContentLength; }
    public Duration getBatchDelay() { return batchDelay; }
    public boolean isFollowRedirects() { return followRedirects; }
    public Map<String, String> getHeaders() { return headers; }

    public ClipOptions setTimeoutMs(long ms) { this.timeout = Duration.ofMillis(Math.max(1, ms)); return this; }
    public ClipOptions setIncludeImages(boolean v) { this.includeImages = v; return this; }
    public ClipOptions setMinContentLength(int v) { this.minContentLength = v; return this; }
    public ClipOptions setBatchDelayMs(long ms) { this.batchDelay = Duration.ofMillis(Math.max(0, ms)); return this; }
    public ClipOptions setFollowRedirects(boolean v) { this.followRedirects = v; return this; }
    public ClipOptions setHeaders(Map<String, String> headers) {
        this.headers = (headers == null) ? Map.of() : Map.copyOf(new LinkedHashMap<>(headers));
        return this;
    }

    public void validate() {
        if (minContentLength < 0) throw new IllegalArgumentException("minContentLength must be >= 0");
    }
}
