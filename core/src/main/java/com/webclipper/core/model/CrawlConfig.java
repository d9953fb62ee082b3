package com.webclipper.core.model;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 크롤 설정 (crawl.yml 매핑 대상). 순수 설정 보관용.
 * 실행 상태는 여기 두지 않는다. 실행마다 RecursiveCrawler가 자체 상태를 만든다.
 */
public final class CrawlConfig {

    /** 기본 최소 본문 길이(문자) */
    public static final int DEFAULT_MIN_CONTENT_LENGTH = 100;

    /** 본문 추출 관련 하위 설정: YAML의 `content:` 섹션과 매핑 */
    public static final class ContentCfg {
        private int minContentLength = DEFAULT_MIN_CONTENT_LENGTH;
        private boolean includeImages = false;

        public int getMinContentLength() { return minContentLength; }
        public ContentCfg setMinContentLength(int v) { this.minContentLength = v; return this; }

        public boolean isIncludeImages() { return includeImages; }
        public ContentCfg setIncludeImages(boolean v) { this.includeImages = v; return this; }
    }

    // ---------- 기본 필드 ----------
    private String target;                   // 시작 주소 (필수)
    private int maxDepth = 2;
    private int maxPages = 50;
    private boolean sameDomainOnly = true;
    private List<String> excludePatterns = List.of();
    private List<String> includePatterns = List.of();

    private Duration delayBetweenRequests = Duration.ofMillis(1000);
    private Duration requestTimeout = Duration.ofMillis(15_000);
    private boolean useFallbackStrategies = true;
    private boolean followRedirects = true;
    private Map<String, String> headers = Map.of(); // 전략 헤더 위에 덮어쓴다
    private Path outputDir = Path.of("out");

    private ContentCfg content = new ContentCfg();

    // ---------- getters ----------
    public String getTarget() { return target; }
    public int getMaxDepth() { return maxDepth; }
    public int getMaxPages() { return maxPages; }
    public boolean isSameDomainOnly() { return sameDomainOnly; }
    public List<String> getExcludePatterns() { return excludePatterns; }
    public List<String> getIncludePatterns() { return includePatterns; }
    public Duration getDelayBetweenRequests() { return delayBetweenRequests; }
    public Duration getRequestTimeout() { return requestTimeout; }
    public boolean isUseFallbackStrategies() { return useFallbackStrategies; }
    public boolean isFollowRedirects() { return followRedirects; }
    public Map<String, String> getHeaders() { return headers; }
    public Path getOutputDir() { return outputDir; }
    public ContentCfg getContent() { return content; }

    /** content.includeImages 단축 접근 */
    public boolean isIncludeImages() { return content.isIncludeImages(); }
    public int getMinContentLength() { return content.getMinContentLength(); }

    // ---------- fluent setters ----------
    public CrawlConfig setTarget(String target) { this.target = target; return this; }
    public CrawlConfig setMaxDepth(int maxDepth) { this.maxDepth = maxDepth; return this; }
    public CrawlConfig setMaxPages(int maxPages) { this.maxPages = maxPages; return this; }
    public CrawlConfig setSameDomainOnly(boolean v) { this.sameDomainOnly = v; return this; }

    public CrawlConfig setExcludePatterns(List<String> patterns) {
        this.excludePatterns = (patterns == null) ? List.of() : List.copyOf(patterns);
        return this;
    }
    public CrawlConfig setIncludePatterns(List<String> patterns) {
        this.includePatterns = (patterns == null) ? List.of() : List.copyOf(patterns);
        return this;
    }

    public CrawlConfig setDelayBetweenRequests(Duration d) { this.delayBetweenRequests = d; return this; }
    public CrawlConfig setDelayBetweenRequestsMs(long ms) {
        this.delayBetweenRequests = Duration.ofMillis(Math.max(0, ms));
        return this;
    }
    public CrawlConfig setRequestTimeout(Duration d) { this.requestTimeout = d; return this; }
    public CrawlConfig setRequestTimeoutMs(long ms) {
        this.requestTimeout = Duration.ofMillis(Math.max(1, ms));
        return this;
    }
    public CrawlConfig setUseFallbackStrategies(boolean v) { this.useFallbackStrategies = v; return this; }
    public CrawlConfig setFollowRedirects(boolean v) { this.followRedirects = v; return this; }

    public CrawlConfig setHeaders(Map<String, String> headers) {
        Map<String, String> copy = new LinkedHashMap<>();
        if (headers != null) {
            // null 이름/값은 보낼 수 없으니 버린다. 순서는 유지
            headers.forEach((k, v) -> {
                if (k != null && v != null) copy.put(k, v);
            });
        }
        this.headers = Collections.unmodifiableMap(copy);
        return this;
    }
    public CrawlConfig setOutputDir(Path outputDir) { this.outputDir = outputDir; return this; }
    public CrawlConfig setContent(ContentCfg content) {
        this.content = (content != null ? content : new ContentCfg());
        return this;
    }
    public CrawlConfig setIncludeImages(boolean v) { this.content.setIncludeImages(v); return this; }
    public CrawlConfig setMinContentLength(int v) { this.content.setMinContentLength(v); return this; }

    // ---------- validate ----------
    public void validate() {
        Objects.requireNonNull(target, "target");
        if (target.isBlank()) throw new IllegalArgumentException("target must not be blank");
        validateOptions();
    }

    /** target 을 제외한 옵션 검사 (시작 주소를 crawl 호출 시 넘기는 경우) */
    public void validateOptions() {
        if (maxDepth < 0) throw new IllegalArgumentException("maxDepth must be >= 0");
        if (maxPages < 1) throw new IllegalArgumentException("maxPages must be >= 1");
        if (requestTimeout == null || requestTimeout.isNegative() || requestTimeout.isZero())
            throw new IllegalArgumentException("requestTimeout must be > 0");
        if (delayBetweenRequests == null || delayBetweenRequests.isNegative())
            throw new IllegalArgumentException("delayBetweenRequests must be >= 0");
        Objects.requireNonNull(content, "content");
        if (content.getMinContentLength() < 0)
            throw new IllegalArgumentException("content.minContentLength must be >= 0");
        Objects.requireNonNull(outputDir, "outputDir");
    }

    // ---------- helpers ----------
    public static CrawlConfig defaults() { return new CrawlConfig(); }

    public long getRequestTimeoutMs() { return requestTimeout.toMillis(); }
    public long getDelayBetweenRequestsMs() { return delayBetweenRequests.toMillis(); }
}
