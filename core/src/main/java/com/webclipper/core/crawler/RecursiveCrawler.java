package com.webclipper.core.crawler;

import com.webclipper.core.api.ICrawler;
import com.webclipper.core.extract.ContentExtractor;
import com.webclipper.core.extract.ExtractionResult;
import com.webclipper.core.extract.PageClipper;
import com.webclipper.core.extract.ReadabilityContentExtractor;
import com.webclipper.core.http.AttemptResult;
import com.webclipper.core.http.FetchOutcome;
import com.webclipper.core.http.FetchStrategySet;
import com.webclipper.core.http.HttpPageFetcher;
import com.webclipper.core.model.CrawlConfig;
import com.webclipper.core.model.CrawlFailure;
import com.webclipper.core.model.CrawlProgress;
import com.webclipper.core.model.CrawlResult;
import com.webclipper.core.model.ExtractedLink;
import com.webclipper.core.model.FetchedPage;
import com.webclipper.core.model.FrontierEntry;
import com.webclipper.core.model.PageRecord;
import com.webclipper.core.util.CrawlProgressListener;
import com.webclipper.core.util.DefaultSleeper;
import com.webclipper.core.util.Sleeper;
import com.webclipper.core.util.StructuredLog;
import org.jsoup.nodes.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * BFS 기반 재귀 크롤러.
 * - 페이지마다: 정책 필터 → 전략 순서대로 페치+본문 추출 → 링크 추출 → depth+1 로 큐 추가
 * - 한 페이지 실패는 CrawlFailure 로 남기고 계속 진행
 * - 실행 상태(큐/방문/결과)는 crawl 호출마다 새로 만든다. 인스턴스는 여러 번 재사용 가능
 * - 인터럽트/취소 시 지금까지의 부분 결과를 cancelled=true 로 반환
 * - 설정은 생성 시점에 한 번 읽는다. 이후 CrawlConfig 를 바꿔도 이 인스턴스에는 반영되지 않는다
 */
public final class RecursiveCrawler implements ICrawler {

    private static final Logger LOG = LoggerFactory.getLogger(RecursiveCrawler.class);
    private static final StructuredLog SLOG = StructuredLog.get(RecursiveCrawler.class);

    static final String INTERRUPTED = "interrupted";

    private final String target;
    private final int maxDepth;
    private final int maxPages;
    private final boolean sameDomainOnly;
    private final boolean useFallback;
    private final List<String> excludePatterns;
    private final List<String> includePatterns;
    private final Duration delayBetweenRequests;
    private final Map<String, String> headers;

    private final HttpPageFetcher fetcher;
    private final FetchStrategySet strategies;
    private final PageClipper clipper;
    private final LinkExtractor linkExtractor;
    private final Sleeper sleeper;

    /** 기본 구현 */
    public RecursiveCrawler(CrawlConfig config) {
        this(validated(config),
                new HttpPageFetcher(config.getRequestTimeout(), config.isFollowRedirects()),
                new ReadabilityContentExtractor(),
                new JsoupLinkExtractor(),
                new DefaultSleeper());
    }

    /** DI/테스트용 */
    public RecursiveCrawler(CrawlConfig config,
                            HttpPageFetcher fetcher,
                            ContentExtractor contentExtractor,
                            LinkExtractor linkExtractor,
                            Sleeper sleeper) {
        validated(config);
        this.target = config.getTarget();
        this.maxDepth = config.getMaxDepth();
        this.maxPages = config.getMaxPages();
        this.sameDomainOnly = config.isSameDomainOnly();
        this.useFallback = config.isUseFallbackStrategies();
        this.excludePatterns = List.copyOf(config.getExcludePatterns());
        this.includePatterns = List.copyOf(config.getIncludePatterns());
        this.delayBetweenRequests = config.getDelayBetweenRequests();
        this.headers = config.getHeaders();
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
        this.linkExtractor = Objects.requireNonNull(linkExtractor, "linkExtractor");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
        this.strategies = new FetchStrategySet(useFallback, sleeper);
        this.clipper = new PageClipper(Objects.requireNonNull(contentExtractor, "contentExtractor"),
                config.isIncludeImages(), config.getMinContentLength());
    }

    private static CrawlConfig validated(CrawlConfig config) {
        Objects.requireNonNull(config, "config").validateOptions();
        return config;
    }

    /* =========================
       실행 API
       ========================= */

    /** 설정의 target 에서 시작 */
    public CrawlResult crawl() {
        return crawl(Objects.requireNonNull(target, "target"), CrawlProgressListener.NONE, null);
    }

    @Override
    public CrawlResult crawl(String startAddress, CrawlProgressListener listener, AtomicBoolean cancelFlag) {
        Objects.requireNonNull(startAddress, "startAddress");
        if (startAddress.isBlank()) throw new IllegalArgumentException("startAddress must not be blank");
        final CrawlProgressListener pl = (listener != null) ? listener : CrawlProgressListener.NONE;

        final Instant startedAt = Instant.now();
        final long t0 = System.nanoTime();

        CrawlScope scope = new CrawlScope(startAddress, sameDomainOnly, excludePatterns, includePatterns);
        Frontier frontier = new Frontier();
        frontier.seed(startAddress);
        List<PageRecord> success = new ArrayList<>();
        List<CrawlFailure> failed = new ArrayList<>();
        boolean cancelled = false;

        LOG.info("Crawl start: target={}, maxDepth={}, maxPages={}, sameDomainOnly={}",
                startAddress, maxDepth, maxPages, sameDomainOnly);
        SLOG.info("crawl-start",
                "target", startAddress,
                "maxDepth", maxDepth,
                "maxPages", maxPages,
                "sameDomainOnly", sameDomainOnly,
                "fallback", useFallback);

        while (!frontier.isEmpty() && success.size() + failed.size() < maxPages) {
            if (isCancelled(cancelFlag)) {
                cancelled = true;
                break;
            }

            FrontierEntry cur = frontier.next();
            // 예산을 쓰지 않는 건너뛰기
            if (frontier.isVisited(cur.address()) || cur.depth() > maxDepth) continue;
            CrawlScope.Decision decision = scope.evaluate(cur.address());
            if (decision != CrawlScope.Decision.ALLOW) {
                LOG.debug("Skip {} ({})", cur.address(), decision);
                continue;
            }
            frontier.markVisited(cur.address());

            notifyProgress(pl, new CrawlProgress(cur.fetchAddress(),
                    success.size() + failed.size(), frontier.queueLength(),
                    success.size(), failed.size(), cur.depth()));

            List<String> tried = new ArrayList<>();
            PageOutcome outcome;
            try {
                outcome = process(cur, tried);
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                failed.add(new CrawlFailure(cur.fetchAddress(), INTERRUPTED, tried, cur.depth()));
                SLOG.warn("page-failed", "url", cur.fetchAddress(), "depth", cur.depth(), "error", INTERRUPTED);
                cancelled = true;
                break;
            } catch (RuntimeException e) {
                // 버그성 예외도 페이지 실패로만 취급
                LOG.error("Unexpected error while crawling {}", cur.fetchAddress(), e);
                SLOG.error("page-error", e, "url", cur.fetchAddress(), "depth", cur.depth());
                outcome = PageOutcome.failure("unexpected error: " + e, tried);
            }

            if (outcome.isSuccess()) {
                PageRecord rec = outcome.record();
                success.add(rec);
                int enqueued = 0;
                if (cur.depth() < maxDepth) {
                    for (ExtractedLink link : outcome.links()) {
                        // 링크의 depth 필드(항상 0)는 쓰지 않는다
                        if (frontier.discover(link.address(), cur.depth() + 1)) enqueued++;
                    }
                }
                LOG.info("Crawled {} (depth {}) -> '{}', words={}, links={}",
                        cur.fetchAddress(), cur.depth(), rec.getTitle(), rec.getWordCount(), enqueued);
                SLOG.info("page-ok",
                        "url", cur.fetchAddress(),
                        "depth", cur.depth(),
                        "words", rec.getWordCount(),
                        "enqueued", enqueued,
                        "strategy", lastOf(outcome.attemptedStrategyNames()));
            } else {
                failed.add(new CrawlFailure(cur.fetchAddress(), outcome.error(),
                        outcome.attemptedStrategyNames(), cur.depth()));
                LOG.warn("Failed {} (depth {}): {} {}", cur.fetchAddress(), cur.depth(),
                        outcome.error(), outcome.attemptedStrategyNames());
                SLOG.warn("page-failed",
                        "url", cur.fetchAddress(),
                        "depth", cur.depth(),
                        "error", outcome.error(),
                        "strategies", String.join(",", outcome.attemptedStrategyNames()));
            }

            // 요청 간 대기(남은 큐가 있고 예산이 남았을 때만)
            if (!frontier.isEmpty() && success.size() + failed.size() < maxPages) {
                try {
                    sleeper.sleep(delayBetweenRequests);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    cancelled = true;
                    break;
                }
            }
        }

        long totalMs = (System.nanoTime() - t0) / 1_000_000;
        CrawlResult result = new CrawlResult(startAddress, startedAt, success, failed, totalMs,
                frontier.visitedAddresses(), cancelled);

        LOG.info("Crawl done. success={}, failed={}, visited={}, timeMs={}, cancelled={}",
                success.size(), failed.size(), result.getVisitedAddresses().size(), totalMs, cancelled);
        SLOG.info("crawl-done",
                "success", success.size(),
                "failed", failed.size(),
                "visited", result.getVisitedAddresses().size(),
                "totalWords", result.getTotalWords(),
                "timeMs", totalMs,
                "cancelled", cancelled);
        return result;
    }

    /* =========================
       페이지 1건
       ========================= */

    /** 페치 + 본문 추출까지를 한 시도로 보고 전략을 순서대로 돈다. tried 에 시도한 전략이 쌓인다. */
    private PageOutcome process(FrontierEntry entry, List<String> tried) throws InterruptedException {
        final String address = entry.fetchAddress();
        final URI uri;
        try {
            uri = new URI(address);
        } catch (URISyntaxException e) {
            return PageOutcome.failure("invalid address: " + e.getMessage(), tried);
        }

        FetchOutcome<Clipped> out = strategies.run(address, strategy -> {
            tried.add(strategy.strategyName());
            AttemptResult<FetchedPage> fetched = fetcher.fetch(uri, strategy, headers);
            if (!fetched.isOk()) return AttemptResult.failed(fetched.getError());

            FetchedPage page = fetched.getValue();
            Document doc;
            try {
                doc = PageClipper.parse(page);
            } catch (IOException e) {
                return AttemptResult.failed("parse error: " + e.getMessage());
            }
            ExtractionResult extracted = clipper.clip(doc, address);
            if (!extracted.isOk()) return AttemptResult.failed(extracted.getReason());

            List<ExtractedLink> links = linkExtractor.extract(doc, page.getFinalUri().toString());
            return AttemptResult.ok(new Clipped(extracted.getRecord(), links));
        });

        return out.isOk()
                ? PageOutcome.success(out.getValue().record(), out.getValue().links(), out.getAttemptedStrategyNames())
                : PageOutcome.failure(out.getError(), out.getAttemptedStrategyNames());
    }

    private record Clipped(PageRecord record, List<ExtractedLink> links) {}

    /* =========================
       공용 유틸
       ========================= */

    private static boolean isCancelled(AtomicBoolean flag) {
        return Thread.currentThread().isInterrupted() || (flag != null && flag.get());
    }

    private static void notifyProgress(CrawlProgressListener pl, CrawlProgress p) {
        try {
            pl.onProgress(p);
        } catch (RuntimeException e) {
            LOG.warn("Progress listener failed: {}", e.toString());
        }
    }

    private static String lastOf(List<String> names) {
        return names.isEmpty() ? null : names.get(names.size() - 1);
    }

    public int getMaxDepth() { return maxDepth; }
    public int getMaxPages() { return maxPages; }
}
