package com.webclipper.core.clip;

import com.webclipper.core.extract.ContentExtractor;
import com.webclipper.core.extract.ExtractionResult;
import com.webclipper.core.extract.PageClipper;
import com.webclipper.core.extract.ReadabilityContentExtractor;
import com.webclipper.core.http.AttemptResult;
import com.webclipper.core.http.FetchStrategy;
import com.webclipper.core.http.HttpPageFetcher;
import com.webclipper.core.model.FetchedPage;
import com.webclipper.core.model.PageRecord;
import com.webclipper.core.util.DefaultSleeper;
import com.webclipper.core.util.Sleeper;
import com.webclipper.core.util.StructuredLog;
import org.jsoup.nodes.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * 단일 페이지 클리퍼: default 전략 1회 페치 → 본문 추출 → markupToText → PageRecord.
 * 폴백 전략은 쓰지 않는다(재귀 크롤러 전용).
 */
public final class WebClipper {
    private static final Logger LOG = LoggerFactory.getLogger(WebClipper.class);
    private static final StructuredLog SLOG = StructuredLog.get(WebClipper.class);

    private final ClipOptions options;
    private final HttpPageFetcher fetcher;
    private final PageClipper clipper;
    private final Sleeper sleeper;

    public WebClipper() {
        this(ClipOptions.defaults());
    }

    public WebClipper(ClipOptions options) {
        this(options,
                new HttpPageFetcher(options.getTimeout(), options.isFollowRedirects()),
                new ReadabilityContentExtractor(),
                new DefaultSleeper());
    }

    /** DI/테스트용 */
    public WebClipper(ClipOptions options, HttpPageFetcher fetcher, ContentExtractor extractor, Sleeper sleeper) {
        this.options = Objects.requireNonNull(options, "options");
        options.validate();
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
        this.clipper = new PageClipper(Objects.requireNonNull(extractor, "extractor"),
                options.isIncludeImages(), options.getMinContentLength());
    }

    public PageRecord clip(String address) throws ClipException, InterruptedException {
        Objects.requireNonNull(address, "address");
        URI uri;
        try {
            uri = new URI(address.trim());
        } catch (URISyntaxException e) {
            throw new ClipException(address, "invalid address: " + e.getMessage(), e);
        }

        AttemptResult<FetchedPage> fetched = fetcher.fetch(uri, FetchStrategy.DEFAULT, options.getHeaders());
        if (!fetched.isOk()) throw new ClipException(address, fetched.getError());

        Document doc;
        try {
            doc = PageClipper.parse(fetched.getValue());
        } catch (IOException e) {
            throw new ClipException(address, "parse error: " + e.getMessage(), e);
        }

        ExtractionResult r = clipper.clip(doc, address);
        if (!r.isOk()) throw new ClipException(address, r.getReason());

        PageRecord rec = r.getRecord();
        LOG.info("Clipped {} -> '{}' ({} words)", address, rec.getTitle(), rec.getWordCount());
        return rec;
    }

    /**
     * 순차 배치. 한 건 실패가 배치를 멈추지 않는다.
     * 인터럽트되면 지금까지의 결과로 끝내고 인터럽트 플래그는 복원한다.
     */
    public ClipBatchResult clipAll(List<String> addresses) {
        List<PageRecord> success = new ArrayList<>();
        List<ClipBatchResult.Failure> failed = new ArrayList<>();
        if (addresses == null) return new ClipBatchResult(success, failed);

        for (int i = 0; i < addresses.size(); i++) {
            String address = addresses.get(i);
            if (address == null || address.isBlank()) {
                failed.add(new ClipBatchResult.Failure(String.valueOf(address), "empty address"));
                continue;
            }
            try {
                success.add(clip(address));
            } catch (ClipException e) {
                LOG.warn("Clip failed: {} - {}", address, e.getMessage());
                SLOG.warn("clip-failed", "url", address, "error", e.getMessage());
                failed.add(new ClipBatchResult.Failure(address, e.getMessage()));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                failed.add(new ClipBatchResult.Failure(address, "interrupted"));
                break;
            }

            if (i < addresses.size() - 1) {
                try {
                    sleeper.sleep(options.getBatchDelay());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    break;
                }
            }
        }
        SLOG.info("clip-batch-done", "success", success.size(), "failed", failed.size());
        return new ClipBatchResult(success, failed);
    }
}
