package com.webclipper.core.extract;

import com.webclipper.core.model.FetchedPage;
import com.webclipper.core.model.PageRecord;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.Objects;
import java.util.Optional;

/**
 * 파싱된 페이지 → PageRecord.
 * 본문 추출 → markupToText → 최소 길이 검사 → 단어 수. 실패는 ExtractionResult 값으로 돌려준다.
 */
public final class PageClipper {

    private final ContentExtractor extractor;
    private final MarkupToText.Options textOptions;
    private final int minContentLength;

    public PageClipper(ContentExtractor extractor, boolean includeImages, int minContentLength) {
        this.extractor = Objects.requireNonNull(extractor, "extractor");
        this.textOptions = new MarkupToText.Options(includeImages);
        if (minContentLength < 0) throw new IllegalArgumentException("minContentLength must be >= 0");
        this.minContentLength = minContentLength;
    }

    /** 응답 바이트를 Document로. charset 헤더가 없으면 jsoup이 meta/BOM 으로 판단(기본 UTF-8). */
    public static Document parse(FetchedPage page) throws IOException {
        Objects.requireNonNull(page, "page");
        return Jsoup.parse(new ByteArrayInputStream(page.getBody()), page.charsetName(), page.getFinalUri().toString());
    }

    /** @param address PageRecord 에 기록될 방문 주소 */
    public ExtractionResult clip(Document doc, String address) {
        Objects.requireNonNull(address, "address");
        if (doc == null) return ExtractionResult.failed("empty document");

        Optional<ExtractedArticle> article = extractor.extract(doc, doc.location());
        if (article.isEmpty()) return ExtractionResult.failed("no readable content");

        String content = MarkupToText.markupToText(article.get().contentHtml(), textOptions);
        if (content.length() < minContentLength) {
            return ExtractionResult.failed("content too short: " + content.length() + " chars");
        }

        PageMetadata meta = article.get().metadata();
        return ExtractionResult.ok(PageRecord.builder()
                .title(meta.title())
                .content(content)
                .address(address)
                .wordCount(WordCounter.count(content))
                .author(meta.author())
                .publishedTime(meta.publishedTime())
                .siteName(meta.siteName())
                .build());
    }
}
