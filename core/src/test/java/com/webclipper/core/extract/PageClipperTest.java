package com.webclipper.core.extract;

import com.webclipper.core.model.FetchedPage;
import com.webclipper.core.model.PageRecord;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.nio.charset.Charset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PageClipperTest {

    private static final String ARTICLE = "<html><head><title>T</title>"
            + "<meta name=\"author\" content=\"Choi\">"
            + "<meta property=\"og:site_name\" content=\"Site\">"
            + "<meta property=\"article:published_time\" content=\"2024-01-01\">"
            + "</head><body><article>"
            + "<p>First paragraph of the article, long enough, with commas, to be scored as content.</p>"
            + "<p>Second paragraph follows, adding words, commas, and more readable text for the clipper.</p>"
            + "</article></body></html>";

    @Test
    void builds_record_with_metadata_and_word_count() {
        PageClipper clipper = new PageClipper(new ReadabilityContentExtractor(), false, 100);

        ExtractionResult r = clipper.clip(Jsoup.parse(ARTICLE, "https://a.test/p"), "https://a.test/p");

        assertThat(r.isOk()).isTrue();
        PageRecord rec = r.getRecord();
        assertThat(rec.getTitle()).isEqualTo("T");
        assertThat(rec.getAddress()).isEqualTo("https://a.test/p");
        assertThat(rec.getAuthor()).isEqualTo("Choi");
        assertThat(rec.getSiteName()).isEqualTo("Site");
        assertThat(rec.getPublishedTime()).isEqualTo("2024-01-01");
        assertThat(rec.getContent()).startsWith("First paragraph").contains("\n\nSecond paragraph");
        assertThat(rec.getWordCount()).isEqualTo(WordCounter.count(rec.getContent())).isGreaterThan(20);
    }

    @Test
    void short_content_is_rejected_with_length() {
        PageClipper clipper = new PageClipper(new ReadabilityContentExtractor(), false, 100);

        ExtractionResult r = clipper.clip(Jsoup.parse("<body><p>Too short.</p></body>"), "https://a.test/s");

        assertThat(r.isOk()).isFalse();
        assertThat(r.getReason()).isEqualTo("content too short: 10 chars");
    }

    @Test
    void zero_minimum_accepts_any_non_empty_content() {
        PageClipper clipper = new PageClipper(new ReadabilityContentExtractor(), false, 0);

        ExtractionResult r = clipper.clip(Jsoup.parse("<body><p>Hi</p></body>"), "https://a.test/s");

        assertThat(r.isOk()).isTrue();
        assertThat(r.getRecord().getContent()).isEqualTo("Hi");
        assertThat(r.getRecord().getTitle()).isEqualTo("Untitled");
    }

    @Test
    void no_readable_content_and_null_document() {
        PageClipper clipper = new PageClipper(new ReadabilityContentExtractor(), false, 0);

        assertThat(clipper.clip(Jsoup.parse("<body></body>"), "x").getReason()).isEqualTo("no readable content");
        assertThat(clipper.clip(null, "x").getReason()).isEqualTo("empty document");
    }

    @Test
    void negative_minimum_is_rejected() {
        assertThatThrownBy(() -> new PageClipper(new ReadabilityContentExtractor(), false, -1))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void parse_uses_header_charset_and_final_uri() throws Exception {
        byte[] body = "<html><body><p>한글 본문</p><a href=\"next\">n</a></body></html>"
                .getBytes(Charset.forName("EUC-KR"));
        FetchedPage page = FetchedPage.builder()
                .requestedUri(URI.create("https://a.test/start"))
                .finalUri(URI.create("https://a.test/dir/moved"))
                .statusCode(200)
                .contentType("text/html; charset=EUC-KR")
                .body(body)
                .build();

        Document doc = PageClipper.parse(page);

        assertThat(doc.select("p").text()).isEqualTo("한글 본문");
        assertThat(doc.location()).isEqualTo("https://a.test/dir/moved");
        assertThat(doc.select("a").attr("abs:href")).isEqualTo("https://a.test/dir/next");
    }
}
