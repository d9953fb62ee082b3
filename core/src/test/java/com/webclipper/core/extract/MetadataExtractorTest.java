package com.webclipper.core.extract;

import org.jsoup.Jsoup;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class MetadataExtractorTest {

    private final MetadataExtractor extractor = new MetadataExtractor();

    @Test
    void open_graph_and_article_meta_win() {
        String html = "<html><head>"
                + "<title>Doc Title</title>"
                + "<meta property=\"og:title\" content=\"OG Title\">"
                + "<meta name=\"author\" content=\"Kim\">"
                + "<meta property=\"article:published_time\" content=\"2024-05-01T10:00:00Z\">"
                + "<meta property=\"og:site_name\" content=\"Example Blog\">"
                + "</head><body><h1>Heading</h1></body></html>";

        PageMetadata m = extractor.extract(Jsoup.parse(html));

        assertThat(m.title()).isEqualTo("OG Title");
        assertThat(m.author()).isEqualTo("Kim");
        assertThat(m.publishedTime()).isEqualTo("2024-05-01T10:00:00Z");
        assertThat(m.siteName()).isEqualTo("Example Blog");
    }

    @Test
    void ld_json_fills_gaps_including_graph_and_author_arrays() {
        String html = "<html><head>"
                + "<script type=\"application/ld+json\">{ broken json </script>"
                + "<script type=\"application/ld+json\">"
                + "{\"@context\":\"https://schema.org\",\"@graph\":[{\"@type\":\"NewsArticle\","
                + "\"headline\":\"LD Headline\",\"datePublished\":\"2023-01-02\","
                + "\"author\":[{\"@type\":\"Person\",\"name\":\"Lee\"}],"
                + "\"publisher\":{\"@type\":\"Organization\",\"name\":\"LD Press\"}}]}"
                + "</script>"
                + "<title>Fallback</title></head><body></body></html>";

        PageMetadata m = extractor.extract(Jsoup.parse(html));

        assertThat(m.title()).isEqualTo("LD Headline");
        assertThat(m.author()).isEqualTo("Lee");
        assertThat(m.publishedTime()).isEqualTo("2023-01-02");
        assertThat(m.siteName()).isEqualTo("LD Press");
    }

    @Test
    void falls_back_to_title_tag_h1_byline_and_time_element() {
        String html = "<html><head><title>  Plain Title </title></head><body>"
                + "<span class=\"post-byline\">By Park</span>"
                + "<time datetime=\"2022-12-24\">Dec 24</time>"
                + "</body></html>";

        PageMetadata m = extractor.extract(Jsoup.parse(html));
        assertThat(m.title()).isEqualTo("Plain Title");
        assertThat(m.author()).isEqualTo("Park");
        assertThat(m.publishedTime()).isEqualTo("2022-12-24");
        assertThat(m.siteName()).isNull();

        PageMetadata h1Only = extractor.extract(Jsoup.parse("<body><h1>Only H1</h1></body>"));
        assertThat(h1Only.title()).isEqualTo("Only H1");
    }

    @Test
    void untitled_when_nothing_found() {
        PageMetadata m = extractor.extract(Jsoup.parse("<body><p>text</p></body>"));
        assertThat(m.title()).isEqualTo(PageMetadata.UNTITLED);
        assertThat(m.author()).isNull();
    }
}
