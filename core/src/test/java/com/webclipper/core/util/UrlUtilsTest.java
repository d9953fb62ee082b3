package com.webclipper.core.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class UrlUtilsTest {

    @Nested
    @DisplayName("normalize")
    class Normalize {

        @Test
        void lowercases_and_drops_default_port_query_fragment_and_trailing_slash() {
            assertThat(UrlUtils.normalize("HTTP://Example.COM:80/Docs/Page/?q=1#frag"))
                    .isEqualTo("http://example.com/docs/page");
        }

        @Test
        void keeps_root_slash_and_adds_it_when_missing() {
            assertThat(UrlUtils.normalize("https://example.com")).isEqualTo("https://example.com/");
            assertThat(UrlUtils.normalize("https://example.com/")).isEqualTo("https://example.com/");
        }

        @Test
        void keeps_non_default_port_and_collapses_double_slashes() {
            assertThat(UrlUtils.normalize("https://example.com:8443/a//b/"))
                    .isEqualTo("https://example.com:8443/a/b");
        }

        @Test
        void same_node_for_case_slash_fragment_and_query_variants() {
            String a = UrlUtils.normalize("https://site.test/Guide/");
            assertThat(UrlUtils.normalize("https://site.test/guide")).isEqualTo(a);
            assertThat(UrlUtils.normalize("https://SITE.test/guide#top")).isEqualTo(a);
            assertThat(UrlUtils.normalize("https://site.test/guide?page=2")).isEqualTo(a);
        }

        @Test
        @DisplayName("normalize(normalize(x)) == normalize(x)")
        void idempotent() {
            List<String> samples = List.of(
                    "https://Example.com/A/B/",
                    "http://example.com:80//x//y//",
                    "https://example.com:443",
                    "https://example.com/path?x=1#y",
                    "https://한글.test/문서/",
                    "not a url at all",
                    "mailto:someone@example.com",
                    "",
                    "/relative/Path/");
            for (String s : samples) {
                String once = UrlUtils.normalize(s);
                assertThat(UrlUtils.normalize(once)).as(s).isEqualTo(once);
            }
        }

        @Test
        void unparseable_input_is_lowercased_as_is() {
            assertThat(UrlUtils.normalize("Not A Url")).isEqualTo("not a url");
            assertThat(UrlUtils.normalize(null)).isEmpty();
        }
    }

    @Test
    void domainOf_returns_lowercase_host_or_empty() {
        assertThat(UrlUtils.domainOf("https://Sub.Example.com/x")).isEqualTo("sub.example.com");
        assertThat(UrlUtils.domainOf("not a url")).isEmpty();
        assertThat(UrlUtils.domainOf("/just/a/path")).isEmpty();
        assertThat(UrlUtils.domainOf(null)).isEmpty();
    }

    @Test
    void sameDomain_is_exact_host_match_and_never_matches_empty() {
        assertThat(UrlUtils.sameDomain("https://a.test/x", "http://A.test/y")).isTrue();
        assertThat(UrlUtils.sameDomain("https://a.test/", "https://b.test/")).isFalse();
        assertThat(UrlUtils.sameDomain("https://a.test/", "https://www.a.test/")).isFalse();
        assertThat(UrlUtils.sameDomain("bad url", "bad url")).isFalse();
    }

    @Test
    void isAssetAddress_checks_path_extension_only() {
        assertThat(UrlUtils.isAssetAddress("https://a.test/file.PDF")).isTrue();
        assertThat(UrlUtils.isAssetAddress("https://a.test/img.jpg?size=2")).isTrue();
        assertThat(UrlUtils.isAssetAddress("https://a.test/static/app.js")).isTrue();
        assertThat(UrlUtils.isAssetAddress("https://a.test/page.html")).isFalse();
        assertThat(UrlUtils.isAssetAddress("https://a.test/docs")).isFalse();
        assertThat(UrlUtils.isAssetAddress("https://a.test/search?format=.pdf")).isFalse();
    }

    @Test
    void stripFragmentAndQuery_keeps_case() {
        assertThat(UrlUtils.stripFragmentAndQuery("https://a.test/P?q=1#f")).isEqualTo("https://a.test/P");
        assertThat(UrlUtils.stripFragmentAndQuery("https://a.test/P#f?x")).isEqualTo("https://a.test/P");
    }

    @Test
    void isHttpLike() {
        assertThat(UrlUtils.isHttpLike("HTTPS://a.test")).isTrue();
        assertThat(UrlUtils.isHttpLike("ftp://a.test")).isFalse();
        assertThat(UrlUtils.isHttpLike("javascript:void(0)")).isFalse();
    }

    @Test
    void toFetchAddress_encodes_path_and_keeps_case_and_existing_escapes() {
        assertThat(UrlUtils.toFetchAddress("https://a.test/문서/My Page?q=a b#x"))
                .isEqualTo("https://a.test/%EB%AC%B8%EC%84%9C/My%20Page");
        assertThat(UrlUtils.toFetchAddress("https://a.test/%EB%AC%B8%EC%84%9C"))
                .isEqualTo("https://a.test/%EB%AC%B8%EC%84%9C");
        assertThat(UrlUtils.toFetchAddress("https://a.test/a|b{c}/100%"))
                .isEqualTo("https://a.test/a%7Cb%7Bc%7D/100%25");
        assertThat(UrlUtils.toFetchAddress("https://a.test")).isEqualTo("https://a.test");

        String once = UrlUtils.toFetchAddress("https://a.test/문서 1");
        assertThat(UrlUtils.toFetchAddress(once)).isEqualTo(once);
    }

    @Test
    void normalize_collapses_raw_and_percent_encoded_paths() {
        String key = UrlUtils.normalize("https://a.test/%EB%AC%B8%EC%84%9C");
        assertThat(key).isEqualTo("https://a.test/%eb%ac%b8%ec%84%9c");
        assertThat(UrlUtils.normalize("https://a.test/문서")).isEqualTo(key);
        assertThat(UrlUtils.normalize("https://a.test/%eb%ac%b8%ec%84%9c/")).isEqualTo(key);
    }
}
