package com.webclipper.core.crawler;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CrawlScopeTest {

    @Test
    void same_domain_only_rejects_other_hosts_and_subdomains() {
        CrawlScope scope = new CrawlScope("https://A.test/start", true, null, null);

        assertThat(scope.getStartDomain()).isEqualTo("a.test");
        assertThat(scope.evaluate("https://a.test/y")).isEqualTo(CrawlScope.Decision.ALLOW);
        assertThat(scope.evaluate("https://b.test/z")).isEqualTo(CrawlScope.Decision.OTHER_DOMAIN);
        assertThat(scope.evaluate("https://www.a.test/")).isEqualTo(CrawlScope.Decision.OTHER_DOMAIN);
        assertThat(scope.evaluate("not a url")).isEqualTo(CrawlScope.Decision.OTHER_DOMAIN);
    }

    @Test
    void cross_domain_allowed_when_flag_off() {
        CrawlScope scope = new CrawlScope("https://a.test/", false, List.of(), List.of());
        assertThat(scope.allows("https://b.test/z")).isTrue();
    }

    @Test
    void exclude_wins_over_include() {
        CrawlScope scope = new CrawlScope("https://a.test/", true, List.of("/docs/private"), List.of("/docs/*"));

        assertThat(scope.evaluate("https://a.test/docs/intro")).isEqualTo(CrawlScope.Decision.ALLOW);
        assertThat(scope.evaluate("https://a.test/docs/private/x")).isEqualTo(CrawlScope.Decision.EXCLUDED);
        assertThat(scope.evaluate("https://a.test/blog")).isEqualTo(CrawlScope.Decision.NOT_INCLUDED);
    }

    @Test
    void invalid_regex_fails_fast() {
        assertThatThrownBy(() -> new CrawlScope("https://a.test/", true, List.of("re:(unclosed"), null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageStartingWith("invalid pattern: re:(unclosed");
    }
}
