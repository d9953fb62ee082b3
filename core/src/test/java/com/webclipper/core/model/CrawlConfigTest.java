package com.webclipper.core.model;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CrawlConfigTest {

    @Test
    void defaults_match_documented_values() {
        CrawlConfig cfg = CrawlConfig.defaults();
        assertThat(cfg.getMaxDepth()).isEqualTo(2);
        assertThat(cfg.getMaxPages()).isEqualTo(50);
        assertThat(cfg.isSameDomainOnly()).isTrue();
        assertThat(cfg.getDelayBetweenRequests()).isEqualTo(Duration.ofMillis(1000));
        assertThat(cfg.getRequestTimeout()).isEqualTo(Duration.ofMillis(15_000));
        assertThat(cfg.isUseFallbackStrategies()).isTrue();
        assertThat(cfg.isIncludeImages()).isFalse();
        assertThat(cfg.getMinContentLength()).isEqualTo(100);
        assertThat(cfg.getExcludePatterns()).isEmpty();
        assertThat(cfg.getHeaders()).isEmpty();
    }

    @Test
    void validate_requires_target_but_validateOptions_does_not() {
        CrawlConfig cfg = CrawlConfig.defaults();
        cfg.validateOptions();
        assertThatThrownBy(cfg::validate).isInstanceOf(NullPointerException.class);
        assertThatThrownBy(() -> cfg.setTarget("  ").validate()).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void validate_rejects_nonsensical_values() {
        assertThatThrownBy(() -> base().setMaxDepth(-1).validate()).hasMessageContaining("maxDepth");
        assertThatThrownBy(() -> base().setMaxPages(0).validate()).hasMessageContaining("maxPages");
        assertThatThrownBy(() -> base().setRequestTimeout(Duration.ZERO).validate()).hasMessageContaining("requestTimeout");
        assertThatThrownBy(() -> base().setDelayBetweenRequests(Duration.ofMillis(-1)).validate())
                .hasMessageContaining("delayBetweenRequests");
        assertThatThrownBy(() -> base().setMinContentLength(-5).validate()).hasMessageContaining("minContentLength");
    }

    @Test
    void ms_setters_clamp_and_lists_are_copied() {
        CrawlConfig cfg = base().setDelayBetweenRequestsMs(-10).setRequestTimeoutMs(0);
        assertThat(cfg.getDelayBetweenRequestsMs()).isZero();
        assertThat(cfg.getRequestTimeoutMs()).isEqualTo(1);

        List<String> patterns = new ArrayList<>(List.of("/a"));
        cfg.setExcludePatterns(patterns);
        patterns.add("/b");
        assertThat(cfg.getExcludePatterns()).containsExactly("/a");
    }

    private static CrawlConfig base() {
        return CrawlConfig.defaults().setTarget("https://a.test/");
    }

    @Test
    void headers_keep_insertion_order_and_drop_null_entries() {
        Map<String, String> h = new LinkedHashMap<>();
        h.put("X-Zeta", "1");
        h.put("X-Null", null);
        h.put("Accept-Language", "ko-KR");
        h.put("X-Alpha", "2");

        CrawlConfig cfg = CrawlConfig.defaults().setHeaders(h);

        assertThat(cfg.getHeaders()).containsExactly(
                Map.entry("X-Zeta", "1"),
                Map.entry("Accept-Language", "ko-KR"),
                Map.entry("X-Alpha", "2"));
        assertThatThrownBy(() -> cfg.getHeaders().put("X-New", "v"))
                .isInstanceOf(UnsupportedOperationException.class);

        h.put("X-Later", "3");
        assertThat(cfg.getHeaders()).doesNotContainKey("X-Later");
        assertThat(CrawlConfig.defaults().setHeaders(null).getHeaders()).isEmpty();
    }
}
