package com.webclipper.core.http;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FetchStrategySetTest {

    private final List<Duration> sleeps = new ArrayList<>();

    @Test
    void all_failures_try_every_strategy_in_order_with_fixed_waits() throws Exception {
        FetchStrategySet set = new FetchStrategySet(true, sleeps::add);

        FetchOutcome<String> out = set.run("https://a.test/", s -> AttemptResult.failed("HTTP 403 via " + s.strategyName()));

        assertThat(out.isOk()).isFalse();
        assertThat(out.getAttemptedStrategyNames())
                .containsExactly("default", "chrome-mac", "firefox", "mobile", "googlebot");
        assertThat(out.getError()).isEqualTo("HTTP 403 via googlebot");
        // 마지막 실패 뒤에는 대기하지 않음
        assertThat(sleeps).hasSize(4).containsOnly(Duration.ofMillis(500));
    }

    @Test
    void stops_at_first_success() throws Exception {
        FetchStrategySet set = new FetchStrategySet(true, sleeps::add);

        FetchOutcome<String> out = set.run("https://a.test/", s ->
                s == FetchStrategy.FIREFOX ? AttemptResult.ok("page") : AttemptResult.failed("HTTP 429"));

        assertThat(out.isOk()).isTrue();
        assertThat(out.getValue()).isEqualTo("page");
        assertThat(out.getAttemptedStrategyNames()).containsExactly("default", "chrome-mac", "firefox");
        assertThat(out.lastStrategyName()).isEqualTo("firefox");
        assertThat(sleeps).hasSize(2);
    }

    @Test
    void without_fallback_only_default_is_tried() throws Exception {
        FetchStrategySet set = new FetchStrategySet(false, sleeps::add);

        FetchOutcome<String> out = set.run("https://a.test/", s -> AttemptResult.failed("HTTP 500"));

        assertThat(out.getAttemptedStrategyNames()).containsExactly("default");
        assertThat(sleeps).isEmpty();
    }

    @Test
    void interruption_during_wait_propagates() {
        FetchStrategySet set = new FetchStrategySet(true, d -> { throw new InterruptedException("stop"); });

        assertThatThrownBy(() -> set.run("https://a.test/", s -> AttemptResult.failed("x")))
                .isInstanceOf(InterruptedException.class);
    }

    @Test
    void empty_strategy_list_is_rejected() {
        assertThatThrownBy(() -> new FetchStrategySet(List.of(), sleeps::add))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void strategy_headers_carry_user_agent_and_language() {
        assertThat(FetchStrategy.ordered(true)).hasSize(5).startsWith(FetchStrategy.DEFAULT);
        assertThat(FetchStrategy.GOOGLEBOT.headers())
                .containsEntry("User-Agent", FetchStrategy.GOOGLEBOT.userAgent())
                .containsKeys("Accept", "Accept-Language", "Upgrade-Insecure-Requests");
    }
}
