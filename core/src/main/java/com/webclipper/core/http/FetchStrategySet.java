package com.webclipper.core.http;

import com.webclipper.core.util.Sleeper;
import com.webclipper.core.util.StructuredLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * 전략을 순서대로 시도해 첫 성공을 돌려준다.
 * 실패한(마지막이 아닌) 시도 뒤에는 고정 500ms 대기.
 * 시도 단위는 호출자가 정한다: 크롤러는 페치+본문 추출까지를 한 시도로 본다.
 */
public final class FetchStrategySet {
    private static final Logger LOG = LoggerFactory.getLogger(FetchStrategySet.class);
    private static final StructuredLog SLOG = StructuredLog.get(FetchStrategySet.class);

    public static final Duration INTER_STRATEGY_DELAY = Duration.ofMillis(500);

    /** 전략 1개로 1회 시도 */
    @FunctionalInterface
    public interface StrategyAttempt<T> {
        AttemptResult<T> attempt(FetchStrategy strategy) throws InterruptedException;
    }

    private final List<FetchStrategy> strategies;
    private final Sleeper sleeper;

    public FetchStrategySet(boolean useFallbackStrategies, Sleeper sleeper) {
        this(FetchStrategy.ordered(useFallbackStrategies), sleeper);
    }

    public FetchStrategySet(List<FetchStrategy> strategies, Sleeper sleeper) {
        if (strategies == null || strategies.isEmpty()) throw new IllegalArgumentException("strategies must not be empty");
        this.strategies = List.copyOf(strategies);
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    }

    public List<FetchStrategy> strategies() { return strategies; }

    public <T> FetchOutcome<T> run(String address, StrategyAttempt<T> attempt) throws InterruptedException {
        Objects.requireNonNull(attempt, "attempt");
        List<String> attempted = new ArrayList<>(strategies.size());
        String lastError = "no strategy attempted";

        for (int i = 0; i < strategies.size(); i++) {
            FetchStrategy s = strategies.get(i);
            attempted.add(s.strategyName());

            AttemptResult<T> r = attempt.attempt(s);
            if (r.isOk()) {
                if (i > 0) LOG.debug("Fetched {} with fallback strategy '{}'", address, s.strategyName());
                return FetchOutcome.ok(r.getValue(), attempted);
            }

            lastError = r.getError();
            SLOG.debug("strategy-failed", "url", address, "strategy", s.strategyName(), "error", lastError);

            if (i < strategies.size() - 1) {
                sleeper.sleep(INTER_STRATEGY_DELAY);
            }
        }
        return FetchOutcome.failed(lastError, attempted);
    }
}
