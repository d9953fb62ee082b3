package com.webclipper.core.util;

import java.time.Duration;

/** 고정 대기(전략 간 500ms, 페이지 간 delay) 추상화. 테스트에선 기록만 하는 구현을 주입한다. */
@FunctionalInterface
public interface Sleeper {
    /** 인터럽트되면 즉시 InterruptedException. 호출자가 실행 중단으로 처리한다. */
    void sleep(Duration d) throws InterruptedException;

    /** 대기 없음(0ms 설정 등) */
    Sleeper NONE = d -> {
        if (Thread.currentThread().isInterrupted()) throw new InterruptedException("interrupted");
    };
}
