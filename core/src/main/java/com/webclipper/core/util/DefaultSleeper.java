package com.webclipper.core.util;

import java.time.Duration;

/** Thread.sleep 기반. 0 이하 대기는 인터럽트 여부만 확인하고 바로 돌아간다. */
public final class DefaultSleeper implements Sleeper {
    @Override public void sleep(Duration d) throws InterruptedException {
        long ms = (d == null) ? 0 : Math.max(0, d.toMillis());
        if (ms > 0) {
            Thread.sleep(ms);
        } else if (Thread.interrupted()) {
            throw new InterruptedException("interrupted before delay");
        }
    }
}
