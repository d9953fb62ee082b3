package com.webclipper.core.util;

import com.webclipper.core.model.CrawlProgress;

@FunctionalInterface
public interface CrawlProgressListener {
    /**
     * 페이지를 페치하기 직전에 1회 호출된다.
     * 구현이 예외를 던져도 크롤은 계속된다(로그만 남김).
     */
    void onProgress(CrawlProgress progress);

    CrawlProgressListener NONE = p -> {};
}
