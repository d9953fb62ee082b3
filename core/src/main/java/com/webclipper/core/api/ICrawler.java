package com.webclipper.core.api;

import com.webclipper.core.model.CrawlResult;
import com.webclipper.core.util.CrawlProgressListener;

import java.util.concurrent.atomic.AtomicBoolean;

/** 재귀 크롤러 최소 계약: 시작 주소에서 예산 안의 페이지를 모아 집계 결과를 돌려준다. */
public interface ICrawler {

    /**
     * @param startAddress 시작 주소
     * @param listener     페이지마다 1회 진행 스냅샷(null 허용)
     * @param cancelFlag   매 dequeue 전에 확인하는 취소 플래그(null 허용)
     */
    CrawlResult crawl(String startAddress, CrawlProgressListener listener, AtomicBoolean cancelFlag);

    default CrawlResult crawl(String startAddress) {
        return crawl(startAddress, CrawlProgressListener.NONE, null);
    }

    default CrawlResult crawl(String startAddress, CrawlProgressListener listener) {
        return crawl(startAddress, listener, null);
    }
}
