package com.webclipper.core.crawler;

import com.webclipper.core.model.ExtractedLink;
import org.jsoup.nodes.Document;

import java.util.List;

/** 파싱된 페이지에서 다음 방문 후보 링크를 뽑는 전략 인터페이스. */
public interface LinkExtractor {
    /**
     * base 기준으로 절대화한 링크 목록(발견 순서, 페이지 내 중복 제거).
     * 깨진 링크는 조용히 건너뛴다. 반환 링크의 depth는 항상 0.
     */
    List<ExtractedLink> extract(Document doc, String baseAddress);
}
