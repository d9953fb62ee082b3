package com.webclipper.core.extract;

import org.jsoup.nodes.Document;

import java.util.Optional;

/**
 * 본문(주요 콘텐츠) 영역 추출 전략.
 * 입력 Document는 링크 추출에도 쓰이므로 구현은 원본을 변경하면 안 된다.
 */
public interface ContentExtractor {
    /** 읽을 만한 본문이 없으면 empty */
    Optional<ExtractedArticle> extract(Document doc, String baseAddress);
}
