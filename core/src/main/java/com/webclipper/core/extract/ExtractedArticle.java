package com.webclipper.core.extract;

import java.util.Objects;

/** 구조 추출 결과: 본문 영역 HTML + 메타데이터. 텍스트 변환 전 단계. */
public record ExtractedArticle(String contentHtml, PageMetadata metadata) {
    public ExtractedArticle {
        Objects.requireNonNull(contentHtml, "contentHtml");
        Objects.requireNonNull(metadata, "metadata");
    }
}
