package com.webclipper.core.extract;

/** 본문과 별개로 head/ld+json 에서 뽑는 메타데이터. title 외에는 null 가능. */
public record PageMetadata(String title, String author, String publishedTime, String siteName) {

    public static final String UNTITLED = "Untitled";

    public PageMetadata {
        if (title == null || title.isBlank()) title = UNTITLED;
    }
}
