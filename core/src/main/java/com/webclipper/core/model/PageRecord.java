package com.webclipper.core.model;

import java.util.Objects;

/** 성공적으로 수집된 페이지 1건 (불변). 인덱싱 단계로 그대로 넘어간다. */
public final class PageRecord {
    private final String title;
    private final String content;       // 정규화된 마크다운 텍스트
    private final String address;       // 리다이렉트 이후 최종 주소가 아니라 방문 주소
    private final int wordCount;
    private final String publishedTime; // nullable
    private final String author;        // nullable
    private final String siteName;      // nullable

    private PageRecord(Builder b) {
        this.title = (b.title == null || b.title.isBlank()) ? "Untitled" : b.title;
        this.content = b.content;
        this.address = b.address;
        this.wordCount = b.wordCount;
        this.publishedTime = b.publishedTime;
        this.author = b.author;
        this.siteName = b.siteName;
    }

    public String getTitle() { return title; }
    public String getContent() { return content; }
    public String getAddress() { return address; }
    public int getWordCount() { return wordCount; }
    public String getPublishedTime() { return publishedTime; }
    public String getAuthor() { return author; }
    public String getSiteName() { return siteName; }

    @Override
    public String toString() {
        return "PageRecord{" + address + ", title=" + title + ", words=" + wordCount + "}";
    }

    public static Builder builder() { return new Builder(); }

    public static final class Builder {
        private String title;
        private String content;
        private String address;
        private int wordCount;
        private String publishedTime;
        private String author;
        private String siteName;

        public Builder title(String title) { this.title = title; return this; }
        public Builder content(String content) { this.content = content; return this; }
        public Builder address(String address) { this.address = address; return this; }
        public Builder wordCount(int wordCount) { this.wordCount = wordCount; return this; }
        public Builder publishedTime(String publishedTime) { this.publishedTime = publishedTime; return this; }
        public Builder author(String author) { this.author = author; return this; }
        public Builder siteName(String siteName) { this.siteName = siteName; return this; }

        public PageRecord build() {
            Objects.requireNonNull(address, "address");
            Objects.requireNonNull(content, "content");
            return new PageRecord(this);
        }
    }
}
