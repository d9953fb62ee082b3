package com.webclipper.core.model;

/** 페이지 처리 직전에 관찰자에게 전달되는 진행 스냅샷. */
public record CrawlProgress(String currentUrl,
                            int processedCount,
                            int queueLength,
                            int successCount,
                            int failedCount,
                            int currentDepth) {
}
