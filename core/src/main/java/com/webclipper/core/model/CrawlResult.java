package com.webclipper.core.model;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * 재귀 크롤 1회의 집계 결과.
 * 일부 실패는 정상 상태다. success가 비어 있어도 예외가 아니라 유효한 결과로 돌려준다.
 */
public final class CrawlResult {
    private final String startAddress;
    private final Instant startedAt;
    private final List<PageRecord> success;
    private final List<CrawlFailure> failed;
    private final long totalTimeMs;
    private final List<String> visitedAddresses; // 방문 순서
    private final boolean cancelled;

    public CrawlResult(String startAddress,
                       Instant startedAt,
                       List<PageRecord> success,
                       List<CrawlFailure> failed,
                       long totalTimeMs,
                       List<String> visitedAddresses,
                       boolean cancelled) {
        this.startAddress = Objects.requireNonNull(startAddress, "startAddress");
        this.startedAt = (startedAt == null) ? Instant.now() : startedAt;
        this.success = List.copyOf(success);
        this.failed = List.copyOf(failed);
        this.totalTimeMs = Math.max(0, totalTimeMs);
        this.visitedAddresses = List.copyOf(visitedAddresses);
        this.cancelled = cancelled;
    }

    public String getStartAddress() { return startAddress; }
    public Instant getStartedAt() { return startedAt; }
    public List<PageRecord> getSuccess() { return success; }
    public List<CrawlFailure> getFailed() { return failed; }
    public long getTotalTimeMs() { return totalTimeMs; }
    public List<String> getVisitedAddresses() { return visitedAddresses; }
    public boolean isCancelled() { return cancelled; }

    public int getProcessedCount() { return success.size() + failed.size(); }

    public long getTotalWords() {
        long sum = 0;
        for (PageRecord p : success) sum += p.getWordCount();
        return sum;
    }
}
