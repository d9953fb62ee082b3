package com.webclipper.core.model;

import java.util.List;
import java.util.Objects;

/**
 * 한 주소의 처리 실패 기록.
 * 페치가 성공하고 추출만 실패한 경우에도 attemptedStrategyNames에는 실제로 시도한 전략이 남는다.
 */
public final class CrawlFailure {
    private final String address;
    private final String errorDescription;
    private final List<String> attemptedStrategyNames; // 시도 순서 그대로
    private final int depth;

    public CrawlFailure(String address, String errorDescription, List<String> attemptedStrategyNames, int depth) {
        this.address = Objects.requireNonNull(address, "address");
        this.errorDescription = (errorDescription == null || errorDescription.isBlank())
                ? "unknown error" : errorDescription;
        this.attemptedStrategyNames = (attemptedStrategyNames == null) ? List.of() : List.copyOf(attemptedStrategyNames);
        this.depth = depth;
    }

    public String getAddress() { return address; }
    public String getErrorDescription() { return errorDescription; }
    public List<String> getAttemptedStrategyNames() { return attemptedStrategyNames; }
    public int getDepth() { return depth; }

    @Override
    public String toString() {
        return "CrawlFailure{" + address + ", depth=" + depth + ", error=" + errorDescription
                + ", strategies=" + attemptedStrategyNames + "}";
    }
}
