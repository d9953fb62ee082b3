package com.webclipper.core.clip;

import com.webclipper.core.model.PageRecord;

import java.util.List;

/** 배치 클리핑 결과. 입력 순서 유지. */
public final class ClipBatchResult {

    /** 실패 1건: 주소 + 사유 */
    public record Failure(String address, String error) {}

    private final List<PageRecord> success;
    private final List<Failure> failed;

    public ClipBatchResult(List<PageRecord> success, List<Failure> failed) {
        this.success = List.copyOf(success);
        this.failed = List.copyOf(failed);
    }

    public List<PageRecord> getSuccess() { return success; }
    public List<Failure> getFailed() { return failed; }
}
