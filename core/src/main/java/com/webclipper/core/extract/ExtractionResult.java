package com.webclipper.core.extract;

import com.webclipper.core.model.PageRecord;

/** 페이지 1건 추출 결과: PageRecord 또는 실패 사유. */
public final class ExtractionResult {
    private final PageRecord record;
    private final String reason;

    private ExtractionResult(PageRecord record, String reason) {
        this.record = record;
        this.reason = reason;
    }

    public static ExtractionResult ok(PageRecord record) {
        if (record == null) throw new IllegalArgumentException("record");
        return new ExtractionResult(record, null);
    }

    public static ExtractionResult failed(String reason) {
        return new ExtractionResult(null, (reason == null || reason.isBlank()) ? "extraction failed" : reason);
    }

    public boolean isOk() { return record != null; }
    public PageRecord getRecord() { return record; }
    public String getReason() { return reason; }
}
