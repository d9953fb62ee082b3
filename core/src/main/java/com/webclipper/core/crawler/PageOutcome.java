package com.webclipper.core.crawler;

import com.webclipper.core.model.ExtractedLink;
import com.webclipper.core.model.PageRecord;

import java.util.List;

/** 페이지 1건 처리 결과(성공: 레코드 + 링크 / 실패: 사유). 시도한 전략 이름은 양쪽 모두 보관. */
final class PageOutcome {
    private final PageRecord record;
    private final List<ExtractedLink> links;
    private final String error;
    private final List<String> attemptedStrategyNames;

    private PageOutcome(PageRecord record, List<ExtractedLink> links, String error, List<String> attempted) {
        this.record = record;
        this.links = (links == null) ? List.of() : List.copyOf(links);
        this.error = error;
        this.attemptedStrategyNames = List.copyOf(attempted);
    }

    static PageOutcome success(PageRecord record, List<ExtractedLink> links, List<String> attempted) {
        return new PageOutcome(record, links, null, attempted);
    }

    static PageOutcome failure(String error, List<String> attempted) {
        return new PageOutcome(null, List.of(), error, attempted);
    }

    boolean isSuccess() { return record != null; }
    PageRecord record() { return record; }
    List<ExtractedLink> links() { return links; }
    String error() { return error; }
    List<String> attemptedStrategyNames() { return attemptedStrategyNames; }
}
