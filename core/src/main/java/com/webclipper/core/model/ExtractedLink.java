package com.webclipper.core.model;

/**
 * 페이지에서 추출된 링크.
 * depth는 추출 시점엔 항상 0이다. 실제 깊이는 프런티어에 넣을 때 부모 깊이로 따로 계산한다.
 */
public record ExtractedLink(String address, String anchorText, int depth) {

    public static ExtractedLink of(String address, String anchorText) {
        return new ExtractedLink(address, anchorText == null ? "" : anchorText, 0);
    }
}
