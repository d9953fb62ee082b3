package com.webclipper.core.model;

/**
 * 프런티어 큐 원소.
 * address 는 중복 판정용 정규화 키, fetchAddress 는 실제 요청할 주소(경로 대소문자 유지).
 */
public record FrontierEntry(String address, int depth, String fetchAddress) {

    public FrontierEntry(String address, int depth) {
        this(address, depth, address);
    }
}
