package com.webclipper.core.clip;

/** 단일 페이지 클리핑 실패(HTTP 오류, 본문 추출 실패, 본문 너무 짧음 등). */
public class ClipException extends Exception {
    private final String address;

    public ClipException(String address, String message) {
        super(message);
        this.address = address;
    }

    public ClipException(String address, String message, Throwable cause) {
        super(message, cause);
        this.address = address;
    }

    public String getAddress() { return address; }
}
