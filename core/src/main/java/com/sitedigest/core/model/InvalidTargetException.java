package com.sitedigest.core.model;

/** 사용자 입력 대상 URL 이 비었거나 URL 로 해석되지 않을 때 */
public class InvalidTargetException extends IllegalArgumentException {
    public InvalidTargetException(String message) { super(message); }
    public InvalidTargetException(String message, Throwable cause) { super(message, cause); }
}
