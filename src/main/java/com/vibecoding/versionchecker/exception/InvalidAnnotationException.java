package com.vibecoding.versionchecker.exception;

/**
 * Pod 어노테이션 값을 검사 옵션으로 변환할 수 없을 때 발생하는 예외
 */
public class InvalidAnnotationException extends RuntimeException {

    public InvalidAnnotationException(String message) {
        super(message);
    }

    public InvalidAnnotationException(String message, Throwable cause) {
        super(message, cause);
    }
}
