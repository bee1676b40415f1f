package com.vibecoding.versionchecker.exception;

/**
 * 검색 조건에 맞는 이미지 버전을 찾지 못했을 때 발생하는 예외
 * 재시도해도 결과가 바뀌지 않으므로 조정 실패로 취급하지 않는다.
 */
public class NoVersionFoundException extends RuntimeException {

    public NoVersionFoundException(String message) {
        super(message);
    }

    public NoVersionFoundException(String message, Throwable cause) {
        super(message, cause);
    }
}
