package com.vibecoding.versionchecker.exception;

/**
 * 조정이 취소되었거나 기한을 넘겼을 때 발생하는 예외
 */
public class ReconcileCancelledException extends RuntimeException {

    public ReconcileCancelledException(String message) {
        super(message);
    }

    public ReconcileCancelledException(String message, Throwable cause) {
        super(message, cause);
    }
}
