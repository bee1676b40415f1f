package com.vibecoding.versionchecker.exception;

/**
 * 단일 컨테이너 조정 실패
 */
public abstract class ContainerReconcileException extends RuntimeException {

    private final String containerName;

    protected ContainerReconcileException(String containerName, String message, Throwable cause) {
        super(message, cause);
        this.containerName = containerName;
    }

    public String getContainerName() {
        return containerName;
    }
}
