package com.vibecoding.versionchecker.exception;

/**
 * 검사 외 단계에서 발생한 예기치 않은 컨테이너 처리 오류 (메트릭 저장소 오류, 작업 거부 등)
 */
public class ContainerProcessingException extends ContainerReconcileException {

    public ContainerProcessingException(String containerName, Throwable cause) {
        super(containerName,
            String.format("failed to reconcile container \"%s\": %s", containerName, cause.getMessage()),
            cause);
    }
}
