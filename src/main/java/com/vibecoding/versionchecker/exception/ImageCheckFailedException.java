package com.vibecoding.versionchecker.exception;

/**
 * 컨테이너 이미지 버전 검사 실패 (레지스트리 오류, 인증 실패, 취소 등)
 */
public class ImageCheckFailedException extends ContainerReconcileException {

    public ImageCheckFailedException(String containerName, Throwable cause) {
        super(containerName,
            String.format("failed to check container image \"%s\": %s", containerName, cause.getMessage()),
            cause);
    }
}
