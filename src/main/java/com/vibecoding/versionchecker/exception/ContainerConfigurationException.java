package com.vibecoding.versionchecker.exception;

/**
 * 어노테이션 설정 오류로 컨테이너 검사 옵션을 만들지 못함
 * Pod 스펙이 바뀌기 전까지는 재시도해도 같은 결과가 나온다.
 */
public class ContainerConfigurationException extends ContainerReconcileException {

    public ContainerConfigurationException(String containerName, Throwable cause) {
        super(containerName,
            String.format("failed to build options from annotations for \"%s\": %s", containerName, cause.getMessage()),
            cause);
    }
}
