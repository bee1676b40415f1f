package com.vibecoding.versionchecker.exception;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Pod 조정 중 하나 이상의 컨테이너가 실패했을 때 발생하는 예외
 * 컨테이너별 실패는 선언 순서대로 {@link #getFailures()} 에 담긴다.
 */
public class PodReconcileException extends RuntimeException {

    private final String namespace;
    private final String podName;
    private final List<ContainerReconcileException> failures;

    public PodReconcileException(String namespace, String podName, List<ContainerReconcileException> failures) {
        super(buildMessage(namespace, podName, failures));
        this.namespace = namespace;
        this.podName = podName;
        this.failures = List.copyOf(failures);
        this.failures.forEach(this::addSuppressed);
    }

    private static String buildMessage(String namespace, String podName,
                                       List<ContainerReconcileException> failures) {
        String joined = failures.stream()
            .map(Throwable::getMessage)
            .collect(Collectors.joining(", "));
        return String.format("failed to sync pod %s/%s: %s", namespace, podName, joined);
    }

    public String getNamespace() {
        return namespace;
    }

    public String getPodName() {
        return podName;
    }

    public List<ContainerReconcileException> getFailures() {
        return failures;
    }
}
