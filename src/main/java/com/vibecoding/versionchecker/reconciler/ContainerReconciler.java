package com.vibecoding.versionchecker.reconciler;

import com.vibecoding.versionchecker.exception.ContainerConfigurationException;
import com.vibecoding.versionchecker.exception.ImageCheckFailedException;
import com.vibecoding.versionchecker.exception.InvalidAnnotationException;
import com.vibecoding.versionchecker.exception.ReconcileCancelledException;
import com.vibecoding.versionchecker.metrics.ImageMetricsStore;
import com.vibecoding.versionchecker.model.CheckOutcome;
import com.vibecoding.versionchecker.model.ImageOptions;
import com.vibecoding.versionchecker.options.OptionsResolver;
import io.fabric8.kubernetes.api.model.Container;
import io.fabric8.kubernetes.api.model.Pod;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

/**
 * 컨테이너 단위 조정
 * 활성화 확인 → 옵션 생성 → 버전 검사 → 결과 분류
 */
@Component
@RequiredArgsConstructor
public class ContainerReconciler {

    private static final Logger log = LoggerFactory.getLogger(ContainerReconciler.class);

    private final CheckResultInterpreter interpreter;
    private final ImageMetricsStore metricsStore;

    /**
     * @throws ContainerConfigurationException 어노테이션 설정 오류
     * @throws ImageCheckFailedException       검사 실패 (취소 포함)
     */
    public void reconcileContainer(ReconcileContext context, Pod pod, Container container, OptionsResolver resolver) {
        String namespace = pod.getMetadata().getNamespace();
        String podName = pod.getMetadata().getName();
        String containerName = container.getName();

        // 비활성화된 컨테이너는 남아 있는 메트릭을 제거하고 종료
        if (!resolver.isEnabled(context.isDefaultTestAll(), containerName)) {
            metricsStore.removeImage(namespace, podName, containerName);
            return;
        }

        ImageOptions options;
        try {
            options = resolver.options(containerName);
        } catch (InvalidAnnotationException e) {
            throw new ContainerConfigurationException(containerName, e);
        }

        if (context.isDone()) {
            throw new ImageCheckFailedException(containerName, new ReconcileCancelledException(context.doneReason()));
        }

        MDC.put("container", containerName);
        try {
            log.debug("Processing container image {}", container.getImage());

            CheckOutcome outcome = interpreter.interpret(context, pod, container, options);
            switch (outcome.getType()) {
                // 재시도해도 결과가 같으므로 실패로 보고하지 않음
                case NO_VERSION_FOUND -> log.error("No version found for container {} of pod {}/{}: {}",
                        containerName, namespace, podName, outcome.getError().getMessage());
                case FAILED -> throw new ImageCheckFailedException(containerName, outcome.getError());
                default -> {
                }
            }
        } finally {
            MDC.remove("container");
        }
    }
}
