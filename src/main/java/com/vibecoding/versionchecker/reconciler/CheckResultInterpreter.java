package com.vibecoding.versionchecker.reconciler;

import com.vibecoding.versionchecker.checker.ImageVersionChecker;
import com.vibecoding.versionchecker.metrics.ImageMetricsStore;
import com.vibecoding.versionchecker.model.CheckOutcome;
import com.vibecoding.versionchecker.model.CheckOutcomeType;
import com.vibecoding.versionchecker.model.ImageCheckResult;
import com.vibecoding.versionchecker.model.ImageMetricEntry;
import com.vibecoding.versionchecker.model.ImageOptions;
import io.fabric8.kubernetes.api.model.Container;
import io.fabric8.kubernetes.api.model.Pod;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 버전 검사 실행 및 결과 해석
 * 결과가 있을 때만 메트릭을 갱신하고, 나머지 결과는 그대로 호출자에게 돌려준다.
 */
@RequiredArgsConstructor
public class CheckResultInterpreter {

    private static final Logger log = LoggerFactory.getLogger(CheckResultInterpreter.class);

    private final ImageVersionChecker versionChecker;
    private final ImageMetricsStore metricsStore;

    public CheckOutcome interpret(ReconcileContext context, Pod pod, Container container, ImageOptions options) {
        CheckOutcome outcome;
        try {
            outcome = versionChecker.check(context, pod, container, options);
        } catch (RuntimeException e) {
            outcome = CheckOutcome.fromException(e);
        }

        // 결과 미준비는 오류가 아님
        if (outcome == null) {
            return CheckOutcome.pending();
        }
        if (outcome.getType() != CheckOutcomeType.RESULT) {
            return outcome;
        }

        ImageCheckResult result = outcome.getResult();
        if (result.isLatest()) {
            log.debug("Image is latest {}:{}", result.getImageUrl(), result.getCurrentVersion());
        } else {
            log.debug("Image is not latest {}: {} -> {}",
                result.getImageUrl(), result.getCurrentVersion(), result.getLatestVersion());
        }

        metricsStore.addImage(toMetricEntry(pod, container, result));
        return outcome;
    }

    private ImageMetricEntry toMetricEntry(Pod pod, Container container, ImageCheckResult result) {
        return ImageMetricEntry.builder()
            .namespace(pod.getMetadata().getNamespace())
            .pod(pod.getMetadata().getName())
            .container(container.getName())
            .imageUrl(result.getImageUrl())
            .latest(result.isLatest())
            .currentVersion(result.getCurrentVersion())
            .latestVersion(result.getLatestVersion())
            .os(result.getOs())
            .arch(result.getArchitecture())
            .build();
    }
}
