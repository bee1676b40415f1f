package com.vibecoding.versionchecker.checker;

import com.vibecoding.versionchecker.model.CheckOutcome;
import com.vibecoding.versionchecker.model.ImageOptions;
import com.vibecoding.versionchecker.reconciler.ReconcileContext;
import io.fabric8.kubernetes.api.model.Container;
import io.fabric8.kubernetes.api.model.Pod;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 실제 검사기가 등록되지 않았을 때 사용하는 검사기
 * 모든 검사를 보류(PENDING) 처리하므로 메트릭은 기록되지 않는다.
 */
public class DeferringVersionChecker implements ImageVersionChecker {

    private static final Logger log = LoggerFactory.getLogger(DeferringVersionChecker.class);

    public DeferringVersionChecker() {
        log.warn("No ImageVersionChecker bean configured, all image checks will be deferred");
    }

    @Override
    public CheckOutcome check(ReconcileContext context, Pod pod, Container container, ImageOptions options) {
        log.debug("Deferring check of image {}", container.getImage());
        return CheckOutcome.pending();
    }
}
