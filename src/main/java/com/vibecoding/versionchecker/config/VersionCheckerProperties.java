package com.vibecoding.versionchecker.config;

import jakarta.annotation.PostConstruct;
import lombok.Data;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * 버전 검사 컨트롤러 설정
 */
@Configuration
@ConfigurationProperties(prefix = "version-checker")
@Data
public class VersionCheckerProperties {

    private static final Logger log = LoggerFactory.getLogger(VersionCheckerProperties.class);

    private boolean testAllContainers = false;   // 어노테이션 없는 컨테이너도 검사
    private Long checkTimeout = 30000L;           // 이미지 1개 검사 제한 (ms)
    private Long reconcileTimeout = 120000L;      // Pod 1개 조정 제한 (ms)
    private Long requeueDelay = 60000L;           // 실패한 Pod 재시도 지연 (ms)
    private Reconcile reconcile = new Reconcile();
    private Watch watch = new Watch();

    @Data
    public static class Reconcile {
        private Integer containerParallelism = 1;   // 1 이면 순차 처리
    }

    @Data
    public static class Watch {
        private boolean enabled = true;
        private String namespace;                   // 비어 있으면 전체 네임스페이스
        private Long resyncPeriod = 300000L;        // ms
    }

    @PostConstruct
    public void init() {
        validateConfig();
    }

    public void validateConfig() {
        requirePositive("check-timeout", checkTimeout);
        requirePositive("reconcile-timeout", reconcileTimeout);
        requirePositive("requeue-delay", requeueDelay);
        requirePositive("watch.resync-period", watch.getResyncPeriod());
        if (reconcile.getContainerParallelism() == null || reconcile.getContainerParallelism() < 1) {
            throw new IllegalStateException("version-checker.reconcile.container-parallelism must be at least 1");
        }

        log.info("Version checker configuration validated successfully");
        log.info("  - Test all containers: {}", testAllContainers);
        log.info("  - Check timeout: {}ms", checkTimeout);
        log.info("  - Reconcile timeout: {}ms", reconcileTimeout);
        log.info("  - Requeue delay: {}ms", requeueDelay);
        log.info("  - Container parallelism: {}", reconcile.getContainerParallelism());
        log.info("  - Watch: {} (namespace: {})", watch.isEnabled() ? "enabled" : "disabled",
            isWatchAllNamespaces() ? "<all>" : watch.getNamespace());
    }

    public boolean isWatchAllNamespaces() {
        return watch.getNamespace() == null || watch.getNamespace().isBlank();
    }

    private static void requirePositive(String name, Long value) {
        if (value == null || value <= 0) {
            log.error("version-checker.{} must be positive, got {}", name, value);
            throw new IllegalStateException("version-checker." + name + " must be positive");
        }
    }
}
