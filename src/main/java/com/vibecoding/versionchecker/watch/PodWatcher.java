package com.vibecoding.versionchecker.watch;

import com.vibecoding.versionchecker.config.VersionCheckerProperties;
import com.vibecoding.versionchecker.metrics.ImageMetricsStore;
import com.vibecoding.versionchecker.reconciler.PodReconciler;
import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.informers.SharedIndexInformer;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Component;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Pod informer 를 시작하고 이벤트를 조정 큐로 연결
 */
@Component
@ConditionalOnProperty(prefix = "version-checker.watch", name = "enabled", havingValue = "true",
    matchIfMissing = true)
@RequiredArgsConstructor
public class PodWatcher {

    private static final Logger log = LoggerFactory.getLogger(PodWatcher.class);

    private final KubernetesClient client;
    private final PodReconciler podReconciler;
    private final ImageMetricsStore metricsStore;
    private final VersionCheckerProperties properties;

    private SharedIndexInformer<Pod> informer;
    private ScheduledExecutorService scheduler;

    @PostConstruct
    public void start() {
        long resync = properties.getWatch().getResyncPeriod();
        informer = properties.isWatchAllNamespaces()
            ? client.pods().inAnyNamespace().runnableInformer(resync)
            : client.pods().inNamespace(properties.getWatch().getNamespace()).runnableInformer(resync);

        scheduler = Executors.newSingleThreadScheduledExecutor(new CustomizableThreadFactory("pod-reconcile-"));
        ReconcileQueue queue = new ReconcileQueue(
            key -> informer.getStore().getByKey(key), podReconciler, scheduler, properties);
        informer.addEventHandler(new PodEventHandler(queue, metricsStore));

        log.info("Starting pod informer (namespace: {}, resync: {}ms)",
            properties.isWatchAllNamespaces() ? "<all>" : properties.getWatch().getNamespace(), resync);
        informer.start().whenComplete((ignored, error) -> {
            if (error != null) {
                log.error("Pod informer failed to start", error);
            } else {
                log.info("Pod informer synced");
            }
        });
    }

    @PreDestroy
    public void stop() {
        if (informer != null) {
            informer.close();
        }
        if (scheduler != null) {
            scheduler.shutdownNow();
        }
        log.info("Pod informer stopped");
    }
}
