package com.vibecoding.versionchecker.watch;

import com.vibecoding.versionchecker.config.VersionCheckerProperties;
import com.vibecoding.versionchecker.exception.PodReconcileException;
import com.vibecoding.versionchecker.reconciler.ReconcileContext;
import com.vibecoding.versionchecker.reconciler.PodReconciler;
import io.fabric8.kubernetes.api.model.Pod;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

/**
 * Pod 조정 작업 큐 ("namespace/name" 키)
 * 같은 키는 한 번만 대기하며, 실패한 Pod 는 지연 후 다시 큐에 넣는다.
 * 재시도는 이 큐에서만 수행한다.
 */
public class ReconcileQueue {

    private static final Logger log = LoggerFactory.getLogger(ReconcileQueue.class);

    private final Function<String, Pod> podLookup;
    private final PodReconciler podReconciler;
    private final ScheduledExecutorService scheduler;
    private final VersionCheckerProperties properties;
    private final Set<String> queued = ConcurrentHashMap.newKeySet();

    public ReconcileQueue(Function<String, Pod> podLookup, PodReconciler podReconciler,
                          ScheduledExecutorService scheduler, VersionCheckerProperties properties) {
        this.podLookup = podLookup;
        this.podReconciler = podReconciler;
        this.scheduler = scheduler;
        this.properties = properties;
    }

    public static String keyOf(Pod pod) {
        return pod.getMetadata().getNamespace() + "/" + pod.getMetadata().getName();
    }

    public void enqueue(String key) {
        enqueueAfter(key, 0L);
    }

    public void enqueueAfter(String key, long delayMillis) {
        if (!queued.add(key)) {
            log.trace("Pod {} is already queued", key);
            return;
        }
        try {
            scheduler.schedule(() -> process(key), delayMillis, TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            queued.remove(key);
            log.warn("Reconcile queue is shut down, dropping pod {}", key);
        }
    }

    public boolean isQueued(String key) {
        return queued.contains(key);
    }

    void process(String key) {
        queued.remove(key);

        Pod pod = podLookup.apply(key);
        if (pod == null) {
            log.debug("Pod {} no longer exists, skipping", key);
            return;
        }

        try {
            ReconcileContext context = ReconcileContext.withTimeout(
                properties.isTestAllContainers(), Duration.ofMillis(properties.getReconcileTimeout()));
            podReconciler.reconcile(context, pod);
            log.debug("Reconciled pod {}", key);
        } catch (PodReconcileException e) {
            log.error(e.getMessage());
            enqueueAfter(key, properties.getRequeueDelay());
        } catch (RuntimeException e) {
            log.error("Unexpected error reconciling pod {}", key, e);
            enqueueAfter(key, properties.getRequeueDelay());
        }
    }
}
