package com.vibecoding.versionchecker.watch;

import com.vibecoding.versionchecker.metrics.ImageMetricsStore;
import io.fabric8.kubernetes.api.model.Container;
import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.client.informers.ResourceEventHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Pod 이벤트 핸들러
 * 추가/변경(재동기화 포함) 시 조정 큐에 넣고, 삭제 시 해당 Pod 의 메트릭을 모두 제거한다.
 */
public class PodEventHandler implements ResourceEventHandler<Pod> {

    private static final Logger log = LoggerFactory.getLogger(PodEventHandler.class);

    private final ReconcileQueue queue;
    private final ImageMetricsStore metricsStore;

    public PodEventHandler(ReconcileQueue queue, ImageMetricsStore metricsStore) {
        this.queue = queue;
        this.metricsStore = metricsStore;
    }

    @Override
    public void onAdd(Pod pod) {
        queue.enqueue(ReconcileQueue.keyOf(pod));
    }

    @Override
    public void onUpdate(Pod oldPod, Pod newPod) {
        queue.enqueue(ReconcileQueue.keyOf(newPod));
    }

    @Override
    public void onDelete(Pod pod, boolean deletedFinalStateUnknown) {
        String namespace = pod.getMetadata().getNamespace();
        String podName = pod.getMetadata().getName();
        log.debug("Pod {}/{} deleted, removing image metrics", namespace, podName);

        if (pod.getSpec() == null || pod.getSpec().getContainers() == null) {
            return;
        }
        for (Container container : pod.getSpec().getContainers()) {
            metricsStore.removeImage(namespace, podName, container.getName());
        }
    }
}
