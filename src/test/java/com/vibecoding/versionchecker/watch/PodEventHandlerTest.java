package com.vibecoding.versionchecker.watch;

import com.vibecoding.versionchecker.TestPods;
import com.vibecoding.versionchecker.metrics.ImageMetricsStore;
import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.api.model.PodBuilder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Map;

import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class PodEventHandlerTest {

    @Mock
    private ReconcileQueue queue;

    @Mock
    private ImageMetricsStore metricsStore;

    private PodEventHandler handler;

    @BeforeEach
    void setUp() {
        handler = new PodEventHandler(queue, metricsStore);
    }

    @Test
    void onAdd_ShouldEnqueuePodKey() {
        handler.onAdd(TestPods.pod("kube-system", "dns", Map.of(), "coredns"));

        verify(queue).enqueue("kube-system/dns");
        verifyNoInteractions(metricsStore);
    }

    @Test
    void onUpdate_ShouldEnqueueNewPodKey() {
        Pod oldPod = TestPods.pod("app");
        Pod newPod = TestPods.pod("app", "sidecar");

        handler.onUpdate(oldPod, newPod);

        verify(queue).enqueue("default/web");
    }

    @Test
    void onDelete_ShouldRemoveMetricsForEveryContainer() {
        handler.onDelete(TestPods.pod("app", "sidecar"), false);

        verify(metricsStore).removeImage("default", "web", "app");
        verify(metricsStore).removeImage("default", "web", "sidecar");
        verifyNoMoreInteractions(metricsStore);
        verifyNoInteractions(queue);
    }

    @Test
    void onDelete_PodWithoutSpec_ShouldDoNothing() {
        Pod pod = new PodBuilder().withNewMetadata().withNamespace("default").withName("bare").endMetadata().build();

        handler.onDelete(pod, true);

        verifyNoInteractions(metricsStore, queue);
    }
}
