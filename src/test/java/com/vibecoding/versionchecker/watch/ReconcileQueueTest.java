package com.vibecoding.versionchecker.watch;

import com.vibecoding.versionchecker.TestPods;
import com.vibecoding.versionchecker.config.VersionCheckerProperties;
import com.vibecoding.versionchecker.exception.ImageCheckFailedException;
import com.vibecoding.versionchecker.exception.PodReconcileException;
import com.vibecoding.versionchecker.reconciler.PodReconciler;
import com.vibecoding.versionchecker.reconciler.ReconcileContext;
import io.fabric8.kubernetes.api.model.Pod;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ReconcileQueueTest {

    @Mock
    private PodReconciler podReconciler;

    @Mock
    private ScheduledExecutorService scheduler;

    private final Map<String, Pod> pods = new HashMap<>();
    private VersionCheckerProperties properties;
    private ReconcileQueue queue;

    @BeforeEach
    void setUp() {
        properties = new VersionCheckerProperties();
        properties.setTestAllContainers(true);
        properties.setRequeueDelay(5000L);
        queue = new ReconcileQueue(pods::get, podReconciler, scheduler, properties);
    }

    @Test
    void keyOf_ShouldJoinNamespaceAndName() {
        assertEquals("default/web", ReconcileQueue.keyOf(TestPods.pod("app")));
    }

    @Test
    void enqueue_SameKeyTwice_ShouldScheduleOnce() {
        queue.enqueue("default/web");
        queue.enqueue("default/web");

        verify(scheduler, times(1)).schedule(any(Runnable.class), eq(0L), eq(TimeUnit.MILLISECONDS));
        assertTrue(queue.isQueued("default/web"));
    }

    @Test
    void enqueue_SchedulerShutDown_ShouldNotStayQueued() {
        when(scheduler.schedule(any(Runnable.class), eq(0L), eq(TimeUnit.MILLISECONDS)))
            .thenThrow(new RejectedExecutionException("shut down"));

        queue.enqueue("default/web");

        assertFalse(queue.isQueued("default/web"));
    }

    @Test
    void process_ExistingPod_ShouldReconcileWithConfiguredDefault() {
        Pod pod = TestPods.pod("app");
        pods.put("default/web", pod);

        queue.process("default/web");

        ArgumentCaptor<ReconcileContext> captor = ArgumentCaptor.forClass(ReconcileContext.class);
        verify(podReconciler).reconcile(captor.capture(), eq(pod));
        assertTrue(captor.getValue().isDefaultTestAll());
        assertTrue(captor.getValue().getDeadline().isPresent());
        verifyNoInteractions(scheduler);
    }

    @Test
    void process_MissingPod_ShouldSkip() {
        queue.process("default/gone");

        verifyNoInteractions(podReconciler, scheduler);
    }

    @Test
    void process_ReconcileFailure_ShouldRequeueAfterDelay() {
        Pod pod = TestPods.pod("app");
        pods.put("default/web", pod);
        doThrow(new PodReconcileException("default", "web",
            List.of(new ImageCheckFailedException("app", new IllegalStateException("timeout")))))
            .when(podReconciler).reconcile(any(), eq(pod));

        queue.process("default/web");

        verify(scheduler).schedule(any(Runnable.class), eq(5000L), eq(TimeUnit.MILLISECONDS));
        assertTrue(queue.isQueued("default/web"));
    }

    @Test
    void process_ShouldAllowKeyToBeQueuedAgain() {
        queue.enqueue("default/web");
        queue.process("default/web");

        assertFalse(queue.isQueued("default/web"));
        queue.enqueue("default/web");

        verify(scheduler, times(2)).schedule(any(Runnable.class), eq(0L), eq(TimeUnit.MILLISECONDS));
    }
}
