package com.vibecoding.versionchecker.reconciler;

import com.vibecoding.versionchecker.exception.ContainerProcessingException;
import com.vibecoding.versionchecker.exception.ContainerReconcileException;
import com.vibecoding.versionchecker.exception.PodReconcileException;
import com.vibecoding.versionchecker.exception.ReconcileCancelledException;
import com.vibecoding.versionchecker.options.OptionsResolver;
import com.vibecoding.versionchecker.options.OptionsResolverFactory;
import io.fabric8.kubernetes.api.model.Container;
import io.fabric8.kubernetes.api.model.Pod;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;

/**
 * Pod 단위 조정
 * 모든 컨테이너를 선언 순서대로 처리하고, 실패는 모아서 하나의 예외로 보고한다.
 * 앞선 컨테이너가 실패해도 나머지 컨테이너는 계속 처리한다.
 */
public class PodReconciler {

    private static final Logger log = LoggerFactory.getLogger(PodReconciler.class);

    private final OptionsResolverFactory resolverFactory;
    private final ContainerReconciler containerReconciler;
    private final ExecutorService containerExecutor;   // null 이면 순차 처리

    public PodReconciler(OptionsResolverFactory resolverFactory, ContainerReconciler containerReconciler) {
        this(resolverFactory, containerReconciler, null);
    }

    public PodReconciler(OptionsResolverFactory resolverFactory, ContainerReconciler containerReconciler,
                         ExecutorService containerExecutor) {
        this.resolverFactory = resolverFactory;
        this.containerReconciler = containerReconciler;
        this.containerExecutor = containerExecutor;
    }

    /**
     * Pod 조정
     *
     * @throws PodReconcileException 하나 이상의 컨테이너가 실패한 경우
     */
    public void reconcile(ReconcileContext context, Pod pod) {
        String namespace = pod.getMetadata().getNamespace();
        String podName = pod.getMetadata().getName();

        MDC.put("namespace", namespace);
        MDC.put("pod", podName);
        try {
            List<Container> containers = containersOf(pod);
            log.debug("Reconciling {} container(s) of pod {}/{}", containers.size(), namespace, podName);

            OptionsResolver resolver = resolverFactory.forAnnotations(pod.getMetadata().getAnnotations());

            List<ContainerReconcileException> failures = containerExecutor == null || containers.size() <= 1
                ? reconcileSequentially(context, pod, containers, resolver)
                : reconcileInParallel(context, pod, containers, resolver);

            if (!failures.isEmpty()) {
                throw new PodReconcileException(namespace, podName, failures);
            }
        } finally {
            MDC.remove("namespace");
            MDC.remove("pod");
        }
    }

    private List<ContainerReconcileException> reconcileSequentially(ReconcileContext context, Pod pod,
                                                                    List<Container> containers,
                                                                    OptionsResolver resolver) {
        List<ContainerReconcileException> failures = new ArrayList<>();
        for (Container container : containers) {
            ContainerReconcileException failure = reconcileOne(context, pod, container, resolver);
            if (failure != null) {
                failures.add(failure);
            }
        }
        return failures;
    }

    /**
     * 컨테이너별 결과를 인덱스 순으로 수집 (완료 순서와 무관하게 선언 순서 유지)
     */
    private List<ContainerReconcileException> reconcileInParallel(ReconcileContext context, Pod pod,
                                                                  List<Container> containers,
                                                                  OptionsResolver resolver) {
        Map<String, String> mdc = MDC.getCopyOfContextMap();
        List<Future<ContainerReconcileException>> futures = new ArrayList<>(containers.size());
        ContainerReconcileException[] results = new ContainerReconcileException[containers.size()];

        for (int i = 0; i < containers.size(); i++) {
            Container container = containers.get(i);
            try {
                futures.add(containerExecutor.submit(() -> {
                    if (mdc != null) {
                        MDC.setContextMap(mdc);
                    }
                    try {
                        return reconcileOne(context, pod, container, resolver);
                    } finally {
                        MDC.clear();
                    }
                }));
            } catch (RejectedExecutionException e) {
                futures.add(null);
                results[i] = new ContainerProcessingException(container.getName(),
                    new ReconcileCancelledException("container executor rejected task", e));
            }
        }

        for (int i = 0; i < futures.size(); i++) {
            Future<ContainerReconcileException> future = futures.get(i);
            if (future == null) {
                continue;
            }
            String containerName = containers.get(i).getName();
            try {
                results[i] = future.get();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                context.cancel();
                future.cancel(true);
                results[i] = new ContainerProcessingException(containerName,
                    new ReconcileCancelledException("reconcile interrupted", e));
            } catch (ExecutionException e) {
                results[i] = new ContainerProcessingException(containerName, e.getCause());
            }
        }

        List<ContainerReconcileException> failures = new ArrayList<>();
        for (ContainerReconcileException result : results) {
            if (result != null) {
                failures.add(result);
            }
        }
        return failures;
    }

    private ContainerReconcileException reconcileOne(ReconcileContext context, Pod pod, Container container,
                                                     OptionsResolver resolver) {
        try {
            containerReconciler.reconcileContainer(context, pod, container, resolver);
            return null;
        } catch (ContainerReconcileException e) {
            log.warn("Container {} of pod {}/{} failed: {}", container.getName(),
                pod.getMetadata().getNamespace(), pod.getMetadata().getName(), e.getMessage());
            return e;
        } catch (RuntimeException e) {
            log.error("Unexpected error reconciling container {} of pod {}/{}", container.getName(),
                pod.getMetadata().getNamespace(), pod.getMetadata().getName(), e);
            return new ContainerProcessingException(container.getName(), e);
        }
    }

    private List<Container> containersOf(Pod pod) {
        if (pod.getSpec() == null || pod.getSpec().getContainers() == null) {
            return Collections.emptyList();
        }
        return pod.getSpec().getContainers().stream()
            .filter(Objects::nonNull)
            .toList();
    }
}
