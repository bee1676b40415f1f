package com.vibecoding.versionchecker.config;

import com.vibecoding.versionchecker.checker.DeferringVersionChecker;
import com.vibecoding.versionchecker.checker.ImageVersionChecker;
import com.vibecoding.versionchecker.checker.TimeBoundVersionChecker;
import com.vibecoding.versionchecker.metrics.ImageMetricsStore;
import com.vibecoding.versionchecker.metrics.MicrometerImageMetricsStore;
import com.vibecoding.versionchecker.options.OptionsResolverFactory;
import com.vibecoding.versionchecker.reconciler.CheckResultInterpreter;
import com.vibecoding.versionchecker.reconciler.ContainerReconciler;
import com.vibecoding.versionchecker.reconciler.PodReconciler;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientBuilder;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * 조정 파이프라인 구성
 * 버전 검사기는 외부에서 {@link ImageVersionChecker} 빈으로 제공하며, 없으면 모든 검사를 보류한다.
 */
@Configuration
public class ReconcilerConfig {

    private static final int VERSION_CHECK_POOL_GROWTH = 4;

    @Bean
    @ConditionalOnMissingBean(ImageMetricsStore.class)
    public ImageMetricsStore imageMetricsStore(MeterRegistry meterRegistry) {
        return new MicrometerImageMetricsStore(meterRegistry);
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService versionCheckExecutor(VersionCheckerProperties properties) {
        return newVersionCheckPool(properties.getReconcile().getContainerParallelism());
    }

    /**
     * 버전 검사 스레드 풀
     * 인터럽트를 무시하고 멈춘 검사가 스레드를 점유해도 최대 스레드 수까지는 새 스레드로 계속 검사한다.
     * 최대치에 도달하면 작업이 거부되어 해당 검사는 실패로 처리된다.
     */
    static ThreadPoolExecutor newVersionCheckPool(int parallelism) {
        int coreThreads = Math.max(4, parallelism);
        return new ThreadPoolExecutor(coreThreads, coreThreads * VERSION_CHECK_POOL_GROWTH,
            60L, TimeUnit.SECONDS, new SynchronousQueue<>(), new CustomizableThreadFactory("version-check-"));
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService containerReconcileExecutor(VersionCheckerProperties properties) {
        return Executors.newFixedThreadPool(properties.getReconcile().getContainerParallelism(),
            new CustomizableThreadFactory("container-reconcile-"));
    }

    @Bean
    public CheckResultInterpreter checkResultInterpreter(
            ObjectProvider<ImageVersionChecker> checkerProvider,
            @Qualifier("versionCheckExecutor") ExecutorService versionCheckExecutor,
            ImageMetricsStore metricsStore,
            VersionCheckerProperties properties) {
        ImageVersionChecker checker = checkerProvider.getIfAvailable(DeferringVersionChecker::new);
        ImageVersionChecker timeBound = new TimeBoundVersionChecker(
            checker, versionCheckExecutor, Duration.ofMillis(properties.getCheckTimeout()));
        return new CheckResultInterpreter(timeBound, metricsStore);
    }

    @Bean
    public PodReconciler podReconciler(
            OptionsResolverFactory resolverFactory,
            ContainerReconciler containerReconciler,
            @Qualifier("containerReconcileExecutor") ExecutorService containerReconcileExecutor,
            VersionCheckerProperties properties) {
        if (properties.getReconcile().getContainerParallelism() > 1) {
            return new PodReconciler(resolverFactory, containerReconciler, containerReconcileExecutor);
        }
        return new PodReconciler(resolverFactory, containerReconciler);
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean(KubernetesClient.class)
    @ConditionalOnProperty(prefix = "version-checker.watch", name = "enabled", havingValue = "true",
        matchIfMissing = true)
    public KubernetesClient kubernetesClient() {
        // in-cluster 서비스 어카운트 또는 ~/.kube/config 자동 설정
        return new KubernetesClientBuilder().build();
    }
}
