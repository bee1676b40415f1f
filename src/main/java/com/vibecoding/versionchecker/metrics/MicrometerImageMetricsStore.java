package com.vibecoding.versionchecker.metrics;

import com.vibecoding.versionchecker.model.ImageMetricEntry;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer 게이지 기반 메트릭 저장소
 *
 * <p>{@value #METRIC_NAME} 게이지는 최신 버전이면 1, 아니면 0 이다.
 * 태그가 바뀌면 기존 게이지를 제거하고 새로 등록한다.
 */
public class MicrometerImageMetricsStore implements ImageMetricsStore {

    private static final Logger log = LoggerFactory.getLogger(MicrometerImageMetricsStore.class);

    public static final String METRIC_NAME = "version_checker_is_latest_version";

    private final MeterRegistry registry;
    private final ConcurrentHashMap<ContainerKey, Registration> registrations = new ConcurrentHashMap<>();

    public MicrometerImageMetricsStore(MeterRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void addImage(ImageMetricEntry entry) {
        ContainerKey key = new ContainerKey(entry.getNamespace(), entry.getPod(), entry.getContainer());
        Tags tags = tagsOf(entry);
        int value = entry.isLatest() ? 1 : 0;

        registrations.compute(key, (k, existing) -> {
            if (existing != null && existing.tags().equals(tags)) {
                existing.value().set(value);
                return existing;
            }
            if (existing != null) {
                registry.remove(existing.meterId());
            }
            AtomicInteger holder = new AtomicInteger(value);
            Gauge gauge = Gauge.builder(METRIC_NAME, holder, AtomicInteger::get)
                .description("Whether the container image is using the latest version")
                .tags(tags)
                .strongReference(true)
                .register(registry);
            return new Registration(gauge.getId(), tags, holder);
        });

        log.debug("Recorded image metric for {}/{}/{}", key.namespace(), key.pod(), key.container());
    }

    @Override
    public void removeImage(String namespace, String pod, String container) {
        Registration removed = registrations.remove(new ContainerKey(namespace, pod, container));
        if (removed != null) {
            registry.remove(removed.meterId());
            log.debug("Removed image metric for {}/{}/{}", namespace, pod, container);
        }
    }

    /**
     * 현재 등록된 항목 수
     */
    public int size() {
        return registrations.size();
    }

    private static Tags tagsOf(ImageMetricEntry entry) {
        return Tags.of(
            "namespace", safeTag(entry.getNamespace()),
            "pod", safeTag(entry.getPod()),
            "container", safeTag(entry.getContainer()),
            "image", safeTag(entry.getImageUrl()),
            "current_version", safeTag(entry.getCurrentVersion()),
            "latest_version", safeTag(entry.getLatestVersion()),
            "os", safeTag(entry.getOs()),
            "arch", safeTag(entry.getArch())
        );
    }

    private static String safeTag(String raw) {
        return raw == null ? "" : raw;
    }

    private record ContainerKey(String namespace, String pod, String container) {
    }

    private record Registration(Meter.Id meterId, Tags tags, AtomicInteger value) {
    }
}
