package com.vibecoding.versionchecker.metrics;

import com.vibecoding.versionchecker.model.ImageMetricEntry;

/**
 * 컨테이너 이미지 메트릭 저장소
 * (namespace, pod, container) 당 최대 1개의 항목을 유지한다.
 * 두 연산 모두 동시 호출에 안전하고 멱등이어야 한다.
 */
public interface ImageMetricsStore {

    /**
     * 항목 추가 또는 교체
     */
    void addImage(ImageMetricEntry entry);

    /**
     * 항목 삭제 (없으면 무시)
     */
    void removeImage(String namespace, String pod, String container);
}
