package com.vibecoding.versionchecker.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 메트릭 저장소에 기록되는 컨테이너 이미지 항목
 * (namespace, pod, container) 조합이 키
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ImageMetricEntry {
    private String namespace;
    private String pod;
    private String container;
    private String imageUrl;
    private boolean latest;
    private String currentVersion;
    private String latestVersion;
    private String os;
    private String arch;
}
