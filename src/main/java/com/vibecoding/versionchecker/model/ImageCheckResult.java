package com.vibecoding.versionchecker.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 컨테이너 이미지 버전 검사 결과
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ImageCheckResult {
    private String imageUrl;
    private String currentVersion;
    private String latestVersion;
    private boolean latest;           // 현재 버전이 최신인지 여부
    private String os;
    private String architecture;
}
