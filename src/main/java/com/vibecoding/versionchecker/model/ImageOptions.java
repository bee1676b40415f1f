package com.vibecoding.versionchecker.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 컨테이너별 버전 검사 옵션 (Pod 어노테이션에서 생성)
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ImageOptions {
    private String overrideUrl;       // 레지스트리 URL 대체
    private boolean useSha;           // 태그 대신 SHA 비교
    private boolean resolveShaToTags;
    private boolean useMetadata;      // semver 메타데이터 허용
    private String matchRegex;        // 태그가 일치해야 하는 정규식
    private Long pinMajor;
    private Long pinMinor;
    private Long pinPatch;
}
