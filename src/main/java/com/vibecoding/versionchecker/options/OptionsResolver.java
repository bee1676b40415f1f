package com.vibecoding.versionchecker.options;

import com.vibecoding.versionchecker.exception.InvalidAnnotationException;
import com.vibecoding.versionchecker.model.ImageOptions;

/**
 * Pod 하나의 어노테이션에서 컨테이너별 검사 설정을 조회하는 인터페이스
 */
public interface OptionsResolver {

    /**
     * 컨테이너 검사 활성화 여부
     *
     * @param defaultEnabled 어노테이션이 없을 때 적용할 기본값
     * @param containerName  컨테이너 이름
     */
    boolean isEnabled(boolean defaultEnabled, String containerName);

    /**
     * 컨테이너 검사 옵션 생성
     *
     * @throws InvalidAnnotationException 어노테이션 값이 잘못된 경우
     */
    ImageOptions options(String containerName);
}
