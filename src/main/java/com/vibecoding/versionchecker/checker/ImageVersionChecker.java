package com.vibecoding.versionchecker.checker;

import com.vibecoding.versionchecker.model.CheckOutcome;
import com.vibecoding.versionchecker.model.ImageOptions;
import com.vibecoding.versionchecker.reconciler.ReconcileContext;
import io.fabric8.kubernetes.api.model.Container;
import io.fabric8.kubernetes.api.model.Pod;

/**
 * 컨테이너 이미지 버전 검사기 인터페이스
 * 레지스트리 조회와 "최신" 판정은 구현체의 책임이다.
 */
public interface ImageVersionChecker {

    /**
     * 컨테이너 이미지 버전 검사
     *
     * <ul>
     *   <li>결과가 아직 없으면 {@link CheckOutcome#pending()}</li>
     *   <li>조건에 맞는 버전이 없으면 NO_VERSION_FOUND</li>
     *   <li>컨텍스트가 취소되거나 기한을 넘기면 FAILED ({@code ReconcileCancelledException})</li>
     * </ul>
     *
     * <p>시간 초과 시 실행 스레드가 인터럽트되므로 구현체는 인터럽트에 응답해야 한다.
     * 응답하지 않는 검사는 종료될 때까지 검사 스레드를 하나 점유한다.
     */
    CheckOutcome check(ReconcileContext context, Pod pod, Container container, ImageOptions options);
}
