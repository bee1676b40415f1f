package com.vibecoding.versionchecker.reconciler;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Pod 조정 1회에 대한 실행 컨텍스트
 * - 기본 활성화 여부 (test-all-containers) 를 명시적으로 전달
 * - 취소 신호와 기한을 버전 검사기까지 전달
 */
public final class ReconcileContext {

    private final boolean defaultTestAll;
    private final Instant deadline;   // null 이면 기한 없음
    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    private ReconcileContext(boolean defaultTestAll, Instant deadline) {
        this.defaultTestAll = defaultTestAll;
        this.deadline = deadline;
    }

    public static ReconcileContext of(boolean defaultTestAll) {
        return new ReconcileContext(defaultTestAll, null);
    }

    public static ReconcileContext withTimeout(boolean defaultTestAll, Duration timeout) {
        return new ReconcileContext(defaultTestAll, Instant.now().plus(timeout));
    }

    public boolean isDefaultTestAll() {
        return defaultTestAll;
    }

    public Optional<Instant> getDeadline() {
        return Optional.ofNullable(deadline);
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * 취소되었거나 기한이 지났는지 확인
     */
    public boolean isDone() {
        return isCancelled() || (deadline != null && !Instant.now().isBefore(deadline));
    }

    /**
     * 남은 시간 (기한이 없으면 empty, 지났으면 ZERO)
     */
    public Optional<Duration> remaining() {
        if (deadline == null) {
            return Optional.empty();
        }
        Duration left = Duration.between(Instant.now(), deadline);
        return Optional.of(left.isNegative() ? Duration.ZERO : left);
    }

    public String doneReason() {
        return isCancelled() ? "reconcile canceled" : "reconcile deadline exceeded";
    }
}
