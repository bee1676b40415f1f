package com.vibecoding.versionchecker.model;

import com.vibecoding.versionchecker.exception.NoVersionFoundException;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Objects;
import java.util.Set;

/**
 * 버전 검사 결과 (RESULT / PENDING / NO_VERSION_FOUND / FAILED)
 *
 * <p>호출자는 메시지 문자열이 아니라 {@link #getType()} 으로 분기한다.
 * RESULT 일 때만 {@link #getResult()} 가, NO_VERSION_FOUND / FAILED 일 때만 {@link #getError()} 가 존재한다.
 */
@Getter
@ToString
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class CheckOutcome {

    private static final CheckOutcome PENDING = new CheckOutcome(CheckOutcomeType.PENDING, null, null);

    private final CheckOutcomeType type;
    private final ImageCheckResult result;
    private final RuntimeException error;

    public static CheckOutcome result(ImageCheckResult result) {
        return new CheckOutcome(CheckOutcomeType.RESULT, Objects.requireNonNull(result, "result"), null);
    }

    public static CheckOutcome pending() {
        return PENDING;
    }

    public static CheckOutcome noVersionFound(NoVersionFoundException error) {
        return new CheckOutcome(CheckOutcomeType.NO_VERSION_FOUND, null, Objects.requireNonNull(error, "error"));
    }

    /**
     * 실패 결과 생성
     * 원인 체인에 {@link NoVersionFoundException} 이 있으면 NO_VERSION_FOUND 로 분류한다.
     */
    public static CheckOutcome failed(RuntimeException error) {
        Objects.requireNonNull(error, "error");
        NoVersionFoundException noVersionFound = findNoVersionFound(error);
        if (noVersionFound != null) {
            return noVersionFound(noVersionFound);
        }
        return new CheckOutcome(CheckOutcomeType.FAILED, null, error);
    }

    /**
     * 검사기가 던진 예외를 결과로 변환
     */
    public static CheckOutcome fromException(RuntimeException error) {
        return failed(error);
    }

    private static NoVersionFoundException findNoVersionFound(Throwable error) {
        Set<Throwable> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        for (Throwable current = error; current != null && seen.add(current); current = current.getCause()) {
            if (current instanceof NoVersionFoundException noVersionFound) {
                return noVersionFound;
            }
        }
        return null;
    }

    public boolean isNoVersionFound() {
        return type == CheckOutcomeType.NO_VERSION_FOUND;
    }

    public boolean isFailed() {
        return type == CheckOutcomeType.FAILED;
    }
}
