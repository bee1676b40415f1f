package com.vibecoding.versionchecker.model;

/**
 * 버전 검사 결과 유형
 */
public enum CheckOutcomeType {
    RESULT("Result", "검사 결과 있음"),
    PENDING("Pending", "아직 결과 없음 (오류 아님)"),
    NO_VERSION_FOUND("NoVersionFound", "검색 조건에 맞는 버전 없음"),
    FAILED("Failed", "검사 실패");

    private final String displayName;
    private final String description;

    CheckOutcomeType(String displayName, String description) {
        this.displayName = displayName;
        this.description = description;
    }

    public String getDisplayName() {
        return displayName;
    }

    public String getDescription() {
        return description;
    }
}
