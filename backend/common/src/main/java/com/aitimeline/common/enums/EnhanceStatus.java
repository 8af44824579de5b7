package com.aitimeline.common.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Arrays;

/**
 * 업스케일 상태
 * 작업(enhancement_jobs)은 QUEUED 부터 시작하고, NONE 은 세그먼트 projection 에서만 쓰인다.
 */
@Getter
@RequiredArgsConstructor
public enum EnhanceStatus {

    NONE("none", "미요청"),
    QUEUED("queued", "대기중"),
    PROCESSING("processing", "처리중"),
    DONE("done", "완료"),
    FAILED("failed", "실패");

    private final String code;
    private final String description;

    public boolean isTerminal() {
        return this == DONE || this == FAILED;
    }

    public static EnhanceStatus fromCode(String code) {
        return Arrays.stream(values())
                .filter(status -> status.code.equals(code))
                .findFirst()
                .orElse(NONE);
    }
}
