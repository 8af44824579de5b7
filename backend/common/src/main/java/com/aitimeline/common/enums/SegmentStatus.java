package com.aitimeline.common.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * 세그먼트 생성 상태
 */
@Getter
@RequiredArgsConstructor
public enum SegmentStatus {

    PENDING("pending", "대기중"),
    GENERATING("generating", "생성중"),
    GENERATED("generated", "생성 완료"),
    ERROR("error", "실패");

    private final String code;
    private final String description;
}
