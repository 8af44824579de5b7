package com.aitimeline.common.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * 타임라인 상태
 */
@Getter
@RequiredArgsConstructor
public enum TimelineStatus {

    DRAFT("draft", "작성중"),
    GENERATING("generating", "생성중"),
    READY("ready", "완료");

    private final String code;
    private final String description;
}
