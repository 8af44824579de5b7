package com.aitimeline.common.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;

@Getter
@RequiredArgsConstructor
public enum ErrorCode {

    // Common
    INTERNAL_SERVER_ERROR(HttpStatus.INTERNAL_SERVER_ERROR, "C001", "서버 내부 오류가 발생했습니다."),
    INVALID_REQUEST(HttpStatus.BAD_REQUEST, "C002", "잘못된 요청입니다."),
    UNAUTHORIZED(HttpStatus.UNAUTHORIZED, "C003", "인증이 필요합니다."),
    FORBIDDEN(HttpStatus.FORBIDDEN, "C004", "접근 권한이 없습니다."),
    NOT_FOUND(HttpStatus.NOT_FOUND, "C005", "리소스를 찾을 수 없습니다."),

    // Timeline
    TIMELINE_NOT_FOUND(HttpStatus.NOT_FOUND, "T001", "타임라인을 찾을 수 없습니다."),
    NO_SEGMENTS(HttpStatus.BAD_REQUEST, "T002", "타임라인에 세그먼트가 없습니다."),
    TIMELINE_GENERATION_IN_PROGRESS(HttpStatus.CONFLICT, "T003", "타임라인이 이미 생성 중입니다. 완료 후 다시 시도해주세요."),

    // Segment
    SEGMENT_NOT_FOUND(HttpStatus.NOT_FOUND, "S001", "세그먼트를 찾을 수 없습니다."),
    INVALID_GENERATION_MODE(HttpStatus.BAD_REQUEST, "S002", "해당 위치에서 사용할 수 없는 생성 모드입니다."),
    CHAIN_INPUT_MISSING(HttpStatus.BAD_REQUEST, "S003", "이전 세그먼트의 마지막 프레임이 없습니다. 이전 세그먼트를 먼저 생성해주세요."),
    SEGMENT_GENERATION_IN_PROGRESS(HttpStatus.CONFLICT, "S004", "세그먼트가 이미 생성 중입니다. 완료 후 다시 시도해주세요."),
    SEGMENT_GENERATION_FAILED(HttpStatus.INTERNAL_SERVER_ERROR, "S005", "세그먼트 영상 생성에 실패했습니다."),
    SEGMENT_POSITION_CONFLICT(HttpStatus.CONFLICT, "S006", "같은 위치에 세그먼트가 먼저 추가되었습니다. 목록을 새로고침 후 다시 시도해주세요."),

    // Generation provider / model registry
    MODEL_NOT_FOUND(HttpStatus.BAD_REQUEST, "G001", "영상 생성 모델을 찾을 수 없습니다."),
    MODEL_CAPABILITY_UNSUPPORTED(HttpStatus.BAD_REQUEST, "G002", "모델이 요청한 생성 조건을 지원하지 않습니다."),
    GENERATION_PROVIDER_FAILED(HttpStatus.BAD_GATEWAY, "G003", "영상 생성 서비스 호출에 실패했습니다."),
    GENERATION_PROVIDER_UNAVAILABLE(HttpStatus.SERVICE_UNAVAILABLE, "G004", "영상 생성 서비스를 사용할 수 없습니다."),
    FRAME_EXTRACTION_FAILED(HttpStatus.INTERNAL_SERVER_ERROR, "G005", "프레임 추출에 실패했습니다."),

    // Enhancement
    UPSCALER_NOT_FOUND(HttpStatus.BAD_REQUEST, "E001", "업스케일러 모델을 찾을 수 없습니다."),
    UNSUPPORTED_SCALE_FACTOR(HttpStatus.BAD_REQUEST, "E002", "지원하지 않는 배율입니다."),
    ENHANCEMENT_JOB_NOT_FOUND(HttpStatus.NOT_FOUND, "E003", "업스케일 작업을 찾을 수 없습니다."),
    ENHANCEMENT_JOB_NOT_QUEUED(HttpStatus.CONFLICT, "E004", "대기 상태의 작업만 처리할 수 있습니다."),
    ENHANCEMENT_PROVIDER_FAILED(HttpStatus.BAD_GATEWAY, "E005", "업스케일 서비스 호출에 실패했습니다."),

    // Storage
    STORAGE_FAILED(HttpStatus.INTERNAL_SERVER_ERROR, "F001", "파일 저장에 실패했습니다.");

    private final HttpStatus status;
    private final String code;
    private final String message;
}
