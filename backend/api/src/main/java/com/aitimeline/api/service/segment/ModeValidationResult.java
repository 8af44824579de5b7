package com.aitimeline.api.service.segment;

/**
 * 생성 모드 검증 결과 (valid 가 false 면 error 에 사유)
 */
public record ModeValidationResult(boolean valid, String error) {

    public static ModeValidationResult ok() {
        return new ModeValidationResult(true, null);
    }

    public static ModeValidationResult invalid(String error) {
        return new ModeValidationResult(false, error);
    }
}
