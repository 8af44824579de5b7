package com.aitimeline.api.service.segment;

import com.aitimeline.common.enums.GenerationMode;
import com.aitimeline.common.exception.ApiException;
import com.aitimeline.common.exception.ErrorCode;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * 위치별 생성 모드 규칙
 * position 0 은 모든 모드, 이후 세그먼트는 image-to-video 만 허용 (프레임 체이닝)
 */
@Component
public class GenerationModeValidator {

    static final String SUBSEQUENT_SEGMENT_ERROR =
            "Only the first segment can use text-to-video, video-to-video, or first-frame-to-video modes. "
            + "Subsequent segments must use image-to-video with frame chaining.";

    public ModeValidationResult validate(Integer position, String modeCode) {
        if (position == null || position < 0) {
            return ModeValidationResult.invalid("position 은 0 이상이어야 합니다");
        }

        Optional<GenerationMode> mode = GenerationMode.fromCode(modeCode);
        if (mode.isEmpty()) {
            return ModeValidationResult.invalid("지원하지 않는 생성 모드입니다: " + modeCode);
        }

        if (position > 0 && mode.get() != GenerationMode.IMAGE_TO_VIDEO) {
            return ModeValidationResult.invalid(SUBSEQUENT_SEGMENT_ERROR);
        }
        return ModeValidationResult.ok();
    }

    /**
     * 검증 후 모드 반환, 실패 시 INVALID_GENERATION_MODE
     */
    public GenerationMode requireValid(Integer position, String modeCode) {
        ModeValidationResult result = validate(position, modeCode);
        if (!result.valid()) {
            throw new ApiException(ErrorCode.INVALID_GENERATION_MODE, result.error());
        }
        return GenerationMode.fromCode(modeCode).orElseThrow();
    }

    public List<String> availableModes(int position) {
        if (position > 0) {
            return List.of(GenerationMode.IMAGE_TO_VIDEO.getCode());
        }
        return Arrays.stream(GenerationMode.values())
                .map(GenerationMode::getCode)
                .collect(Collectors.toList());
    }
}
