package com.aitimeline.api.service.segment;

import com.aitimeline.api.entity.Segment;
import com.aitimeline.common.exception.ApiException;
import com.aitimeline.common.exception.ErrorCode;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * 프레임 체이닝 입력 계산
 * 세그먼트 목록은 position 오름차순이어야 한다.
 */
@Component
public class FrameChainResolver {

    /**
     * 이전 세그먼트의 마지막 프레임 (첫 세그먼트거나 아직 없으면 empty)
     */
    public Optional<String> chainInput(List<Segment> ordered, int index) {
        if (index <= 0 || index >= ordered.size()) {
            return Optional.empty();
        }
        Segment previous = ordered.get(index - 1);
        if (!previous.isGenerated() || previous.getLastFrameUrl() == null) {
            return Optional.empty();
        }
        return Optional.of(previous.getLastFrameUrl());
    }

    /**
     * 체이닝 입력 필수 (index > 0)
     */
    public String requireChainInput(List<Segment> ordered, int index) {
        return chainInput(ordered, index).orElseThrow(() -> new ApiException(ErrorCode.CHAIN_INPUT_MISSING,
                String.format("이전 세그먼트(position %d)가 아직 생성되지 않았습니다", index - 1)));
    }

    public Long previousSegmentId(List<Segment> ordered, int index) {
        if (index <= 0 || index > ordered.size()) {
            return null;
        }
        return ordered.get(index - 1).getSegmentId();
    }

    public int indexOf(List<Segment> ordered, Long segmentId) {
        for (int i = 0; i < ordered.size(); i++) {
            if (ordered.get(i).getSegmentId().equals(segmentId)) {
                return i;
            }
        }
        return -1;
    }
}
