package com.aitimeline.api.mapper;

import com.aitimeline.api.entity.Segment;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.List;
import java.util.Optional;

@Mapper
public interface SegmentMapper {

    void insert(Segment segment);

    Optional<Segment> findById(Long segmentId);

    List<Segment> findByTimelineIdOrderByPosition(Long timelineId);

    Optional<Segment> findByTimelineIdAndPosition(@Param("timelineId") Long timelineId,
                                                  @Param("position") Integer position);

    void delete(Long segmentId);

    void deleteByTimelineId(Long timelineId);

    /**
     * 삭제된 위치 이후 세그먼트의 position 을 음수로 옮긴다.
     * (timeline_id, position) UNIQUE 제약 때문에 {@link #shiftParkedPositions} 와 함께 두 단계로 당긴다.
     */
    void parkPositionsAfter(@Param("timelineId") Long timelineId, @Param("position") Integer position);

    /**
     * 음수로 옮겨 둔 세그먼트를 한 칸 앞 위치로 되돌리고 첫 세그먼트 플래그 재계산
     */
    void shiftParkedPositions(Long timelineId);

    // ========== 생성 ==========

    /**
     * 생성 lease 획득: generating 이 아니고 version 이 일치할 때만 generating 으로 전환
     * @return 변경된 row 수 (0 이면 다른 생성이 진행 중)
     */
    int acquireGenerationLease(@Param("segmentId") Long segmentId, @Param("version") Integer version);

    void updateGenerationInput(@Param("segmentId") Long segmentId,
                               @Param("generationMode") String generationMode,
                               @Param("isFirstSegment") Boolean isFirstSegment,
                               @Param("sourceUrl") String sourceUrl,
                               @Param("promptText") String promptText);

    /**
     * 생성 성공 결과 저장 (generating 상태에서만)
     */
    int updateGenerationResult(@Param("segmentId") Long segmentId,
                               @Param("videoUrl") String videoUrl,
                               @Param("firstFrameUrl") String firstFrameUrl,
                               @Param("lastFrameUrl") String lastFrameUrl,
                               @Param("thumbnailUrl") String thumbnailUrl,
                               @Param("generationTimeSec") Double generationTimeSec);

    void updateGenerationError(@Param("segmentId") Long segmentId, @Param("errorMessage") String errorMessage);

    // ========== 편집 ==========

    void updateMode(@Param("segmentId") Long segmentId,
                    @Param("generationMode") String generationMode,
                    @Param("sourceUrl") String sourceUrl);

    /**
     * 프롬프트/모션/카메라/전환 정보 부분 수정 (null 필드는 유지)
     */
    void updateDetails(Segment segment);

    // ========== 업스케일 projection ==========

    void updateEnhanceSelection(@Param("segmentId") Long segmentId,
                                @Param("enhanceEnabled") Boolean enhanceEnabled,
                                @Param("enhanceModel") String enhanceModel);

    void enableEnhanceForTimeline(@Param("timelineId") Long timelineId, @Param("enhanceModel") String enhanceModel);

    /**
     * 작업 상태를 세그먼트에 반영. 같은 세그먼트에 jobId 보다 나중 작업이 있으면 반영하지 않는다.
     * @return 변경된 row 수 (0 이면 더 최근 작업이 projection 을 소유)
     */
    int updateEnhanceProjection(@Param("segmentId") Long segmentId,
                                @Param("jobId") Long jobId,
                                @Param("enhanceModel") String enhanceModel,
                                @Param("enhanceStatus") String enhanceStatus,
                                @Param("enhancedVideoUrl") String enhancedVideoUrl,
                                @Param("enhanceError") String enhanceError);

    /**
     * 업스케일 대상: enhance_enabled = 1 이고 아직 done 이 아닌 세그먼트
     */
    List<Segment> findEnhanceEligibleByTimelineId(Long timelineId);
}
