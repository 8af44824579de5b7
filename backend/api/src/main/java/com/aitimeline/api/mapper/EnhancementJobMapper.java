package com.aitimeline.api.mapper;

import com.aitimeline.api.entity.EnhancementJob;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.List;
import java.util.Optional;

@Mapper
public interface EnhancementJobMapper {

    void insert(EnhancementJob job);

    Optional<EnhancementJob> findById(Long jobId);

    /**
     * 세그먼트의 작업 이력 (최신순)
     */
    List<EnhancementJob> findBySegmentId(Long segmentId);

    /**
     * queued / processing 작업 (생성순)
     */
    List<EnhancementJob> findPendingByTimelineId(Long timelineId);

    /**
     * 아직 시작되지 않은 작업 id (생성순)
     */
    List<Long> findQueuedJobIds();

    /**
     * queued → processing (started_at, progress = 0)
     * @return 변경된 row 수 (0 이면 queued 상태가 아님)
     */
    int markProcessing(Long jobId);

    int updateProgress(@Param("jobId") Long jobId, @Param("progress") Integer progress);

    /**
     * processing → done
     */
    int markDone(@Param("jobId") Long jobId,
                 @Param("outputUrl") String outputUrl,
                 @Param("processingTimeSec") Double processingTimeSec);

    /**
     * queued | processing → failed
     */
    int markFailed(@Param("jobId") Long jobId,
                   @Param("errorMessage") String errorMessage,
                   @Param("processingTimeSec") Double processingTimeSec);

    void deleteByTimelineId(Long timelineId);
}
