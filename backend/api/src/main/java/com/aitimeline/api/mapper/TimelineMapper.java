package com.aitimeline.api.mapper;

import com.aitimeline.api.entity.Timeline;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.List;
import java.util.Optional;

@Mapper
public interface TimelineMapper {

    void insert(Timeline timeline);

    Optional<Timeline> findById(Long timelineId);

    List<Timeline> findByUserId(Long userId);

    void updateStatus(@Param("timelineId") Long timelineId, @Param("status") String status);

    /**
     * generating 이 아닌 경우에만 generating 으로 전환
     * @return 변경된 row 수 (0 이면 이미 생성 중)
     */
    int markGenerating(Long timelineId);

    /**
     * segment_count / total_duration_sec 재계산
     */
    void recountSegments(Long timelineId);

    void delete(Long timelineId);
}
