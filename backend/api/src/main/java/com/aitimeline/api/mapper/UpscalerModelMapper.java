package com.aitimeline.api.mapper;

import com.aitimeline.api.entity.UpscalerModel;
import org.apache.ibatis.annotations.Mapper;

import java.util.List;

@Mapper
public interface UpscalerModelMapper {

    /**
     * 활성 업스케일러 (priority, quality_score 순)
     */
    List<UpscalerModel> findAllActive();
}
