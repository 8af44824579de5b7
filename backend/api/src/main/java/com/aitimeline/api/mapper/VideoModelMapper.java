package com.aitimeline.api.mapper;

import com.aitimeline.api.entity.VideoModelCapability;
import org.apache.ibatis.annotations.Mapper;

import java.util.List;
import java.util.Optional;

@Mapper
public interface VideoModelMapper {

    Optional<VideoModelCapability> findCapabilityByModelId(String modelId);

    List<VideoModelCapability> findAllActiveCapabilities();
}
