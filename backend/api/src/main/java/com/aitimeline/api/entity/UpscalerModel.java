package com.aitimeline.api.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.List;

/**
 * 업스케일러 모델 레지스트리 (읽기 전용)
 */
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UpscalerModel {
    private String id;
    private String provider;          // replicate, topaz, google, stability
    private String displayName;
    private String description;
    private List<Integer> scaleFactors;
    private String maxOutputResolution;
    private Boolean supportsVideo;
    private Integer qualityScore;
    private Integer creditsPerUse;
    private Integer priority;
    private String providerVersion;   // Replicate model version hash
    private Boolean isActive;

    public boolean supportsScale(int scaleFactor) {
        return scaleFactors != null && scaleFactors.contains(scaleFactor);
    }
}
