package com.whu.cosmicam.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.whu.cosmicam.model.CameraProfile;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 当前相机 profile 查询结果
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class CameraProfileVo {

    @JsonProperty("current_profile")
    private String profileName;

    private CameraProfile settings;

    @JsonProperty("sun_phase")
    private String sunPhase;
}
