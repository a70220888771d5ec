package com.whu.cosmicam.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.whu.cosmicam.model.CameraProfile;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 最新图片查询结果
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class LatestImageVo {

    private String path;               // 前端访问路径 /images/{文件名}
    private LocalDateTime timestamp;   // 图片创建时间 (参考时区)

    @JsonProperty("sun_phase")
    private String sunPhase;

    @JsonProperty("camera_profile")
    private String profileName;

    @JsonProperty("camera_settings")
    private CameraProfile profileSettings;
}
