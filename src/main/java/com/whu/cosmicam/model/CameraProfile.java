package com.whu.cosmicam.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 相机拍摄参数组 (一个具名 profile)
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class CameraProfile {

    // 快门时间，单位微秒，0 表示自动
    @JsonProperty("shutter_speed")
    private Integer shutterSpeed;

    // 增益，0 表示自动
    private Double gain;

    // 亮度：0 是有效值，null 才表示未设置
    private Double brightness;

    // 对比度，必须大于 0
    private Double contrast;

    public CameraProfile copy() {
        return new CameraProfile(shutterSpeed, gain, brightness, contrast);
    }
}
