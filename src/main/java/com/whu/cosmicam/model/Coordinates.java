package com.whu.cosmicam.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class Coordinates {
    private Double latitude;  // 纬度 [-90, 90]
    private Double longitude; // 经度 [-180, 180]
}
