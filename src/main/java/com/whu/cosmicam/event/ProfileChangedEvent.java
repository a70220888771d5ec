package com.whu.cosmicam.event;

import com.whu.cosmicam.model.CameraProfile;
import com.whu.cosmicam.model.SunPhase;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;

/**
 * 当前生效的相机 profile 因太阳相位变化而切换时发布
 */
@Getter
@ToString
@AllArgsConstructor
public class ProfileChangedEvent {
    private final String previousProfile;
    private final String newProfile;
    private final CameraProfile newSettings;
    private final SunPhase phase;
    private final Instant changedAt;
}
