package com.whu.cosmicam.store;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 内置默认配置
 * 配置文件不存在、损坏或读取失败时使用。每次调用都返回全新的可变副本。
 */
public final class ConfigDefaults {

    // 默认坐标：DFW
    public static final double DEFAULT_LATITUDE = 32.7;
    public static final double DEFAULT_LONGITUDE = -97.3;

    private ConfigDefaults() {
    }

    public static Map<String, Object> of(ConfigDocument document) {
        switch (document) {
            case COORDINATES:
                return coordinates();
            case CAMERA_PROFILES:
                return cameraProfiles();
            case SYSTEM_SETTINGS:
                return systemSettings();
            default:
                throw new IllegalArgumentException("未知的配置文档: " + document);
        }
    }

    private static Map<String, Object> coordinates() {
        Map<String, Object> coordinates = new LinkedHashMap<>();
        coordinates.put("latitude", DEFAULT_LATITUDE);
        coordinates.put("longitude", DEFAULT_LONGITUDE);
        return coordinates;
    }

    private static Map<String, Object> cameraProfiles() {
        Map<String, Object> profiles = new LinkedHashMap<>();
        profiles.put("default", profile(0, 0, 0, 1.0));
        profiles.put("day", profile(0, 0, 0, 1.0));
        profiles.put("civil_twilight", profile(100000, 1.5, 0.2, 1.1));
        profiles.put("nautical_twilight", profile(1000000, 1.8, 0.3, 1.2));
        profiles.put("astronomical_twilight", profile(3000000, 2.0, 0.4, 1.3));
        profiles.put("night", profile(6000000, 2.0, 0.5, 1.4));
        return profiles;
    }

    private static Map<String, Object> systemSettings() {
        Map<String, Object> fanControl = new LinkedHashMap<>();
        fanControl.put("log_interval", 300);
        fanControl.put("min_temp", 40);
        fanControl.put("max_temp", 80);

        Map<String, Object> settings = new LinkedHashMap<>();
        settings.put("capture_interval", 60);
        settings.put("max_disk_usage_gb", 20);
        // 风扇控制由独立进程读取，这里只负责保留默认值
        settings.put("fan_control", fanControl);
        return settings;
    }

    private static Map<String, Object> profile(int shutterSpeed, double gain, double brightness, double contrast) {
        Map<String, Object> profile = new LinkedHashMap<>();
        profile.put("shutter_speed", shutterSpeed);
        profile.put("gain", gain);
        profile.put("brightness", brightness);
        profile.put("contrast", contrast);
        return profile;
    }
}
