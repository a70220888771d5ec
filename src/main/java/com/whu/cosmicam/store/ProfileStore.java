package com.whu.cosmicam.store;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.whu.cosmicam.model.CameraProfile;
import com.whu.cosmicam.model.Coordinates;
import com.whu.cosmicam.model.SystemSettings;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 在 ConfigStore 的文档之上提供强类型的读写：相机 profile、地理坐标、系统设置。
 * 所有 load 方法每次都重新读取底层文档；文档内容无法解析时抛 ConfigStoreException，
 * 由调用方决定是降级还是沿用内存中的值。
 */
@Component
public class ProfileStore {

    private static final TypeReference<LinkedHashMap<String, Object>> DOCUMENT_TYPE = new TypeReference<>() {};

    private final ConfigStore configStore;
    private final ObjectMapper objectMapper;

    public ProfileStore(ConfigStore configStore, ObjectMapper objectMapper) {
        this.configStore = configStore;
        this.objectMapper = objectMapper;
    }

    // ------------------------- 相机 profile -------------------------

    public Map<String, CameraProfile> loadProfiles() {
        return toProfiles(configStore.get(ConfigDocument.CAMERA_PROFILES));
    }

    public boolean saveProfiles(Map<String, CameraProfile> profiles) {
        Map<String, Object> document = new LinkedHashMap<>();
        profiles.forEach((name, profile) -> document.put(name, toDocument(profile)));
        return configStore.update(ConfigDocument.CAMERA_PROFILES, document);
    }

    public Map<String, CameraProfile> defaultProfiles() {
        return toProfiles(ConfigDefaults.of(ConfigDocument.CAMERA_PROFILES));
    }

    /**
     * 把部分参数合并到 profile 的副本上，原对象不受影响
     *
     * @param existing 可以为 null，表示新建
     * @throws IllegalArgumentException 参数类型不合法
     */
    public CameraProfile merge(CameraProfile existing, Map<String, Object> partial) {
        CameraProfile base = existing == null ? new CameraProfile() : existing.copy();
        try {
            return objectMapper.updateValue(base, partial);
        } catch (JsonMappingException e) {
            throw new IllegalArgumentException("无效的相机参数: " + e.getOriginalMessage(), e);
        }
    }

    private Map<String, CameraProfile> toProfiles(Map<String, Object> document) {
        Map<String, CameraProfile> profiles = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : document.entrySet()) {
            if (entry.getValue() == null) {
                throw new ConfigStoreException("相机配置 [" + entry.getKey() + "] 为空");
            }
            try {
                profiles.put(entry.getKey(), objectMapper.convertValue(entry.getValue(), CameraProfile.class));
            } catch (IllegalArgumentException e) {
                throw new ConfigStoreException("相机配置 [" + entry.getKey() + "] 格式错误: " + e.getMessage(), e);
            }
        }
        return profiles;
    }

    private Map<String, Object> toDocument(Object value) {
        return objectMapper.convertValue(value, DOCUMENT_TYPE);
    }

    // ------------------------- 地理坐标 -------------------------

    public Coordinates loadCoordinates() {
        Coordinates coordinates;
        try {
            coordinates = objectMapper.convertValue(configStore.get(ConfigDocument.COORDINATES), Coordinates.class);
        } catch (IllegalArgumentException e) {
            throw new ConfigStoreException("坐标配置格式错误: " + e.getMessage(), e);
        }
        if (coordinates == null || coordinates.getLatitude() == null || coordinates.getLongitude() == null) {
            throw new ConfigStoreException("坐标配置缺少 latitude/longitude");
        }
        return coordinates;
    }

    public boolean saveCoordinates(Coordinates coordinates) {
        return configStore.update(ConfigDocument.COORDINATES, toDocument(coordinates));
    }

    public Coordinates defaultCoordinates() {
        return new Coordinates(ConfigDefaults.DEFAULT_LATITUDE, ConfigDefaults.DEFAULT_LONGITUDE);
    }

    // ------------------------- 系统设置 -------------------------

    public SystemSettings loadSystemSettings() {
        try {
            return objectMapper.convertValue(configStore.get(ConfigDocument.SYSTEM_SETTINGS), SystemSettings.class);
        } catch (IllegalArgumentException e) {
            throw new ConfigStoreException("系统设置格式错误: " + e.getMessage(), e);
        }
    }

    /**
     * 原始文档，保留 fan_control 等本服务不关心的字段
     */
    public Map<String, Object> loadSystemSettingsDocument() {
        return configStore.get(ConfigDocument.SYSTEM_SETTINGS);
    }

    /**
     * 校验后合并写入系统设置
     *
     * @throws IllegalArgumentException 间隔小于 1 秒或配额不是正数
     */
    public boolean updateSystemSettings(Map<String, Object> partial) {
        Map<String, Object> merged = loadSystemSettingsDocument();
        merged.putAll(partial);

        SystemSettings settings;
        try {
            settings = objectMapper.convertValue(merged, SystemSettings.class);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("系统设置格式错误: " + e.getMessage(), e);
        }
        if (settings.getCaptureInterval() != null && settings.getCaptureInterval() < 1) {
            throw new IllegalArgumentException("capture_interval 必须是正整数");
        }
        if (settings.getMaxDiskUsageGb() != null && settings.getMaxDiskUsageGb() <= 0) {
            throw new IllegalArgumentException("max_disk_usage_gb 必须大于 0");
        }
        return configStore.update(ConfigDocument.SYSTEM_SETTINGS, partial);
    }
}
