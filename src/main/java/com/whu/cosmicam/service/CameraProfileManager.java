package com.whu.cosmicam.service;

import com.whu.cosmicam.event.ProfileChangedEvent;
import com.whu.cosmicam.model.CameraProfile;
import com.whu.cosmicam.model.Coordinates;
import com.whu.cosmicam.model.SunPhase;
import com.whu.cosmicam.store.ConfigStoreException;
import com.whu.cosmicam.store.ProfileStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 相机 profile 管理
 * 负责：
 * 1. 启动时加载 profile 与坐标 (失败则降级为内置默认值)
 * 2. 根据太阳相位切换当前 profile
 * 3. profile 合并更新、手动切换、坐标更新
 *
 * 拍摄线程和 HTTP 线程共用同一个实例，所有公开方法都加锁。
 */
@Service
public class CameraProfileManager {

    private static final Logger log = LoggerFactory.getLogger(CameraProfileManager.class);

    public static final String DEFAULT_PROFILE = "default";

    private final ProfileStore profileStore;
    private final SunPhaseCalculator sunPhaseCalculator;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    private String currentProfileName = DEFAULT_PROFILE;
    private Map<String, CameraProfile> profiles;
    private Coordinates coordinates;
    private SunPhase lastPhase;

    public CameraProfileManager(ProfileStore profileStore, SunPhaseCalculator sunPhaseCalculator,
                                ApplicationEventPublisher eventPublisher, Clock clock) {
        this.profileStore = profileStore;
        this.sunPhaseCalculator = sunPhaseCalculator;
        this.eventPublisher = eventPublisher;
        this.clock = clock;

        try {
            log.info("[相机配置] 正在加载相机 profile 与坐标...");
            this.profiles = withDefaultProfile(profileStore.loadProfiles());
            this.coordinates = profileStore.loadCoordinates();
            log.info("[相机配置] 已加载 profile: {}，坐标: {}", profiles.keySet(), coordinates);
        } catch (RuntimeException e) {
            // 降级运行：用内置默认值继续，绝不因为配置问题起不来
            this.profiles = withDefaultProfile(profileStore.defaultProfiles());
            this.coordinates = profileStore.defaultCoordinates();
            log.warn("[相机配置] 加载失败，降级使用内置默认值 {}: {}", coordinates, e.getMessage());
        }
    }

    /**
     * 根据当前太阳相位切换 profile
     * 相位没有对应 profile 时保持原 profile；相位不变时重复调用不会再次发布切换事件。
     *
     * @return 本次计算出的太阳相位
     */
    public synchronized SunPhase refreshFromSunPhase() {
        reloadProfiles();
        reloadCoordinates();

        SunPhase phase = sunPhaseCalculator.calculate(clock.instant(), coordinates);
        lastPhase = phase;

        CameraProfile settings = profiles.get(phase.getKey());
        if (settings == null) {
            log.warn("[相机配置] 相位 {} 没有对应的 profile，保持当前 profile: {}", phase.getKey(), currentProfileName);
            return phase;
        }

        String previous = currentProfileName;
        currentProfileName = phase.getKey();
        if (!previous.equals(currentProfileName)) {
            log.info("[相机配置] profile 切换: {} -> {}", previous, currentProfileName);
            log.info("[相机配置] 新参数: {}", settings);
            eventPublisher.publishEvent(new ProfileChangedEvent(
                    previous, currentProfileName, settings.copy(), phase, clock.instant()));
        }
        return phase;
    }

    /**
     * 当前 profile 的参数副本，每次都重新读取配置，保证不会拿到过期参数
     */
    public synchronized CameraProfile currentSettings() {
        reloadProfiles();
        CameraProfile profile = profiles.get(currentProfileName);
        if (profile == null) {
            log.warn("[相机配置] 当前 profile {} 已被删除，改用 {}", currentProfileName, DEFAULT_PROFILE);
            profile = profiles.get(DEFAULT_PROFILE);
        }
        return profile.copy();
    }

    /**
     * 合并更新 (不存在则新建) 指定 profile，并持久化整个 profile 映射
     * 写入失败时返回 false，内存中的合并结果不回滚，直到下一次重新加载。
     *
     * @throws IllegalArgumentException 参数类型不合法
     */
    public synchronized boolean updateProfile(String profileName, Map<String, Object> partialSettings) {
        reloadProfiles();
        CameraProfile merged = profileStore.merge(profiles.get(profileName), partialSettings);
        profiles.put(profileName, merged);

        boolean saved = profileStore.saveProfiles(profiles);
        if (saved) {
            log.info("[相机配置] profile {} 已更新: {}", profileName, merged);
        } else {
            log.error("[相机配置] profile {} 持久化失败，仅内存生效", profileName);
        }
        return saved;
    }

    /**
     * 手动切换 profile，名称不存在时返回 false 且不改变状态
     */
    public synchronized boolean switchProfile(String profileName) {
        reloadProfiles();
        if (!profiles.containsKey(profileName)) {
            log.warn("[相机配置] 切换失败，profile 不存在: {}", profileName);
            return false;
        }
        log.info("[相机配置] 手动切换 profile: {} -> {}", currentProfileName, profileName);
        currentProfileName = profileName;
        return true;
    }

    /**
     * 更新并持久化坐标。调用方随后应调用 refreshFromSunPhase() 使其立即生效。
     */
    public synchronized boolean updateCoordinates(double latitude, double longitude) {
        Coordinates updated = new Coordinates(latitude, longitude);
        this.coordinates = updated;
        boolean saved = profileStore.saveCoordinates(updated);
        if (saved) {
            log.info("[相机配置] 坐标已更新: {}", updated);
        } else {
            log.error("[相机配置] 坐标持久化失败: {}", updated);
        }
        return saved;
    }

    public synchronized String getCurrentProfileName() {
        return currentProfileName;
    }

    /**
     * 最近一次 refreshFromSunPhase() 算出的相位，从未刷新过时为 null
     */
    public synchronized SunPhase getLastPhase() {
        return lastPhase;
    }

    public synchronized Coordinates getCoordinates() {
        return new Coordinates(coordinates.getLatitude(), coordinates.getLongitude());
    }

    public synchronized Map<String, CameraProfile> getProfiles() {
        Map<String, CameraProfile> copy = new LinkedHashMap<>();
        profiles.forEach((name, profile) -> copy.put(name, profile.copy()));
        return copy;
    }

    private void reloadProfiles() {
        try {
            profiles = withDefaultProfile(profileStore.loadProfiles());
        } catch (ConfigStoreException e) {
            log.warn("[相机配置] 重新读取 profile 失败，沿用内存中的配置: {}", e.getMessage());
        }
    }

    private void reloadCoordinates() {
        try {
            coordinates = profileStore.loadCoordinates();
        } catch (ConfigStoreException e) {
            log.warn("[相机配置] 重新读取坐标失败，沿用内存中的坐标 {}: {}", coordinates, e.getMessage());
        }
    }

    /**
     * 保证映射里始终有 default
     */
    private Map<String, CameraProfile> withDefaultProfile(Map<String, CameraProfile> loaded) {
        Map<String, CameraProfile> result = new LinkedHashMap<>(loaded);
        if (!result.containsKey(DEFAULT_PROFILE)) {
            result.put(DEFAULT_PROFILE, profileStore.defaultProfiles().get(DEFAULT_PROFILE));
        }
        return result;
    }
}
