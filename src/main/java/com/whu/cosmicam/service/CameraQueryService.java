package com.whu.cosmicam.service;

import com.whu.cosmicam.dto.CameraProfileVo;
import com.whu.cosmicam.dto.CaptureStatusVo;
import com.whu.cosmicam.dto.LatestImageVo;
import com.whu.cosmicam.event.ProfileChangedEvent;
import com.whu.cosmicam.model.CameraProfile;
import com.whu.cosmicam.model.CaptureArtifact;
import com.whu.cosmicam.model.CleanupReport;
import com.whu.cosmicam.model.Coordinates;
import com.whu.cosmicam.model.SunPhase;
import com.whu.cosmicam.store.ProfileStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Map;
import java.util.Optional;

/**
 * 对外查询接口背后的服务：最新图片、当前 profile、坐标与系统设置的读写、拍摄状态
 */
@Service
public class CameraQueryService {

    private static final Logger log = LoggerFactory.getLogger(CameraQueryService.class);

    private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final CameraProfileManager profileManager;
    private final ProfileStore profileStore;
    private final ArtifactRepository artifactRepository;
    private final CaptureService captureService;
    private final Clock clock;

    private volatile ProfileChangedEvent lastProfileChange;

    public CameraQueryService(CameraProfileManager profileManager, ProfileStore profileStore,
                              ArtifactRepository artifactRepository, CaptureService captureService, Clock clock) {
        this.profileManager = profileManager;
        this.profileStore = profileStore;
        this.artifactRepository = artifactRepository;
        this.captureService = captureService;
        this.clock = clock;
    }

    /**
     * 最新图片及当前的相位、profile；目录为空时返回 empty
     */
    public Optional<LatestImageVo> getLatestArtifact() {
        Optional<CaptureArtifact> latest = artifactRepository.findLatest();
        if (latest.isEmpty()) {
            log.info("[查询] 图片目录 {} 中没有图片", artifactRepository.getImageDir());
            return Optional.empty();
        }

        CaptureArtifact artifact = latest.get();
        SunPhase phase = profileManager.refreshFromSunPhase();
        String profileName = profileManager.getCurrentProfileName();
        CameraProfile settings = profileManager.currentSettings();

        return Optional.of(new LatestImageVo(
                "/images/" + artifact.getFileName(),
                toLocal(artifact.getCreatedAt()),
                phase.getKey(),
                profileName,
                settings));
    }

    /**
     * 先按太阳相位刷新，所以刚更新过的坐标会立即体现在结果里
     */
    public CameraProfileVo getCurrentProfile() {
        SunPhase phase = profileManager.refreshFromSunPhase();
        String profileName = profileManager.getCurrentProfileName();
        CameraProfile settings = profileManager.currentSettings();
        log.debug("[查询] 当前 profile: {}，相位: {}", profileName, phase.getKey());
        return new CameraProfileVo(profileName, settings, phase.getKey());
    }

    public boolean updateCoordinates(double latitude, double longitude) {
        boolean saved = profileManager.updateCoordinates(latitude, longitude);
        if (saved) {
            profileManager.refreshFromSunPhase();
        }
        return saved;
    }

    public Coordinates getCoordinates() {
        return profileStore.loadCoordinates();
    }

    public boolean updateProfile(String profileName, Map<String, Object> partialSettings) {
        return profileManager.updateProfile(profileName, partialSettings);
    }

    public boolean switchProfile(String profileName) {
        return profileManager.switchProfile(profileName);
    }

    public Map<String, Object> getSystemSettings() {
        return profileStore.loadSystemSettingsDocument();
    }

    public boolean updateSystemSettings(Map<String, Object> partial) {
        return profileStore.updateSystemSettings(partial);
    }

    public CaptureStatusVo getCaptureStatus() {
        CaptureStatusVo status = new CaptureStatusVo();
        status.setState(captureService.getState().name());
        status.setSuccessCount(captureService.getSuccessCount());
        status.setFailureCount(captureService.getFailureCount());
        status.setConsecutiveFailures(captureService.getConsecutiveFailures());

        CaptureArtifact last = captureService.getLastArtifact();
        if (last != null) {
            status.setLastImage(last.getFileName());
            status.setLastCaptureTime(format(last.getCreatedAt()));
        }
        status.setLastError(captureService.getLastError());
        status.setLastFailureTime(format(captureService.getLastFailureAt()));

        CleanupReport cleanup = captureService.getLastCleanupReport();
        if (cleanup != null) {
            status.setLastCleanupReclaimedBytes(cleanup.getBytesReclaimed());
        }

        ProfileChangedEvent change = lastProfileChange;
        if (change != null) {
            status.setLastProfileChange(change.getPreviousProfile() + " -> " + change.getNewProfile());
            status.setLastProfileChangeTime(format(change.getChangedAt()));
        }
        return status;
    }

    @EventListener
    public void onProfileChanged(ProfileChangedEvent event) {
        lastProfileChange = event;
    }

    private LocalDateTime toLocal(Instant instant) {
        return LocalDateTime.ofInstant(instant, clock.getZone());
    }

    private String format(Instant instant) {
        return instant == null ? null : toLocal(instant).format(TIME_FORMAT);
    }
}
