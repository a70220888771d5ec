package com.whu.cosmicam.service;

import com.whu.cosmicam.model.CameraProfile;
import com.whu.cosmicam.model.CaptureArtifact;
import com.whu.cosmicam.model.CleanupReport;
import com.whu.cosmicam.model.SystemSettings;
import com.whu.cosmicam.store.ProfileStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 连续拍摄服务
 * 每一轮：重新读取系统设置 -> 按太阳相位刷新 profile -> 拍摄 -> 处理 -> 配额检查 -> 等待下一轮。
 * 单次拍摄或读取设置失败只记录日志，短暂等待后重试；只有 stop() 能结束循环。
 * 循环是唯一的图片写入者，同一时刻最多只有一次拍摄在进行。
 */
@Service
public class CaptureService {

    private static final Logger log = LoggerFactory.getLogger(CaptureService.class);

    public enum State {
        STOPPED,
        RUNNING
    }

    private final ProfileStore profileStore;
    private final CameraProfileManager profileManager;
    private final ImageCapturer imageCapturer;
    private final ImageProcessor imageProcessor;
    private final ArtifactRepository artifactRepository;
    private final Clock clock;
    private final long retryDelayMillis;

    private volatile State state = State.STOPPED;
    private volatile CountDownLatch stopSignal = new CountDownLatch(0);
    private volatile QuotaEnforcer quotaEnforcer;

    private final AtomicLong successCount = new AtomicLong();
    private final AtomicLong failureCount = new AtomicLong();
    private final AtomicInteger consecutiveFailures = new AtomicInteger();
    private volatile CaptureArtifact lastArtifact;
    private volatile CleanupReport lastCleanupReport;
    private volatile String lastError;
    private volatile Instant lastFailureAt;

    public CaptureService(ProfileStore profileStore,
                          CameraProfileManager profileManager,
                          ImageCapturer imageCapturer,
                          ImageProcessor imageProcessor,
                          ArtifactRepository artifactRepository,
                          Clock clock,
                          @Value("${cosmicam.capture.retry-delay-ms:5000}") long retryDelayMillis) {
        this.profileStore = profileStore;
        this.profileManager = profileManager;
        this.imageCapturer = imageCapturer;
        this.imageProcessor = imageProcessor;
        this.artifactRepository = artifactRepository;
        this.clock = clock;
        this.retryDelayMillis = retryDelayMillis;
    }

    /**
     * 进入拍摄循环，在调用线程上一直运行到 stop() 被调用
     */
    public void start() {
        synchronized (this) {
            if (state == State.RUNNING) {
                log.warn("[拍摄服务] 已经在运行，忽略重复启动");
                return;
            }
            state = State.RUNNING;
            stopSignal = new CountDownLatch(1);
        }

        try {
            artifactRepository.ensureDirectoryExists();
        } catch (IOException e) {
            // 目录建不出来时后续拍摄会失败并进入重试，不在这里退出
            log.error("[拍摄服务] 创建图片目录失败: {}", e.getMessage());
        }

        SystemSettings settings = loadSettingsOrDefaults();
        quotaEnforcer = new QuotaEnforcer(artifactRepository, settings.getMaxDiskUsageBytes());
        log.info("[拍摄服务] 启动，图片目录: {}，拍摄间隔 {} 秒，磁盘配额 {} 字节",
                artifactRepository.getImageDir().toAbsolutePath(),
                settings.getEffectiveCaptureIntervalSeconds(), settings.getMaxDiskUsageBytes());

        try {
            while (state == State.RUNNING) {
                long waitMillis = runOnce();
                if (awaitStop(waitMillis)) {
                    break;
                }
            }
        } finally {
            state = State.STOPPED;
            log.info("[拍摄服务] 拍摄循环已退出");
        }
    }

    /**
     * 请求停止。正在进行的拍摄会执行完，等待中的休眠立即结束。
     */
    public synchronized void stop() {
        if (state == State.STOPPED) {
            return;
        }
        log.info("[拍摄服务] 正在停止拍摄服务");
        state = State.STOPPED;
        stopSignal.countDown();
    }

    /**
     * 执行一轮拍摄
     *
     * @return 到下一轮之前需要等待的毫秒数
     */
    long runOnce() {
        int intervalSeconds = SystemSettings.DEFAULT_CAPTURE_INTERVAL_SECONDS;
        try {
            // 1. 每轮重新读取设置，修改在本轮生效
            SystemSettings settings = profileStore.loadSystemSettings();
            intervalSeconds = settings.getEffectiveCaptureIntervalSeconds();
            quotaEnforcer.setMaxDiskUsageBytes(settings.getMaxDiskUsageBytes());

            // 2. 按太阳相位刷新 profile
            profileManager.refreshFromSunPhase();
            CameraProfile params = profileManager.currentSettings();

            // 3. 拍摄 (同步阻塞)
            Path captured = imageCapturer.capture(params);
            Path processed = imageProcessor.process(captured);
            recordSuccess(processed);
        } catch (CaptureException e) {
            recordFailure("拍摄失败: " + e.getMessage());
            return retryDelay(intervalSeconds);
        } catch (RuntimeException e) {
            log.error("[拍摄服务] 本轮执行异常", e);
            recordFailure("本轮执行异常: " + e);
            return retryDelay(intervalSeconds);
        }

        // 4. 拍摄成功后检查磁盘配额
        try {
            lastCleanupReport = quotaEnforcer.enforceIfNeeded();
        } catch (RuntimeException e) {
            log.error("[拍摄服务] 磁盘配额检查异常", e);
        }
        return intervalSeconds * 1000L;
    }

    private void recordSuccess(Path imagePath) {
        long size = 0;
        try {
            size = Files.size(imagePath);
        } catch (IOException e) {
            log.warn("[拍摄服务] 读取图片大小失败 {}: {}", imagePath, e.getMessage());
        }
        lastArtifact = new CaptureArtifact(imagePath, size, clock.instant());
        successCount.incrementAndGet();
        consecutiveFailures.set(0);
        log.info("[拍摄服务] 拍摄成功: {}，当前 profile: {}", imagePath.getFileName(), profileManager.getCurrentProfileName());
    }

    private void recordFailure(String message) {
        failureCount.incrementAndGet();
        int streak = consecutiveFailures.incrementAndGet();
        lastError = message;
        lastFailureAt = clock.instant();
        log.error("[拍摄服务] {} (连续失败 {} 次)，稍后重试", message, streak);
    }

    /**
     * 失败后的重试等待，不超过正常拍摄间隔
     */
    private long retryDelay(int intervalSeconds) {
        return Math.min(retryDelayMillis, intervalSeconds * 1000L);
    }

    /**
     * @return true 表示收到了停止信号
     */
    private boolean awaitStop(long waitMillis) {
        try {
            return stopSignal.await(waitMillis, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[拍摄服务] 拍摄线程被中断，退出循环");
            return true;
        }
    }

    private SystemSettings loadSettingsOrDefaults() {
        try {
            return profileStore.loadSystemSettings();
        } catch (RuntimeException e) {
            log.warn("[拍摄服务] 读取系统设置失败，使用默认值: {}", e.getMessage());
            return new SystemSettings();
        }
    }

    public State getState() {
        return state;
    }

    public long getSuccessCount() {
        return successCount.get();
    }

    public long getFailureCount() {
        return failureCount.get();
    }

    public int getConsecutiveFailures() {
        return consecutiveFailures.get();
    }

    public CaptureArtifact getLastArtifact() {
        return lastArtifact;
    }

    public CleanupReport getLastCleanupReport() {
        return lastCleanupReport;
    }

    public String getLastError() {
        return lastError;
    }

    public Instant getLastFailureAt() {
        return lastFailureAt;
    }
}
