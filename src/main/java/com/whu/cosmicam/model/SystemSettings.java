package com.whu.cosmicam.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

/**
 * 系统设置 (拍摄间隔、磁盘配额)
 * 拍摄循环每一轮都会重新读取，不做缓存。
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class SystemSettings {

    public static final int DEFAULT_CAPTURE_INTERVAL_SECONDS = 60;
    public static final double DEFAULT_MAX_DISK_USAGE_GB = 20;

    private static final long BYTES_PER_GB = 1024L * 1024L * 1024L;

    @JsonProperty("capture_interval")
    @JsonAlias("capture_interval_seconds")
    private Integer captureInterval;

    @JsonProperty("max_disk_usage_gb")
    private Double maxDiskUsageGb;

    /**
     * 实际使用的拍摄间隔，最少 1 秒
     */
    @JsonIgnore
    public int getEffectiveCaptureIntervalSeconds() {
        if (captureInterval == null) {
            return DEFAULT_CAPTURE_INTERVAL_SECONDS;
        }
        return Math.max(1, captureInterval);
    }

    @JsonIgnore
    public long getMaxDiskUsageBytes() {
        double gb = maxDiskUsageGb == null || maxDiskUsageGb <= 0 ? DEFAULT_MAX_DISK_USAGE_GB : maxDiskUsageGb;
        return (long) (gb * BYTES_PER_GB);
    }
}
