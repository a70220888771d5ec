package com.whu.cosmicam.dto;

import lombok.Data;

/**
 * 拍摄服务运行状态，供监控面板展示
 */
@Data
public class CaptureStatusVo {
    // === 拍摄循环 ===
    private String state;              // RUNNING / STOPPED
    private long successCount;         // 累计成功次数
    private long failureCount;         // 累计失败次数
    private int consecutiveFailures;   // 当前连续失败次数
    private String lastImage;          // 最近一次成功拍摄的文件名
    private String lastCaptureTime;
    private String lastError;
    private String lastFailureTime;

    // === 磁盘配额 ===
    private Long lastCleanupReclaimedBytes; // 最近一次清理释放的字节数，未清理过为 null

    // === profile 切换 ===
    private String lastProfileChange;  // 例如 "day -> civil_twilight"
    private String lastProfileChangeTime;
}
