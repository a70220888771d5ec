package com.whu.cosmicam.service;

import com.whu.cosmicam.model.CaptureArtifact;
import com.whu.cosmicam.model.CleanupReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.List;

/**
 * 磁盘配额管理：超出配额时从最旧的图片开始删除，直到降到配额的 90%
 */
public class QuotaEnforcer {

    private static final Logger log = LoggerFactory.getLogger(QuotaEnforcer.class);

    // 清理目标水位，留 10% 余量避免在边界上反复清理
    public static final double TARGET_RATIO = 0.9;

    private static final double MB = 1024.0 * 1024.0;

    private final ArtifactRepository artifactRepository;
    private volatile long maxDiskUsageBytes;

    public QuotaEnforcer(ArtifactRepository artifactRepository, long maxDiskUsageBytes) {
        this.artifactRepository = artifactRepository;
        this.maxDiskUsageBytes = maxDiskUsageBytes;
    }

    public long getMaxDiskUsageBytes() {
        return maxDiskUsageBytes;
    }

    public void setMaxDiskUsageBytes(long maxDiskUsageBytes) {
        this.maxDiskUsageBytes = maxDiskUsageBytes;
    }

    /**
     * 检查占用，必要时清理
     * 单次只删到目标水位为止；单个文件删除失败记录后跳过。
     */
    public CleanupReport enforceIfNeeded() {
        long quota = maxDiskUsageBytes;
        long usage = artifactRepository.totalSizeBytes();

        if (usage <= quota) {
            log.debug("[磁盘配额] 占用 {} MB，未超过配额 {} MB", format(usage), format(quota));
            return CleanupReport.notNeeded(usage, quota);
        }

        long target = (long) (quota * TARGET_RATIO);
        long bytesToFree = usage - target;
        log.info("[磁盘配额] 占用 {} MB 超过配额 {} MB，需释放 {} MB",
                format(usage), format(quota), format(bytesToFree));

        long reclaimed = 0;
        List<String> deleted = new ArrayList<>();
        List<String> failed = new ArrayList<>();

        for (CaptureArtifact artifact : artifactRepository.listEvictionCandidates()) {
            if (reclaimed >= bytesToFree) {
                break;
            }
            try {
                long size = Files.size(artifact.getPath());
                Files.delete(artifact.getPath());
                reclaimed += size;
                deleted.add(artifact.getFileName());
                log.info("[磁盘配额] 已删除 {} ({} MB)", artifact.getFileName(), format(size));
            } catch (IOException e) {
                failed.add(artifact.getFileName());
                log.error("[磁盘配额] 删除 {} 失败: {}", artifact.getFileName(), e.toString());
            }
        }

        if (reclaimed < bytesToFree) {
            log.warn("[磁盘配额] 清理结束但未达到目标：释放 {} MB / 需要 {} MB，失败 {} 个",
                    format(reclaimed), format(bytesToFree), failed.size());
        } else {
            log.info("[磁盘配额] 清理完成：删除 {} 个文件，释放 {} MB", deleted.size(), format(reclaimed));
        }
        return new CleanupReport(true, usage, quota, target, bytesToFree, reclaimed, deleted, failed);
    }

    private static String format(long bytes) {
        return String.format("%.2f", bytes / MB);
    }
}
