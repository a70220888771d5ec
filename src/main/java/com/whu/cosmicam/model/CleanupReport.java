package com.whu.cosmicam.model;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import java.util.Collections;
import java.util.List;

/**
 * 一次配额检查的结果
 * 实际回收量可能小于 bytesToFree (删除失败或可删图片不够)，这属于部分成功，不视为错误。
 */
@Getter
@ToString
@AllArgsConstructor
public class CleanupReport {

    private final boolean cleanupPerformed;
    private final long usageBeforeBytes;
    private final long quotaBytes;
    private final long targetBytes;
    private final long bytesToFree;
    private final long bytesReclaimed;
    private final List<String> deletedFiles;
    private final List<String> failedFiles;

    public static CleanupReport notNeeded(long usageBytes, long quotaBytes) {
        return new CleanupReport(false, usageBytes, quotaBytes, quotaBytes, 0, 0,
                Collections.emptyList(), Collections.emptyList());
    }

    public boolean isTargetReached() {
        return bytesReclaimed >= bytesToFree;
    }
}
