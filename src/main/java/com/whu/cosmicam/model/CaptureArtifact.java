package com.whu.cosmicam.model;

import java.nio.file.Path;
import java.time.Instant;

/**
 * 已落盘的一张拍摄图片。写入后不再修改，只会被配额清理删除。
 */
public class CaptureArtifact {

    private final Path path;
    private final long sizeBytes;
    private final Instant createdAt;

    public CaptureArtifact(Path path, long sizeBytes, Instant createdAt) {
        this.path = path;
        this.sizeBytes = sizeBytes;
        this.createdAt = createdAt;
    }

    public Path getPath() { return path; }
    public String getFileName() { return path.getFileName().toString(); }
    public long getSizeBytes() { return sizeBytes; }
    public Instant getCreatedAt() { return createdAt; }

    @Override
    public String toString() {
        return String.format("图片: %s [大小: %d 字节, 创建时间: %s]", getFileName(), sizeBytes, createdAt);
    }
}
