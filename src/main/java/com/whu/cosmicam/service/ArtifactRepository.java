package com.whu.cosmicam.service;

import com.whu.cosmicam.model.CaptureArtifact;
import com.whu.cosmicam.util.ArtifactNaming;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * 图片目录的读取与统计
 * 拍摄循环是唯一的写入者；HTTP 接口只读。
 */
public class ArtifactRepository {

    private static final Logger log = LoggerFactory.getLogger(ArtifactRepository.class);

    // 创建时间相同按文件名排序，保证结果可复现
    static final Comparator<CaptureArtifact> OLDEST_FIRST =
            Comparator.comparing(CaptureArtifact::getCreatedAt).thenComparing(CaptureArtifact::getFileName);

    private final Path imageDir;
    private final ZoneId zone;

    public ArtifactRepository(Path imageDir, ZoneId zone) {
        this.imageDir = imageDir;
        this.zone = zone;
    }

    public Path getImageDir() {
        return imageDir;
    }

    public void ensureDirectoryExists() throws IOException {
        if (!Files.isDirectory(imageDir)) {
            Files.createDirectories(imageDir);
            log.info("[图片目录] 已创建目录: {}", imageDir.toAbsolutePath());
        }
    }

    /**
     * 为新拍摄的图片分配路径；同一秒内重复拍摄时追加序号
     */
    public Path newArtifactPath(Instant captureTime) {
        String fileName = ArtifactNaming.fileName(captureTime, zone);
        Path target = imageDir.resolve(fileName);
        int sequence = 1;
        while (Files.exists(target)) {
            String base = fileName.substring(0, fileName.length() - ArtifactNaming.EXTENSION.length());
            target = imageDir.resolve(base + "_" + sequence++ + ArtifactNaming.EXTENSION);
        }
        return target;
    }

    /**
     * 递归统计目录下所有文件的总字节数；符号链接不计入，也不跟随
     */
    public long totalSizeBytes() {
        if (!Files.isDirectory(imageDir)) {
            return 0;
        }
        long[] total = {0};
        try {
            Files.walkFileTree(imageDir, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                    if (attrs.isRegularFile()) {
                        total[0] += attrs.size();
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFileFailed(Path file, IOException e) {
                    log.warn("[图片目录] 无法读取 {} 的大小: {}", file, e.getMessage());
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (IOException e) {
            log.error("[图片目录] 统计目录大小失败: {}", e.getMessage());
        }
        return total[0];
    }

    /**
     * 可被配额清理删除的图片，最旧的在前
     */
    public List<CaptureArtifact> listEvictionCandidates() {
        List<CaptureArtifact> artifacts = listImages(true);
        artifacts.sort(OLDEST_FIRST);
        return artifacts;
    }

    /**
     * 目录下创建时间最新的图片 (任意文件名，只看扩展名)
     */
    public Optional<CaptureArtifact> findLatest() {
        return listImages(false).stream().max(OLDEST_FIRST);
    }

    private List<CaptureArtifact> listImages(boolean captureArtifactsOnly) {
        List<CaptureArtifact> artifacts = new ArrayList<>();
        if (!Files.isDirectory(imageDir)) {
            return artifacts;
        }
        try (DirectoryStream<Path> entries = Files.newDirectoryStream(imageDir)) {
            for (Path entry : entries) {
                String name = entry.getFileName().toString();
                boolean matches = captureArtifactsOnly ? ArtifactNaming.isCaptureArtifact(name) : ArtifactNaming.isImage(name);
                if (!matches) {
                    continue;
                }
                try {
                    BasicFileAttributes attrs = Files.readAttributes(entry, BasicFileAttributes.class, LinkOption.NOFOLLOW_LINKS);
                    if (attrs.isRegularFile()) {
                        artifacts.add(new CaptureArtifact(entry, attrs.size(), attrs.creationTime().toInstant()));
                    }
                } catch (IOException e) {
                    log.warn("[图片目录] 读取文件属性失败 {}: {}", name, e.getMessage());
                }
            }
        } catch (IOException e) {
            log.error("[图片目录] 列举图片失败: {}", e.getMessage());
        }
        return artifacts;
    }
}
