package com.whu.cosmicam.util;

import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.Set;

/**
 * 图片文件命名规则
 * 文件名形如 image_20240621_130000.jpg，精确到秒。
 */
public final class ArtifactNaming {

    public static final String PREFIX = "image_";
    public static final String EXTENSION = ".jpg";

    // 查询“最新图片”时认可的图片扩展名
    public static final Set<String> IMAGE_EXTENSIONS = Set.of(".jpg", ".jpeg", ".png");

    private static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private ArtifactNaming() {
    }

    public static String fileName(Instant captureTime, ZoneId zone) {
        return PREFIX + TIMESTAMP_FORMAT.format(captureTime.atZone(zone)) + EXTENSION;
    }

    public static boolean isImage(String fileName) {
        String lower = fileName.toLowerCase(Locale.ROOT);
        int dot = lower.lastIndexOf('.');
        return dot >= 0 && IMAGE_EXTENSIONS.contains(lower.substring(dot));
    }

    /**
     * 是否是本服务拍摄产生的图片 (配额清理只删除这类文件)
     */
    public static boolean isCaptureArtifact(String fileName) {
        return fileName.startsWith(PREFIX) && isImage(fileName);
    }
}
