package com.whu.cosmicam.service;

import com.whu.cosmicam.model.CaptureArtifact;
import com.whu.cosmicam.model.CleanupReport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributeView;
import java.nio.file.attribute.FileTime;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class QuotaEnforcerTest {

    private static final int KB = 1024;
    private static final Instant BASE_TIME = Instant.parse("2024-06-21T00:00:00Z");

    @TempDir
    Path imageDir;

    private ArtifactRepository repository;

    @BeforeEach
    void setUp() {
        repository = new ArtifactRepository(imageDir, ZoneId.of("UTC"));
    }

    @Test
    void noCleanupWhenUnderQuota() throws IOException {
        writeArtifact("image_20240621_000001.jpg", 100, 1);
        writeArtifact("image_20240621_000002.jpg", 100, 2);

        CleanupReport report = new QuotaEnforcer(repository, 1000).enforceIfNeeded();

        assertFalse(report.isCleanupPerformed());
        assertEquals(200, report.getUsageBeforeBytes());
        assertEquals(0, report.getBytesReclaimed());
        assertEquals(2, repository.listEvictionCandidates().size());
    }

    @Test
    void usageExactlyAtQuotaIsNotCleaned() throws IOException {
        writeArtifact("image_20240621_000001.jpg", 500, 1);

        CleanupReport report = new QuotaEnforcer(repository, 500).enforceIfNeeded();

        assertFalse(report.isCleanupPerformed());
        assertTrue(Files.exists(imageDir.resolve("image_20240621_000001.jpg")));
    }

    @Test
    void evictsOnlyTheOldestWhenThatIsEnough() throws IOException {
        Path t1 = writeArtifact("image_20240621_000001.jpg", 100, 1);
        Path t2 = writeArtifact("image_20240621_000002.jpg", 100, 2);
        Path t3 = writeArtifact("image_20240621_000003.jpg", 100, 3);

        // 300 字节，配额 250 -> 目标 225，需释放 75
        CleanupReport report = new QuotaEnforcer(repository, 250).enforceIfNeeded();

        assertTrue(report.isCleanupPerformed());
        assertEquals(225, report.getTargetBytes());
        assertEquals(75, report.getBytesToFree());
        assertEquals(100, report.getBytesReclaimed());
        assertFalse(Files.exists(t1));
        assertTrue(Files.exists(t2));
        assertTrue(Files.exists(t3));
    }

    @Test
    void stopsOnceTheWatermarkIsReached() throws IOException {
        for (int i = 1; i <= 10; i++) {
            writeArtifact(String.format("image_20240621_0000%02d.jpg", i), 10 * KB, i);
        }

        // 100 KB，配额 80 KB -> 目标 72 KB，需释放 28 KB，删 3 张
        CleanupReport report = new QuotaEnforcer(repository, 80 * KB).enforceIfNeeded();

        assertEquals(3, report.getDeletedFiles().size());
        assertEquals(30 * KB, report.getBytesReclaimed());
        assertTrue(report.isTargetReached());
        assertEquals(70 * KB, repository.totalSizeBytes());
        assertTrue(repository.totalSizeBytes() <= 80 * KB);
    }

    @Test
    void reclaimsWhatItCanWhenArtifactsRunOut() throws IOException {
        // 95 KB 非拍摄文件 + 25 KB 图片 = 120 KB，配额 100 KB -> 目标 90 KB，需释放 30 KB
        Files.write(imageDir.resolve("calibration.dat"), new byte[95 * KB]);
        for (int i = 1; i <= 5; i++) {
            writeArtifact("image_20240621_00000" + i + ".jpg", 5 * KB, i);
        }

        CleanupReport report = new QuotaEnforcer(repository, 100 * KB).enforceIfNeeded();

        assertTrue(report.isCleanupPerformed());
        assertEquals(120 * KB, report.getUsageBeforeBytes());
        assertEquals(30 * KB, report.getBytesToFree());
        assertEquals(25 * KB, report.getBytesReclaimed());
        assertEquals(5, report.getDeletedFiles().size());
        assertTrue(report.getFailedFiles().isEmpty());
        assertFalse(report.isTargetReached());
        assertTrue(Files.exists(imageDir.resolve("calibration.dat")));
    }

    @Test
    void countsNestedFilesButOnlyEvictsTopLevelArtifacts() throws IOException {
        Path nested = Files.createDirectories(imageDir.resolve("archive"));
        Files.write(nested.resolve("image_20200101_000000.jpg"), new byte[300]);
        Path top = writeArtifact("image_20240621_000001.jpg", 100, 1);

        assertEquals(400, repository.totalSizeBytes());

        CleanupReport report = new QuotaEnforcer(repository, 350).enforceIfNeeded();

        assertEquals(100, report.getBytesReclaimed());
        assertFalse(Files.exists(top));
        assertTrue(Files.exists(nested.resolve("image_20200101_000000.jpg")));
    }

    @Test
    void symbolicLinksAreNotCounted() throws IOException {
        Path outside = Files.createTempFile("cosmicam-outside", ".bin");
        try {
            Files.write(outside, new byte[1000]);
            writeArtifact("image_20240621_000001.jpg", 100, 1);
            try {
                Files.createSymbolicLink(imageDir.resolve("linked.jpg"), outside);
            } catch (UnsupportedOperationException | IOException e) {
                // 文件系统不支持符号链接时只校验普通文件
            }

            assertEquals(100, repository.totalSizeBytes());
        } finally {
            Files.deleteIfExists(outside);
        }
    }

    @Test
    void thresholdCanChangeBetweenPasses() throws IOException {
        writeArtifact("image_20240621_000001.jpg", 100, 1);
        writeArtifact("image_20240621_000002.jpg", 100, 2);
        QuotaEnforcer enforcer = new QuotaEnforcer(repository, 1000);

        assertFalse(enforcer.enforceIfNeeded().isCleanupPerformed());

        enforcer.setMaxDiskUsageBytes(150);
        CleanupReport report = enforcer.enforceIfNeeded();

        assertTrue(report.isCleanupPerformed());
        assertEquals(1, report.getDeletedFiles().size());
        assertEquals("image_20240621_000001.jpg", report.getDeletedFiles().get(0));
    }

    @Test
    void failedDeletionIsReportedAndNextOldestIsEvicted() throws IOException {
        ArtifactRepository mocked = mock(ArtifactRepository.class);
        // 最旧的文件在列出后被外部删除
        CaptureArtifact vanished = new CaptureArtifact(imageDir.resolve("image_20240621_000000.jpg"), 200,
                BASE_TIME);
        Path real = writeArtifact("image_20240621_000001.jpg", 100, 1);
        CaptureArtifact present = new CaptureArtifact(real, 100, BASE_TIME.plusSeconds(1));
        when(mocked.totalSizeBytes()).thenReturn(300L);
        when(mocked.listEvictionCandidates()).thenReturn(Arrays.asList(vanished, present));

        CleanupReport report = new QuotaEnforcer(mocked, 250).enforceIfNeeded();

        assertTrue(report.isCleanupPerformed());
        assertEquals(75, report.getBytesToFree());
        assertEquals(Collections.singletonList("image_20240621_000000.jpg"), report.getFailedFiles());
        assertEquals(Collections.singletonList("image_20240621_000001.jpg"), report.getDeletedFiles());
        assertEquals(100, report.getBytesReclaimed());
        assertTrue(report.isTargetReached());
        assertFalse(Files.exists(real));
    }

    @Test
    void equalCreationTimesAreEvictedInNameOrder() throws IOException {
        ArtifactRepository mocked = mock(ArtifactRepository.class);
        Path later = writeArtifact("image_20240621_000000_2.jpg", 100, 0);
        Path earlier = writeArtifact("image_20240621_000000_1.jpg", 100, 0);
        List<CaptureArtifact> candidates = new ArrayList<>(Arrays.asList(
                new CaptureArtifact(later, 100, BASE_TIME),
                new CaptureArtifact(earlier, 100, BASE_TIME)));
        candidates.sort(ArtifactRepository.OLDEST_FIRST);
        when(mocked.totalSizeBytes()).thenReturn(200L);
        when(mocked.listEvictionCandidates()).thenReturn(candidates);

        // 200 字节，配额 150 -> 目标 135，只需删一张
        CleanupReport report = new QuotaEnforcer(mocked, 150).enforceIfNeeded();

        assertEquals(Collections.singletonList("image_20240621_000000_1.jpg"), report.getDeletedFiles());
        assertFalse(Files.exists(earlier));
        assertTrue(Files.exists(later));
    }

    /**
     * 清理按创建时间排序。Linux 上 JDK 17 的 creationTime 取的就是 mtime；
     * 在能设置创建时间的文件系统上一并设置。其余平台上由写入顺序决定先后，
     * 所以各测试都按预期的新旧顺序写文件，文件名也按同一顺序递增。
     */
    private Path writeArtifact(String name, int size, int secondsAfterBase) throws IOException {
        Path file = imageDir.resolve(name);
        Files.write(file, new byte[size]);
        FileTime time = FileTime.from(BASE_TIME.plusSeconds(secondsAfterBase));
        Files.getFileAttributeView(file, BasicFileAttributeView.class).setTimes(time, null, time);
        return file;
    }
}
