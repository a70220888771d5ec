package com.whu.cosmicam.service;

import com.whu.cosmicam.model.CaptureArtifact;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;

class ArtifactRepositoryTest {

    private static final Instant CAPTURE_TIME = Instant.parse("2024-06-21T07:00:00Z");

    @TempDir
    Path tempDir;

    @Test
    void namesArtifactsInTheReferenceZone() {
        ArtifactRepository repository = new ArtifactRepository(tempDir, ZoneId.of("America/Chicago"));

        assertThat(repository.newArtifactPath(CAPTURE_TIME).getFileName().toString())
                .isEqualTo("image_20240621_020000.jpg");
    }

    @Test
    void sameSecondCapturesGetASuffix() throws IOException {
        ArtifactRepository repository = new ArtifactRepository(tempDir, ZoneId.of("UTC"));
        Files.write(tempDir.resolve("image_20240621_070000.jpg"), new byte[1]);
        Files.write(tempDir.resolve("image_20240621_070000_1.jpg"), new byte[1]);

        assertThat(repository.newArtifactPath(CAPTURE_TIME).getFileName().toString())
                .isEqualTo("image_20240621_070000_2.jpg");
    }

    @Test
    void missingDirectoryIsEmptyAndCanBeCreated() throws IOException {
        Path imageDir = tempDir.resolve("images");
        ArtifactRepository repository = new ArtifactRepository(imageDir, ZoneId.of("UTC"));

        assertThat(repository.totalSizeBytes()).isZero();
        assertThat(repository.findLatest()).isEmpty();

        repository.ensureDirectoryExists();
        assertThat(imageDir).isDirectory();
    }

    @Test
    void evictionCandidatesAreOnlyCaptureArtifacts() throws IOException {
        ArtifactRepository repository = new ArtifactRepository(tempDir, ZoneId.of("UTC"));
        Files.write(tempDir.resolve("image_20240621_070000.jpg"), new byte[10]);
        Files.write(tempDir.resolve("image_20240621_070100.PNG"), new byte[10]);
        Files.write(tempDir.resolve("upload.jpg"), new byte[10]);
        Files.write(tempDir.resolve("image_notes.txt"), new byte[10]);

        List<String> names = repository.listEvictionCandidates().stream()
                .map(CaptureArtifact::getFileName)
                .collect(Collectors.toList());

        assertThat(names).containsExactlyInAnyOrder("image_20240621_070000.jpg", "image_20240621_070100.PNG");
        assertThat(repository.totalSizeBytes()).isEqualTo(40);
    }

    @Test
    void oldestFirstBreaksCreationTimeTiesByName() {
        List<CaptureArtifact> artifacts = new ArrayList<>(Arrays.asList(
                new CaptureArtifact(tempDir.resolve("image_20240621_070000_2.jpg"), 10, CAPTURE_TIME),
                new CaptureArtifact(tempDir.resolve("image_20240621_070001.jpg"), 10, CAPTURE_TIME.plusSeconds(1)),
                new CaptureArtifact(tempDir.resolve("image_20240621_070000_1.jpg"), 10, CAPTURE_TIME)));

        artifacts.sort(ArtifactRepository.OLDEST_FIRST);

        assertThat(artifacts).extracting(CaptureArtifact::getFileName).containsExactly(
                "image_20240621_070000_1.jpg", "image_20240621_070000_2.jpg", "image_20240621_070001.jpg");
    }
}
