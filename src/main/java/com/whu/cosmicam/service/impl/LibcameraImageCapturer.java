package com.whu.cosmicam.service.impl;

import com.whu.cosmicam.model.CameraProfile;
import com.whu.cosmicam.service.ArtifactRepository;
import com.whu.cosmicam.service.CaptureException;
import com.whu.cosmicam.service.ImageCapturer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 调用 libcamera-still 拍摄一张图片
 * 参数规则：快门、增益为 0 表示自动，不传；亮度 0 是有效值，只要不为 null 就传；对比度大于 0 才传。
 */
public class LibcameraImageCapturer implements ImageCapturer {

    private static final Logger log = LoggerFactory.getLogger(LibcameraImageCapturer.class);

    private final ArtifactRepository artifactRepository;
    private final Clock clock;
    private final String command;
    private final int width;
    private final int height;
    private final long timeoutSeconds;

    /**
     * @param timeoutSeconds 单次拍摄的最长等待时间，0 表示一直等
     */
    public LibcameraImageCapturer(ArtifactRepository artifactRepository, Clock clock, String command,
                                  int width, int height, long timeoutSeconds) {
        this.artifactRepository = artifactRepository;
        this.clock = clock;
        this.command = command;
        this.width = width;
        this.height = height;
        this.timeoutSeconds = timeoutSeconds;
    }

    @Override
    public Path capture(CameraProfile settings) throws CaptureException {
        Path target = artifactRepository.newArtifactPath(clock.instant());
        List<String> cmd = buildCommand(target, settings);

        log.info("==================================================");
        log.info("[拍摄] 当前参数: {}", settings);
        log.info("[拍摄] 执行命令: {}", String.join(" ", cmd));

        long start = System.nanoTime();
        Process process;
        try {
            process = new ProcessBuilder(cmd).redirectErrorStream(true).start();
        } catch (IOException e) {
            throw new CaptureException("无法启动拍摄命令 " + command + ": " + e.getMessage(), e);
        }

        CompletableFuture<String> output = CompletableFuture.supplyAsync(() -> readFully(process.getInputStream()));
        int exitCode = waitFor(process);
        String commandOutput = collectOutput(output);
        double seconds = (System.nanoTime() - start) / 1_000_000_000.0;

        if (exitCode != 0) {
            throw new CaptureException("拍摄命令退出码 " + exitCode + "，输出: " + commandOutput);
        }
        if (!Files.isRegularFile(target)) {
            throw new CaptureException("拍摄命令执行成功但没有生成文件: " + target);
        }

        if (!commandOutput.isEmpty()) {
            log.info("[拍摄] libcamera 输出: {}", commandOutput);
        }
        log.info("[拍摄] 拍摄成功: {}，耗时 {} 秒", target.getFileName(), String.format("%.2f", seconds));
        log.info("==================================================");
        return target;
    }

    /**
     * 拼装 libcamera-still 命令行
     */
    public List<String> buildCommand(Path outputFile, CameraProfile settings) {
        List<String> cmd = new ArrayList<>();
        cmd.add(command);
        cmd.add("-o");
        cmd.add(outputFile.toString());
        cmd.add("--width");
        cmd.add(String.valueOf(width));
        cmd.add("--height");
        cmd.add(String.valueOf(height));

        if (settings.getShutterSpeed() != null && settings.getShutterSpeed() > 0) {
            cmd.add("--shutter");
            cmd.add(String.valueOf(settings.getShutterSpeed()));
        }
        if (settings.getGain() != null && settings.getGain() > 0) {
            cmd.add("--gain");
            cmd.add(String.valueOf(settings.getGain()));
        }
        if (settings.getBrightness() != null) {
            cmd.add("--brightness");
            cmd.add(String.valueOf(settings.getBrightness()));
        }
        if (settings.getContrast() != null && settings.getContrast() > 0) {
            cmd.add("--contrast");
            cmd.add(String.valueOf(settings.getContrast()));
        }
        return cmd;
    }

    private int waitFor(Process process) throws CaptureException {
        try {
            if (timeoutSeconds <= 0) {
                return process.waitFor();
            }
            if (!process.waitFor(timeoutSeconds, TimeUnit.SECONDS)) {
                process.destroyForcibly();
                throw new CaptureException("拍摄命令超过 " + timeoutSeconds + " 秒未结束，已强制终止");
            }
            return process.exitValue();
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new CaptureException("等待拍摄命令时线程被中断", e);
        }
    }

    private String collectOutput(CompletableFuture<String> output) {
        try {
            return output.get(5, TimeUnit.SECONDS).trim();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return "";
        } catch (ExecutionException | TimeoutException e) {
            log.warn("[拍摄] 读取命令输出失败: {}", e.toString());
            return "";
        }
    }

    private static String readFully(InputStream in) {
        try (InputStream stream = in) {
            return new String(stream.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
