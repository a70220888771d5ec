package com.whu.cosmicam.config;

import com.whu.cosmicam.service.ArtifactRepository;
import com.whu.cosmicam.service.ImageCapturer;
import com.whu.cosmicam.service.SunPhaseCalculator;
import com.whu.cosmicam.service.impl.LibcameraImageCapturer;
import com.whu.cosmicam.store.ConfigStore;
import com.whu.cosmicam.store.impl.YamlConfigStore;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Paths;
import java.time.Clock;
import java.time.ZoneId;

/**
 * 相机服务的核心 Bean 配置
 * 读取 application.properties 中 cosmicam.* 的配置，创建配置存储、图片目录、拍摄程序等对象。
 */
@Configuration
public class CosmiCamConfig {

    @Value("${cosmicam.config-dir}")
    private String configDir;

    @Value("${cosmicam.image-dir}")
    private String imageDir;

    // 太阳相位计算与图片命名使用的参考时区
    @Value("${cosmicam.timezone:America/Chicago}")
    private String timezone;

    @Value("${cosmicam.capture.command:libcamera-still}")
    private String captureCommand;

    @Value("${cosmicam.capture.width:4056}")
    private int captureWidth;

    @Value("${cosmicam.capture.height:3040}")
    private int captureHeight;

    @Value("${cosmicam.capture.timeout-seconds:120}")
    private long captureTimeoutSeconds;

    @Bean
    public Clock clock() {
        return Clock.system(ZoneId.of(timezone));
    }

    /**
     * 显式创建、注入到各组件的配置存储 (不使用全局单例)
     */
    @Bean
    public ConfigStore configStore() {
        YamlConfigStore store = new YamlConfigStore(Paths.get(configDir));
        store.initialize();
        return store;
    }

    @Bean
    public SunPhaseCalculator sunPhaseCalculator(Clock clock) {
        return new SunPhaseCalculator(clock.getZone());
    }

    @Bean
    public ArtifactRepository artifactRepository(Clock clock) {
        return new ArtifactRepository(Paths.get(imageDir), clock.getZone());
    }

    @Bean
    public ImageCapturer imageCapturer(ArtifactRepository artifactRepository, Clock clock) {
        return new LibcameraImageCapturer(artifactRepository, clock, captureCommand,
                captureWidth, captureHeight, captureTimeoutSeconds);
    }
}
