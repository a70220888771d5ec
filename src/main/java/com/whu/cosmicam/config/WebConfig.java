package com.whu.cosmicam.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.ResourceHandlerRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

import java.nio.file.Paths;

/**
 * Web 配置类
 * 把图片目录映射为 /images/**，前端用 latest-image 接口返回的 path 直接访问图片
 */
@Configuration
public class WebConfig implements WebMvcConfigurer {

    @Value("${cosmicam.image-dir:images}")
    private String imageDir;

    @Override
    public void addResourceHandlers(ResourceHandlerRegistry registry) {
        String location = "file:" + Paths.get(imageDir).toAbsolutePath() + "/";
        registry.addResourceHandler("/images/**")
                .addResourceLocations(location);
    }
}
