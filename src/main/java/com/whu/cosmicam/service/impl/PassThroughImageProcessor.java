package com.whu.cosmicam.service.impl;

import com.whu.cosmicam.service.ImageProcessor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.nio.file.Path;

/**
 * 不做任何处理，原样返回
 */
@Component
public class PassThroughImageProcessor implements ImageProcessor {

    private static final Logger log = LoggerFactory.getLogger(PassThroughImageProcessor.class);

    @Override
    public Path process(Path imagePath) {
        log.debug("[图片处理] 直通处理: {}", imagePath);
        return imagePath;
    }
}
