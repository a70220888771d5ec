package com.whu.cosmicam.service;

import java.nio.file.Path;

/**
 * 拍摄后的图片处理能力 (例如暗场扣除)，返回处理后图片的路径
 */
public interface ImageProcessor {

    Path process(Path imagePath);
}
