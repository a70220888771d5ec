package com.whu.cosmicam.service;

import com.whu.cosmicam.model.CameraProfile;

import java.nio.file.Path;

/**
 * 外部拍摄程序的抽象
 * 调用会同步阻塞到拍摄结束 (夜间长曝光可能需要数秒)，
 * 成功时图片目录里恰好多出一个新文件。
 */
public interface ImageCapturer {

    /**
     * @return 新图片的路径
     * @throws CaptureException 拍摄失败 (程序不存在、非零退出、超时、没有产生文件)
     */
    Path capture(CameraProfile settings) throws CaptureException;
}
