package com.whu.cosmicam.task;

import com.whu.cosmicam.service.CaptureService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import javax.annotation.PreDestroy;

/**
 * 后台拍摄任务
 * 应用启动完成后在独立线程上运行拍摄循环，应用关闭时发出停止信号并等待循环退出。
 * 拍摄间隔每轮都可能变化，所以不用 @Scheduled 的固定频率。
 */
@Component
public class CaptureTask {

    private static final Logger log = LoggerFactory.getLogger(CaptureTask.class);

    // 关闭时等待当前拍摄结束的最长时间
    private static final long SHUTDOWN_WAIT_MILLIS = 30_000;

    @Autowired
    private CaptureService captureService;

    @Value("${cosmicam.capture.enabled:true}")
    private boolean enabled;

    private Thread worker;

    @EventListener(ApplicationReadyEvent.class)
    public synchronized void startCapture() {
        if (!enabled) {
            log.info("[拍摄任务] cosmicam.capture.enabled=false，不启动拍摄循环");
            return;
        }
        if (worker != null && worker.isAlive()) {
            return;
        }
        worker = new Thread(captureService::start, "cosmicam-capture");
        worker.setDaemon(true);
        worker.start();
        log.info("[拍摄任务] 拍摄线程已启动");
    }

    @PreDestroy
    public synchronized void stopCapture() {
        captureService.stop();
        if (worker == null) {
            return;
        }
        try {
            worker.join(SHUTDOWN_WAIT_MILLIS);
            if (worker.isAlive()) {
                log.warn("[拍摄任务] 拍摄线程 {} 毫秒内未退出", SHUTDOWN_WAIT_MILLIS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[拍摄任务] 等待拍摄线程退出时被中断");
        }
    }
}
