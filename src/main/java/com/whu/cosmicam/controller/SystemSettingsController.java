package com.whu.cosmicam.controller;

import com.whu.cosmicam.dto.ApiResponse;
import com.whu.cosmicam.service.CameraQueryService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * 系统设置 (拍摄间隔、磁盘配额)
 * 拍摄循环每轮都会重新读取，所以这里保存后下一轮即生效，无需重启。
 */
@RestController
@RequestMapping("/api/settings")
public class SystemSettingsController {

    @Autowired
    private CameraQueryService cameraQueryService;

    @GetMapping("/system")
    public ResponseEntity<ApiResponse<Map<String, Object>>> getSystemSettings() {
        return ResponseEntity.ok(ApiResponse.success("获取成功", cameraQueryService.getSystemSettings()));
    }

    /**
     * 例如 {"capture_interval": 30, "max_disk_usage_gb": 10}
     */
    @PostMapping("/system")
    public ResponseEntity<ApiResponse<String>> saveSystemSettings(@RequestBody Map<String, Object> body) {
        if (body == null || body.isEmpty()) {
            return ResponseEntity.badRequest().body(ApiResponse.error(400, "参数不能为空"));
        }
        try {
            if (!cameraQueryService.updateSystemSettings(body)) {
                return ResponseEntity.status(500).body(ApiResponse.error("设置保存失败"));
            }
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(ApiResponse.error(400, e.getMessage()));
        }
        return ResponseEntity.ok(ApiResponse.success("设置保存成功"));
    }
}
