package com.whu.cosmicam.controller;

import com.whu.cosmicam.dto.ApiResponse;
import com.whu.cosmicam.dto.CameraProfileVo;
import com.whu.cosmicam.dto.CaptureStatusVo;
import com.whu.cosmicam.dto.LatestImageVo;
import com.whu.cosmicam.model.Coordinates;
import com.whu.cosmicam.service.CameraQueryService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;
import java.util.Optional;

@RestController
@RequestMapping("/api")
public class CameraController {

    private static final Logger log = LoggerFactory.getLogger(CameraController.class);

    @Autowired
    private CameraQueryService cameraQueryService;

    /**
     * 当前 profile、参数与太阳相位
     */
    @GetMapping("/camera/profile")
    public ResponseEntity<ApiResponse<CameraProfileVo>> getCameraProfile() {
        return ResponseEntity.ok(ApiResponse.success("获取成功", cameraQueryService.getCurrentProfile()));
    }

    /**
     * 合并更新指定 profile (不存在则新建)
     * 例如 POST /api/camera/profile/night  {"shutter_speed": 8000000}
     */
    @PostMapping("/camera/profile/{name}")
    public ResponseEntity<ApiResponse<String>> updateProfile(@PathVariable String name,
                                                             @RequestBody Map<String, Object> body) {
        if (body == null || body.isEmpty()) {
            return ResponseEntity.badRequest().body(ApiResponse.error(400, "参数不能为空"));
        }
        try {
            if (!cameraQueryService.updateProfile(name, body)) {
                return ResponseEntity.status(500).body(ApiResponse.error("profile 保存失败"));
            }
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(ApiResponse.error(400, e.getMessage()));
        }
        return ResponseEntity.ok(ApiResponse.success("profile 已更新"));
    }

    /**
     * 手动切换 profile，下一次按太阳相位刷新时可能被覆盖
     */
    @PostMapping("/camera/profile/{name}/activate")
    public ResponseEntity<ApiResponse<String>> activateProfile(@PathVariable String name) {
        if (!cameraQueryService.switchProfile(name)) {
            return ResponseEntity.status(404).body(ApiResponse.error(404, "profile 不存在: " + name));
        }
        return ResponseEntity.ok(ApiResponse.success("已切换到 " + name));
    }

    @GetMapping("/latest-image")
    public ResponseEntity<ApiResponse<LatestImageVo>> getLatestImage() {
        Optional<LatestImageVo> latest = cameraQueryService.getLatestArtifact();
        if (latest.isEmpty()) {
            return ResponseEntity.status(404).body(ApiResponse.error(404, "No images found"));
        }
        return ResponseEntity.ok(ApiResponse.success("获取成功", latest.get()));
    }

    @GetMapping("/coordinates")
    public ResponseEntity<ApiResponse<Coordinates>> getCoordinates() {
        return ResponseEntity.ok(ApiResponse.success("获取成功", cameraQueryService.getCoordinates()));
    }

    /**
     * 更新坐标，成功后立即按新坐标刷新 profile
     */
    @PostMapping("/coordinates")
    public ResponseEntity<ApiResponse<String>> updateCoordinates(@RequestBody Map<String, Object> body) {
        if (body == null || body.get("latitude") == null || body.get("longitude") == null) {
            return ResponseEntity.badRequest().body(ApiResponse.error(400, "Missing coordinates"));
        }

        double latitude;
        double longitude;
        try {
            latitude = Double.parseDouble(body.get("latitude").toString());
            longitude = Double.parseDouble(body.get("longitude").toString());
        } catch (NumberFormatException e) {
            return ResponseEntity.badRequest().body(ApiResponse.error(400, "坐标必须是数字"));
        }

        if (!cameraQueryService.updateCoordinates(latitude, longitude)) {
            log.error("[接口] 坐标更新失败: ({}, {})", latitude, longitude);
            return ResponseEntity.status(500).body(ApiResponse.error("Failed to update coordinates"));
        }
        return ResponseEntity.ok(ApiResponse.success("Coordinates updated successfully"));
    }

    @GetMapping("/capture/status")
    public ResponseEntity<ApiResponse<CaptureStatusVo>> getCaptureStatus() {
        return ResponseEntity.ok(ApiResponse.success("获取成功", cameraQueryService.getCaptureStatus()));
    }
}
