package com.whu.cosmicam.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Data;

/**
 * 接口统一返回格式：status 与 HTTP 状态码保持一致
 */
@Data
public class ApiResponse<T> {

    private int status;
    private String message;
    private T data;

    public static <T> ApiResponse<T> success(String message, T data) {
        ApiResponse<T> response = new ApiResponse<>();
        response.setStatus(200);
        response.setMessage(message);
        response.setData(data);
        return response;
    }

    public static <T> ApiResponse<T> success(String message) {
        return success(message, null);
    }

    /**
     * 服务端错误 (500)，例如配置写入失败
     */
    public static <T> ApiResponse<T> error(String message) {
        return error(500, message);
    }

    /**
     * 指定状态码的失败，例如参数缺失 (400)、没有图片 (404)
     */
    public static <T> ApiResponse<T> error(int status, String message) {
        ApiResponse<T> response = new ApiResponse<>();
        response.setStatus(status);
        response.setMessage(message);
        return response;
    }

    @JsonIgnore
    public boolean isSuccess() {
        return status == 200;
    }
}
