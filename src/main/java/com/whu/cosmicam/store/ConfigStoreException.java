package com.whu.cosmicam.store;

/**
 * 配置文档无法读取或内容无法解析时抛出
 */
public class ConfigStoreException extends RuntimeException {

    public ConfigStoreException(String message) {
        super(message);
    }

    public ConfigStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
