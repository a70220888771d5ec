package com.whu.cosmicam.store;

/**
 * 持久化的三个配置文档，每个文档都是一个扁平的 key -> value 映射
 */
public enum ConfigDocument {

    COORDINATES("coordinates"),
    CAMERA_PROFILES("camera_profiles"),
    SYSTEM_SETTINGS("system_settings");

    private final String documentName;

    ConfigDocument(String documentName) {
        this.documentName = documentName;
    }

    public String getDocumentName() {
        return documentName;
    }
}
