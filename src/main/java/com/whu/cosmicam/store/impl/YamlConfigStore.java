package com.whu.cosmicam.store.impl;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import com.whu.cosmicam.store.ConfigDefaults;
import com.whu.cosmicam.store.ConfigDocument;
import com.whu.cosmicam.store.ConfigStore;
import com.whu.cosmicam.store.ConfigStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 基于 YAML 文件的配置存储
 * 每个文档对应配置目录下的一个 {name}.yaml 文件；
 * 兼容旧版本遗留的 {name}.json 文件 (首次初始化时自动转换为 YAML)。
 */
public class YamlConfigStore implements ConfigStore {

    private static final Logger log = LoggerFactory.getLogger(YamlConfigStore.class);

    private static final TypeReference<LinkedHashMap<String, Object>> DOCUMENT_TYPE = new TypeReference<>() {};

    private final Path configDir;
    private final ObjectMapper yamlMapper;
    private final ObjectMapper jsonMapper;

    public YamlConfigStore(Path configDir) {
        this.configDir = configDir;
        this.yamlMapper = YAMLMapper.builder()
                .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
                .build();
        this.jsonMapper = new ObjectMapper();
    }

    /**
     * 确保配置目录存在，并为缺失或损坏的文档写入默认值
     */
    public synchronized void initialize() {
        try {
            Files.createDirectories(configDir);
        } catch (IOException e) {
            throw new ConfigStoreException("无法创建配置目录: " + configDir, e);
        }
        log.info("[配置] 配置目录: {}", configDir.toAbsolutePath());

        for (ConfigDocument document : ConfigDocument.values()) {
            initDocument(document);
        }
    }

    private void initDocument(ConfigDocument document) {
        Path yamlFile = yamlPath(document);

        if (Files.exists(yamlFile)) {
            // 文件存在时只校验格式，损坏则恢复默认值
            try {
                readDocument(yamlMapper, yamlFile);
            } catch (IOException e) {
                log.error("[配置] {} 不是合法的 YAML，恢复默认值: {}", yamlFile, e.getMessage());
                writeDefaults(document, yamlFile);
            }
            return;
        }

        Path jsonFile = jsonPath(document);
        if (Files.exists(jsonFile)) {
            try {
                Map<String, Object> data = readDocument(jsonMapper, jsonFile);
                writeDocument(yamlFile, data);
                log.info("[配置] 已将 JSON 转换为 YAML: {} -> {}", jsonFile, yamlFile);
                return;
            } catch (IOException e) {
                log.error("[配置] JSON 转换 YAML 失败: {}", e.getMessage());
            }
        }

        log.info("[配置] 创建默认配置文件: {}", yamlFile);
        writeDefaults(document, yamlFile);
    }

    @Override
    public synchronized Map<String, Object> get(ConfigDocument document) {
        try {
            Path yamlFile = yamlPath(document);
            if (Files.exists(yamlFile)) {
                return readDocument(yamlMapper, yamlFile);
            }

            Path jsonFile = jsonPath(document);
            if (Files.exists(jsonFile)) {
                return readDocument(jsonMapper, jsonFile);
            }
        } catch (IOException e) {
            log.error("[配置] 读取 {} 失败: {}", document.getDocumentName(), e.getMessage());
        }

        log.warn("[配置] {} 使用内置默认配置", document.getDocumentName());
        return ConfigDefaults.of(document);
    }

    @Override
    public synchronized boolean update(ConfigDocument document, Map<String, Object> partial) {
        try {
            Map<String, Object> current = get(document);
            current.putAll(partial);
            writeDocument(yamlPath(document), current);
            log.info("[配置] 已更新 {}", document.getDocumentName());
            return true;
        } catch (IOException e) {
            log.error("[配置] 更新 {} 失败: {}", document.getDocumentName(), e.getMessage());
            return false;
        }
    }

    public Path getConfigDir() {
        return configDir;
    }

    Path yamlPath(ConfigDocument document) {
        return configDir.resolve(document.getDocumentName() + ".yaml");
    }

    Path jsonPath(ConfigDocument document) {
        return configDir.resolve(document.getDocumentName() + ".json");
    }

    private Map<String, Object> readDocument(ObjectMapper mapper, Path file) throws IOException {
        Map<String, Object> data = mapper.readValue(file.toFile(), DOCUMENT_TYPE);
        if (data == null) {
            throw new IOException("文档内容为空: " + file);
        }
        return data;
    }

    /**
     * 先写临时文件再替换，避免写到一半被其他进程读到残缺内容
     */
    private void writeDocument(Path file, Map<String, Object> data) throws IOException {
        Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
        yamlMapper.writeValue(tmp.toFile(), data);
        Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    }

    private void writeDefaults(ConfigDocument document, Path file) {
        try {
            writeDocument(file, ConfigDefaults.of(document));
        } catch (IOException e) {
            log.error("[配置] 写入默认配置 {} 失败: {}", file, e.getMessage());
        }
    }
}
