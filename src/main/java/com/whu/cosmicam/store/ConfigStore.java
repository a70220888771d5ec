package com.whu.cosmicam.store;

import java.util.Map;

/**
 * 配置文档存储接口
 * 约定：每次 get 都从持久化介质重新读取，实现类不得缓存文档内容，
 * 这样运维人员或 API 写入的修改能在下一个拍摄周期内生效。
 */
public interface ConfigStore {

    /**
     * 读取整个文档；读取失败时返回内置默认值，不抛异常
     */
    Map<String, Object> get(ConfigDocument document);

    /**
     * 先读出当前文档，把 partial 合并进去(同名 key 覆盖)，再整体写回
     *
     * @return 写入成功返回 true，写入失败返回 false
     */
    boolean update(ConfigDocument document, Map<String, Object> partial);
}
