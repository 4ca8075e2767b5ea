package com.wangbin.homesync.core.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * homesync 配置映射
 */
@Data
@Component
@ConfigurationProperties(prefix = "homesync")
public class SyncProperties {

    /**
     * 应用启动后是否自动建立同步会话
     */
    private boolean autoStart = true;

    /**
     * 网关 Zigbee API 地址（快照拉取/写入/刷新）
     */
    private String zigbeeApiUrl = "http://localhost:8080/zigbee";

    /**
     * 推送通道配置
     */
    private final Push push = new Push();

    /**
     * 轮询配置
     */
    private final Poll poll = new Poll();

    /**
     * 乐观写入配置
     */
    private final Write write = new Write();

    /**
     * 设备副本配置
     */
    private final Store store = new Store();

    /**
     * 诊断事件保留数量
     */
    private int diagnosticHistorySize = 100;

    @Data
    public static class Push {
        private String url = "ws://localhost:8080/ws";
        /**
         * 连接建立超时（毫秒），超时前未收到任何有效帧视为失败
         */
        private long connectTimeoutMs = 10000;
        /**
         * 重连基础延迟（毫秒）
         */
        private long reconnectBaseDelayMs = 2000;
        /**
         * 重连最大延迟（毫秒）
         */
        private long reconnectMaxDelayMs = 30000;
        /**
         * 连续失败多少次后切换为长间隔重试
         */
        private int maxBackoffAttempts = 5;
        /**
         * 长间隔重试周期（毫秒）
         */
        private long longRetryIntervalMs = 120000;
    }

    @Data
    public static class Poll {
        /**
         * 推送通道未连接时的轮询间隔（毫秒）
         */
        private long intervalMs = 10000;
        /**
         * 推送通道已连接时的轮询间隔（毫秒）
         */
        private long connectedIntervalMs = 30000;
        /**
         * 快照请求超时（毫秒）
         */
        private long requestTimeoutMs = 8000;
        /**
         * 快照路径
         */
        private String listPath = "/list_devices";
    }

    @Data
    public static class Write {
        /**
         * 连续型属性的静默期（毫秒）
         */
        private long debounceMs = 100;
        /**
         * 写入请求超时（毫秒）
         */
        private long requestTimeoutMs = 8000;
        /**
         * 写入方式：POST 发送JSON请求体，GET 以 state 查询参数发送
         */
        private String method = "POST";
        private String setPath = "/set/{deviceId}";
        private String refreshPath = "/get/{deviceId}";
        /**
         * 连续型属性（滑块类），其余属性按离散型（开关类）处理
         */
        private List<String> continuousProperties = new ArrayList<>(List.of("brightness", "color_temp", "color"));
    }

    @Data
    public static class Store {
        /**
         * 是否缓存未知设备的增量更新，等待下一次全量快照后回放
         */
        private boolean bufferUnknownPatches = true;
        /**
         * 未知设备增量缓存的最大设备数
         */
        private int maxBufferedDevices = 64;
    }
}
