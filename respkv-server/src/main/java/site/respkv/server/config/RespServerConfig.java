package site.respkv.server.config;

import lombok.Builder;
import lombok.Data;

/**
 * 服务器配置
 *
 * <p>使用Builder构建，未指定的字段取默认值；{@link #validate()} 在启动前校验取值范围。
 *
 * @author respkv
 * @since 1.0.0
 */
@Data
@Builder
public class RespServerConfig {

    // ========== 网络配置 ==========

    @Builder.Default
    private String host = "localhost";

    /** 0 表示由操作系统分配临时端口 */
    @Builder.Default
    private int port = 6379;

    @Builder.Default
    private int backlogSize = 1024;

    @Builder.Default
    private int receiveBufferSize = 32 * 1024;

    @Builder.Default
    private int sendBufferSize = 32 * 1024;

    // ========== 线程配置 ==========

    @Builder.Default
    private int bossThreadCount = 1;

    @Builder.Default
    private int workerThreadCount = Runtime.getRuntime().availableProcessors() * 2;

    @Builder.Default
    private int commandExecutorThreadCount = Runtime.getRuntime().availableProcessors();

    // ========== 过期清理配置 ==========

    @Builder.Default
    private boolean expirySweepEnabled = true;

    @Builder.Default
    private long expirySweepIntervalMillis = 60_000L;

    // ========== 工厂方法 ==========

    public static RespServerConfig defaultConfig() {
        return RespServerConfig.builder().build();
    }

    public static RespServerConfig developmentConfig() {
        return RespServerConfig.builder()
                .host("127.0.0.1")
                .port(6379)
                .workerThreadCount(2)
                .commandExecutorThreadCount(2)
                .expirySweepIntervalMillis(1_000L)
                .build();
    }

    public void validate() {
        if (host == null || host.trim().isEmpty()) {
            throw new IllegalArgumentException("监听地址不能为空");
        }

        if (port < 0 || port > 65535) {
            throw new IllegalArgumentException("端口号必须在0-65535范围内");
        }

        if (bossThreadCount <= 0 || workerThreadCount <= 0 || commandExecutorThreadCount <= 0) {
            throw new IllegalArgumentException("线程数量必须大于0");
        }

        if (backlogSize <= 0 || receiveBufferSize <= 0 || sendBufferSize <= 0) {
            throw new IllegalArgumentException("缓冲区大小必须大于0");
        }

        if (expirySweepEnabled && expirySweepIntervalMillis <= 0) {
            throw new IllegalArgumentException("启用过期清理时清理间隔必须大于0");
        }
    }
}
