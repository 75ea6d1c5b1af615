package site.respkv.server;

import site.respkv.core.KeyspaceStore;

/**
 * RESP服务器接口，定义服务器的生命周期管理。
 *
 * @author respkv
 * @since 1.0.0
 */
public interface RespServer {

    /**
     * 启动服务器：启动过期清理任务并绑定监听端口。
     *
     * @throws IllegalStateException 如果服务器已经启动或端口绑定失败
     */
    void start();

    /**
     * 停止服务器：关闭监听端口与所有连接，停止线程池和过期清理任务。
     */
    void stop();

    /**
     * 实际监听的端口，配置端口为0时返回系统分配的端口。
     *
     * @return 端口号，未启动时返回-1
     */
    int getBoundPort();

    /**
     * 获取所有连接共享的键值存储。
     */
    KeyspaceStore getKeyspaceStore();
}
