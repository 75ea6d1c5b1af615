package site.respkv.core;

import site.respkv.datastructure.RedisBytes;

import java.time.Duration;

/**
 * 支持过期时间的键值存储接口
 *
 * <p>进程内只有一个实例，由所有连接共享。所有操作都是原子的，
 * 已过期的键对每一条读路径都表现为不存在。
 *
 * <ul>
 *     <li>惰性过期 - 读取时发现过期即删除</li>
 *     <li>定期过期 - 后台任务按固定间隔扫描</li>
 * </ul>
 *
 * @author respkv
 * @since 1.0.0
 */
public interface KeyspaceStore {

    /**
     * 存储键值对，不带过期时间；覆盖旧值时会清除旧的过期时间
     *
     * @param key 键
     * @param value 值
     */
    void set(String key, RedisBytes value);

    /**
     * 存储键值对，过期时间为当前时刻加上ttl
     *
     * @param key 键
     * @param value 值
     * @param ttl 存活时间，必须为正
     * @throws IllegalArgumentException ttl为null、零或负数
     */
    void set(String key, RedisBytes value, Duration ttl);

    /**
     * 获取值
     *
     * @param key 键
     * @return 值，不存在或已过期返回null
     */
    RedisBytes get(String key);

    /**
     * 删除键
     *
     * @param key 键
     * @return 删除了未过期的条目返回true
     */
    boolean delete(String key);

    /**
     * 判断键是否存在且未过期，不修改键空间
     */
    boolean exists(String key);

    /**
     * 扫描并删除所有已过期的键
     *
     * @return 删除的键数量
     */
    int sweepExpired();

    /**
     * 存储的条目数，包括尚未回收的过期条目
     */
    int size();

    /**
     * 启动后台过期清理任务
     *
     * @param interval 清理间隔
     * @throws IllegalStateException 清理任务已启动或存储已关闭
     */
    void startExpirySweeper(Duration interval);

    /**
     * 停止后台清理任务
     */
    void shutdown();
}
