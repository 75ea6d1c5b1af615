package site.respkv.database;

import site.respkv.datastructure.RedisBytes;
import site.respkv.datastructure.StoreEntry;

import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 键空间：键到 {@link StoreEntry} 的映射
 *
 * <p>整个键空间由一把互斥锁保护，每个操作相对其他操作都是原子的。
 * 过期判断与惰性删除在同一次持锁中完成；定期清理与惰性删除使用同一个
 * 过期判断 {@link StoreEntry#isExpired(long)}。
 *
 * <p>本类不读取时钟，当前时间由调用方传入。
 *
 * @author respkv
 * @since 1.0.0
 */
public class Keyspace {

    private final Map<String, StoreEntry> data = new HashMap<>();

    private final ReentrantLock lock = new ReentrantLock();

    /**
     * 存储键值对，覆盖已有条目（包括其过期时间）
     *
     * @param key 键
     * @param entry 条目
     */
    public void put(final String key, final StoreEntry entry) {
        lock.lock();
        try {
            data.put(key, entry);
        } finally {
            lock.unlock();
        }
    }

    /**
     * 获取未过期的值，已过期的条目会被顺带删除
     *
     * @param key 键
     * @param nowMillis 当前时间戳（毫秒）
     * @return 值，不存在或已过期返回null
     */
    public RedisBytes get(final String key, final long nowMillis) {
        lock.lock();
        try {
            final StoreEntry entry = data.get(key);
            if (entry == null || removeIfExpired(key, entry, nowMillis)) {
                return null;
            }
            return entry.getValue();
        } finally {
            lock.unlock();
        }
    }

    /**
     * 删除键
     *
     * @param key 键
     * @param nowMillis 当前时间戳（毫秒）
     * @return 只有删除了未过期的条目才返回true；已过期的条目同样被移除但返回false
     */
    public boolean remove(final String key, final long nowMillis) {
        lock.lock();
        try {
            final StoreEntry entry = data.remove(key);
            return entry != null && !entry.isExpired(nowMillis);
        } finally {
            lock.unlock();
        }
    }

    /**
     * 只读的存在性检查，与 {@link #get} 使用相同的过期判断
     */
    public boolean containsLive(final String key, final long nowMillis) {
        lock.lock();
        try {
            final StoreEntry entry = data.get(key);
            return entry != null && !entry.isExpired(nowMillis);
        } finally {
            lock.unlock();
        }
    }

    /**
     * 一次线性扫描，删除所有已过期的条目
     *
     * @param nowMillis 当前时间戳（毫秒）
     * @return 删除的条目数
     */
    public int removeExpired(final long nowMillis) {
        lock.lock();
        try {
            int removed = 0;
            final Iterator<Map.Entry<String, StoreEntry>> it = data.entrySet().iterator();
            while (it.hasNext()) {
                if (it.next().getValue().isExpired(nowMillis)) {
                    it.remove();
                    removed++;
                }
            }
            return removed;
        } finally {
            lock.unlock();
        }
    }

    /**
     * 条目数，包含尚未回收的过期条目
     */
    public int size() {
        lock.lock();
        try {
            return data.size();
        } finally {
            lock.unlock();
        }
    }

    /** 调用方必须持有锁 */
    private boolean removeIfExpired(final String key, final StoreEntry entry, final long nowMillis) {
        if (entry.isExpired(nowMillis)) {
            data.remove(key);
            return true;
        }
        return false;
    }
}
