package site.respkv.command;

import lombok.Getter;
import site.respkv.command.impl.Echo;
import site.respkv.command.impl.Ping;
import site.respkv.command.impl.Quit;
import site.respkv.command.impl.key.Del;
import site.respkv.command.impl.string.Get;
import site.respkv.command.impl.string.Set;
import site.respkv.core.KeyspaceStore;
import site.respkv.datastructure.RedisBytes;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;
import java.util.function.IntPredicate;

/**
 * 命令表
 *
 * <p>每个命令类型包含命令名、参数个数约束（包含命令名本身）和命令工厂。
 * 查找时忽略大小写。
 *
 * @author respkv
 * @since 1.0.0
 */
@Getter
public enum CommandType {
    // ========== 连接命令 ==========
    PING("PING", argc -> argc >= 1, store -> new Ping()),
    ECHO("ECHO", argc -> argc == 2, store -> new Echo()),
    QUIT("QUIT", argc -> argc >= 1, store -> new Quit()),

    // ========== 字符串命令 ==========
    GET("GET", argc -> argc == 2, Get::new),
    SET("SET", argc -> argc == 3 || argc == 5, Set::new),

    // ========== 键命令 ==========
    DEL("DEL", argc -> argc >= 2, Del::new);

    private static final Map<RedisBytes, CommandType> COMMAND_CACHE = new HashMap<>();

    static {
        for (final CommandType type : CommandType.values()) {
            COMMAND_CACHE.put(type.commandBytes, type);
        }
    }

    private final RedisBytes commandBytes;

    /** 用于错误消息的小写命令名 */
    private final String lowerName;

    private final IntPredicate arity;

    private final Function<KeyspaceStore, Command> supplier;

    CommandType(final String commandName,
                final IntPredicate arity,
                final Function<KeyspaceStore, Command> supplier) {
        this.commandBytes = RedisBytes.fromString(commandName);
        this.lowerName = commandName.toLowerCase(Locale.ROOT);
        this.arity = arity;
        this.supplier = supplier;
    }

    /**
     * 根据命令名字节查找命令类型，忽略大小写
     *
     * @param commandBytes 命令名
     * @return 命令类型，未知命令返回null
     */
    public static CommandType findByBytes(final RedisBytes commandBytes) {
        if (commandBytes == null) {
            return null;
        }
        // 1. 客户端通常发送大写命令，先直接查找
        final CommandType result = COMMAND_CACHE.get(commandBytes);
        if (result != null) {
            return result;
        }
        // 2. 转为大写后再查找
        return COMMAND_CACHE.get(commandBytes.toUpperCase());
    }

    /**
     * 校验参数个数
     *
     * @param argc 命令数组长度，包含命令名
     * @return 符合约束返回true
     */
    public boolean acceptsArity(final int argc) {
        return arity.test(argc);
    }

    /**
     * 创建命令实例
     *
     * @param store 键值存储
     * @return 新的命令实例
     */
    public Command createCommand(final KeyspaceStore store) {
        return supplier.apply(store);
    }
}
