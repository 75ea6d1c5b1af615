package site.respkv.command.impl.string;

import lombok.extern.slf4j.Slf4j;
import site.respkv.command.Command;
import site.respkv.command.KeyArgs;
import site.respkv.core.KeyspaceStore;
import site.respkv.datastructure.RedisBytes;
import site.respkv.protocol.BulkString;
import site.respkv.protocol.Errors;
import site.respkv.protocol.Resp;
import site.respkv.protocol.SimpleString;

import java.time.Duration;

/**
 * SET key value [EX seconds | PX milliseconds]
 *
 * <p>选项名忽略大小写。其他选项名被接受但不生效：值照常写入，不带过期时间。
 *
 * @author respkv
 * @since 1.0.0
 */
@Slf4j
public class Set implements Command {

    static final Errors NOT_AN_INTEGER_ERROR = new Errors("ERR value is not an integer or out of range");

    static final Errors INVALID_EXPIRE_ERROR = new Errors("ERR invalid expire time in 'set' command");

    private static final RedisBytes EX = RedisBytes.fromString("EX");

    private static final RedisBytes PX = RedisBytes.fromString("PX");

    private final KeyspaceStore store;

    private String key;

    private RedisBytes value;

    /** 选项名，三参数形式时为null */
    private RedisBytes option;

    private RedisBytes magnitude;

    public Set(final KeyspaceStore store) {
        this.store = store;
    }

    @Override
    public void setContext(final Resp[] array) {
        key = KeyArgs.key(array[1]);
        value = ((BulkString) array[2]).getContent();
        if (array.length == 5) {
            option = ((BulkString) array[3]).getContent();
            magnitude = ((BulkString) array[4]).getContent();
        }
    }

    @Override
    public Resp handle() {
        if (option == null) {
            store.set(key, value);
            return SimpleString.OK;
        }

        final boolean seconds = option.equalsIgnoreCase(EX);
        if (!seconds && !option.equalsIgnoreCase(PX)) {
            log.debug("忽略未知的SET选项: {}", option.getString());
            store.set(key, value);
            return SimpleString.OK;
        }

        final long amount;
        try {
            amount = Long.parseLong(magnitude.getString());
        } catch (NumberFormatException e) {
            return NOT_AN_INTEGER_ERROR;
        }
        if (amount <= 0) {
            return INVALID_EXPIRE_ERROR;
        }

        try {
            store.set(key, value, seconds ? Duration.ofSeconds(amount) : Duration.ofMillis(amount));
        } catch (IllegalArgumentException e) {
            // 换算成绝对时间时溢出
            return INVALID_EXPIRE_ERROR;
        }
        return SimpleString.OK;
    }
}
