package site.respkv.command;

import site.respkv.datastructure.RedisBytes;
import site.respkv.protocol.BulkString;
import site.respkv.protocol.Resp;

import java.nio.charset.CharacterCodingException;

/**
 * 键名参数解码
 *
 * <p>键名按严格UTF-8解码，非法字节不做替换。不同的字节序列因此不会落到同一个键上。
 *
 * @author respkv
 * @since 1.0.0
 */
public final class KeyArgs {

    private KeyArgs() {
    }

    /**
     * 把批量字符串参数解码为键名
     *
     * @param arg 命令参数，已由分发器保证是非null批量字符串
     * @return 键名
     * @throws IllegalArgumentException 参数不是合法UTF-8，按内部错误处理并关闭连接
     */
    public static String key(final Resp arg) {
        final byte[] bytes = ((BulkString) arg).getContent().getBytesUnsafe();
        try {
            return RedisBytes.decodeStrict(bytes, 0, bytes.length);
        } catch (CharacterCodingException e) {
            throw new IllegalArgumentException("Invalid UTF-8 in key", e);
        }
    }
}
