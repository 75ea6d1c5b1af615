package site.respkv.datastructure;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * 不可变字节串封装类，协议层与存储层共用的二进制安全值类型。
 *
 * <p>批量字符串的负载、键空间中保存的值都以本类表示：
 * <ul>
 *   <li>内容相等性：equals/hashCode 基于字节内容，可直接作为容器键使用
 *   <li>哈希值缓存：构造时预计算哈希值
 *   <li>字符串缓存：延迟初始化并缓存 UTF-8 字符串表示
 *   <li>零拷贝接口：为解码器等受信任路径提供不复制的包装方式
 * </ul>
 *
 * <p>线程安全性：本类是不可变的，线程安全。
 *
 * @author respkv
 * @since 1.0.0
 */
public final class RedisBytes implements Comparable<RedisBytes> {

    /** 字符串编码解码使用的字符集 */
    public static final Charset CHARSET = StandardCharsets.UTF_8;

    /** 预分配的空字节串实例 */
    public static final RedisBytes EMPTY = new RedisBytes(new byte[0], true);

    private final byte[] bytes;

    private final int hashCode;

    /** 延迟初始化的字符串值 */
    private volatile String stringValue;

    /**
     * 创建不可变字节串实例，执行防御性拷贝。
     *
     * @param bytes 源字节数组，不能为null
     * @throws IllegalArgumentException 如果bytes为null
     */
    public RedisBytes(final byte[] bytes) {
        this(bytes, false);
    }

    private RedisBytes(final byte[] bytes, final boolean trusted) {
        if (bytes == null) {
            throw new IllegalArgumentException("字节数组不能为null");
        }
        this.bytes = trusted ? bytes : bytes.clone();
        this.hashCode = Arrays.hashCode(this.bytes);
    }

    /**
     * 创建零拷贝实例。
     *
     * <p><b>警告</b>：调用者必须保证参数数组在实例生命周期内不被修改！
     *
     * @param trustedBytes 受信任的字节数组
     * @return RedisBytes实例，如果输入为null则返回null
     */
    public static RedisBytes wrapTrusted(final byte[] trustedBytes) {
        if (trustedBytes == null) {
            return null;
        }
        return new RedisBytes(trustedBytes, true);
    }

    /**
     * 以 UTF-8 编码创建实例。
     *
     * @param str 源字符串
     * @return RedisBytes实例，如果输入为null则返回null
     */
    public static RedisBytes fromString(final String str) {
        if (str == null) {
            return null;
        }
        if (str.isEmpty()) {
            return EMPTY;
        }
        final RedisBytes redisBytes = new RedisBytes(str.getBytes(CHARSET), true);
        redisBytes.stringValue = str;
        return redisBytes;
    }

    /**
     * 严格 UTF-8 解码，遇到非法字节序列时抛出异常而不是替换字符。
     *
     * @param bytes 待解码字节
     * @param offset 起始偏移
     * @param length 长度
     * @return 解码后的字符串
     * @throws CharacterCodingException 字节序列不是合法的 UTF-8
     */
    public static String decodeStrict(final byte[] bytes, final int offset, final int length)
            throws CharacterCodingException {
        return CHARSET.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT)
                .decode(ByteBuffer.wrap(bytes, offset, length))
                .toString();
    }

    /**
     * 获取底层字节数组的副本
     *
     * @return 字节数组的副本
     */
    public byte[] getBytes() {
        return bytes.clone();
    }

    /**
     * 获取底层字节数组的直接引用，调用者不得修改返回的数组。
     *
     * @return 字节数组的直接引用
     */
    public byte[] getBytesUnsafe() {
        return bytes;
    }

    /**
     * 获取 UTF-8 字符串表示，非法字节按替换字符处理。
     *
     * @return 字符串值
     */
    public String getString() {
        String result = stringValue;
        if (result == null) {
            result = new String(bytes, CHARSET);
            stringValue = result;
        }
        return result;
    }

    /**
     * 大小写不敏感的 ASCII 比较，用于命令名匹配。
     *
     * @param other 另一个RedisBytes对象
     * @return 是否相等（忽略ASCII大小写）
     */
    public boolean equalsIgnoreCase(final RedisBytes other) {
        if (this == other) {
            return true;
        }
        if (other == null || bytes.length != other.bytes.length) {
            return false;
        }
        for (int i = 0; i < bytes.length; i++) {
            if (toLowerAscii(bytes[i]) != toLowerAscii(other.bytes[i])) {
                return false;
            }
        }
        return true;
    }

    /**
     * 转换为 ASCII 大写形式，非字母字节保持不变。
     *
     * @return 大写形式的新实例，如果本身已是大写则返回自身
     */
    public RedisBytes toUpperCase() {
        byte[] upper = null;
        for (int i = 0; i < bytes.length; i++) {
            final byte b = bytes[i];
            if (b >= 'a' && b <= 'z') {
                if (upper == null) {
                    upper = bytes.clone();
                }
                upper[i] = (byte) (b - 32);
            }
        }
        return upper == null ? this : new RedisBytes(upper, true);
    }

    private static byte toLowerAscii(final byte b) {
        return b >= 'A' && b <= 'Z' ? (byte) (b + 32) : b;
    }

    public int length() {
        return bytes.length;
    }

    public boolean isEmpty() {
        return bytes.length == 0;
    }

    @Override
    public int compareTo(final RedisBytes other) {
        return Arrays.compareUnsigned(this.bytes, other.bytes);
    }

    @Override
    public boolean equals(final Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null || getClass() != obj.getClass()) {
            return false;
        }
        final RedisBytes other = (RedisBytes) obj;
        return hashCode == other.hashCode && Arrays.equals(bytes, other.bytes);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        final StringBuilder sb = new StringBuilder();
        sb.append("RedisBytes[length=").append(bytes.length);

        // 只预览短数据，不可打印字节转为十六进制
        if (bytes.length <= 32) {
            sb.append(", preview='");
            for (int i = 0; i < Math.min(bytes.length, 16); i++) {
                final byte b = bytes[i];
                if (b >= 32 && b <= 126) {
                    sb.append((char) b);
                } else {
                    sb.append("\\x").append(String.format("%02x", b & 0xFF));
                }
            }
            if (bytes.length > 16) {
                sb.append("...");
            }
            sb.append("'");
        }
        sb.append("]");
        return sb.toString();
    }
}
