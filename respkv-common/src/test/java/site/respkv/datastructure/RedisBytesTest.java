package site.respkv.datastructure;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.nio.charset.CharacterCodingException;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * RedisBytes 单元测试
 *
 * 测试覆盖：
 * 1. 构造函数与工厂方法
 * 2. 内容相等性与哈希
 * 3. 大小写处理
 * 4. 严格 UTF-8 解码
 */
@DisplayName("RedisBytes 单元测试")
class RedisBytesTest {

    @Nested
    @DisplayName("构造函数测试")
    class ConstructorTests {

        @Test
        @DisplayName("标准构造函数执行防御性拷贝")
        void testConstructorCopiesInput() {
            final byte[] source = "value".getBytes(RedisBytes.CHARSET);
            final RedisBytes rb = new RedisBytes(source);

            source[0] = 'X';

            assertEquals("value", rb.getString());
        }

        @Test
        @DisplayName("标准构造函数 - null 输入")
        void testConstructorWithNull() {
            assertThrows(IllegalArgumentException.class, () -> new RedisBytes(null));
        }

        @Test
        @DisplayName("wrapTrusted 不拷贝数组，null 输入返回 null")
        void testWrapTrusted() {
            final byte[] source = {1, 2, 3};
            final RedisBytes rb = RedisBytes.wrapTrusted(source);

            assertSame(source, rb.getBytesUnsafe());
            assertNull(RedisBytes.wrapTrusted(null));
        }

        @Test
        @DisplayName("fromString 空串返回 EMPTY")
        void testFromStringEmpty() {
            assertSame(RedisBytes.EMPTY, RedisBytes.fromString(""));
            assertNull(RedisBytes.fromString(null));
            assertTrue(RedisBytes.EMPTY.isEmpty());
        }
    }

    @Nested
    @DisplayName("相等性测试")
    class EqualityTests {

        @Test
        @DisplayName("内容相同即相等，可作为 Map 键")
        void testContentEquality() {
            final RedisBytes a = RedisBytes.fromString("key");
            final RedisBytes b = new RedisBytes("key".getBytes(RedisBytes.CHARSET));

            assertEquals(a, b);
            assertEquals(a.hashCode(), b.hashCode());

            final Map<RedisBytes, Integer> map = new HashMap<>();
            map.put(a, 1);
            assertEquals(1, map.get(b));
        }

        @Test
        @DisplayName("getBytes 返回副本")
        void testGetBytesReturnsCopy() {
            final RedisBytes rb = RedisBytes.fromString("abc");
            rb.getBytes()[0] = 'z';

            assertEquals("abc", rb.getString());
        }

        @Test
        @DisplayName("compareTo 按无符号字节序比较")
        void testCompareTo() {
            final RedisBytes low = new RedisBytes(new byte[]{0x01});
            final RedisBytes high = new RedisBytes(new byte[]{(byte) 0xFF});

            assertTrue(low.compareTo(high) < 0);
            assertEquals(0, low.compareTo(new RedisBytes(new byte[]{0x01})));
        }
    }

    @Nested
    @DisplayName("大小写测试")
    class CaseTests {

        @Test
        @DisplayName("equalsIgnoreCase 只忽略 ASCII 字母大小写")
        void testEqualsIgnoreCase() {
            assertTrue(RedisBytes.fromString("ping").equalsIgnoreCase(RedisBytes.fromString("PiNg")));
            assertFalse(RedisBytes.fromString("ping").equalsIgnoreCase(RedisBytes.fromString("pong")));
            assertFalse(RedisBytes.fromString("ping").equalsIgnoreCase(null));
        }

        @Test
        @DisplayName("toUpperCase 已是大写时返回自身")
        void testToUpperCase() {
            final RedisBytes upper = RedisBytes.fromString("SET");

            assertSame(upper, upper.toUpperCase());
            assertEquals(upper, RedisBytes.fromString("sEt").toUpperCase());
            assertEquals("A1-", RedisBytes.fromString("a1-").toUpperCase().getString());
        }
    }

    @Nested
    @DisplayName("UTF-8 解码测试")
    class DecodeTests {

        @Test
        @DisplayName("严格解码合法 UTF-8")
        void testDecodeStrictValid() throws CharacterCodingException {
            final byte[] bytes = "héllo".getBytes(RedisBytes.CHARSET);

            assertEquals("héllo", RedisBytes.decodeStrict(bytes, 0, bytes.length));
        }

        @Test
        @DisplayName("严格解码拒绝非法字节序列")
        void testDecodeStrictInvalid() {
            final byte[] bytes = {'o', 'k', (byte) 0xC3};

            assertThrows(CharacterCodingException.class,
                    () -> RedisBytes.decodeStrict(bytes, 0, bytes.length));
        }

        @Test
        @DisplayName("toString 以十六进制预览不可打印字节")
        void testToStringPreview() {
            final RedisBytes rb = new RedisBytes(new byte[]{'a', 0x00});

            assertEquals("RedisBytes[length=2, preview='a\\x00']", rb.toString());
        }
    }
}
