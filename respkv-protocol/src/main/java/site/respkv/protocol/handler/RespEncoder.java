package site.respkv.protocol.handler;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.MessageToByteEncoder;
import lombok.extern.slf4j.Slf4j;
import site.respkv.protocol.BulkString;
import site.respkv.protocol.Resp;
import site.respkv.protocol.RespArray;

/**
 * RESP协议编码器
 *
 * <p>将响应值直接编码到出站 ByteBuf，编码前按类型预估大小以减少扩容。
 *
 * @author respkv
 * @since 1.0.0
 */
@Slf4j
public class RespEncoder extends MessageToByteEncoder<Resp> {

    @Override
    protected void encode(final ChannelHandlerContext ctx, final Resp msg, final ByteBuf out) {
        try {
            out.ensureWritable(estimateMessageSize(msg));
            msg.encode(out);
            log.debug("成功编码RESP响应: {} (大小: {} bytes)",
                    msg.getClass().getSimpleName(), out.readableBytes());
        } catch (RuntimeException e) {
            log.error("编码错误: {}", e.getMessage(), e);
            ctx.channel().close();
        }
    }

    /**
     * 估算RESP消息编码后的大小
     *
     * @param msg RESP消息对象
     * @return 估算的编码大小（字节数）
     */
    static int estimateMessageSize(final Resp msg) {
        if (msg instanceof BulkString) {
            final BulkString bulkString = (BulkString) msg;
            // "$-1\r\n" 或 内容 + 协议开销
            return bulkString.isNull() ? 5 : bulkString.getContent().length() + 16;
        }
        if (msg instanceof RespArray) {
            final RespArray array = (RespArray) msg;
            if (array.isNull()) {
                return 5;
            }
            int totalSize = 16;
            for (final Resp element : array.getContent()) {
                totalSize += estimateMessageSize(element);
            }
            return totalSize;
        }
        return 32;
    }
}
