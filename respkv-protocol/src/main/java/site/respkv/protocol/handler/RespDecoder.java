package site.respkv.protocol.handler;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.ByteToMessageDecoder;
import lombok.extern.slf4j.Slf4j;
import site.respkv.protocol.IncompleteFrameException;
import site.respkv.protocol.MalformedFrameException;
import site.respkv.protocol.Resp;

import java.util.List;

/**
 * RESP协议解码器
 *
 * <p>基于Netty的ByteToMessageDecoder，在累积缓冲区上驱动 {@link site.respkv.protocol.RespParser}。
 * 每次调用解码一个完整元素，ByteToMessageDecoder 会循环调用直到缓冲区中没有完整帧，
 * 因此一次读取中的多条流水线命令会按顺序全部交给下游。
 *
 * <p>错误处理：
 * <ul>
 *     <li>帧不完整 - 回退读指针，等待下一次读取</li>
 *     <li>格式错误 - 丢弃已累积的数据并抛出，由下游的连接处理器回复错误并关闭连接</li>
 * </ul>
 *
 * <p>格式错误之后连接关闭前仍可能有数据到达，这些字节一律丢弃，不再解码。
 *
 * @author respkv
 * @since 1.0.0
 */
@Slf4j
public class RespDecoder extends ByteToMessageDecoder {

    /** 已遇到格式错误，连接等待关闭 */
    private boolean failed;

    @Override
    protected void decode(final ChannelHandlerContext ctx, final ByteBuf in, final List<Object> out) {
        if (!in.isReadable()) {
            return;
        }
        if (failed) {
            log.trace("连接已出现格式错误，丢弃 {} 字节", in.readableBytes());
            in.skipBytes(in.readableBytes());
            return;
        }

        // 1. 标记位置，帧不完整时回退
        in.markReaderIndex();
        try {
            final Resp resp = Resp.decode(in);
            if (resp != null) {
                out.add(resp);
                log.debug("成功解码RESP对象: {}", resp.getClass().getSimpleName());
            }
        } catch (IncompleteFrameException e) {
            // 2. 数据不完整，等待更多数据
            in.resetReaderIndex();
            log.trace("帧不完整，等待更多数据: {}", e.getMessage());
        } catch (MalformedFrameException e) {
            // 3. 格式错误不可恢复，丢弃剩余字节
            log.warn("RESP格式错误，丢弃 {} 字节: {}", in.readableBytes(), e.getMessage());
            failed = true;
            in.skipBytes(in.readableBytes());
            throw e;
        }
    }

    /**
     * 解码异常交给下游的连接处理器统一处理
     */
    @Override
    public void exceptionCaught(final ChannelHandlerContext ctx, final Throwable cause) {
        log.debug("RespDecoder异常: {}", cause.getMessage());
        ctx.fireExceptionCaught(cause);
    }
}
