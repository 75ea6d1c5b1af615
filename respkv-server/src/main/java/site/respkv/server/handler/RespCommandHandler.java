package site.respkv.server.handler;

import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.DecoderException;
import lombok.extern.slf4j.Slf4j;
import site.respkv.command.CommandDispatcher;
import site.respkv.command.DispatchResult;
import site.respkv.protocol.Errors;
import site.respkv.protocol.MalformedFrameException;
import site.respkv.protocol.Resp;

/**
 * 连接处理器，每个连接一个实例。
 *
 * <p>职责：
 * <ul>
 *   <li>把解码后的命令交给 {@link CommandDispatcher} 并写回响应
 *   <li>QUIT 等命令在响应发送完成后关闭连接
 *   <li>作为唯一的致命错误出口：格式错误的帧或未预期的异常都回复内部错误并关闭连接
 * </ul>
 *
 * @author respkv
 * @since 1.0.0
 */
@Slf4j
public class RespCommandHandler extends SimpleChannelInboundHandler<Resp> {

    private static final String INTERNAL_ERROR_PREFIX = "ERR Internal error: ";

    private final CommandDispatcher dispatcher;

    public RespCommandHandler(final CommandDispatcher dispatcher) {
        if (dispatcher == null) {
            throw new IllegalArgumentException("命令分发器不能为null");
        }
        this.dispatcher = dispatcher;
    }

    @Override
    public void channelActive(final ChannelHandlerContext ctx) throws Exception {
        log.info("Connection from {} has been established.", ctx.channel().remoteAddress());
        super.channelActive(ctx);
    }

    @Override
    public void channelInactive(final ChannelHandlerContext ctx) throws Exception {
        log.info("Connection from {} has been closed.", ctx.channel().remoteAddress());
        super.channelInactive(ctx);
    }

    @Override
    protected void channelRead0(final ChannelHandlerContext ctx, final Resp msg) {
        final DispatchResult result = dispatcher.dispatch(msg);

        if (result.isCloseConnection()) {
            ctx.writeAndFlush(result.getReply()).addListener(ChannelFutureListener.CLOSE);
        } else {
            ctx.writeAndFlush(result.getReply());
        }
    }

    /**
     * 处理连接异常：回复内部错误后关闭连接。
     *
     * @param ctx 通道上下文
     * @param cause 异常原因，解码器抛出的异常被 {@link DecoderException} 包装
     */
    @Override
    public void exceptionCaught(final ChannelHandlerContext ctx, final Throwable cause) {
        final Throwable root = cause instanceof DecoderException && cause.getCause() != null
                ? cause.getCause()
                : cause;

        if (root instanceof MalformedFrameException) {
            log.warn("来自 {} 的请求格式错误: {}", ctx.channel().remoteAddress(), root.getMessage());
        } else {
            log.error("处理来自 {} 的请求时发生错误", ctx.channel().remoteAddress(), root);
        }

        if (!ctx.channel().isActive()) {
            ctx.close();
            return;
        }
        ctx.writeAndFlush(new Errors(INTERNAL_ERROR_PREFIX + internalErrorMessage(root)))
                .addListener(ChannelFutureListener.CLOSE);
    }

    /**
     * 错误行不能包含CR或LF
     */
    static String internalErrorMessage(final Throwable cause) {
        final String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        return message.replace('\r', ' ').replace('\n', ' ');
    }
}
