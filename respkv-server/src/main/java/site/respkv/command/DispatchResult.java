package site.respkv.command;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import site.respkv.protocol.Resp;

/**
 * 命令分发结果：响应以及响应发送后是否关闭连接
 *
 * @author respkv
 * @since 1.0.0
 */
@Getter
@ToString
@EqualsAndHashCode
public final class DispatchResult {

    private final Resp reply;

    private final boolean closeConnection;

    private DispatchResult(final Resp reply, final boolean closeConnection) {
        this.reply = reply;
        this.closeConnection = closeConnection;
    }

    public static DispatchResult reply(final Resp reply) {
        return new DispatchResult(reply, false);
    }

    public static DispatchResult replyAndClose(final Resp reply) {
        return new DispatchResult(reply, true);
    }
}
