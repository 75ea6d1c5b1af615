package site.respkv.command.impl;

import site.respkv.command.Command;
import site.respkv.protocol.Resp;
import site.respkv.protocol.SimpleString;

/**
 * PING：总是回复PONG，多余参数被忽略
 */
public class Ping implements Command {

    @Override
    public void setContext(final Resp[] array) {
        // 不需要参数
    }

    @Override
    public Resp handle() {
        return SimpleString.PONG;
    }
}
