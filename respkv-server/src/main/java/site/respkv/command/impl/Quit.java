package site.respkv.command.impl;

import site.respkv.command.Command;
import site.respkv.protocol.Resp;
import site.respkv.protocol.SimpleString;

/**
 * QUIT：回复OK，发送完成后关闭连接
 */
public class Quit implements Command {

    @Override
    public void setContext(final Resp[] array) {
        // 参数被忽略
    }

    @Override
    public Resp handle() {
        return SimpleString.OK;
    }

    @Override
    public boolean closesConnection() {
        return true;
    }
}
