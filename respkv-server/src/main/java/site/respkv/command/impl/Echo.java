package site.respkv.command.impl;

import site.respkv.command.Command;
import site.respkv.protocol.BulkString;
import site.respkv.protocol.Resp;

public class Echo implements Command {

    private BulkString message;

    @Override
    public void setContext(final Resp[] array) {
        message = (BulkString) array[1];
    }

    @Override
    public Resp handle() {
        return message;
    }
}
