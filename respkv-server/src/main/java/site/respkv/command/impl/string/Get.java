package site.respkv.command.impl.string;

import site.respkv.command.Command;
import site.respkv.command.KeyArgs;
import site.respkv.core.KeyspaceStore;
import site.respkv.protocol.BulkString;
import site.respkv.protocol.Resp;

public class Get implements Command {

    private final KeyspaceStore store;

    private String key;

    public Get(final KeyspaceStore store) {
        this.store = store;
    }

    @Override
    public void setContext(final Resp[] array) {
        key = KeyArgs.key(array[1]);
    }

    @Override
    public Resp handle() {
        // 不存在或已过期时 create 返回 NULL
        return BulkString.create(store.get(key));
    }
}
