package site.respkv.command.impl.key;

import site.respkv.command.Command;
import site.respkv.command.KeyArgs;
import site.respkv.core.KeyspaceStore;
import site.respkv.protocol.Resp;
import site.respkv.protocol.RespInteger;

/**
 * DEL key [key ...]
 *
 * <p>逐个删除，每个键的删除各自原子，整体不构成事务。回复实际删除的未过期键数量。
 */
public class Del implements Command {

    private final KeyspaceStore store;

    private String[] keys;

    public Del(final KeyspaceStore store) {
        this.store = store;
    }

    @Override
    public void setContext(final Resp[] array) {
        keys = new String[array.length - 1];
        for (int i = 1; i < array.length; i++) {
            keys[i - 1] = KeyArgs.key(array[i]);
        }
    }

    @Override
    public Resp handle() {
        long deleted = 0;
        for (final String key : keys) {
            if (store.delete(key)) {
                deleted++;
            }
        }
        return RespInteger.valueOf(deleted);
    }
}
