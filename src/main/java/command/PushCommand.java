package command;

import protocol.RespValue;
import storage.StorageManager;

import java.util.List;

/**
 * LPUSH / RPUSH key value [value ...]
 */
public class PushCommand implements Command {

    private final StorageManager storageManager;
    private final boolean head;

    public PushCommand(StorageManager storageManager, boolean head) {
        this.storageManager = storageManager;
        this.head = head;
    }

    @Override
    public RespValue execute(List<String> args) {
        String key = args.get(0);
        String[] values = args.subList(1, args.size()).toArray(new String[0]);
        long length = head ? storageManager.lpush(key, values) : storageManager.rpush(key, values);
        return RespValue.integer(length);
    }
}
