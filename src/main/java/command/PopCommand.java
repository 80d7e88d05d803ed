package command;

import protocol.RespValue;
import storage.StorageManager;

import java.util.List;

/**
 * LPOP / RPOP key
 */
public class PopCommand implements Command {

    private final StorageManager storageManager;
    private final boolean head;

    public PopCommand(StorageManager storageManager, boolean head) {
        this.storageManager = storageManager;
        this.head = head;
    }

    @Override
    public RespValue execute(List<String> args) {
        String key = args.get(0);
        return RespValue.bulkString(head ? storageManager.lpop(key) : storageManager.rpop(key));
    }
}
