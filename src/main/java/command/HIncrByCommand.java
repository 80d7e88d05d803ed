package command;

import protocol.RespValue;
import storage.StorageManager;

import java.util.List;

/**
 * HINCRBY key field increment
 */
public class HIncrByCommand implements Command {

    private final StorageManager storageManager;

    public HIncrByCommand(StorageManager storageManager) {
        this.storageManager = storageManager;
    }

    @Override
    public RespValue execute(List<String> args) {
        long delta = Long.parseLong(args.get(2));
        return RespValue.integer(storageManager.hincrBy(args.get(0), args.get(1), delta));
    }
}
