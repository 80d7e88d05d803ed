package command;

import protocol.RespValue;
import storage.StorageManager;

import java.util.List;

/**
 * LRANGE key start stop
 */
public class LRangeCommand implements Command {

    private final StorageManager storageManager;

    public LRangeCommand(StorageManager storageManager) {
        this.storageManager = storageManager;
    }

    @Override
    public RespValue execute(List<String> args) {
        long start = Long.parseLong(args.get(1));
        long stop = Long.parseLong(args.get(2));
        return RespValue.bulkStringArray(storageManager.lrange(args.get(0), start, stop));
    }
}
