package command;

import protocol.RespValue;
import storage.StorageManager;

import java.util.List;

/**
 * INCR / DECR key
 */
public class IncrCommand implements Command {

    private final StorageManager storageManager;
    private final long delta;

    public IncrCommand(StorageManager storageManager, long delta) {
        this.storageManager = storageManager;
        this.delta = delta;
    }

    @Override
    public RespValue execute(List<String> args) {
        // Missing key starts from 0, the whole read-modify-write is atomic in the store
        return RespValue.integer(storageManager.incrBy(args.get(0), delta));
    }
}
