package command;

import protocol.RespValue;
import storage.StorageManager;

import java.util.List;

/**
 * SETEX key seconds value
 */
public class SetExCommand implements Command {

    private final StorageManager storageManager;

    public SetExCommand(StorageManager storageManager) {
        this.storageManager = storageManager;
    }

    @Override
    public RespValue execute(List<String> args) {
        String key = args.get(0);
        long ttlMillis = SetCommand.secondsToMillis(Long.parseLong(args.get(1)), "setex");
        String value = args.get(2);

        storageManager.set(key, value, ttlMillis, false, false);
        return RespValue.OK;
    }
}
