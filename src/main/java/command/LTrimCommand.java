package command;

import protocol.RespValue;
import storage.StorageManager;

import java.util.List;

/**
 * LTRIM key start stop
 */
public class LTrimCommand implements Command {

    private final StorageManager storageManager;

    public LTrimCommand(StorageManager storageManager) {
        this.storageManager = storageManager;
    }

    @Override
    public RespValue execute(List<String> args) {
        long start = Long.parseLong(args.get(1));
        long stop = Long.parseLong(args.get(2));
        storageManager.ltrim(args.get(0), start, stop);
        return RespValue.OK;
    }
}
