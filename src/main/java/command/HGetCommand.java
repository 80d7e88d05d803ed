package command;

import protocol.RespValue;
import storage.StorageManager;

import java.util.List;

public class HGetCommand implements Command {

    private final StorageManager storageManager;

    public HGetCommand(StorageManager storageManager) {
        this.storageManager = storageManager;
    }

    @Override
    public RespValue execute(List<String> args) {
        return RespValue.bulkString(storageManager.hget(args.get(0), args.get(1)));
    }
}
