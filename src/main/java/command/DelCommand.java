package command;

import protocol.RespValue;
import storage.StorageManager;

import java.util.List;

public class DelCommand implements Command {

    private final StorageManager storageManager;

    public DelCommand(StorageManager storageManager) {
        this.storageManager = storageManager;
    }

    @Override
    public RespValue execute(List<String> args) {
        return RespValue.integer(storageManager.del(args.toArray(new String[0])));
    }
}
