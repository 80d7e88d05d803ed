package command;

import protocol.RespValue;
import storage.StorageManager;

import java.util.List;

public class KeysCommand implements Command {

    private final StorageManager storageManager;

    public KeysCommand(StorageManager storageManager) {
        this.storageManager = storageManager;
    }

    @Override
    public RespValue execute(List<String> args) {
        return RespValue.bulkStringArray(storageManager.keys(args.get(0)));
    }
}
