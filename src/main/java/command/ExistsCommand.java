package command;

import protocol.RespValue;
import storage.StorageManager;

import java.util.List;

public class ExistsCommand implements Command {

    private final StorageManager storageManager;

    public ExistsCommand(StorageManager storageManager) {
        this.storageManager = storageManager;
    }

    @Override
    public RespValue execute(List<String> args) {
        return RespValue.integer(storageManager.exists(args.toArray(new String[0])));
    }
}
