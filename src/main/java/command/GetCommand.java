package command;

import protocol.RespValue;
import storage.StorageManager;

import java.util.List;

public class GetCommand implements Command {

    private final StorageManager storageManager;

    public GetCommand(StorageManager storageManager) {
        this.storageManager = storageManager;
    }

    @Override
    public RespValue execute(List<String> args) {
        String key = args.get(0);
        return RespValue.bulkString(storageManager.get(key));
    }
}
