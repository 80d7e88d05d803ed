package command;

import protocol.RespValue;
import storage.StorageManager;

import java.util.List;

public class HMGetCommand implements Command {

    private final StorageManager storageManager;

    public HMGetCommand(StorageManager storageManager) {
        this.storageManager = storageManager;
    }

    @Override
    public RespValue execute(List<String> args) {
        List<String> values = storageManager.hmget(args.get(0), args.subList(1, args.size()));
        return RespValue.bulkStringArray(values);
    }
}
