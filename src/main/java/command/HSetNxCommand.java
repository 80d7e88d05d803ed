package command;

import protocol.RespValue;
import storage.StorageManager;

import java.util.List;

public class HSetNxCommand implements Command {

    private final StorageManager storageManager;

    public HSetNxCommand(StorageManager storageManager) {
        this.storageManager = storageManager;
    }

    @Override
    public RespValue execute(List<String> args) {
        boolean added = storageManager.hsetnx(args.get(0), args.get(1), args.get(2));
        return RespValue.integer(added ? 1 : 0);
    }
}
