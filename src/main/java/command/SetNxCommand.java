package command;

import protocol.RespValue;
import storage.StorageManager;

import java.util.List;

public class SetNxCommand implements Command {

    private final StorageManager storageManager;

    public SetNxCommand(StorageManager storageManager) {
        this.storageManager = storageManager;
    }

    @Override
    public RespValue execute(List<String> args) {
        boolean written = storageManager.set(args.get(0), args.get(1), StorageManager.NO_TTL, true, false);
        return RespValue.integer(written ? 1 : 0);
    }
}
