package command;

import protocol.RespValue;
import storage.StorageManager;

import java.util.List;

public class LLenCommand implements Command {

    private final StorageManager storageManager;

    public LLenCommand(StorageManager storageManager) {
        this.storageManager = storageManager;
    }

    @Override
    public RespValue execute(List<String> args) {
        return RespValue.integer(storageManager.llen(args.get(0)));
    }
}
