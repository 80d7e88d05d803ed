package command;

import protocol.RespValue;
import storage.StorageManager;

import java.util.List;

public class PersistCommand implements Command {

    private final StorageManager storageManager;

    public PersistCommand(StorageManager storageManager) {
        this.storageManager = storageManager;
    }

    @Override
    public RespValue execute(List<String> args) {
        return RespValue.integer(storageManager.persist(args.get(0)) ? 1 : 0);
    }
}
