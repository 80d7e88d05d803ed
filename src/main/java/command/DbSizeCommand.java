package command;

import protocol.RespValue;
import storage.StorageManager;

import java.util.List;

public class DbSizeCommand implements Command {

    private final StorageManager storageManager;

    public DbSizeCommand(StorageManager storageManager) {
        this.storageManager = storageManager;
    }

    @Override
    public RespValue execute(List<String> args) {
        return RespValue.integer(storageManager.liveKeyCount());
    }
}
