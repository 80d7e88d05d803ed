package command;

import protocol.RespValue;
import storage.StorageManager;

import java.util.List;

/**
 * FLUSHALL / FLUSHDB [ASYNC | SYNC]. 두 모드 모두 동기적으로 비웁니다.
 */
public class FlushAllCommand implements Command {

    private final StorageManager storageManager;

    public FlushAllCommand(StorageManager storageManager) {
        this.storageManager = storageManager;
    }

    @Override
    public RespValue execute(List<String> args) {
        if (!args.isEmpty() && !"ASYNC".equalsIgnoreCase(args.get(0)) && !"SYNC".equalsIgnoreCase(args.get(0))) {
            throw CommandException.syntaxError();
        }
        storageManager.flushAll();
        return RespValue.OK;
    }
}
