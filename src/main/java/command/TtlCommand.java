package command;

import protocol.RespValue;
import storage.StorageManager;

import java.util.List;

/**
 * TTL key / PTTL key. 키가 없으면 -2, 만료 시간이 없으면 -1.
 */
public class TtlCommand implements Command {

    private final StorageManager storageManager;
    private final boolean seconds;

    public TtlCommand(StorageManager storageManager, boolean seconds) {
        this.storageManager = storageManager;
        this.seconds = seconds;
    }

    @Override
    public RespValue execute(List<String> args) {
        long remaining = storageManager.pttl(args.get(0));
        if (seconds && remaining >= 0) {
            // rounded to the nearest second
            remaining = (remaining + 500) / 1000;
        }
        return RespValue.integer(remaining);
    }
}
