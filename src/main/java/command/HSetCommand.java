package command;

import protocol.RespValue;
import storage.StorageManager;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * HSET key field value [field value ...]
 */
public class HSetCommand implements Command {

    private final StorageManager storageManager;

    public HSetCommand(StorageManager storageManager) {
        this.storageManager = storageManager;
    }

    @Override
    public RespValue execute(List<String> args) {
        String key = args.get(0);
        // A repeated field keeps its last value and counts once
        Map<String, String> fields = new LinkedHashMap<>();
        for (int i = 1; i + 1 < args.size(); i += 2) {
            fields.put(args.get(i), args.get(i + 1));
        }
        return RespValue.integer(storageManager.hset(key, fields));
    }
}
