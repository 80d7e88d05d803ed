package command;

import protocol.RespValue;
import storage.StorageManager;
import storage.ValueType;

import java.util.List;

public class TypeCommand implements Command {

    private final StorageManager storageManager;

    public TypeCommand(StorageManager storageManager) {
        this.storageManager = storageManager;
    }

    @Override
    public RespValue execute(List<String> args) {
        ValueType type = storageManager.type(args.get(0));
        return RespValue.simpleString(type == null ? "none" : type.typeName());
    }
}
