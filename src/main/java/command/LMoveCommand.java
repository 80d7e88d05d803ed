package command;

import protocol.RespValue;
import storage.StorageManager;

import java.util.List;

/**
 * LMOVE source destination LEFT|RIGHT LEFT|RIGHT
 */
public class LMoveCommand implements Command {

    private final StorageManager storageManager;

    public LMoveCommand(StorageManager storageManager) {
        this.storageManager = storageManager;
    }

    @Override
    public RespValue execute(List<String> args) {
        boolean fromLeft = isLeft(args.get(2));
        boolean toLeft = isLeft(args.get(3));
        return RespValue.bulkString(storageManager.lmove(args.get(0), args.get(1), fromLeft, toLeft));
    }

    private static boolean isLeft(String direction) {
        if ("LEFT".equalsIgnoreCase(direction)) {
            return true;
        }
        if ("RIGHT".equalsIgnoreCase(direction)) {
            return false;
        }
        throw CommandException.syntaxError();
    }
}
