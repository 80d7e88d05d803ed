package command;

import protocol.RespValue;
import storage.StorageManager;

import java.util.List;
import java.util.Locale;

/**
 * SET key value [EX seconds | PX milliseconds] [NX | XX]
 */
public class SetCommand implements Command {

    private final StorageManager storageManager;

    public SetCommand(StorageManager storageManager) {
        this.storageManager = storageManager;
    }

    @Override
    public RespValue execute(List<String> args) {
        String key = args.get(0);
        String value = args.get(1);
        long ttlMillis = StorageManager.NO_TTL;
        boolean expirySeen = false;
        boolean nx = false;
        boolean xx = false;

        // Options are fully parsed before the store is touched
        for (int i = 2; i < args.size(); i++) {
            String option = args.get(i).toUpperCase(Locale.ROOT);
            switch (option) {
                case "NX":
                    nx = true;
                    break;
                case "XX":
                    xx = true;
                    break;
                case "EX":
                case "PX":
                    if (expirySeen || i + 1 >= args.size()) {
                        throw CommandException.syntaxError();
                    }
                    long amount = Long.parseLong(args.get(++i));
                    ttlMillis = "EX".equals(option) ? secondsToMillis(amount, "set") : positive(amount, "set");
                    expirySeen = true;
                    break;
                default:
                    throw CommandException.syntaxError();
            }
        }
        if (nx && xx) {
            throw CommandException.syntaxError();
        }

        boolean written = storageManager.set(key, value, ttlMillis, nx, xx);
        return written ? RespValue.OK : RespValue.NULL_BULK_STRING;
    }

    static long secondsToMillis(long seconds, String commandName) {
        positive(seconds, commandName);
        try {
            return Math.multiplyExact(seconds, 1000L);
        } catch (ArithmeticException e) {
            throw CommandException.invalidExpireTime(commandName);
        }
    }

    private static long positive(long amount, String commandName) {
        if (amount <= 0) {
            throw CommandException.invalidExpireTime(commandName);
        }
        return amount;
    }
}
