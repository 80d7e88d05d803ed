package command;

import protocol.RespValue;
import storage.StorageManager;

import java.util.List;

/**
 * EXPIRE key seconds / PEXPIRE key milliseconds
 * 0 이하의 시간이 주어지면 키는 바로 삭제됩니다.
 */
public class ExpireCommand implements Command {

    private final StorageManager storageManager;
    private final boolean seconds;

    public ExpireCommand(StorageManager storageManager, boolean seconds) {
        this.storageManager = storageManager;
        this.seconds = seconds;
    }

    @Override
    public RespValue execute(List<String> args) {
        long amount = Long.parseLong(args.get(1));
        long ttlMillis = amount;
        if (seconds && amount > 0) {
            try {
                ttlMillis = Math.multiplyExact(amount, 1000L);
            } catch (ArithmeticException e) {
                throw CommandException.invalidExpireTime("expire");
            }
        }
        return RespValue.integer(storageManager.expire(args.get(0), ttlMillis) ? 1 : 0);
    }
}
