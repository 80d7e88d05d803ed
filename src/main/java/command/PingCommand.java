package command;

import protocol.RespValue;

import java.util.List;

public class PingCommand implements Command {
    @Override
    public RespValue execute(List<String> args) {
        if (args.isEmpty()) {
            return RespValue.PONG;
        } else {
            return RespValue.bulkString(args.get(0));
        }
    }
}
