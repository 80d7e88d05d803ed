package command;

import protocol.RespValue;

import java.util.List;

public class EchoCommand implements Command {
    @Override
    public RespValue execute(List<String> args) {
        return RespValue.bulkString(args.get(0));
    }
}
