package command;

import protocol.RespValue;

import java.util.List;
import java.util.function.IntSupplier;

/**
 * COMMAND [COUNT]
 * 명령어 상세 정보 조회는 지원하지 않으므로 인자가 없으면 빈 배열을 반환합니다.
 */
public class CommandCommand implements Command {

    private final IntSupplier commandCount;

    public CommandCommand(IntSupplier commandCount) {
        this.commandCount = commandCount;
    }

    @Override
    public RespValue execute(List<String> args) {
        if (args.isEmpty()) {
            return RespValue.EMPTY_ARRAY;
        }
        if (args.size() == 1 && "COUNT".equalsIgnoreCase(args.get(0))) {
            return RespValue.integer(commandCount.getAsInt());
        }
        throw new CommandException("unknown subcommand '" + args.get(0) + "'. Try COMMAND HELP.");
    }
}
