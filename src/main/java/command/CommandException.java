package command;

/**
 * 명령어 인자 검증 실패. 메시지는 "ERR " 뒤에 붙는 에러 문자열입니다.
 */
public class CommandException extends RuntimeException {

    public static final String SYNTAX_ERROR = "syntax error";

    public CommandException(String message) {
        super(message);
    }

    public static CommandException syntaxError() {
        return new CommandException(SYNTAX_ERROR);
    }

    public static CommandException invalidExpireTime(String commandName) {
        return new CommandException("invalid expire time in '" + commandName + "' command");
    }
}
