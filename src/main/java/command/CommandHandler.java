package command;

import lombok.extern.slf4j.Slf4j;
import protocol.RespValue;
import storage.StorageException;
import storage.StorageManager;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * 모든 Redis 명령어를 관리하고, 요청에 맞는 명령어를 찾아 실행하는 핸들러 클래스
 * <p>
 * 인자 개수는 명령어 실행 전에 검증되므로 잘못된 요청이 저장소를 바꾸는 일은 없습니다.
 * 저장소와 인자 검증에서 발생한 예외는 여기서 RESP 에러 응답으로 변환됩니다.
 */
@Slf4j
public class CommandHandler {

    static final String NOT_AN_INTEGER = "value is not an integer or out of range";

    private static final class RegisteredCommand {
        private final Arity arity;
        private final Command command;

        private RegisteredCommand(Arity arity, Command command) {
            this.arity = arity;
            this.command = command;
        }
    }

    private final Map<String, RegisteredCommand> commandMap = new HashMap<>();

    public CommandHandler(StorageManager storageManager) {
        // Connection / introspection
        register("PING", Arity.between(0, 1), new PingCommand());
        register("ECHO", Arity.exactly(1), new EchoCommand());
        register("HELLO", Arity.any(), new HelloCommand());
        register("COMMAND", Arity.any(), new CommandCommand(this::commandCount));

        // Strings and keyspace
        register("SET", Arity.atLeast(2), new SetCommand(storageManager));
        register("GET", Arity.exactly(1), new GetCommand(storageManager));
        register("SETNX", Arity.exactly(2), new SetNxCommand(storageManager));
        register("SETEX", Arity.exactly(3), new SetExCommand(storageManager));
        register("INCR", Arity.exactly(1), new IncrCommand(storageManager, 1));
        register("DECR", Arity.exactly(1), new IncrCommand(storageManager, -1));
        register("DEL", Arity.atLeast(1), new DelCommand(storageManager));
        register("EXISTS", Arity.atLeast(1), new ExistsCommand(storageManager));
        register("TYPE", Arity.exactly(1), new TypeCommand(storageManager));
        register("KEYS", Arity.exactly(1), new KeysCommand(storageManager));
        register("DBSIZE", Arity.exactly(0), new DbSizeCommand(storageManager));
        register("FLUSHALL", Arity.between(0, 1), new FlushAllCommand(storageManager));
        register("FLUSHDB", Arity.between(0, 1), new FlushAllCommand(storageManager));

        // Expiration
        register("EXPIRE", Arity.exactly(2), new ExpireCommand(storageManager, true));
        register("PEXPIRE", Arity.exactly(2), new ExpireCommand(storageManager, false));
        register("TTL", Arity.exactly(1), new TtlCommand(storageManager, true));
        register("PTTL", Arity.exactly(1), new TtlCommand(storageManager, false));
        register("PERSIST", Arity.exactly(1), new PersistCommand(storageManager));

        // Hashes
        register("HSET", Arity.keyAndPairs(), new HSetCommand(storageManager));
        register("HSETNX", Arity.exactly(3), new HSetNxCommand(storageManager));
        register("HGET", Arity.exactly(2), new HGetCommand(storageManager));
        register("HMGET", Arity.atLeast(2), new HMGetCommand(storageManager));
        register("HINCRBY", Arity.exactly(3), new HIncrByCommand(storageManager));

        // Lists
        register("LPUSH", Arity.atLeast(2), new PushCommand(storageManager, true));
        register("RPUSH", Arity.atLeast(2), new PushCommand(storageManager, false));
        register("LPOP", Arity.exactly(1), new PopCommand(storageManager, true));
        register("RPOP", Arity.exactly(1), new PopCommand(storageManager, false));
        register("LLEN", Arity.exactly(1), new LLenCommand(storageManager));
        register("LRANGE", Arity.exactly(3), new LRangeCommand(storageManager));
        register("LTRIM", Arity.exactly(3), new LTrimCommand(storageManager));
        register("LMOVE", Arity.exactly(4), new LMoveCommand(storageManager));
    }

    private void register(String name, Arity arity, Command command) {
        commandMap.put(name, new RegisteredCommand(arity, command));
    }

    public int commandCount() {
        return commandMap.size();
    }

    /**
     * 요청(명령어 이름 + 인자)을 실행하고 응답 값을 반환합니다.
     * 클라이언트 요청 오류는 에러 응답으로 반환되며, 그 외 예외는 호출자에게 전파됩니다.
     */
    public RespValue handleCommand(List<String> request) {
        if (request.isEmpty()) {
            return RespValue.err("empty command");
        }
        String commandName = request.get(0);
        RegisteredCommand registered = commandMap.get(commandName.toUpperCase(Locale.ROOT));
        if (registered == null) {
            return RespValue.err("unknown command '" + commandName + "'");
        }

        List<String> args = request.size() > 1 ? request.subList(1, request.size()) : Collections.emptyList();
        if (!registered.arity.accepts(args.size())) {
            return RespValue.err("wrong number of arguments for '" + commandName.toLowerCase(Locale.ROOT) + "' command");
        }

        try {
            return registered.command.execute(args);
        } catch (StorageException e) {
            // already carries its full error text (ERR ... / WRONGTYPE ...)
            return RespValue.error(e.getMessage());
        } catch (CommandException e) {
            return RespValue.err(e.getMessage());
        } catch (NumberFormatException e) {
            log.debug("Non-integer argument for {}: {}", commandName, e.getMessage());
            return RespValue.err(NOT_AN_INTEGER);
        }
    }
}
