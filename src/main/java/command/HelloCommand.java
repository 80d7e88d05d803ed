package command;

import protocol.RespValue;

import java.util.List;

/**
 * HELLO [protover ...]
 * 항상 RESP2 로만 응답하므로 요청된 프로토콜 버전과 관계없이 proto 2 를 알립니다.
 */
public class HelloCommand implements Command {

    static final String SERVER_VERSION = "7.0.0";

    private static final RespValue CAPABILITIES = RespValue.array(
            RespValue.bulkString("server"), RespValue.bulkString("redis"),
            RespValue.bulkString("version"), RespValue.bulkString(SERVER_VERSION),
            RespValue.bulkString("proto"), RespValue.integer(2),
            RespValue.bulkString("mode"), RespValue.bulkString("standalone"),
            RespValue.bulkString("role"), RespValue.bulkString("master"),
            RespValue.bulkString("modules"), RespValue.EMPTY_ARRAY
    );

    @Override
    public RespValue execute(List<String> args) {
        return CAPABILITIES;
    }
}
