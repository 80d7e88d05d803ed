package command;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import protocol.RespValue;
import storage.StorageManager;

import java.util.Arrays;
import java.util.Collections;

import static org.junit.jupiter.api.Assertions.*;

class CommandHandlerTest {

    private static final String WRONGTYPE = "WRONGTYPE Operation against a key holding the wrong kind of value";

    private final StorageManager storage = new StorageManager();
    private final CommandHandler handler = new CommandHandler(storage);

    @AfterEach
    void tearDown() {
        storage.shutdown();
    }

    private RespValue run(String... request) {
        return handler.handleCommand(Arrays.asList(request));
    }

    private static RespValue bulk(String value) {
        return RespValue.bulkString(value);
    }

    @Test
    void ping_and_echo() {
        assertEquals(RespValue.PONG, run("PING"));
        assertEquals(bulk("hi"), run("ping", "hi"));
        assertEquals(bulk("hello world"), run("ECHO", "hello world"));
    }

    @Test
    void command_names_are_case_insensitive() {
        assertEquals(RespValue.OK, run("sEt", "k", "v"));
        assertEquals(bulk("v"), run("get", "k"));
    }

    @Test
    void unknown_and_empty_commands() {
        assertEquals(RespValue.error("ERR unknown command 'FOOBAR'"), run("FOOBAR", "x"));
        assertEquals(RespValue.error("ERR empty command"), handler.handleCommand(Collections.emptyList()));
    }

    @Test
    void wrong_arity_is_rejected_before_execution() {
        assertEquals(RespValue.error("ERR wrong number of arguments for 'get' command"), run("GET"));
        assertEquals(RespValue.error("ERR wrong number of arguments for 'set' command"), run("SET", "k"));
        assertEquals(RespValue.error("ERR wrong number of arguments for 'hset' command"), run("HSET", "h", "f"));
        assertEquals(RespValue.error("ERR wrong number of arguments for 'lmove' command"), run("LMOVE", "a", "b", "LEFT"));
        assertEquals(RespValue.error("ERR wrong number of arguments for 'echo' command"), run("ECHO", "a", "b"));
        assertEquals(0, storage.size());
    }

    @Test
    void set_with_options() {
        assertEquals(RespValue.OK, run("SET", "k", "v", "NX"));
        assertEquals(RespValue.NULL_BULK_STRING, run("SET", "k", "v2", "NX"));
        assertEquals(RespValue.NULL_BULK_STRING, run("SET", "other", "v", "XX"));
        assertEquals(RespValue.OK, run("SET", "k", "v3", "xx", "px", "60000"));
        assertEquals(bulk("v3"), run("GET", "k"));
        assertEquals(RespValue.OK, run("SET", "k", "v4", "EX", "10"));
    }

    @Test
    void set_rejects_bad_options_without_writing() {
        RespValue syntax = RespValue.error("ERR syntax error");
        assertEquals(syntax, run("SET", "k", "v", "NX", "XX"));
        assertEquals(syntax, run("SET", "k", "v", "EX"));
        assertEquals(syntax, run("SET", "k", "v", "EX", "1", "PX", "100"));
        assertEquals(syntax, run("SET", "k", "v", "KEEPALIVE"));
        assertEquals(RespValue.error("ERR invalid expire time in 'set' command"), run("SET", "k", "v", "EX", "0"));
        assertEquals(RespValue.error("ERR invalid expire time in 'set' command"), run("SET", "k", "v", "PX", "-5"));
        assertEquals(RespValue.error("ERR value is not an integer or out of range"), run("SET", "k", "v", "EX", "soon"));
        assertEquals(RespValue.NULL_BULK_STRING, run("GET", "k"));
    }

    @Test
    void setnx_and_setex() {
        assertEquals(RespValue.integer(1), run("SETNX", "k", "v"));
        assertEquals(RespValue.integer(0), run("SETNX", "k", "other"));
        assertEquals(RespValue.OK, run("SETEX", "t", "100", "v"));
        assertEquals(bulk("v"), run("GET", "t"));
        assertEquals(RespValue.error("ERR invalid expire time in 'setex' command"), run("SETEX", "t", "0", "v"));
        assertEquals(RespValue.error("ERR value is not an integer or out of range"), run("SETEX", "t", "x", "v"));
    }

    @Test
    void keyspace_commands() {
        run("SET", "a", "1");
        run("HSET", "h", "f", "v");
        run("RPUSH", "l", "x");

        assertEquals(RespValue.integer(3), run("EXISTS", "a", "h", "l", "missing"));
        assertEquals(RespValue.simpleString("string"), run("TYPE", "a"));
        assertEquals(RespValue.simpleString("hash"), run("TYPE", "h"));
        assertEquals(RespValue.simpleString("list"), run("TYPE", "l"));
        assertEquals(RespValue.simpleString("none"), run("TYPE", "missing"));
        assertEquals(RespValue.array(bulk("h")), run("KEYS", "h*"));
        assertEquals(RespValue.integer(3), run("DBSIZE"));
        assertEquals(RespValue.integer(2), run("DEL", "a", "l", "missing"));
        assertEquals(RespValue.OK, run("FLUSHALL", "ASYNC"));
        assertEquals(RespValue.integer(0), run("DBSIZE"));
        assertEquals(RespValue.error("ERR syntax error"), run("FLUSHDB", "LATER"));
    }

    @Test
    void expiration_commands() {
        assertEquals(RespValue.integer(0), run("EXPIRE", "missing", "10"));
        assertEquals(RespValue.integer(-2), run("TTL", "missing"));

        run("RPUSH", "l", "x");
        assertEquals(RespValue.integer(-1), run("TTL", "l"));
        assertEquals(RespValue.integer(1), run("EXPIRE", "l", "100"));
        assertEquals(RespValue.integer(100), run("TTL", "l"));
        assertEquals(RespValue.integer(1), run("PEXPIRE", "l", "60000"));
        assertEquals(RespValue.integer(60), run("TTL", "l"));
        assertEquals(RespValue.integer(1), run("PERSIST", "l"));
        assertEquals(RespValue.integer(0), run("PERSIST", "l"));
        assertEquals(RespValue.integer(-1), run("PTTL", "l"));

        assertEquals(RespValue.integer(1), run("EXPIRE", "l", "0"));
        assertEquals(RespValue.integer(0), run("EXISTS", "l"));

        run("SET", "k", "v");
        assertEquals(RespValue.error("ERR invalid expire time in 'expire' command"),
                run("EXPIRE", "k", String.valueOf(Long.MAX_VALUE)));
        assertEquals(RespValue.error("ERR value is not an integer or out of range"), run("EXPIRE", "k", "soon"));
        assertEquals(RespValue.integer(-1), run("TTL", "k"));
    }

    @Test
    void incr_and_decr() {
        assertEquals(RespValue.integer(1), run("INCR", "n"));
        assertEquals(RespValue.integer(0), run("DECR", "n"));
        run("SET", "s", "abc");
        assertEquals(RespValue.error("ERR value is not an integer or out of range"), run("INCR", "s"));
        run("SET", "max", String.valueOf(Long.MAX_VALUE));
        assertEquals(RespValue.error("ERR increment or decrement would overflow"), run("INCR", "max"));
    }

    @Test
    void hash_commands() {
        assertEquals(RespValue.integer(2), run("HSET", "h", "f1", "v1", "f2", "v2"));
        assertEquals(RespValue.integer(0), run("HSET", "h", "f1", "v1"));
        assertEquals(RespValue.integer(1), run("HSETNX", "h", "f3", "v3"));
        assertEquals(RespValue.integer(0), run("HSETNX", "h", "f3", "other"));
        assertEquals(bulk("v1"), run("HGET", "h", "f1"));
        assertEquals(RespValue.NULL_BULK_STRING, run("HGET", "h", "nope"));
        assertEquals(RespValue.array(bulk("v1"), RespValue.NULL_BULK_STRING, bulk("v3")),
                run("HMGET", "h", "f1", "nope", "f3"));
        assertEquals(RespValue.integer(5), run("HINCRBY", "h", "n", "5"));
        assertEquals(RespValue.error("ERR hash value is not an integer"), run("HINCRBY", "h", "f1", "1"));
        assertEquals(RespValue.error("ERR value is not an integer or out of range"), run("HINCRBY", "h", "n", "x"));
    }

    @Test
    void list_commands() {
        assertEquals(RespValue.integer(2), run("LPUSH", "l", "x", "y"));
        assertEquals(RespValue.integer(3), run("RPUSH", "l", "z"));
        assertEquals(RespValue.integer(3), run("LLEN", "l"));
        assertEquals(RespValue.array(bulk("y"), bulk("x"), bulk("z")), run("LRANGE", "l", "0", "-1"));
        assertEquals(bulk("y"), run("LMOVE", "l", "l2", "left", "RIGHT"));
        assertEquals(RespValue.array(bulk("y")), run("LRANGE", "l2", "0", "-1"));
        assertEquals(bulk("x"), run("LPOP", "l"));
        assertEquals(bulk("z"), run("RPOP", "l"));
        assertEquals(RespValue.NULL_BULK_STRING, run("LPOP", "l"));
        assertEquals(RespValue.NULL_BULK_STRING, run("LMOVE", "l", "l2", "LEFT", "LEFT"));
        assertEquals(RespValue.EMPTY_ARRAY, run("LRANGE", "l", "0", "-1"));

        run("RPUSH", "t", "a", "b", "c");
        assertEquals(RespValue.OK, run("LTRIM", "t", "1", "-1"));
        assertEquals(RespValue.array(bulk("b"), bulk("c")), run("LRANGE", "t", "0", "-1"));
        assertEquals(RespValue.error("ERR value is not an integer or out of range"), run("LRANGE", "t", "a", "1"));
    }

    @Test
    void lmove_rejects_unknown_direction() {
        run("RPUSH", "l", "x");

        assertEquals(RespValue.error("ERR syntax error"), run("LMOVE", "l", "l2", "UP", "LEFT"));
        assertEquals(RespValue.integer(1), run("LLEN", "l"));
    }

    @Test
    void wrong_type_errors_use_the_wrongtype_prefix() {
        run("SET", "s", "v");
        run("RPUSH", "l", "x");

        assertEquals(RespValue.error(WRONGTYPE), run("HGET", "s", "f"));
        assertEquals(RespValue.error(WRONGTYPE), run("LPUSH", "s", "x"));
        assertEquals(RespValue.error(WRONGTYPE), run("GET", "l"));
        assertEquals(RespValue.error(WRONGTYPE), run("LMOVE", "l", "s", "LEFT", "LEFT"));
        assertEquals(RespValue.integer(1), run("LLEN", "l"));
    }

    @Test
    void hello_reports_resp2_capabilities() {
        RespValue reply = run("HELLO", "3");

        assertEquals(RespValue.Type.ARRAY, reply.getType());
        assertEquals(12, reply.getElements().size());
        assertEquals(bulk("proto"), reply.getElements().get(4));
        assertEquals(RespValue.integer(2), reply.getElements().get(5));
    }

    @Test
    void command_introspection() {
        assertEquals(RespValue.EMPTY_ARRAY, run("COMMAND"));
        assertEquals(RespValue.integer(handler.commandCount()), run("COMMAND", "COUNT"));
        assertEquals(35, handler.commandCount());
        assertEquals(RespValue.error("ERR unknown subcommand 'DOCS'. Try COMMAND HELP."), run("COMMAND", "DOCS"));
    }
}
