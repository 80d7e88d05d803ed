package protocol;

import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * RESP2 프로토콜로 주고받는 하나의 값
 * 타입별로 하나의 payload 만 사용합니다.
 */
@Getter
@EqualsAndHashCode
public final class RespValue {

    public enum Type {
        SIMPLE_STRING,
        ERROR,
        INTEGER,
        BULK_STRING,
        ARRAY
    }

    public static final RespValue OK = simpleString("OK");
    public static final RespValue PONG = simpleString("PONG");
    public static final RespValue NULL_BULK_STRING = new RespValue(Type.BULK_STRING, null, 0L, null, null);
    public static final RespValue NULL_ARRAY = new RespValue(Type.ARRAY, null, 0L, null, null);
    public static final RespValue EMPTY_ARRAY = array(Collections.emptyList());

    private final Type type;
    // SIMPLE_STRING, ERROR
    private final String text;
    private final long integer;
    // null means null bulk string
    private final byte[] bulk;
    // null means null array
    private final List<RespValue> elements;

    private RespValue(Type type, String text, long integer, byte[] bulk, List<RespValue> elements) {
        this.type = type;
        this.text = text;
        this.integer = integer;
        this.bulk = bulk;
        this.elements = elements;
    }

    public static RespValue simpleString(String text) {
        return new RespValue(Type.SIMPLE_STRING, text, 0L, null, null);
    }

    /**
     * 에러 응답을 생성합니다. 메시지는 접두어(ERR, WRONGTYPE 등)를 포함한 전체 문자열입니다.
     */
    public static RespValue error(String text) {
        return new RespValue(Type.ERROR, text, 0L, null, null);
    }

    /**
     * "ERR " 접두어가 붙은 에러 응답을 생성합니다.
     */
    public static RespValue err(String message) {
        return error("ERR " + message);
    }

    public static RespValue integer(long value) {
        return new RespValue(Type.INTEGER, null, value, null, null);
    }

    public static RespValue bulkString(byte[] data) {
        if (data == null) {
            return NULL_BULK_STRING;
        }
        return new RespValue(Type.BULK_STRING, null, 0L, data, null);
    }

    public static RespValue bulkString(String value) {
        if (value == null) {
            return NULL_BULK_STRING;
        }
        return bulkString(value.getBytes(StandardCharsets.UTF_8));
    }

    public static RespValue array(List<RespValue> elements) {
        if (elements == null) {
            return NULL_ARRAY;
        }
        return new RespValue(Type.ARRAY, null, 0L, null, Collections.unmodifiableList(new ArrayList<>(elements)));
    }

    public static RespValue array(RespValue... elements) {
        return array(Arrays.asList(elements));
    }

    /**
     * 문자열 목록을 bulk string 배열로 변환합니다. null 원소는 null bulk string 이 됩니다.
     */
    public static RespValue bulkStringArray(List<String> values) {
        List<RespValue> elements = new ArrayList<>(values.size());
        for (String value : values) {
            elements.add(bulkString(value));
        }
        return array(elements);
    }

    public boolean isNull() {
        return (type == Type.BULK_STRING && bulk == null) || (type == Type.ARRAY && elements == null);
    }

    /**
     * simple string, error, bulk string 의 내용을 문자열로 반환합니다.
     */
    public String asString() {
        switch (type) {
            case SIMPLE_STRING:
            case ERROR:
                return text;
            case BULK_STRING:
                return bulk == null ? null : new String(bulk, StandardCharsets.UTF_8);
            case INTEGER:
                return String.valueOf(integer);
            default:
                throw new IllegalStateException("Array has no string form");
        }
    }

    @Override
    public String toString() {
        switch (type) {
            case SIMPLE_STRING:
                return "+" + text;
            case ERROR:
                return "-" + text;
            case INTEGER:
                return ":" + integer;
            case BULK_STRING:
                return bulk == null ? "(nil)" : "\"" + asString() + "\"";
            default:
                return elements == null ? "(nil array)" : elements.toString();
        }
    }
}
