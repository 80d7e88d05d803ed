package storage;

/**
 * 정수 연산 대상 값이 10진수 정수가 아닐 때 발생합니다.
 */
public class NotAnIntegerException extends StorageException {

    public static final String HASH_VALUE_MESSAGE = "ERR hash value is not an integer";
    public static final String VALUE_MESSAGE = "ERR value is not an integer or out of range";

    public NotAnIntegerException(String message, NumberFormatException cause) {
        super(message, cause);
    }
}
