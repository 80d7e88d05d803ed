package storage;

/**
 * 다른 종류의 값을 가진 키에 연산했을 때 발생합니다.
 */
public class WrongTypeException extends StorageException {

    public static final String MESSAGE = "WRONGTYPE Operation against a key holding the wrong kind of value";

    public WrongTypeException() {
        super(MESSAGE);
    }
}
