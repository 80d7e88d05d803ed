package storage;

/**
 * 정수 증감 결과가 64비트 범위를 벗어날 때 발생합니다.
 */
public class OverflowException extends StorageException {

    public static final String MESSAGE = "ERR increment or decrement would overflow";

    public OverflowException(ArithmeticException cause) {
        super(MESSAGE, cause);
    }
}
