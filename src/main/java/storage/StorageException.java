package storage;

/**
 * 저장소 연산이 클라이언트 요청 때문에 실패했음을 나타내는 예외의 상위 타입
 * 메시지는 클라이언트에게 그대로 전달되는 에러 문자열입니다.
 */
public abstract class StorageException extends RuntimeException {

    protected StorageException(String message) {
        super(message);
    }

    protected StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
