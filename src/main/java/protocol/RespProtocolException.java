package protocol;

import java.io.IOException;

/**
 * 잘못된 RESP 프레임을 읽었을 때 발생합니다.
 * 스트림이 프레임 중간에 끝난 경우는 {@link java.io.EOFException} 으로 구분됩니다.
 */
public class RespProtocolException extends IOException {

    public RespProtocolException(String message) {
        super(message);
    }

    public RespProtocolException(String message, Throwable cause) {
        super(message, cause);
    }
}
