package protocol;

import org.apache.commons.io.IOUtils;

import java.io.ByteArrayOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Redis RESP2 프로토콜 인코딩과 디코딩을 담당하는 클래스
 */
public final class RespProtocol {

    private static final byte[] CRLF = {'\r', '\n'};
    private static final byte[] NULL_BULK = "$-1\r\n".getBytes(StandardCharsets.US_ASCII);
    private static final byte[] NULL_ARRAY = "*-1\r\n".getBytes(StandardCharsets.US_ASCII);

    static final int MAX_LINE_LENGTH = 64 * 1024;
    static final int MAX_BULK_LENGTH = 512 * 1024 * 1024;
    static final int MAX_ARRAY_LENGTH = 1024 * 1024;
    private static final int READ_CHUNK = 8 * 1024;

    private RespProtocol() {
    }

    /**
     * 값을 RESP 바이트 배열로 인코딩합니다. Java null 은 null bulk string 으로 인코딩됩니다.
     */
    public static byte[] encode(RespValue value) {
        ByteArrayOutputStream bos = new ByteArrayOutputStream();
        writeValue(bos, value);
        return bos.toByteArray();
    }

    /**
     * 값을 인코딩해서 스트림에 쓰고 flush 합니다.
     */
    public static void write(OutputStream out, RespValue value) throws IOException {
        out.write(encode(value));
        out.flush();
    }

    private static void writeValue(ByteArrayOutputStream out, RespValue value) {
        if (value == null) {
            out.writeBytes(NULL_BULK);
            return;
        }
        switch (value.getType()) {
            case SIMPLE_STRING:
                writeLine(out, '+', value.getText());
                break;
            case ERROR:
                writeLine(out, '-', value.getText());
                break;
            case INTEGER:
                writeLine(out, ':', String.valueOf(value.getInteger()));
                break;
            case BULK_STRING:
                byte[] data = value.getBulk();
                if (data == null) {
                    out.writeBytes(NULL_BULK);
                } else {
                    writeLine(out, '$', String.valueOf(data.length));
                    out.writeBytes(data);
                    out.writeBytes(CRLF);
                }
                break;
            case ARRAY:
                List<RespValue> elements = value.getElements();
                if (elements == null) {
                    out.writeBytes(NULL_ARRAY);
                } else {
                    writeLine(out, '*', String.valueOf(elements.size()));
                    for (RespValue element : elements) {
                        writeValue(out, element);
                    }
                }
                break;
            default:
                throw new IllegalArgumentException("Unsupported RESP type: " + value.getType());
        }
    }

    private static void writeLine(ByteArrayOutputStream out, char prefix, String line) {
        out.write(prefix);
        out.writeBytes(line.getBytes(StandardCharsets.UTF_8));
        out.writeBytes(CRLF);
    }

    /**
     * 스트림에서 RESP 값 하나를 읽습니다.
     * 선언된 프레임 길이만큼만 소비하며, 그 뒤의 바이트는 읽지 않습니다.
     *
     * @throws EOFException          프레임이 끝나기 전에 스트림이 종료된 경우
     * @throws RespProtocolException 프레임 형식이 잘못된 경우
     */
    public static RespValue decode(InputStream in) throws IOException {
        int first = in.read();
        if (first == -1) {
            throw new EOFException("Stream ended before a RESP frame");
        }
        switch (first) {
            case '+':
                return RespValue.simpleString(readLine(in));
            case '-':
                return RespValue.error(readLine(in));
            case ':':
                return RespValue.integer(parseLong(readLine(in), "integer"));
            case '$':
                return readBulkString(in);
            case '*':
                return readArray(in);
            default:
                throw new RespProtocolException("Unknown RESP type byte: 0x" + Integer.toHexString(first));
        }
    }

    private static RespValue readBulkString(InputStream in) throws IOException {
        long length = parseLong(readLine(in), "bulk length");
        if (length == -1) {
            return RespValue.NULL_BULK_STRING;
        }
        if (length < 0 || length > MAX_BULK_LENGTH) {
            throw new RespProtocolException("Invalid bulk length: " + length);
        }
        // 실제로 도착한 만큼만 버퍼를 키우고, 정확히 length 바이트까지만 읽는다
        ByteArrayOutputStream payload = new ByteArrayOutputStream((int) Math.min(length, READ_CHUNK));
        long copied = IOUtils.copyLarge(in, payload, 0, length);
        if (copied < length) {
            throw new EOFException("Stream ended after " + copied + " of " + length + " bulk bytes");
        }
        int cr = in.read();
        int lf = in.read();
        if (cr == -1 || lf == -1) {
            throw new EOFException("Stream ended before bulk string terminator");
        }
        if (cr != '\r' || lf != '\n') {
            throw new RespProtocolException("Bulk string not terminated by CRLF");
        }
        return RespValue.bulkString(payload.toByteArray());
    }

    private static RespValue readArray(InputStream in) throws IOException {
        long count = parseLong(readLine(in), "array length");
        if (count == -1) {
            return RespValue.NULL_ARRAY;
        }
        if (count < 0 || count > MAX_ARRAY_LENGTH) {
            throw new RespProtocolException("Invalid array length: " + count);
        }
        List<RespValue> elements = new ArrayList<>((int) Math.min(count, READ_CHUNK));
        for (int i = 0; i < count; i++) {
            elements.add(decode(in));
        }
        return RespValue.array(elements);
    }

    /**
     * CRLF 까지 한 줄을 읽습니다 (CRLF 제외).
     */
    private static String readLine(InputStream in) throws IOException {
        ByteArrayOutputStream bos = new ByteArrayOutputStream();
        while (true) {
            int b = in.read();
            if (b == -1) {
                throw new EOFException("Stream ended before CRLF");
            }
            if (b == '\r') {
                int next = in.read();
                if (next == -1) {
                    throw new EOFException("Stream ended before CRLF");
                }
                if (next != '\n') {
                    throw new RespProtocolException("CR not followed by LF");
                }
                return bos.toString(StandardCharsets.UTF_8);
            }
            if (bos.size() >= MAX_LINE_LENGTH) {
                throw new RespProtocolException("Line exceeds " + MAX_LINE_LENGTH + " bytes");
            }
            bos.write(b);
        }
    }

    private static long parseLong(String line, String what) throws RespProtocolException {
        try {
            return Long.parseLong(line);
        } catch (NumberFormatException e) {
            throw new RespProtocolException("Invalid " + what + ": '" + line + "'", e);
        }
    }
}
