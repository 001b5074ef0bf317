package protocol;

import org.apache.commons.io.output.ByteArrayOutputStream;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Redis RESP 프로토콜의 디코딩과 인코딩을 담당하는 클래스
 * 상태가 없는 순수 함수만 제공하며 I/O는 하지 않습니다.
 */
public final class RespProtocol {

    /**
     * 바이트와 문자를 1:1로 대응시키는 문자셋. 페이로드를 바이트 그대로 보존합니다.
     */
    public static final Charset CHARSET = StandardCharsets.ISO_8859_1;

    /** 최상위 프레임 하나의 최대 크기 (헤더와 CRLF 포함, 8 MiB) */
    public static final int MAX_FRAME_BYTES = 8 * 1024 * 1024;

    /** 헤더 한 줄(타입 바이트 이후 CRLF 전까지)의 최대 길이 */
    public static final int MAX_LINE_BYTES = 64 * 1024;

    /** 배열 중첩 최대 깊이 */
    public static final int MAX_NESTING_DEPTH = 64;

    public static final RespValue PONG_RESPONSE = RespValue.simpleString("PONG");
    public static final RespValue OK_RESPONSE = RespValue.simpleString("OK");

    private static final byte CR = '\r';
    private static final byte LF = '\n';
    private static final byte[] CRLF = {CR, LF};

    private RespProtocol() {
        // 인스턴스화 방지
    }

    /**
     * 버퍼 전체에서 RESP 값 하나를 디코딩합니다.
     */
    public static DecodeResult decode(byte[] buffer) throws RespProtocolException {
        return decode(buffer, 0, buffer.length);
    }

    /**
     * buffer[offset, offset + length) 구간의 앞부분에서 RESP 값 하나를 디코딩합니다.
     * 버퍼는 읽기만 하고 변경하지 않습니다.
     *
     * @return 완성된 값과 소비한 바이트 수, 값이 아직 다 도착하지 않았으면 {@link DecodeResult#incomplete()}
     * @throws RespProtocolException 유효한 RESP 인코딩의 접두어가 될 수 없는 경우
     */
    public static DecodeResult decode(byte[] buffer, int offset, int length) throws RespProtocolException {
        Objects.checkFromIndexSize(offset, length, buffer.length);
        FrameReader reader = new FrameReader(buffer, offset, offset + length);
        RespValue value = reader.readValue(0);
        if (value == null) {
            return DecodeResult.incomplete();
        }
        return DecodeResult.complete(value, reader.pos - offset);
    }

    /**
     * RESP 값을 바이트 배열로 인코딩합니다.
     */
    public static byte[] encode(RespValue value) {
        ByteArrayOutputStream out = new ByteArrayOutputStream(encodedLength(value));
        write(value, out);
        return out.toByteArray();
    }

    /**
     * {@link #encode}가 만들어낼 바이트 수를 계산합니다.
     */
    public static int encodedLength(RespValue value) {
        switch (value.getType()) {
            case SIMPLE_STRING:
                return 1 + ((SimpleString) value).getValue().length() + 2;
            case ERROR:
                return 1 + ((ErrorValue) value).getMessage().length() + 2;
            case INTEGER:
                return 1 + Long.toString(((IntegerValue) value).getValue()).length() + 2;
            case BULK_STRING: {
                BulkString bulk = (BulkString) value;
                if (bulk.isNull()) {
                    return 5;
                }
                int len = bulk.length();
                return 1 + Integer.toString(len).length() + 2 + len + 2;
            }
            case ARRAY: {
                RespArray array = (RespArray) value;
                if (array.isNull()) {
                    return 5;
                }
                int total = 1 + Integer.toString(array.size()).length() + 2;
                for (RespValue element : array.getElements()) {
                    total += encodedLength(element);
                }
                return total;
            }
            default:
                throw new IllegalStateException("Unhandled RESP type: " + value.getType());
        }
    }

    /**
     * "ERR " 접두어가 붙은 에러 응답을 생성합니다.
     */
    public static ErrorValue createErrorResponse(String message) {
        return RespValue.error("ERR " + message);
    }

    static String singleLine(String text) {
        if (text == null) {
            return "";
        }
        return text.replace('\r', ' ').replace('\n', ' ');
    }

    private static void write(RespValue value, ByteArrayOutputStream out) {
        out.write(value.getType().getPrefix());
        switch (value.getType()) {
            case SIMPLE_STRING:
                writeLine(out, ((SimpleString) value).getValue());
                break;
            case ERROR:
                writeLine(out, ((ErrorValue) value).getMessage());
                break;
            case INTEGER:
                writeLine(out, Long.toString(((IntegerValue) value).getValue()));
                break;
            case BULK_STRING: {
                BulkString bulk = (BulkString) value;
                if (bulk.isNull()) {
                    writeLine(out, "-1");
                } else {
                    byte[] data = bulk.rawData();
                    writeLine(out, Integer.toString(data.length));
                    out.write(data, 0, data.length);
                    out.write(CRLF, 0, CRLF.length);
                }
                break;
            }
            case ARRAY: {
                RespArray array = (RespArray) value;
                if (array.isNull()) {
                    writeLine(out, "-1");
                } else {
                    writeLine(out, Integer.toString(array.size()));
                    for (RespValue element : array.getElements()) {
                        write(element, out);
                    }
                }
                break;
            }
            default:
                throw new IllegalStateException("Unhandled RESP type: " + value.getType());
        }
    }

    private static void writeLine(ByteArrayOutputStream out, String line) {
        byte[] bytes = line.getBytes(CHARSET);
        out.write(bytes, 0, bytes.length);
        out.write(CRLF, 0, CRLF.length);
    }

    /**
     * 버퍼를 한 번 훑으면서 값을 읽는 커서.
     * 데이터가 부족하면 null을 반환합니다.
     */
    private static final class FrameReader {

        private final byte[] buf;
        private final int start;
        private final int limit;
        private int pos;

        FrameReader(byte[] buf, int start, int limit) {
            this.buf = buf;
            this.start = start;
            this.pos = start;
            this.limit = limit;
        }

        RespValue readValue(int depth) throws RespProtocolException {
            if (pos >= limit) {
                return null;
            }
            byte prefix = buf[pos];
            RespType type = RespType.fromPrefix(prefix);
            if (type == null) {
                throw new RespProtocolException("unknown type byte " + describe(prefix));
            }

            int headerStart = pos + 1;
            int headerEnd = findLineEnd(headerStart);
            if (headerEnd < 0) {
                return null;
            }
            pos = headerEnd + 2;
            if (pos - start > MAX_FRAME_BYTES) {
                throw new RespProtocolException("frame too large");
            }

            switch (type) {
                case SIMPLE_STRING:
                    return new SimpleString(text(headerStart, headerEnd));
                case ERROR:
                    return new ErrorValue(text(headerStart, headerEnd));
                case INTEGER:
                    return new IntegerValue(parseNumber(headerStart, headerEnd));
                case BULK_STRING:
                    return readBulkPayload(parseNumber(headerStart, headerEnd));
                case ARRAY:
                    return readArrayElements(parseNumber(headerStart, headerEnd), depth);
                default:
                    throw new IllegalStateException("Unhandled RESP type: " + type);
            }
        }

        private RespValue readBulkPayload(long declared) throws RespProtocolException {
            if (declared == -1) {
                return BulkString.NULL;
            }
            if (declared < 0) {
                throw new RespProtocolException("invalid bulk length " + declared);
            }
            if ((pos - start) + declared + 2 > MAX_FRAME_BYTES) {
                throw new RespProtocolException("frame too large");
            }
            int len = (int) declared;
            if (limit - pos < len + 2) {
                return null;
            }
            if (buf[pos + len] != CR || buf[pos + len + 1] != LF) {
                throw new RespProtocolException("bulk string of length " + len + " is not terminated by CRLF");
            }
            byte[] data = new byte[len];
            System.arraycopy(buf, pos, data, 0, len);
            pos += len + 2;
            return new BulkString(data);
        }

        private RespValue readArrayElements(long declared, int depth) throws RespProtocolException {
            if (declared == -1) {
                return RespArray.NULL;
            }
            if (declared < 0 || declared > MAX_FRAME_BYTES) {
                throw new RespProtocolException("invalid multibulk length " + declared);
            }
            if (depth >= MAX_NESTING_DEPTH) {
                throw new RespProtocolException("array nesting deeper than " + MAX_NESTING_DEPTH);
            }
            int count = (int) declared;
            List<RespValue> elements = new ArrayList<>(Math.min(count, 16));
            for (int i = 0; i < count; i++) {
                RespValue element = readValue(depth + 1);
                if (element == null) {
                    return null;
                }
                elements.add(element);
            }
            return new RespArray(elements);
        }

        /**
         * from부터 CR 위치를 찾습니다. CRLF가 아직 다 도착하지 않았으면 -1.
         */
        private int findLineEnd(int from) throws RespProtocolException {
            int scanLimit = Math.min(limit, from + MAX_LINE_BYTES + 1);
            for (int i = from; i < scanLimit; i++) {
                byte b = buf[i];
                if (b == CR) {
                    if (i + 1 >= limit) {
                        return -1;
                    }
                    if (buf[i + 1] != LF) {
                        throw new RespProtocolException("expected LF after CR");
                    }
                    return i;
                }
                if (b == LF) {
                    throw new RespProtocolException("unexpected LF without CR");
                }
            }
            if (limit - from > MAX_LINE_BYTES) {
                throw new RespProtocolException("line longer than " + MAX_LINE_BYTES + " bytes");
            }
            return -1;
        }

        private long parseNumber(int from, int to) throws RespProtocolException {
            int i = from;
            if (i < to && buf[i] == '-') {
                i++;
            }
            if (i == to) {
                throw new RespProtocolException("empty length or integer field");
            }
            for (; i < to; i++) {
                if (buf[i] < '0' || buf[i] > '9') {
                    throw new RespProtocolException("invalid number '" + text(from, to) + "'");
                }
            }
            try {
                return Long.parseLong(text(from, to));
            } catch (NumberFormatException e) {
                throw new RespProtocolException("number out of range '" + text(from, to) + "'");
            }
        }

        private String text(int from, int to) {
            return new String(buf, from, to - from, CHARSET);
        }

        private static String describe(byte b) {
            if (b >= 0x20 && b < 0x7f) {
                return "'" + (char) b + "'";
            }
            return String.format("0x%02x", b & 0xff);
        }
    }
}
