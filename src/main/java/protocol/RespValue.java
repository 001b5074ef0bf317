package protocol;

import java.util.List;

/**
 * RESP 프로토콜 값의 공통 상위 타입
 * 타입별 하위 클래스: {@link SimpleString}, {@link ErrorValue}, {@link IntegerValue},
 * {@link BulkString}, {@link RespArray}
 */
public abstract class RespValue {

    RespValue() {
    }

    public abstract RespType getType();

    public static SimpleString simpleString(String value) {
        return new SimpleString(value);
    }

    public static ErrorValue error(String message) {
        return new ErrorValue(message);
    }

    public static IntegerValue integer(long value) {
        return new IntegerValue(value);
    }

    public static BulkString bulkString(byte[] data) {
        return new BulkString(data);
    }

    public static BulkString bulkString(String value) {
        return value == null ? BulkString.NULL : new BulkString(value.getBytes(RespProtocol.CHARSET));
    }

    public static BulkString nullBulkString() {
        return BulkString.NULL;
    }

    public static RespArray array(List<RespValue> elements) {
        return new RespArray(elements);
    }

    public static RespArray array(RespValue... elements) {
        return new RespArray(List.of(elements));
    }

    public static RespArray nullArray() {
        return RespArray.NULL;
    }
}
