package protocol;

import lombok.EqualsAndHashCode;

/**
 * Bulk String ({@code $5\r\nhello\r\n})
 * data가 null이면 Null Bulk String ({@code $-1\r\n})을 나타냅니다.
 */
@EqualsAndHashCode(callSuper = false)
public final class BulkString extends RespValue {

    static final BulkString NULL = new BulkString(null);

    private final byte[] data;

    BulkString(byte[] data) {
        this.data = data;
    }

    @Override
    public RespType getType() {
        return RespType.BULK_STRING;
    }

    public boolean isNull() {
        return data == null;
    }

    /**
     * 페이로드 바이트의 복사본을 반환합니다. Null Bulk String이면 null.
     */
    public byte[] getData() {
        return data == null ? null : data.clone();
    }

    public int length() {
        return data == null ? -1 : data.length;
    }

    /**
     * 페이로드를 바이트 단위 그대로 문자열로 변환합니다.
     */
    public String asString() {
        return data == null ? null : new String(data, RespProtocol.CHARSET);
    }

    // 인코더 전용, 복사 없이 원본 바이트에 접근
    byte[] rawData() {
        return data;
    }

    @Override
    public String toString() {
        return isNull() ? "BulkString(null)" : "BulkString(" + asString() + ")";
    }
}
