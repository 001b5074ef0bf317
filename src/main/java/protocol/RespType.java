package protocol;

import lombok.Getter;

/**
 * RESP 타입과 한 바이트 타입 접두어의 매핑
 */
@Getter
public enum RespType {
    SIMPLE_STRING((byte) '+'),
    ERROR((byte) '-'),
    INTEGER((byte) ':'),
    BULK_STRING((byte) '$'),
    ARRAY((byte) '*');

    private final byte prefix;

    RespType(byte prefix) {
        this.prefix = prefix;
    }

    /**
     * 접두어 바이트에 해당하는 타입을 찾습니다.
     * @return 알 수 없는 접두어면 null
     */
    public static RespType fromPrefix(byte prefix) {
        for (RespType type : values()) {
            if (type.prefix == prefix) {
                return type;
            }
        }
        return null;
    }
}
