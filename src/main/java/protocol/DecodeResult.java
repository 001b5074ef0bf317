package protocol;

import lombok.Getter;
import lombok.ToString;

/**
 * {@link RespProtocol#decode} 결과
 * 완성된 값과 소비한 바이트 수, 또는 데이터가 더 필요하다는 표시(incomplete)
 */
@Getter
@ToString
public final class DecodeResult {

    private static final DecodeResult INCOMPLETE = new DecodeResult(null, 0);

    private final RespValue value;
    private final int bytesConsumed;

    private DecodeResult(RespValue value, int bytesConsumed) {
        this.value = value;
        this.bytesConsumed = bytesConsumed;
    }

    static DecodeResult complete(RespValue value, int bytesConsumed) {
        return new DecodeResult(value, bytesConsumed);
    }

    public static DecodeResult incomplete() {
        return INCOMPLETE;
    }

    public boolean isComplete() {
        return value != null;
    }
}
