package protocol;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Simple String ({@code +OK\r\n})
 */
@Getter
@ToString
@EqualsAndHashCode(callSuper = false)
public final class SimpleString extends RespValue {

    private final String value;

    SimpleString(String value) {
        // 한 줄 타입이므로 CR/LF는 공백으로 치환
        this.value = RespProtocol.singleLine(value);
    }

    @Override
    public RespType getType() {
        return RespType.SIMPLE_STRING;
    }
}
