package protocol;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Integer ({@code :1000\r\n})
 */
@Getter
@ToString
@EqualsAndHashCode(callSuper = false)
public final class IntegerValue extends RespValue {

    private final long value;

    IntegerValue(long value) {
        this.value = value;
    }

    @Override
    public RespType getType() {
        return RespType.INTEGER;
    }
}
