package protocol;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Error ({@code -ERR message\r\n})
 */
@Getter
@ToString
@EqualsAndHashCode(callSuper = false)
public final class ErrorValue extends RespValue {

    private final String message;

    ErrorValue(String message) {
        this.message = RespProtocol.singleLine(message);
    }

    @Override
    public RespType getType() {
        return RespType.ERROR;
    }
}
