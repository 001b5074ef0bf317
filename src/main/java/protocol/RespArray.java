package protocol;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.List;

/**
 * Array ({@code *2\r\n...})
 * elements가 null이면 Null Array ({@code *-1\r\n})를 나타냅니다.
 */
@Getter
@ToString
@EqualsAndHashCode(callSuper = false)
public final class RespArray extends RespValue {

    static final RespArray NULL = new RespArray(null);

    private final List<RespValue> elements;

    RespArray(List<RespValue> elements) {
        this.elements = elements == null ? null : List.copyOf(elements);
    }

    @Override
    public RespType getType() {
        return RespType.ARRAY;
    }

    public boolean isNull() {
        return elements == null;
    }

    public int size() {
        return elements == null ? -1 : elements.size();
    }
}
