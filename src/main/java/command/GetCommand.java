package command;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import protocol.RespValue;
import service.StorageService;

/**
 * GET key. 키가 없으면 Null Bulk String을 반환합니다.
 */
@Getter
@ToString
@EqualsAndHashCode
public class GetCommand implements Command {

    private final String key;

    public GetCommand(String key) {
        this.key = key;
    }

    @Override
    public CommandType getType() {
        return CommandType.GET;
    }

    @Override
    public RespValue execute(StorageService storageService) {
        String value = storageService.get(key);
        if (value == null) {
            return RespValue.nullBulkString();
        }
        return RespValue.bulkString(value);
    }
}
