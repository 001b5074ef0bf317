package command;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import protocol.RespProtocol;
import protocol.RespValue;
import service.StorageService;

/**
 * SET key value. 기존 값은 조건 없이 덮어씁니다.
 */
@Getter
@ToString
@EqualsAndHashCode
public class SetCommand implements Command {

    private final String key;
    private final String value;

    public SetCommand(String key, String value) {
        this.key = key;
        this.value = value;
    }

    @Override
    public CommandType getType() {
        return CommandType.SET;
    }

    @Override
    public RespValue execute(StorageService storageService) {
        storageService.set(key, value);
        return RespProtocol.OK_RESPONSE;
    }
}
