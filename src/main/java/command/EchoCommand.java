package command;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import protocol.RespValue;
import service.StorageService;

@Getter
@ToString
@EqualsAndHashCode
public class EchoCommand implements Command {

    private final String message;

    public EchoCommand(String message) {
        this.message = message;
    }

    @Override
    public CommandType getType() {
        return CommandType.ECHO;
    }

    @Override
    public RespValue execute(StorageService storageService) {
        return RespValue.bulkString(message);
    }
}
