package command;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import protocol.RespProtocol;
import protocol.RespValue;
import service.StorageService;

@Getter
@ToString
@EqualsAndHashCode
public class PingCommand implements Command {

    // null이면 인자 없는 PING
    private final String message;

    public PingCommand() {
        this(null);
    }

    public PingCommand(String message) {
        this.message = message;
    }

    @Override
    public CommandType getType() {
        return CommandType.PING;
    }

    @Override
    public RespValue execute(StorageService storageService) {
        if (message == null) {
            return RespProtocol.PONG_RESPONSE;
        }
        return RespValue.bulkString(message);
    }
}
