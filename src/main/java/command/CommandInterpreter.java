package command;

import lombok.extern.slf4j.Slf4j;
import protocol.BulkString;
import protocol.RespArray;
import protocol.RespProtocol;
import protocol.RespType;
import protocol.RespValue;
import service.StorageService;

import java.util.ArrayList;
import java.util.List;

/**
 * 요청 값(Bulk String 배열)을 명령어로 해석하고, 공유 저장소에 적용하는 클래스
 */
@Slf4j
public class CommandInterpreter {

    private final StorageService storageService;

    public CommandInterpreter(StorageService storageService) {
        this.storageService = storageService;
    }

    /**
     * 요청 하나를 처리하고 응답을 생성합니다.
     * 명령어 오류는 에러 응답으로 바뀌며 예외를 던지지 않습니다.
     */
    public RespValue handle(RespValue request) {
        Command command;
        try {
            command = interpret(request);
        } catch (CommandException e) {
            log.debug("Rejected request {}: {}", request, e.getMessage());
            return RespProtocol.createErrorResponse(e.getMessage());
        }

        try {
            return execute(command);
        } catch (RuntimeException e) {
            log.error("Error executing {}", command, e);
            return RespProtocol.createErrorResponse("internal server error");
        }
    }

    /**
     * 요청 값을 검증해 명령어로 변환합니다.
     * 명령어 이름은 대소문자를 구분하지 않고, 인자는 그대로 전달합니다.
     */
    public Command interpret(RespValue request) throws CommandException {
        List<String> parts = toBulkStrings(request);
        String name = parts.get(0);
        List<String> args = parts.subList(1, parts.size());

        CommandType type = CommandType.fromName(name);
        if (type == null) {
            throw CommandException.unknownCommand(name);
        }
        if (!type.acceptsArgCount(args.size())) {
            throw CommandException.wrongArity(name);
        }

        switch (type) {
            case PING:
                return args.isEmpty() ? new PingCommand() : new PingCommand(args.get(0));
            case ECHO:
                return new EchoCommand(args.get(0));
            case SET:
                return new SetCommand(args.get(0), args.get(1));
            case GET:
                return new GetCommand(args.get(0));
            default:
                throw CommandException.unknownCommand(name);
        }
    }

    public RespValue execute(Command command) {
        return command.execute(storageService);
    }

    private static List<String> toBulkStrings(RespValue request) throws CommandException {
        if (request.getType() != RespType.ARRAY) {
            throw CommandException.invalidRequest("expected array of bulk strings, got " + request.getType());
        }
        RespArray array = (RespArray) request;
        if (array.isNull() || array.size() == 0) {
            throw CommandException.invalidRequest("empty command");
        }

        List<String> parts = new ArrayList<>(array.size());
        for (RespValue element : array.getElements()) {
            if (element.getType() != RespType.BULK_STRING || ((BulkString) element).isNull()) {
                throw CommandException.invalidRequest("command parts must be non-null bulk strings");
            }
            parts.add(((BulkString) element).asString());
        }
        return parts;
    }
}
