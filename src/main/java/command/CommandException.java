package command;

import lombok.Getter;

import java.util.Locale;

/**
 * 명령어 해석 실패. 에러 응답 하나를 보내고 연결은 유지합니다.
 */
@Getter
public class CommandException extends Exception {

    public enum Kind {
        UNKNOWN_COMMAND,
        WRONG_ARITY,
        INVALID_REQUEST
    }

    private final Kind kind;
    private final String commandName;

    private CommandException(Kind kind, String commandName, String message) {
        super(message);
        this.kind = kind;
        this.commandName = commandName;
    }

    public static CommandException unknownCommand(String name) {
        return new CommandException(Kind.UNKNOWN_COMMAND, name, "unknown command '" + name + "'");
    }

    public static CommandException wrongArity(String name) {
        return new CommandException(Kind.WRONG_ARITY, name,
                "wrong number of arguments for '" + name.toLowerCase(Locale.ROOT) + "' command");
    }

    public static CommandException invalidRequest(String detail) {
        return new CommandException(Kind.INVALID_REQUEST, null, "invalid request: " + detail);
    }
}
