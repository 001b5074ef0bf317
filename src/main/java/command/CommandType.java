package command;

import lombok.Getter;

import java.util.Locale;

/**
 * 지원하는 명령어와 허용되는 인자 개수(명령어 이름 제외)
 */
@Getter
public enum CommandType {
    PING(0, 1),
    ECHO(1, 1),
    SET(2, 2),
    GET(1, 1);

    private final int minArgs;
    private final int maxArgs;

    CommandType(int minArgs, int maxArgs) {
        this.minArgs = minArgs;
        this.maxArgs = maxArgs;
    }

    public boolean acceptsArgCount(int count) {
        return count >= minArgs && count <= maxArgs;
    }

    /**
     * 대소문자 구분 없이 명령어 이름으로 타입을 찾습니다.
     * @return 지원하지 않는 명령어면 null
     */
    public static CommandType fromName(String name) {
        String upper = name.toUpperCase(Locale.ROOT);
        for (CommandType type : values()) {
            if (type.name().equals(upper)) {
                return type;
            }
        }
        return null;
    }
}
