package config;

import lombok.Getter;
import lombok.Setter;
import lombok.extern.slf4j.Slf4j;

/**
 * Redis 서버 설정을 관리하는 클래스
 */
@Slf4j
@Getter
@Setter
public class ServerConfig {

    public static final int DEFAULT_PORT = 6379;

    private int port = DEFAULT_PORT;
    private String bindAddress = "0.0.0.0";

    /**
     * 명령행 인수를 파싱하여 설정을 업데이트합니다.
     * 잘못된 값은 로그만 남기고 기존 값을 유지합니다.
     */
    public void parseCommandLineArgs(String[] args) {
        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--port":
                    if (i + 1 < args.length) {
                        applyPort(args[++i]);
                    } else {
                        log.error("--port requires a value");
                    }
                    break;
                case "--bind":
                    if (i + 1 < args.length) {
                        this.bindAddress = args[++i];
                        log.info("Bind address set from command line: {}", this.bindAddress);
                    } else {
                        log.error("--bind requires a value");
                    }
                    break;
                default:
                    log.warn("Ignoring unknown argument: {}", args[i]);
                    break;
            }
        }
    }

    private void applyPort(String value) {
        try {
            int parsed = Integer.parseInt(value);
            if (parsed < 0 || parsed > 65535) {
                log.error("Port out of range: {}", value);
                return;
            }
            this.port = parsed;
            log.info("Port set from command line: {}", this.port);
        } catch (NumberFormatException e) {
            log.error("Invalid port number: {}", value);
        }
    }
}
