import config.ServerConfig;
import lombok.extern.slf4j.Slf4j;
import server.RedisServer;
import service.StorageService;

import java.io.IOException;

/**
 * Redis 서버 애플리케이션의 진입점
 */
@Slf4j
public class Main {

    public static void main(String[] args) {
        // 서버 설정 생성
        ServerConfig config = new ServerConfig();

        // 명령행 인수로 설정 오버라이드
        config.parseCommandLineArgs(args);

        // Redis 서버 생성 및 시작
        RedisServer server = new RedisServer(config, new StorageService());
        try {
            server.start();
        } catch (IOException e) {
            log.error("Failed to start Redis server on {}:{}", config.getBindAddress(), config.getPort(), e);
            System.exit(1);
        }
    }
}
