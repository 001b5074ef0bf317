package server;

import command.CommandInterpreter;
import config.ServerConfig;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.IOUtils;
import service.StorageService;

import java.io.Closeable;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;

/**
 * Redis 서버의 메인 클래스
 * 포트를 바인딩하고, 연결마다 {@link ClientHandler} 스레드를 띄웁니다.
 */
@Slf4j
public class RedisServer implements Closeable {

    private final ServerConfig config;
    private final CommandInterpreter commandInterpreter;

    private volatile ServerSocket serverSocket;
    private volatile boolean closed;

    public RedisServer(ServerConfig config, StorageService storageService) {
        this.config = config;
        this.commandInterpreter = new CommandInterpreter(storageService);
    }

    /**
     * 서버를 시작합니다. 닫힐 때까지 반환하지 않습니다.
     */
    public void start() throws IOException {
        bind();
        serve();
    }

    public void bind() throws IOException {
        serverSocket = createServerSocket();
        log.info("Redis server listening on {}:{}", config.getBindAddress(), serverSocket.getLocalPort());
    }

    /**
     * 연결 수락 루프. 개별 연결 수락 실패는 로그만 남기고 계속합니다.
     */
    public void serve() {
        ServerSocket listener = serverSocket;
        if (listener == null) {
            throw new IllegalStateException("bind() must be called before serve()");
        }

        while (!closed && !listener.isClosed()) {
            Socket clientSocket;
            try {
                clientSocket = listener.accept();
            } catch (IOException e) {
                if (closed || listener.isClosed()) {
                    break;
                }
                log.warn("Error accepting client connection: {}", e.getMessage());
                continue;
            }

            log.debug("Client connected: {}", clientSocket.getRemoteSocketAddress());

            // 클라이언트 연결을 별도의 스레드로 처리
            ClientHandler clientHandler = new ClientHandler(clientSocket, commandInterpreter);
            new Thread(clientHandler, "client-" + clientSocket.getRemoteSocketAddress()).start();
        }

        log.info("Redis server stopped accepting connections");
    }

    /**
     * 바인딩된 포트. 아직 바인딩 전이면 -1.
     */
    public int getLocalPort() {
        ServerSocket listener = serverSocket;
        return listener == null ? -1 : listener.getLocalPort();
    }

    /**
     * 새 연결 수락을 중단합니다. 이미 열린 연결은 상대가 닫을 때까지 유지됩니다.
     */
    @Override
    public void close() throws IOException {
        closed = true;
        ServerSocket listener = serverSocket;
        if (listener != null) {
            listener.close();
        }
    }

    /**
     * 서버 소켓을 생성하고 설정합니다.
     */
    private ServerSocket createServerSocket() throws IOException {
        ServerSocket socket = openServerSocket();
        // 서버 재시작 시 'Address already in use' 에러 방지
        socket.setReuseAddress(true);
        try {
            socket.bind(new InetSocketAddress(config.getBindAddress(), config.getPort()));
        } catch (IOException e) {
            IOUtils.closeQuietly(socket, suppressed -> e.addSuppressed(suppressed));
            throw e;
        }
        return socket;
    }

    /**
     * 바인딩 전의 서버 소켓을 엽니다.
     */
    protected ServerSocket openServerSocket() throws IOException {
        return new ServerSocket();
    }
}
