package server;

import command.CommandInterpreter;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.IOUtils;
import protocol.DecodeResult;
import protocol.FrameScanner;
import protocol.RespProtocol;
import protocol.RespProtocolException;
import protocol.RespValue;

import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.Socket;

/**
 * 클라이언트 연결 하나를 처리하는 핸들러
 * 읽기 → 디코딩 → 실행 → 쓰기를 연결이 닫힐 때까지 반복합니다.
 */
@Slf4j
public class ClientHandler implements Runnable {

    public enum State {
        READING,
        DECODING,
        DISPATCHING,
        WRITING,
        CLOSED
    }

    private static final int READ_CHUNK_SIZE = 4096;

    private final Socket clientSocket;
    private final CommandInterpreter commandInterpreter;
    private final InputBuffer inputBuffer = new InputBuffer(READ_CHUNK_SIZE);
    private final FrameScanner frameScanner = new FrameScanner();

    @Getter
    private volatile State state = State.READING;

    public ClientHandler(Socket clientSocket, CommandInterpreter commandInterpreter) {
        this.clientSocket = clientSocket;
        this.commandInterpreter = commandInterpreter;
    }

    @Override
    public void run() {
        String clientAddress = String.valueOf(clientSocket.getRemoteSocketAddress());

        try (InputStream inputStream = clientSocket.getInputStream();
             OutputStream outputStream = new BufferedOutputStream(clientSocket.getOutputStream())) {

            serve(inputStream, outputStream);

        } catch (IOException e) {
            log.warn("Transport error on client {}: {}", clientAddress, e.getMessage());
        } finally {
            state = State.CLOSED;
            IOUtils.closeQuietly(clientSocket,
                    e -> log.warn("Error closing client socket {}: {}", clientAddress, e.getMessage()));
        }

        log.debug("Client connection closed: {}", clientAddress);
    }

    /**
     * 연결이 닫힐 때까지 요청을 처리합니다.
     * 파이프라이닝된 요청은 버퍼가 빌 때까지 새로 읽지 않고 이어서 처리하며,
     * 응답은 다음 읽기 전에 한꺼번에 flush합니다.
     */
    void serve(InputStream inputStream, OutputStream outputStream) throws IOException {
        byte[] chunk = new byte[READ_CHUNK_SIZE];
        RespValue request = null;
        RespValue reply = null;

        while (state != State.CLOSED) {
            switch (state) {
                case READING:
                    outputStream.flush();
                    int bytesRead = inputStream.read(chunk);
                    if (bytesRead == -1) {
                        if (!inputBuffer.isEmpty()) {
                            log.debug("Discarding {} bytes of incomplete request", inputBuffer.size());
                            inputBuffer.clear();
                            frameScanner.reset();
                        }
                        state = State.CLOSED;
                    } else {
                        inputBuffer.append(chunk, 0, bytesRead);
                        state = State.DECODING;
                    }
                    break;

                case DECODING:
                    try {
                        int frameLength = frameScanner.scan(inputBuffer.array(), inputBuffer.offset(), inputBuffer.size());
                        if (frameLength < 0) {
                            if (inputBuffer.size() > RespProtocol.MAX_FRAME_BYTES) {
                                throw new RespProtocolException("frame too large");
                            }
                            state = State.READING;
                            break;
                        }
                        // 경계가 확인된 프레임만 한 번 디코딩
                        DecodeResult result = RespProtocol.decode(inputBuffer.array(), inputBuffer.offset(), frameLength);
                        if (!result.isComplete()) {
                            throw new IllegalStateException("Scanned frame of " + frameLength + " bytes did not decode");
                        }
                        request = result.getValue();
                        inputBuffer.consume(frameLength);
                        state = State.DISPATCHING;
                    } catch (RespProtocolException e) {
                        rejectMalformedInput(outputStream, e);
                        state = State.CLOSED;
                    }
                    break;

                case DISPATCHING:
                    reply = commandInterpreter.handle(request);
                    request = null;
                    state = State.WRITING;
                    break;

                case WRITING:
                    outputStream.write(RespProtocol.encode(reply));
                    reply = null;
                    state = inputBuffer.isEmpty() ? State.READING : State.DECODING;
                    break;

                default:
                    throw new IllegalStateException("Unexpected state " + state);
            }
        }
    }

    /**
     * 프로토콜 오류 응답을 한 번 보냅니다. 쓰기가 불가능하면 포기합니다.
     */
    private void rejectMalformedInput(OutputStream outputStream, RespProtocolException cause) {
        log.warn("Protocol error, closing connection: {}", cause.getMessage());
        inputBuffer.clear();
        frameScanner.reset();
        try {
            outputStream.write(RespProtocol.encode(RespProtocol.createErrorResponse("Protocol error: " + cause.getMessage())));
            outputStream.flush();
        } catch (IOException e) {
            log.debug("Could not send protocol error reply: {}", e.getMessage());
        }
    }
}
