package command;

import protocol.RespValue;
import service.StorageService;

/**
 * 검증을 마친 Redis 명령어
 */
public interface Command {

    CommandType getType();

    /**
     * 명령어 실행 로직
     * @param storageService 모든 연결이 공유하는 저장소
     * @return 클라이언트에게 보낼 응답 값
     */
    RespValue execute(StorageService storageService);
}
