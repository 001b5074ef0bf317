package protocol;

/**
 * 버퍼 내용이 어떤 유효한 RESP 인코딩의 접두어도 될 수 없을 때 발생합니다.
 * 스트림 재동기화는 하지 않으므로 호출자는 연결을 종료해야 합니다.
 */
public class RespProtocolException extends Exception {

    public RespProtocolException(String message) {
        super(message);
    }
}
