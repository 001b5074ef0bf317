package protocol;

/**
 * 연결별로 하나씩 두는 프레임 경계 탐색기
 * 값 객체를 만들지 않고 최상위 RESP 값 하나의 끝 위치만 찾으며,
 * 이전 호출에서 확인한 위치를 기억해 새로 도착한 바이트만 검사합니다.
 *
 * 호출 사이에 버퍼 앞부분이 소비되면 안 됩니다. 프레임 하나를 찾은 뒤에는 자동으로 초기화됩니다.
 */
public final class FrameScanner {

    private static final byte CR = '\r';
    private static final byte LF = '\n';

    // 아직 읽지 않은 원소 개수 (중첩 배열마다 한 칸)
    private final long[] remaining = new long[RespProtocol.MAX_NESTING_DEPTH];
    private int depth;

    // 프레임 시작 기준 다음 항목 위치
    private int pos;
    // 헤더 줄에서 CR을 이어서 찾을 위치
    private int lineSearchFrom = -1;
    // 대기 중인 Bulk String 페이로드의 끝(CRLF 포함), 없으면 -1
    private int bulkEnd = -1;

    /**
     * buffer[offset, offset + length)의 앞에서 완성된 프레임을 찾습니다.
     *
     * @return 프레임 전체 길이, 아직 다 도착하지 않았으면 -1
     * @throws RespProtocolException 유효한 RESP 인코딩이 될 수 없거나 프레임이 최대 크기를 넘는 경우
     */
    public int scan(byte[] buffer, int offset, int length) throws RespProtocolException {
        while (true) {
            if (bulkEnd >= 0) {
                if (length < bulkEnd) {
                    return -1;
                }
                if (buffer[offset + bulkEnd - 2] != CR || buffer[offset + bulkEnd - 1] != LF) {
                    throw new RespProtocolException("bulk string is not terminated by CRLF");
                }
                pos = bulkEnd;
                bulkEnd = -1;
                if (itemCompleted()) {
                    return finish();
                }
                continue;
            }

            if (pos >= length) {
                return -1;
            }
            RespType type = RespType.fromPrefix(buffer[offset + pos]);
            if (type == null) {
                throw new RespProtocolException("unknown type byte at offset " + pos);
            }

            int headerStart = pos + 1;
            int headerEnd = findLineEnd(buffer, offset, headerStart, length);
            if (headerEnd < 0) {
                return -1;
            }
            int next = headerEnd + 2;
            if (next > RespProtocol.MAX_FRAME_BYTES) {
                throw new RespProtocolException("frame too large");
            }

            switch (type) {
                case SIMPLE_STRING:
                case ERROR:
                    break;
                case INTEGER:
                    parseNumber(buffer, offset + headerStart, offset + headerEnd);
                    break;
                case BULK_STRING: {
                    long declared = parseNumber(buffer, offset + headerStart, offset + headerEnd);
                    if (declared < -1) {
                        throw new RespProtocolException("invalid bulk length " + declared);
                    }
                    if (declared >= 0) {
                        if (next + declared + 2 > RespProtocol.MAX_FRAME_BYTES) {
                            throw new RespProtocolException("frame too large");
                        }
                        pos = next;
                        bulkEnd = next + (int) declared + 2;
                        continue;
                    }
                    break;
                }
                case ARRAY: {
                    long declared = parseNumber(buffer, offset + headerStart, offset + headerEnd);
                    if (declared < -1 || declared > RespProtocol.MAX_FRAME_BYTES) {
                        throw new RespProtocolException("invalid multibulk length " + declared);
                    }
                    if (declared >= 0 && depth >= RespProtocol.MAX_NESTING_DEPTH) {
                        throw new RespProtocolException("array nesting deeper than " + RespProtocol.MAX_NESTING_DEPTH);
                    }
                    if (declared > 0) {
                        remaining[depth++] = declared;
                        pos = next;
                        continue;
                    }
                    break;
                }
                default:
                    throw new IllegalStateException("Unhandled RESP type: " + type);
            }

            pos = next;
            if (itemCompleted()) {
                return finish();
            }
        }
    }

    /**
     * 진행 중인 프레임 상태를 버립니다.
     */
    public void reset() {
        depth = 0;
        pos = 0;
        lineSearchFrom = -1;
        bulkEnd = -1;
    }

    // 값 하나가 끝났을 때 부모 배열들을 정리. 최상위 값이 끝났으면 true
    private boolean itemCompleted() {
        while (depth > 0) {
            if (--remaining[depth - 1] > 0) {
                return false;
            }
            depth--;
        }
        return true;
    }

    private int finish() {
        int frameLength = pos;
        reset();
        return frameLength;
    }

    private int findLineEnd(byte[] buffer, int offset, int from, int length) throws RespProtocolException {
        int start = Math.max(from, lineSearchFrom);
        int scanLimit = Math.min(length, from + RespProtocol.MAX_LINE_BYTES + 1);
        for (int i = start; i < scanLimit; i++) {
            byte b = buffer[offset + i];
            if (b == CR) {
                if (i + 1 >= length) {
                    lineSearchFrom = i;
                    return -1;
                }
                if (buffer[offset + i + 1] != LF) {
                    throw new RespProtocolException("expected LF after CR");
                }
                lineSearchFrom = -1;
                return i;
            }
            if (b == LF) {
                throw new RespProtocolException("unexpected LF without CR");
            }
        }
        if (length - from > RespProtocol.MAX_LINE_BYTES) {
            throw new RespProtocolException("line longer than " + RespProtocol.MAX_LINE_BYTES + " bytes");
        }
        lineSearchFrom = scanLimit;
        return -1;
    }

    private static long parseNumber(byte[] buffer, int from, int to) throws RespProtocolException {
        int i = from;
        boolean negative = false;
        if (i < to && buffer[i] == '-') {
            negative = true;
            i++;
        }
        if (i == to) {
            throw new RespProtocolException("empty length or integer field");
        }
        long value = 0;
        for (; i < to; i++) {
            byte b = buffer[i];
            if (b < '0' || b > '9') {
                throw new RespProtocolException("invalid number in header");
            }
            // 음수 쪽으로 누적해 Long.MIN_VALUE까지 표현
            long digit = b - '0';
            if (value < (Long.MIN_VALUE + digit) / 10) {
                throw new RespProtocolException("number out of range");
            }
            value = value * 10 - digit;
        }
        if (!negative) {
            if (value == Long.MIN_VALUE) {
                throw new RespProtocolException("number out of range");
            }
            value = -value;
        }
        return value;
    }
}
