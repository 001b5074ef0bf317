package server;

/**
 * 연결별 입력 버퍼. 아직 완전한 값이 되지 않은 바이트를 쌓아 둡니다.
 * 한 연결의 핸들러만 사용하므로 동기화하지 않습니다.
 */
final class InputBuffer {

    private byte[] data;
    private int start;
    private int end;

    InputBuffer(int initialCapacity) {
        this.data = new byte[initialCapacity];
    }

    void append(byte[] src, int offset, int length) {
        ensureWritable(length);
        System.arraycopy(src, offset, data, end, length);
        end += length;
    }

    /**
     * 앞에서부터 count 바이트를 버립니다.
     */
    void consume(int count) {
        if (count < 0 || count > size()) {
            throw new IllegalArgumentException("cannot consume " + count + " of " + size() + " bytes");
        }
        start += count;
        if (start == end) {
            start = 0;
            end = 0;
        }
    }

    void clear() {
        start = 0;
        end = 0;
    }

    int size() {
        return end - start;
    }

    boolean isEmpty() {
        return start == end;
    }

    byte[] array() {
        return data;
    }

    int offset() {
        return start;
    }

    private void ensureWritable(int length) {
        if (data.length - end >= length) {
            return;
        }
        int size = size();
        if (data.length - size >= length) {
            // 앞쪽의 소비된 공간을 재사용
            System.arraycopy(data, start, data, 0, size);
        } else {
            byte[] grown = new byte[Math.max(data.length * 2, size + length)];
            System.arraycopy(data, start, grown, 0, size);
            data = grown;
        }
        start = 0;
        end = size;
    }
}
