package protocol;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class FrameScannerTest {

    private final FrameScanner scanner = new FrameScanner();

    private static byte[] bytes(String s) {
        return s.getBytes(StandardCharsets.ISO_8859_1);
    }

    private int scan(String input) throws RespProtocolException {
        byte[] data = bytes(input);
        return scanner.scan(data, 0, data.length);
    }

    @Test
    void findsEndOfEachValueType() throws Exception {
        assertEquals(5, scan("+OK\r\n"));
        assertEquals(6, scan("-ERR\r\n"));
        assertEquals(5, scan(":42\r\n"));
        assertEquals(9, scan("$3\r\nabc\r\n"));
        assertEquals(5, scan("$-1\r\n"));
        assertEquals(4, scan("*0\r\n"));
        assertEquals(5, scan("*-1\r\n"));
        assertEquals(22, scan("*2\r\n$4\r\nECHO\r\n$2\r\nhi\r\n"));
    }

    @Test
    void stopsAtFirstFrameOfPipeline() throws Exception {
        assertEquals(14, scan("*1\r\n$4\r\nPING\r\n*1\r\n$4\r\nPING\r\n"));
        assertEquals(14, scan("*1\r\n$4\r\nPING\r\n*1\r\n$4\r\nPING\r\n"));
    }

    @Test
    void resumesAtEverySplitPoint() throws Exception {
        String frame = "*3\r\n$3\r\nSET\r\n*2\r\n:1\r\n$0\r\n\r\n+x\r\n";
        byte[] data = bytes(frame);
        for (int split = 0; split < data.length; split++) {
            FrameScanner fresh = new FrameScanner();
            for (int length = 0; length <= split; length++) {
                assertEquals(-1, fresh.scan(data, 0, length), "prefix of " + length + " bytes");
            }
            assertEquals(data.length, fresh.scan(data, 0, data.length), "split at " + split);
        }
    }

    @Test
    void honorsBufferOffset() throws Exception {
        byte[] data = bytes("junk*1\r\n$4\r\nPING\r\n");
        assertEquals(-1, scanner.scan(data, 4, 8));
        assertEquals(14, scanner.scan(data, 4, 14));
    }

    @Test
    void resetDiscardsPartialFrame() throws Exception {
        assertEquals(-1, scan("*2\r\n$4\r\nECHO\r\n"));
        scanner.reset();
        assertEquals(5, scan("+OK\r\n"));
    }

    @Test
    void rejectsMalformedInput() {
        List<String> malformed = List.of(
                "*1\r\n$abc\r\n",
                "$-2\r\n",
                "*-5\r\n",
                "$3\r\nabcd\r\n",
                "?foo\r\n",
                "+a\rb\r\n",
                "+a\nb\r\n",
                ":+5\r\n",
                ":\r\n",
                ":99999999999999999999\r\n");
        for (String input : malformed) {
            assertThrows(RespProtocolException.class, () -> new FrameScanner().scan(bytes(input), 0, input.length()),
                    () -> "expected malformed: " + input.replace("\r\n", "\\r\\n"));
        }
    }

    @Test
    void acceptsLongMinValue() throws Exception {
        assertEquals(23, scan(":-9223372036854775808\r\n"));
    }

    @Test
    void rejectsExcessiveNesting() {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i <= RespProtocol.MAX_NESTING_DEPTH; i++) {
            sb.append("*1\r\n");
        }
        assertThrows(RespProtocolException.class, () -> scan(sb.toString()));
    }

    @Test
    void rejectsOversizedBulkBeforePayloadArrives() {
        String header = "$" + (RespProtocol.MAX_FRAME_BYTES - 11) + "\r\n";
        assertThrows(RespProtocolException.class, () -> scan(header));
    }

    @Test
    void bulkFillingTheWholeFrameLimitIsAllowed() throws Exception {
        String header = "$" + (RespProtocol.MAX_FRAME_BYTES - 12) + "\r\n";
        assertEquals(-1, scan(header));
    }
}
