package command;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import protocol.RespProtocol;
import protocol.RespValue;
import service.StorageService;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

class CommandInterpreterTest {

    private StorageService storageService;
    private CommandInterpreter interpreter;

    @BeforeEach
    void setUp() {
        storageService = new StorageService();
        interpreter = new CommandInterpreter(storageService);
    }

    private static RespValue request(String... parts) {
        List<RespValue> elements = new ArrayList<>();
        for (String part : parts) {
            elements.add(RespValue.bulkString(part));
        }
        return RespValue.array(elements);
    }

    @Test
    void interpretsEachSupportedCommand() throws CommandException {
        assertEquals(new PingCommand(), interpreter.interpret(request("PING")));
        assertEquals(new PingCommand("hello"), interpreter.interpret(request("PING", "hello")));
        assertEquals(new EchoCommand("hi"), interpreter.interpret(request("ECHO", "hi")));
        assertEquals(new SetCommand("k", "v"), interpreter.interpret(request("SET", "k", "v")));
        assertEquals(new GetCommand("k"), interpreter.interpret(request("GET", "k")));
    }

    @Test
    void commandNamesAreCaseInsensitive() {
        RespValue expected = interpreter.handle(request("PING"));
        assertEquals(RespProtocol.PONG_RESPONSE, expected);
        assertEquals(expected, interpreter.handle(request("ping")));
        assertEquals(expected, interpreter.handle(request("PiNg")));
        assertEquals(RespValue.bulkString("x"), interpreter.handle(request("eCHo", "x")));
    }

    @Test
    void pingWithArgumentRepliesWithBulkString() {
        assertEquals(RespValue.bulkString("hello world"), interpreter.handle(request("PING", "hello world")));
    }

    @Test
    void setThenGetReturnsStoredValue() {
        assertEquals(RespProtocol.OK_RESPONSE, interpreter.handle(request("SET", "greeting", "Hello")));
        assertEquals(RespValue.bulkString("Hello"), interpreter.handle(request("GET", "greeting")));

        assertEquals(RespProtocol.OK_RESPONSE, interpreter.handle(request("SET", "greeting", "Bye")));
        assertEquals(RespValue.bulkString("Bye"), interpreter.handle(request("GET", "greeting")));
    }

    @Test
    void getOfAbsentKeyIsNullBulkString() {
        assertEquals(RespValue.nullBulkString(), interpreter.handle(request("GET", "missing")));
    }

    @Test
    void repeatedGetDoesNotChangeResult() {
        interpreter.handle(request("SET", "k", "v"));
        RespValue first = interpreter.handle(request("GET", "k"));
        for (int i = 0; i < 5; i++) {
            assertEquals(first, interpreter.handle(request("GET", "k")));
        }
        assertEquals(1, storageService.size());
    }

    @Test
    void argumentsKeepTheirCase() {
        interpreter.handle(request("set", "Key", "Value"));
        assertEquals(RespValue.bulkString("Value"), interpreter.handle(request("get", "Key")));
        assertEquals(RespValue.nullBulkString(), interpreter.handle(request("get", "key")));
        assertNull(storageService.get("KEY"));
    }

    @Test
    void unknownCommandIsRejected() {
        CommandException e = assertThrows(CommandException.class, () -> interpreter.interpret(request("FLUSHALL")));
        assertEquals(CommandException.Kind.UNKNOWN_COMMAND, e.getKind());
        assertEquals("FLUSHALL", e.getCommandName());
        assertEquals(RespValue.error("ERR unknown command 'FLUSHALL'"), interpreter.handle(request("FLUSHALL")));
    }

    @Test
    void wrongArityIsRejected() {
        List<RespValue> badRequests = List.of(
                request("PING", "a", "b"),
                request("ECHO"),
                request("ECHO", "a", "b"),
                request("SET", "k"),
                request("SET", "k", "v", "NX"),
                request("GET"),
                request("GET", "a", "b"));
        for (RespValue bad : badRequests) {
            CommandException e = assertThrows(CommandException.class, () -> interpreter.interpret(bad));
            assertEquals(CommandException.Kind.WRONG_ARITY, e.getKind());
        }
        assertEquals(RespValue.error("ERR wrong number of arguments for 'echo' command"),
                interpreter.handle(request("EcHo")));
        assertEquals(0, storageService.size());
    }

    @Test
    void malformedRequestShapesAreRejected() {
        List<RespValue> badRequests = List.of(
                RespValue.array(List.of()),
                RespValue.nullArray(),
                RespValue.simpleString("PING"),
                RespValue.bulkString("PING"),
                RespValue.array(RespValue.bulkString("ECHO"), RespValue.integer(1)),
                RespValue.array(RespValue.bulkString("GET"), RespValue.nullBulkString()));
        for (RespValue bad : badRequests) {
            CommandException e = assertThrows(CommandException.class, () -> interpreter.interpret(bad));
            assertEquals(CommandException.Kind.INVALID_REQUEST, e.getKind());
        }
    }

    @Test
    void unexpectedFailureBecomesErrorReply() {
        CommandInterpreter failing = new CommandInterpreter(new StorageService() {
            @Override
            public String get(String key) {
                throw new IllegalStateException("boom");
            }
        });
        assertEquals(RespValue.error("ERR internal server error"), failing.handle(request("GET", "k")));
        assertEquals(RespProtocol.PONG_RESPONSE, failing.handle(request("PING")));
    }
}
