package config;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class ServerConfigTest {

    @Test
    void defaults() {
        ServerConfig config = new ServerConfig();
        assertEquals(6379, config.getPort());
        assertEquals("0.0.0.0", config.getBindAddress());
    }

    @Test
    void parsesPortAndBindAddress() {
        ServerConfig config = new ServerConfig();
        config.parseCommandLineArgs(new String[]{"--port", "7000", "--bind", "127.0.0.1"});
        assertEquals(7000, config.getPort());
        assertEquals("127.0.0.1", config.getBindAddress());
    }

    @Test
    void invalidValuesKeepPreviousSettings() {
        ServerConfig config = new ServerConfig();
        config.parseCommandLineArgs(new String[]{"--port", "not-a-number"});
        assertEquals(6379, config.getPort());

        config.parseCommandLineArgs(new String[]{"--port", "70000"});
        assertEquals(6379, config.getPort());

        config.parseCommandLineArgs(new String[]{"--verbose", "--port"});
        assertEquals(6379, config.getPort());
    }
}
