package site.respkv;

import org.junit.jupiter.api.Test;
import site.respkv.server.config.RespServerConfig;

import static org.junit.jupiter.api.Assertions.*;

class RespServerLauncherTest {

    @Test
    void testDefaultsWithoutArgs() {
        final RespServerConfig config = RespServerLauncher.parseArgs(new String[0]);

        assertEquals("localhost", config.getHost());
        assertEquals(6379, config.getPort());
    }

    @Test
    void testHostAndPort() {
        final RespServerConfig config = RespServerLauncher.parseArgs(new String[]{"0.0.0.0", "7000"});

        assertEquals("0.0.0.0", config.getHost());
        assertEquals(7000, config.getPort());
    }

    @Test
    void testInvalidPort() {
        assertThrows(IllegalArgumentException.class,
                () -> RespServerLauncher.parseArgs(new String[]{"localhost", "abc"}));
        assertThrows(IllegalArgumentException.class,
                () -> RespServerLauncher.parseArgs(new String[]{"localhost", "70000"}));
    }
}
