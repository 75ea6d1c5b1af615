package site.respkv.server;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import site.respkv.server.config.RespServerConfig;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.Socket;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 端到端测试：在临时端口上启动服务器，通过真实的socket收发RESP
 */
@DisplayName("RespMiniServer 端到端测试")
class RespMiniServerTest {

    private RespMiniServer server;

    @BeforeEach
    void setUp() {
        final RespServerConfig config = RespServerConfig.builder()
                .host("127.0.0.1")
                .port(0)
                .workerThreadCount(2)
                .commandExecutorThreadCount(2)
                .expirySweepIntervalMillis(50)
                .build();
        server = new RespMiniServer(config);
        server.start();
    }

    @AfterEach
    void tearDown() {
        server.stop();
    }

    private Socket connect() throws IOException {
        final Socket socket = new Socket("127.0.0.1", server.getBoundPort());
        socket.setSoTimeout(5000);
        return socket;
    }

    private static void send(final Socket socket, final String wire) throws IOException {
        final OutputStream out = socket.getOutputStream();
        out.write(wire.getBytes(StandardCharsets.UTF_8));
        out.flush();
    }

    private static void expect(final Socket socket, final String expected) throws IOException {
        final byte[] actual = socket.getInputStream().readNBytes(expected.getBytes(StandardCharsets.UTF_8).length);
        assertEquals(expected, new String(actual, StandardCharsets.UTF_8));
    }

    @Test
    @DisplayName("绑定临时端口")
    void testBoundPort() {
        assertTrue(server.getBoundPort() > 0);
        assertThrows(IllegalStateException.class, server::start);
    }

    @Test
    @DisplayName("PING、ECHO、SET/GET、DEL")
    void testBasicScenarios() throws IOException {
        try (Socket socket = connect()) {
            send(socket, "*1\r\n$4\r\nPING\r\n");
            expect(socket, "+PONG\r\n");

            send(socket, "*2\r\n$4\r\nECHO\r\n$5\r\nhello\r\n");
            expect(socket, "$5\r\nhello\r\n");

            send(socket, "*3\r\n$3\r\nSET\r\n$3\r\nfoo\r\n$3\r\nbar\r\n");
            expect(socket, "+OK\r\n");
            send(socket, "*2\r\n$3\r\nGET\r\n$3\r\nfoo\r\n");
            expect(socket, "$3\r\nbar\r\n");
            send(socket, "*2\r\n$3\r\nGET\r\n$7\r\nmissing\r\n");
            expect(socket, "$-1\r\n");

            send(socket, "*3\r\n$3\r\nSET\r\n$1\r\na\r\n$1\r\n1\r\n");
            expect(socket, "+OK\r\n");
            send(socket, "*4\r\n$3\r\nDEL\r\n$1\r\na\r\n$1\r\nb\r\n$1\r\nc\r\n");
            expect(socket, ":1\r\n");
        }
    }

    @Test
    @DisplayName("SET PX 100 后 150ms 键过期")
    void testPxExpiry() throws IOException, InterruptedException {
        try (Socket socket = connect()) {
            send(socket, "*5\r\n$3\r\nSET\r\n$3\r\nfoo\r\n$3\r\nbar\r\n$2\r\nPX\r\n$3\r\n100\r\n");
            expect(socket, "+OK\r\n");
            send(socket, "*2\r\n$3\r\nGET\r\n$3\r\nfoo\r\n");
            expect(socket, "$3\r\nbar\r\n");

            Thread.sleep(150);
            send(socket, "*2\r\n$3\r\nGET\r\n$3\r\nfoo\r\n");
            expect(socket, "$-1\r\n");
        }
    }

    @Test
    @DisplayName("后台清理回收不再读取的过期键")
    void testBackgroundSweep() throws IOException, InterruptedException {
        try (Socket socket = connect()) {
            send(socket, "*5\r\n$3\r\nSET\r\n$1\r\nk\r\n$1\r\nv\r\n$2\r\nPX\r\n$2\r\n10\r\n");
            expect(socket, "+OK\r\n");
        }

        final long deadline = System.currentTimeMillis() + 5000;
        while (server.getKeyspaceStore().size() > 0 && System.currentTimeMillis() < deadline) {
            Thread.sleep(20);
        }
        assertEquals(0, server.getKeyspaceStore().size());
    }

    @Test
    @DisplayName("跨两次写入的命令与流水线命令")
    void testFraming() throws IOException, InterruptedException {
        try (Socket socket = connect()) {
            send(socket, "*2\r\n$4\r\nECHO\r\n$5\r\nhel");
            Thread.sleep(50);
            send(socket, "lo\r\n");
            expect(socket, "$5\r\nhello\r\n");

            send(socket, "*1\r\n$4\r\nPING\r\n*2\r\n$4\r\nECHO\r\n$2\r\nhi\r\n");
            expect(socket, "+PONG\r\n$2\r\nhi\r\n");
        }
    }

    @Test
    @DisplayName("QUIT 回复OK后关闭连接，不影响其他连接")
    void testQuit() throws IOException {
        try (Socket quitter = connect(); Socket other = connect()) {
            send(quitter, "*1\r\n$4\r\nQUIT\r\n");
            expect(quitter, "+OK\r\n");
            assertEquals(-1, quitter.getInputStream().read());

            send(other, "*1\r\n$4\r\nPING\r\n");
            expect(other, "+PONG\r\n");
        }
    }

    @Test
    @DisplayName("格式错误的帧回复内部错误并关闭连接")
    void testMalformedFrame() throws IOException {
        try (Socket socket = connect()) {
            send(socket, "?oops\r\n");

            final InputStream in = socket.getInputStream();
            final String reply = new String(in.readAllBytes(), StandardCharsets.UTF_8);
            assertTrue(reply.startsWith("-ERR Internal error: "), reply);
            assertTrue(reply.endsWith("\r\n"), reply);
        }
    }

    @Test
    @DisplayName("连接共享同一个存储")
    void testSharedStore() throws IOException {
        try (Socket writer = connect(); Socket reader = connect()) {
            send(writer, "*3\r\n$3\r\nSET\r\n$6\r\nshared\r\n$1\r\nx\r\n");
            expect(writer, "+OK\r\n");

            send(reader, "*2\r\n$3\r\nGET\r\n$6\r\nshared\r\n");
            expect(reader, "$1\r\nx\r\n");
        }
    }
}
