package server;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import protocol.RespProtocol;
import protocol.RespValue;

import java.io.BufferedInputStream;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.Socket;
import java.net.SocketTimeoutException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.*;

class RedisServerTest {

    private static final String HOST = "127.0.0.1";

    private RedisServer server;

    @BeforeEach
    void setUp() throws IOException {
        server = new RedisServer(10);
        server.start(HOST, 0);
    }

    @AfterEach
    void tearDown() {
        server.stop();
    }

    private Client connect() throws IOException {
        return new Client(server.getPort());
    }

    @Test
    void ping_set_and_get_over_tcp() throws IOException {
        try (Client client = connect()) {
            assertEquals(RespValue.PONG, client.call("PING"));
            assertEquals(RespValue.OK, client.call("SET", "foo", "bar"));
            assertEquals(RespValue.bulkString("bar"), client.call("GET", "foo"));
            assertEquals(RespValue.NULL_BULK_STRING, client.call("GET", "missing"));
        }
    }

    @Test
    void clients_share_one_keyspace() throws IOException {
        try (Client writer = connect(); Client reader = connect()) {
            writer.call("RPUSH", "queue", "a", "b");

            assertEquals(RespValue.bulkString("a"), reader.call("LPOP", "queue"));
        }
    }

    @Test
    void pipelined_requests_are_answered_in_order() throws IOException {
        try (Client client = connect()) {
            client.send("SET", "k", "1");
            client.send("INCR", "k");
            client.send("GET", "k");

            assertEquals(RespValue.OK, client.read());
            assertEquals(RespValue.integer(2), client.read());
            assertEquals(RespValue.bulkString("2"), client.read());
        }
    }

    @Test
    void command_errors_keep_the_connection_open() throws IOException {
        try (Client client = connect()) {
            assertEquals(RespValue.error("ERR unknown command 'NOPE'"), client.call("NOPE"));
            assertEquals(RespValue.error("ERR wrong number of arguments for 'get' command"), client.call("GET"));
            assertEquals(RespValue.PONG, client.call("PING"));
        }
    }

    @Test
    void non_array_request_gets_an_error_reply() throws IOException {
        try (Client client = connect()) {
            client.sendRaw("+PING\r\n");
            assertEquals(RespValue.error("ERR invalid command format"), client.read());

            client.sendRaw("*1\r\n:5\r\n");
            assertEquals(RespValue.error("ERR invalid command format"), client.read());

            assertEquals(RespValue.PONG, client.call("PING"));
        }
    }

    @Test
    void null_and_empty_arrays_are_empty_commands() throws IOException {
        try (Client client = connect()) {
            client.sendRaw("*-1\r\n");
            assertEquals(RespValue.error("ERR empty command"), client.read());

            client.sendRaw("*0\r\n");
            assertEquals(RespValue.error("ERR empty command"), client.read());

            assertEquals(RespValue.PONG, client.call("PING"));
        }
    }

    @Test
    void malformed_frame_closes_the_connection_without_reply() throws IOException {
        try (Client client = connect()) {
            client.sendRaw("?garbage\r\n");

            assertClosedByServer(client);
        }
        try (Client other = connect()) {
            assertEquals(RespValue.PONG, other.call("PING"));
        }
    }

    @Test
    void quit_replies_ok_then_closes() throws IOException {
        try (Client client = connect()) {
            client.send("QUIT");

            assertEquals(RespValue.OK, client.read());
            assertClosedByServer(client);
        }
    }

    @Test
    void key_expires_without_being_read() throws Exception {
        try (Client client = connect()) {
            assertEquals(RespValue.OK, client.call("SET", "short", "v", "PX", "50"));
            assertEquals(RespValue.integer(1), client.call("DBSIZE"));

            long deadline = System.currentTimeMillis() + 3000;
            RespValue exists = client.call("EXISTS", "short");
            while (!exists.equals(RespValue.integer(0)) && System.currentTimeMillis() < deadline) {
                Thread.sleep(10);
                exists = client.call("EXISTS", "short");
            }
            assertEquals(RespValue.integer(0), exists);
        }
    }

    @Test
    void parallel_clients_do_not_lose_increments() throws Exception {
        int clients = 4;
        int perClient = 200;
        ExecutorService pool = Executors.newFixedThreadPool(clients);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int c = 0; c < clients; c++) {
                futures.add(pool.submit(() -> {
                    try (Client client = connect()) {
                        for (int i = 0; i < perClient; i++) {
                            client.call("INCR", "counter");
                        }
                    }
                    return null;
                }));
            }
            for (Future<?> future : futures) {
                future.get();
            }
        } finally {
            pool.shutdownNow();
        }

        try (Client client = connect()) {
            assertEquals(RespValue.bulkString(String.valueOf(clients * perClient)), client.call("GET", "counter"));
        }
    }

    @Test
    void second_start_is_ignored() throws IOException {
        int port = server.getPort();

        server.start(HOST, 0);

        assertTrue(server.isRunning());
        assertEquals(port, server.getPort());
    }

    @Test
    void stop_is_idempotent_and_restart_begins_with_an_empty_store() throws IOException {
        try (Client client = connect()) {
            client.call("SET", "k", "v");
        }

        server.stop();
        server.stop();
        assertFalse(server.isRunning());
        assertEquals(-1, server.getPort());

        server.start(HOST, 0);
        assertTrue(server.isRunning());
        try (Client client = connect()) {
            assertEquals(RespValue.NULL_BULK_STRING, client.call("GET", "k"));
        }
    }

    @Test
    void stop_disconnects_open_clients() throws IOException {
        try (Client client = connect()) {
            assertEquals(RespValue.PONG, client.call("PING"));

            server.stop();

            assertClosedByServer(client);
        }
    }

    @Test
    void binding_a_busy_port_fails() {
        RedisServer other = new RedisServer();
        try {
            assertThrows(IOException.class, () -> other.start(HOST, server.getPort()));
            assertFalse(other.isRunning());
        } finally {
            other.stop();
        }
    }

    private static void assertClosedByServer(Client client) {
        try {
            assertEquals(-1, client.in.read());
        } catch (SocketTimeoutException e) {
            fail("connection was left open");
        } catch (IOException e) {
            // a reset also means the server dropped the connection
        }
    }

    private static final class Client implements Closeable {
        private final Socket socket;
        private final InputStream in;
        private final OutputStream out;

        Client(int port) throws IOException {
            socket = new Socket(HOST, port);
            socket.setSoTimeout(5000);
            in = new BufferedInputStream(socket.getInputStream());
            out = socket.getOutputStream();
        }

        void send(String... parts) throws IOException {
            List<RespValue> elements = new ArrayList<>();
            for (String part : parts) {
                elements.add(RespValue.bulkString(part));
            }
            RespProtocol.write(out, RespValue.array(elements));
        }

        void sendRaw(String raw) throws IOException {
            out.write(raw.getBytes(StandardCharsets.UTF_8));
            out.flush();
        }

        RespValue read() throws IOException {
            return RespProtocol.decode(in);
        }

        RespValue call(String... parts) throws IOException {
            send(parts);
            return read();
        }

        @Override
        public void close() throws IOException {
            socket.close();
        }
    }
}
