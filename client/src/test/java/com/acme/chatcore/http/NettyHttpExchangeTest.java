package com.acme.chatcore.http;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.ConnectException;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class NettyHttpExchangeTest {

    @Test
    void shouldTimeoutAndReleaseInFlightSlot() throws Exception {
        try (HangingHttpServer server = new HangingHttpServer();
             NettyHttpExchange exchange = new NettyHttpExchange(1, 150)) {
            Throwable first = waitFailure(exchange.execute(get(server.uri("/gateway"))));
            assertInstanceOf(TimeoutException.class, first);

            Throwable second = waitFailure(exchange.execute(get(server.uri("/gateway"))));
            assertInstanceOf(TimeoutException.class, second);
        }
    }

    @Test
    void shouldRejectRequestsBeyondInFlightLimit() throws Exception {
        try (HangingHttpServer server = new HangingHttpServer();
             NettyHttpExchange exchange = new NettyHttpExchange(1, 1_000)) {
            CompletableFuture<RestResponse> pending = exchange.execute(get(server.uri("/a")));
            Throwable rejected = waitFailure(exchange.execute(get(server.uri("/b"))));

            assertInstanceOf(IllegalStateException.class, rejected);
            assertTrue(rejected.getMessage().contains("too many in-flight requests"));
            assertInstanceOf(TimeoutException.class, waitFailure(pending));
        }
    }

    @Test
    void shouldReturnStatusHeadersAndBody() throws Exception {
        String body = "{\"url\":\"wss://gateway.test\"}";
        try (CannedHttpServer server = new CannedHttpServer(200, body, Map.of(
                "X-RateLimit-Remaining", "3",
                "X-RateLimit-Bucket", "abc"), false);
             NettyHttpExchange exchange = new NettyHttpExchange(8, 2_000)) {
            RestResponse response = exchange.execute(get(server.uri("/gateway"))).get(3, TimeUnit.SECONDS);

            assertEquals(200, response.status());
            assertEquals("3", response.header("x-ratelimit-remaining"));
            assertEquals("abc", response.header("X-RateLimit-Bucket"));
            assertEquals(body, response.bodyAsString());
        }
    }

    @Test
    void shouldSendMethodPathHeadersAndBody() throws Exception {
        try (CannedHttpServer server = new CannedHttpServer(204, "", Map.of(), false);
             NettyHttpExchange exchange = new NettyHttpExchange(8, 2_000)) {
            byte[] payload = "{\"content\":\"hi\"}".getBytes(StandardCharsets.UTF_8);
            RestRequest request = new RestRequest("POST", server.uri("/channels/1/messages?wait=true"),
                Map.of("Authorization", "Bot secret", "Content-Type", "application/json"), payload);

            RestResponse response = exchange.execute(request).get(3, TimeUnit.SECONDS);

            assertEquals(204, response.status());
            CapturedRequest captured = server.requests().get(0);
            assertEquals("POST /channels/1/messages?wait=true HTTP/1.1", captured.requestLine());
            assertEquals("Bot secret", captured.headers().get("authorization"));
            assertEquals("application/json", captured.headers().get("content-type"));
            assertEquals("{\"content\":\"hi\"}", captured.body());
        }
    }

    @Test
    void shouldReusePooledConnectionsWithKeepAlive() throws Exception {
        try (CannedHttpServer server = new CannedHttpServer(200, "{}", Map.of(), true);
             NettyHttpExchange exchange = new NettyHttpExchange(8, 2_000)) {
            for (int i = 0; i < 5; i++) {
                RestResponse response = exchange.execute(get(server.uri("/users/@me"))).get(3, TimeUnit.SECONDS);
                assertEquals(200, response.status(), "request " + i + " should succeed");
            }
            assertEquals(1, server.connectionCount(), "all requests should reuse a single TCP connection");
        }
    }

    @Test
    void shouldFailFastOnConnectFailure() throws Exception {
        int port = freePort();
        try (NettyHttpExchange exchange = new NettyHttpExchange(8, 300)) {
            Throwable failure = waitFailure(exchange.execute(get(URI.create("http://127.0.0.1:" + port + "/gateway"))));
            assertTrue(failure instanceof ConnectException || failure.getClass().getSimpleName().contains("Connect"),
                "Expected connect failure, got: " + failure);
        }
    }

    private static RestRequest get(URI uri) {
        return new RestRequest("GET", uri, Map.of(), null);
    }

    private static Throwable waitFailure(Future<?> future) {
        ExecutionException error = assertThrows(ExecutionException.class, () -> future.get(3, TimeUnit.SECONDS));
        return error.getCause();
    }

    private static int freePort() throws Exception {
        try (ServerSocket socket = new ServerSocket(0)) {
            return socket.getLocalPort();
        }
    }

    private record CapturedRequest(String requestLine, Map<String, String> headers, String body) {
    }

    private static final class HangingHttpServer implements AutoCloseable {
        private final ServerSocket serverSocket;
        private final ExecutorService acceptLoop;
        private final Set<Socket> sockets = ConcurrentHashMap.newKeySet();

        private HangingHttpServer() throws IOException {
            this.serverSocket = new ServerSocket(0);
            this.acceptLoop = Executors.newSingleThreadExecutor();
            this.acceptLoop.submit(this::acceptForever);
        }

        private void acceptForever() {
            while (!serverSocket.isClosed()) {
                try {
                    sockets.add(serverSocket.accept());
                } catch (IOException e) {
                    if (serverSocket.isClosed()) {
                        return;
                    }
                }
            }
        }

        private URI uri(String path) {
            return URI.create("http://127.0.0.1:" + serverSocket.getLocalPort() + path);
        }

        @Override
        public void close() throws Exception {
            for (Socket socket : sockets) {
                try {
                    socket.close();
                } catch (IOException ignored) {
                }
            }
            serverSocket.close();
            acceptLoop.shutdownNow();
            acceptLoop.awaitTermination(2, TimeUnit.SECONDS);
        }
    }

    /**
     * Answers every request with the same response and records what it received.
     */
    private static final class CannedHttpServer implements AutoCloseable {
        private final ServerSocket serverSocket;
        private final ExecutorService acceptLoop;
        private final int statusCode;
        private final String body;
        private final Map<String, String> headers;
        private final boolean keepAlive;
        private final AtomicInteger connections = new AtomicInteger();
        private final List<CapturedRequest> requests = new CopyOnWriteArrayList<>();

        private CannedHttpServer(int statusCode, String body, Map<String, String> headers, boolean keepAlive)
            throws IOException {
            this.serverSocket = new ServerSocket(0);
            this.acceptLoop = Executors.newCachedThreadPool();
            this.statusCode = statusCode;
            this.body = body;
            this.headers = headers;
            this.keepAlive = keepAlive;
            this.acceptLoop.submit(this::acceptForever);
        }

        private void acceptForever() {
            while (!serverSocket.isClosed()) {
                try {
                    Socket socket = serverSocket.accept();
                    connections.incrementAndGet();
                    acceptLoop.submit(() -> serveConnection(socket));
                } catch (IOException e) {
                    if (serverSocket.isClosed()) {
                        return;
                    }
                }
            }
        }

        private void serveConnection(Socket socket) {
            try (socket) {
                socket.setSoTimeout(5_000);
                InputStream in = socket.getInputStream();
                OutputStream out = socket.getOutputStream();
                do {
                    CapturedRequest request = readRequest(in);
                    if (request == null) {
                        return;
                    }
                    requests.add(request);
                    byte[] content = body.getBytes(StandardCharsets.UTF_8);
                    StringBuilder resp = new StringBuilder("HTTP/1.1 " + statusCode + " OK\r\n");
                    headers.forEach((k, v) -> resp.append(k).append(": ").append(v).append("\r\n"));
                    resp.append("Content-Length: ").append(content.length).append("\r\n")
                        .append("Connection: ").append(keepAlive ? "keep-alive" : "close").append("\r\n\r\n");
                    out.write(resp.toString().getBytes(StandardCharsets.US_ASCII));
                    out.write(content);
                    out.flush();
                } while (keepAlive && !serverSocket.isClosed());
            } catch (IOException ignored) {
            }
        }

        private static CapturedRequest readRequest(InputStream in) throws IOException {
            ByteArrayOutputStream head = new ByteArrayOutputStream();
            int prev3 = -1, prev2 = -1, prev1 = -1;
            while (true) {
                int b = in.read();
                if (b == -1) {
                    return null;
                }
                head.write(b);
                if (prev3 == '\r' && prev2 == '\n' && prev1 == '\r' && b == '\n') {
                    break;
                }
                prev3 = prev2;
                prev2 = prev1;
                prev1 = b;
            }
            String[] lines = head.toString(StandardCharsets.US_ASCII).split("\r\n");
            Map<String, String> parsed = new ConcurrentHashMap<>();
            for (int i = 1; i < lines.length; i++) {
                int colon = lines[i].indexOf(':');
                if (colon > 0) {
                    parsed.put(lines[i].substring(0, colon).trim().toLowerCase(Locale.ROOT),
                        lines[i].substring(colon + 1).trim());
                }
            }
            int length = Integer.parseInt(parsed.getOrDefault("content-length", "0"));
            byte[] content = in.readNBytes(length);
            return new CapturedRequest(lines[0], parsed, new String(content, StandardCharsets.UTF_8));
        }

        List<CapturedRequest> requests() {
            return requests;
        }

        int connectionCount() {
            return connections.get();
        }

        private URI uri(String path) {
            return URI.create("http://127.0.0.1:" + serverSocket.getLocalPort() + path);
        }

        @Override
        public void close() throws Exception {
            serverSocket.close();
            acceptLoop.shutdownNow();
            acceptLoop.awaitTermination(2, TimeUnit.SECONDS);
        }
    }
}
