package com.questrail.irrigation.transport.http.netty;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

/**
 * NettyHttpWeatherTransportTest
 * -----------------------------------------------------------------------------
 * Real Netty client against an in-process HTTP server on the loopback interface.
 */
class NettyHttpWeatherTransportTest {

    private HttpServer server;
    private NettyHttpWeatherTransport transport;
    private final AtomicReference<String> lastQuery = new AtomicReference<>();

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/v1/forecast", exchange -> {
            lastQuery.set(exchange.getRequestURI().getRawQuery());
            respond(exchange, 200, "{\"current\":{\"temperature_2m\":58.1}}");
        });
        server.createContext("/broken", exchange -> respond(exchange, 500, "{\"error\":true}"));
        server.start();
        transport = new NettyHttpWeatherTransport(Duration.ofSeconds(5));
    }

    @AfterEach
    void tearDown() {
        transport.close();
        server.stop(0);
    }

    private static void respond(HttpExchange exchange, int status, String body)
            throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write(bytes);
        }
    }

    private URI uri(String pathAndQuery) {
        return URI.create("http://127.0.0.1:" + server.getAddress().getPort() + pathAndQuery);
    }

    @Test
    void fetchesBodyAndForwardsQuery() throws IOException {
        String body = transport.get(uri("/v1/forecast?latitude=37.3382&current=temperature_2m"));

        assertEquals("{\"current\":{\"temperature_2m\":58.1}}", body);
        assertEquals("latitude=37.3382&current=temperature_2m", lastQuery.get());
    }

    @Test
    void serverErrorBecomesIOException() {
        IOException e = assertThrows(IOException.class, () -> transport.get(uri("/broken")));

        assertTrue(e.getMessage().startsWith("HTTP 500"));
    }

    @Test
    void refusedConnectionBecomesIOException() throws IOException {
        int port;
        try (ServerSocket socket = new ServerSocket(0, 1, InetAddress.getLoopbackAddress())) {
            port = socket.getLocalPort();
        }

        assertThrows(IOException.class,
                () -> transport.get(URI.create("http://127.0.0.1:" + port + "/v1/forecast")));
    }

    @Test
    void unsupportedSchemeIsRejected() {
        assertThrows(IOException.class, () -> transport.get(URI.create("ftp://example.org/data")));
    }
}
