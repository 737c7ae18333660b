package com.vibeblog.app.scheduler;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import com.vibeblog.scheduler.cron.CronErrors.ExecutionFailure;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs the callback against an in-process HTTP server.
 */
class HttpExecutionCallbackTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final List<String> received = new CopyOnWriteArrayList<>();
    private HttpServer server;
    private String baseUrl;

    @BeforeEach
    void startServer() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/ok", exchange -> {
            received.add(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
            respond(exchange, 200, "{\"task\":\"queued\"}");
        });
        server.createContext("/fail", exchange -> respond(exchange, 500, "pipeline down"));
        server.start();
        baseUrl = "http://127.0.0.1:" + server.getAddress().getPort();
    }

    @AfterEach
    void stopServer() {
        server.stop(0);
    }

    private static void respond(HttpExchange exchange, int status, String body)
            throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    @Test
    void postsPayloadAndReturnsResponseBody() throws Exception {
        HttpExecutionCallback callback = new HttpExecutionCallback(baseUrl + "/ok", mapper);

        String summary = callback.execute("{\"topic\":\"rust\"}", Duration.ofSeconds(5)).get(10, TimeUnit.SECONDS);

        assertEquals("{\"task\":\"queued\"}", summary);
        assertEquals(List.of("{\"topic\":\"rust\"}"), received);
    }

    @Test
    void nonSuccessStatusFailsTheRun() {
        HttpExecutionCallback callback = new HttpExecutionCallback(baseUrl + "/fail", mapper);

        ExecutionException e = assertThrows(ExecutionException.class,
                () -> callback.execute("{}", Duration.ofSeconds(5)).get(10, TimeUnit.SECONDS));

        assertInstanceOf(ExecutionFailure.class, e.getCause());
        assertTrue(e.getCause().getMessage().contains("HTTP 500"));
    }

    @Test
    void invalidJsonPayloadFailsWithoutSending() {
        HttpExecutionCallback callback = new HttpExecutionCallback(baseUrl + "/ok", mapper);

        ExecutionException e = assertThrows(ExecutionException.class,
                () -> callback.execute("not json", Duration.ofSeconds(5)).get(10, TimeUnit.SECONDS));

        assertInstanceOf(ExecutionFailure.class, e.getCause());
        assertTrue(received.isEmpty());
    }

    @Test
    void missingUrlIsADryRun() throws Exception {
        HttpExecutionCallback callback = new HttpExecutionCallback(null, mapper);
        String summary = callback.execute("{\"topic\":\"go\"}", Duration.ofSeconds(5)).get();
        assertTrue(summary.startsWith("dry run"));
    }
}
