package com.vibeblog.app.scheduler;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vibeblog.scheduler.cron.CronErrors.ExecutionFailure;
import com.vibeblog.scheduler.cron.ExecutionCallback;
import lombok.extern.slf4j.Slf4j;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/**
 * Hands a job's generation payload to the blog pipeline over HTTP.
 * <p>
 * The payload is POSTed as-is to {@code cron.dispatchUrl}; a non-2xx answer
 * fails the run. Without a URL every run is a logged dry run.
 */
@Slf4j
public class HttpExecutionCallback implements ExecutionCallback {

    private static final int MAX_SUMMARY_CHARS = 500;

    private final String dispatchUrl;
    private final ObjectMapper objectMapper;
    private final HttpClient client;

    public HttpExecutionCallback(String dispatchUrl, ObjectMapper objectMapper) {
        this.dispatchUrl = dispatchUrl;
        this.objectMapper = objectMapper;
        this.client = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    @Override
    public CompletableFuture<String> execute(String payload, Duration timeout) {
        String body = payload == null || payload.isBlank() ? "{}" : payload;
        if (dispatchUrl == null || dispatchUrl.isBlank()) {
            log.info("cron.dispatchUrl not set, dry run for payload: {}", abbreviate(body));
            return CompletableFuture.completedFuture("dry run: " + abbreviate(body));
        }
        try {
            objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            return CompletableFuture.failedFuture(
                    new ExecutionFailure("payload is not valid JSON: " + e.getOriginalMessage(), e));
        }

        HttpRequest request = HttpRequest.newBuilder(URI.create(dispatchUrl))
                .timeout(timeout)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build();
        return client.sendAsync(request, HttpResponse.BodyHandlers.ofString())
                .thenApply(response -> {
                    int status = response.statusCode();
                    if (status < 200 || status >= 300) {
                        throw new ExecutionFailure("dispatch returned HTTP " + status + ": "
                                + abbreviate(response.body()));
                    }
                    log.debug("Dispatched payload to {} ({})", dispatchUrl, status);
                    return abbreviate(response.body());
                });
    }

    private static String abbreviate(String s) {
        if (s == null) {
            return "";
        }
        return s.length() <= MAX_SUMMARY_CHARS ? s : s.substring(0, MAX_SUMMARY_CHARS) + "...";
    }
}
