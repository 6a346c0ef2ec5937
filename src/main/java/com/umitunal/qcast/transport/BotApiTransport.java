package com.umitunal.qcast.transport;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.umitunal.qcast.core.MessageTransport;
import com.umitunal.qcast.core.SendResult;
import com.umitunal.qcast.serialization.JsonCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.List;
import java.util.Locale;

/**
 * Sends messages through a Telegram-style Bot HTTP API.
 *
 * Response mapping:
 * <ul>
 *   <li>{@code ok: true}: delivered</li>
 *   <li>403, or 400 saying the chat or user does not exist or blocked the bot: permanent failure</li>
 *   <li>429: rate limited for {@code parameters.retry_after} seconds</li>
 *   <li>anything else, including I/O errors: transient</li>
 * </ul>
 */
public class BotApiTransport implements MessageTransport {
    private static final Logger log = LoggerFactory.getLogger(BotApiTransport.class);

    public static final String DEFAULT_BASE_URL = "https://api.telegram.org";
    static final Duration DEFAULT_RETRY_AFTER = Duration.ofSeconds(1);
    private static final List<String> UNREACHABLE_MARKERS = List.of("chat not found", "user not found", "blocked");

    private final HttpClient httpClient;
    private final ObjectMapper mapper;
    private final URI sendMessageUri;
    private final Duration requestTimeout;
    private final String parseMode;

    private BotApiTransport(Builder builder) {
        this.httpClient = builder.httpClient != null
                ? builder.httpClient
                : HttpClient.newBuilder().connectTimeout(builder.requestTimeout).build();
        this.mapper = JsonCodec.createDefaultMapper();
        this.sendMessageUri = URI.create(stripTrailingSlash(builder.baseUrl) + "/bot" + builder.token + "/sendMessage");
        this.requestTimeout = builder.requestTimeout;
        this.parseMode = builder.parseMode;
    }

    @Override
    public SendResult send(String recipientId, String text) {
        HttpRequest request;
        try {
            request = HttpRequest.newBuilder(sendMessageUri)
                    .timeout(requestTimeout)
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofByteArray(requestBody(recipientId, text)))
                    .build();
        } catch (IOException e) {
            return SendResult.transientError("Cannot encode request: " + e.getMessage());
        }

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            return SendResult.transientError(e.getClass().getSimpleName() + ": " + e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return SendResult.transientError("Interrupted");
        }

        return interpret(response.statusCode(), response.body());
    }

    SendResult interpret(int status, String body) {
        JsonNode json = parse(body);
        if (status == 200 && json.path("ok").asBoolean(false)) {
            return SendResult.delivered();
        }

        String description = json.path("description").asText("HTTP " + status);
        if (status == 429) {
            long seconds = json.path("parameters").path("retry_after").asLong(0);
            return SendResult.rateLimited(seconds > 0 ? Duration.ofSeconds(seconds) : DEFAULT_RETRY_AFTER);
        }
        if (status == 403 || (status == 400 && mentionsUnreachable(description))) {
            return SendResult.permanentFailure(description);
        }
        log.debug("Bot API returned {}: {}", status, description);
        return SendResult.transientError(description);
    }

    private byte[] requestBody(String recipientId, String text) throws IOException {
        ObjectNode body = mapper.createObjectNode();
        body.put("chat_id", recipientId);
        body.put("text", text);
        if (parseMode != null) {
            body.put("parse_mode", parseMode);
        }
        return mapper.writeValueAsBytes(body);
    }

    private JsonNode parse(String body) {
        if (body == null || body.isBlank()) {
            return mapper.createObjectNode();
        }
        try {
            return mapper.readTree(body);
        } catch (IOException e) {
            log.debug("Unparsable Bot API response: {}", body);
            return mapper.createObjectNode();
        }
    }

    private static boolean mentionsUnreachable(String description) {
        String lower = description.toLowerCase(Locale.ROOT);
        return UNREACHABLE_MARKERS.stream().anyMatch(lower::contains);
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    public static Builder builder(String token) {
        return new Builder(token);
    }

    public static class Builder {
        private final String token;
        private String baseUrl = DEFAULT_BASE_URL;
        private Duration requestTimeout = Duration.ofSeconds(10);
        private String parseMode = "HTML";
        private HttpClient httpClient;

        private Builder(String token) {
            this.token = token;
        }

        public Builder withBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
            return this;
        }

        public Builder withRequestTimeout(Duration timeout) {
            this.requestTimeout = timeout;
            return this;
        }

        /**
         * Formatting mode sent with every message, or null for plain text.
         * Default: HTML
         */
        public Builder withParseMode(String parseMode) {
            this.parseMode = parseMode;
            return this;
        }

        public Builder withHttpClient(HttpClient httpClient) {
            this.httpClient = httpClient;
            return this;
        }

        public BotApiTransport build() {
            if (token == null || token.isBlank()) {
                throw new IllegalArgumentException("Bot token must not be blank");
            }
            return new BotApiTransport(this);
        }
    }
}
