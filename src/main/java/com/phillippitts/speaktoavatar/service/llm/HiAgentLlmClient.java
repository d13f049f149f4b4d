package com.phillippitts.speaktoavatar.service.llm;

import com.phillippitts.speaktoavatar.config.properties.LlmProperties;
import com.phillippitts.speaktoavatar.exception.ConnectionException;
import com.phillippitts.speaktoavatar.exception.ProtocolException;
import com.phillippitts.speaktoavatar.exception.RemoteServiceExceptionBuilder;
import com.phillippitts.speaktoavatar.util.LogSanitizer;
import com.phillippitts.speaktoavatar.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONException;
import org.json.JSONObject;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.function.Predicate;

/**
 * HiAgent chat API over plain HTTP. Streaming answers arrive as {@code data:} lines, each a JSON
 * object whose {@code answer} field carries the next text delta.
 */
@Component
public class HiAgentLlmClient implements LlmClient {

    private static final Logger LOG = LogManager.getLogger(HiAgentLlmClient.class);

    static final String SERVICE = "llm";
    private static final String DATA_PREFIX = "data:";

    private final LlmProperties props;
    private final HttpClient httpClient;

    @Autowired
    public HiAgentLlmClient(LlmProperties props) {
        this(props, HttpClient.newBuilder()
                .connectTimeout(Duration.ofMillis(props.getConnectTimeoutMs()))
                .build());
    }

    HiAgentLlmClient(LlmProperties props, HttpClient httpClient) {
        this.props = props;
        this.httpClient = httpClient;
    }

    @Override
    public String createConversation(String userId) {
        JSONObject body = new JSONObject()
                .put("UserID", userId)
                .put("Inputs", new JSONObject());
        HttpResponse<String> resp = send(request("create_conversation", body, false),
                HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        if (resp.statusCode() / 100 != 2) {
            throw rejected("create_conversation", resp.statusCode(), resp.body());
        }
        try {
            String id = new JSONObject(resp.body()).getJSONObject("Conversation").getString("AppConversationID");
            LOG.info("LLM conversation created for user {}: {}", userId, id);
            return id;
        } catch (JSONException e) {
            throw new ProtocolException("LLM create_conversation response missing Conversation.AppConversationID", e);
        }
    }

    @Override
    public int chatStream(String userId, String conversationId, String query, Predicate<String> onDelta) {
        JSONObject body = new JSONObject()
                .put("UserID", userId)
                .put("AppConversationID", conversationId)
                .put("Query", query)
                .put("ResponseMode", "streaming");
        long start = System.nanoTime();
        HttpResponse<InputStream> resp = send(request("chat_query_v2", body, true),
                HttpResponse.BodyHandlers.ofInputStream());
        if (resp.statusCode() / 100 != 2) {
            throw rejected("chat_query_v2", resp.statusCode(), readQuietly(resp.body()));
        }

        int deltas = 0;
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(resp.body(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                String delta = parseDelta(line);
                if (delta == null || delta.isEmpty()) {
                    continue;
                }
                deltas++;
                if (!onDelta.test(delta)) {
                    LOG.info("LLM stream stopped by consumer after {} deltas", deltas);
                    return deltas;
                }
            }
        } catch (IOException e) {
            throw new ConnectionException("LLM stream read failed: " + e.getMessage(), SERVICE,
                    ConnectionException.Reason.TRANSPORT, e);
        }
        LOG.info("LLM stream complete: deltas={}, {}ms", deltas, TimeUtils.elapsedMillis(start));
        return deltas;
    }

    /**
     * Text delta carried by one stream line, or null for lines that carry none.
     */
    static String parseDelta(String line) {
        if (line == null) {
            return null;
        }
        String trimmed = line.trim();
        if (!trimmed.startsWith(DATA_PREFIX)) {
            return null;
        }
        String data = trimmed.substring(DATA_PREFIX.length()).trim();
        if (data.isEmpty()) {
            return null;
        }
        try {
            JSONObject json = new JSONObject(data);
            return json.optString("answer", null);
        } catch (JSONException e) {
            LOG.debug("LLM skipping unparseable stream line: {}", LogSanitizer.truncate(data, 80));
            return null;
        }
    }

    private HttpRequest request(String path, JSONObject body, boolean streaming) {
        String base = props.getBaseUrl().endsWith("/")
                ? props.getBaseUrl().substring(0, props.getBaseUrl().length() - 1)
                : props.getBaseUrl();
        HttpRequest.Builder b = HttpRequest.newBuilder(URI.create(base + "/" + path))
                .timeout(Duration.ofMillis(props.getRequestTimeoutMs()))
                .header("Apikey", props.getApiKey())
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body.toString(), StandardCharsets.UTF_8));
        if (streaming) {
            b.header("Accept", "text/event-stream");
        }
        return b.build();
    }

    private <T> HttpResponse<T> send(HttpRequest request, HttpResponse.BodyHandler<T> handler) {
        try {
            return httpClient.send(request, handler);
        } catch (HttpTimeoutException e) {
            throw new ConnectionException("LLM request timed out: " + request.uri(), SERVICE,
                    ConnectionException.Reason.TIMEOUT, e);
        } catch (IOException e) {
            throw new ConnectionException("LLM request failed: " + e.getMessage(), SERVICE,
                    ConnectionException.Reason.TRANSPORT, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ConnectionException("Interrupted during LLM request", SERVICE,
                    ConnectionException.Reason.TRANSPORT, e);
        }
    }

    private static ConnectionException rejected(String path, int status, String body) {
        return RemoteServiceExceptionBuilder.create("LLM request rejected")
                .service(SERVICE)
                .metadata("path", path)
                .metadata("status", status)
                .metadata("body", LogSanitizer.truncate(body, 200))
                .buildConnection(ConnectionException.Reason.HANDSHAKE);
    }

    private static String readQuietly(InputStream in) {
        try (InputStream is = in) {
            return new String(is.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            return "<unreadable: " + e.getMessage() + ">";
        }
    }
}
