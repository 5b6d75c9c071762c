package com.shortspilot.orchestrator.notify;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.shortspilot.orchestrator.model.WorkItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Posts pipeline events as JSON to a webhook (chat bot relay, push service).
 *
 * Body: {@code {"event": "...", "itemId": ..., "title": ..., ...}}. Delivery
 * is best effort; failures are logged and swallowed because the state they
 * describe is already committed.
 */
public class WebhookNotifier implements PipelineNotifier {

    private static final Logger log = LoggerFactory.getLogger(WebhookNotifier.class);

    private final HttpClient   http;
    private final ObjectMapper json;
    private final URI          webhook;

    public WebhookNotifier(String webhookUrl, ObjectMapper objectMapper) {
        this.webhook = URI.create(webhookUrl);
        this.json    = objectMapper;
        this.http    = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    @Override
    public void segmentPublished(WorkItem item, int segmentIndex, String remoteId) {
        Map<String, Object> body = itemBody("segment_published", item);
        body.put("part",     segmentIndex);
        body.put("total",    item.getSegments().size());
        body.put("remoteId", remoteId);
        send(body);
    }

    @Override
    public void itemCompleted(WorkItem item) {
        send(itemBody("item_completed", item));
    }

    @Override
    public void itemFailed(WorkItem item) {
        Map<String, Object> body = itemBody("item_failed", item);
        body.put("error", item.getLastError());
        send(body);
    }

    @Override
    public void queueDrained() {
        send(new LinkedHashMap<>(Map.of("event", "queue_drained")));
    }

    private static Map<String, Object> itemBody(String event, WorkItem item) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("event",  event);
        body.put("itemId", item.getId());
        body.put("title",  item.getTitle());
        return body;
    }

    private void send(Map<String, Object> body) {
        try {
            HttpRequest req = HttpRequest.newBuilder()
                    .uri(webhook)
                    .timeout(Duration.ofSeconds(30))
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(json.writeValueAsString(body)))
                    .build();
            HttpResponse<String> resp = http.send(req, HttpResponse.BodyHandlers.ofString());
            if (resp.statusCode() < 200 || resp.statusCode() >= 300) {
                log.warn("Webhook rejected '{}' event: HTTP {} {}", body.get("event"), resp.statusCode(), resp.body());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while sending '{}' notification", body.get("event"));
        } catch (Exception e) {
            log.warn("Could not send '{}' notification: {}", body.get("event"), e.getMessage());
        }
    }
}
