package com.shortspilot.orchestrator.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.shortspilot.orchestrator.client.dto.DiscoverResponse;
import com.shortspilot.orchestrator.client.dto.FetchResponse;
import com.shortspilot.orchestrator.client.dto.PublishResponse;
import com.shortspilot.orchestrator.client.dto.TransformResponse;
import com.shortspilot.orchestrator.config.WorkerProperties;
import com.shortspilot.orchestrator.discovery.DiscoveredItem;
import com.shortspilot.orchestrator.discovery.DiscoverySource;
import com.shortspilot.orchestrator.model.Segment;
import com.shortspilot.orchestrator.model.SourceRange;
import com.shortspilot.orchestrator.model.WorkItem;
import com.shortspilot.orchestrator.stage.FetchStage;
import com.shortspilot.orchestrator.stage.FetchedSource;
import com.shortspilot.orchestrator.stage.PublishRequest;
import com.shortspilot.orchestrator.stage.PublishStage;
import com.shortspilot.orchestrator.stage.StageException;
import com.shortspilot.orchestrator.stage.TransformRequest;
import com.shortspilot.orchestrator.stage.TransformStage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * HTTP client for the media worker sidecar.
 *
 * The worker does the actual media work (listing candidates, downloading,
 * cutting and rendering, uploading). Each endpoint backs one stage executor,
 * wired in {@code OrchestratorConfig}, so the scheduler never sees HTTP:
 * <pre>
 *   GET  /discover   → {@link DiscoverySource}
 *   POST /fetch      → {@link FetchStage}
 *   POST /transform  → {@link TransformStage}
 *   POST /publish    → {@link PublishStage}
 * </pre>
 *
 * Failure classification:
 *   HTTP 4xx other than 408 and 429 → PERMANENT (the request itself is wrong)
 *   408, 429, 5xx, I/O errors, timeouts → TRANSIENT
 *   a 2xx body that cannot be parsed or misses required fields → PERMANENT
 */
@Component
public class MediaWorkerClient implements DiscoverySource {

    private static final Logger log = LoggerFactory.getLogger(MediaWorkerClient.class);

    private static final Duration DISCOVER_TIMEOUT = Duration.ofSeconds(60);

    private final HttpClient   http;
    private final ObjectMapper json;
    private final String       baseUrl;
    private final Duration     requestTimeout;

    public MediaWorkerClient(WorkerProperties props, ObjectMapper objectMapper) {
        this.baseUrl        = stripTrailingSlash(props.baseUrl());
        this.requestTimeout = props.requestTimeout();
        this.json           = objectMapper;
        this.http           = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)   // uvicorn doesn't support h2c upgrade
                .connectTimeout(props.connectTimeout())
                .build();
    }

    // ------------------------------------------------------------------
    // Discovery
    // ------------------------------------------------------------------

    @Override
    public List<DiscoveredItem> discover() {
        HttpRequest req = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + "/discover"))
                .timeout(DISCOVER_TIMEOUT)
                .header("Accept", "application/json")
                .GET()
                .build();
        DiscoverResponse resp = parse(send(req, "discover"), DiscoverResponse.class, "discover");
        if (resp.items() == null) return List.of();

        List<DiscoveredItem> items = new ArrayList<>();
        for (DiscoverResponse.Entry e : resp.items()) {
            items.add(new DiscoveredItem(e.id(), e.priority(), e.title(), e.source_url()));
        }
        log.debug("Media worker reported {} candidate(s)", items.size());
        return items;
    }

    // ------------------------------------------------------------------
    // Stages
    // ------------------------------------------------------------------

    // Each call is one attempt; retries across invocations are the scheduler's job.

    public FetchedSource fetch(WorkItem item) {
        log.info("Fetching source of item {} from {}", item.getId(), item.getSourceUrl());
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("item_id",    item.getId());
        body.put("source_url", item.getSourceUrl());

        FetchResponse resp = parse(post("/fetch", body, "fetch " + item.getId()),
                FetchResponse.class, "fetch");
        return new FetchedSource(resp.artifact_ref(), resp.duration_seconds());
    }

    public List<Segment> transform(TransformRequest request) {
        WorkItem item = request.item();
        log.info("Transforming item {} into {} segment(s)", item.getId(), request.plannedRanges().size());

        List<Map<String, Object>> ranges = new ArrayList<>();
        int index = 1;
        for (SourceRange r : request.plannedRanges()) {
            Map<String, Object> range = new LinkedHashMap<>();
            range.put("index",            index++);
            range.put("start_seconds",    r.startSeconds());
            range.put("duration_seconds", r.durationSeconds());
            ranges.add(range);
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("item_id",             item.getId());
        body.put("source_artifact_ref", item.getSourceArtifactRef());
        body.put("ranges",              ranges);

        TransformResponse resp = parse(post("/transform", body, "transform " + item.getId()),
                TransformResponse.class, "transform");
        if (resp.segments() == null) {
            throw StageException.permanentFailure("transform response has no segments");
        }
        try {
            return resp.segments().stream()
                    .map(s -> new Segment(s.index(),
                            new SourceRange(s.start_seconds(), s.duration_seconds()),
                            s.artifact_ref()))
                    .toList();
        } catch (IllegalArgumentException e) {
            throw StageException.permanentFailure("transform returned an invalid segment: " + e.getMessage());
        }
    }

    public String publish(PublishRequest request) {
        WorkItem item    = request.item();
        Segment  segment = request.segment();
        log.info("Publishing item {} segment {}", item.getId(), segment.index());

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("item_id",       item.getId());
        body.put("segment_index", segment.index());
        body.put("artifact_ref",  segment.localArtifactRef());
        body.put("title",         request.metadata().title());
        body.put("description",   request.metadata().description());
        body.put("tags",          request.metadata().tags());

        PublishResponse resp = parse(
                post("/publish", body, "publish " + item.getId() + "#" + segment.index()),
                PublishResponse.class, "publish");
        if (resp.remote_id() == null || resp.remote_id().isBlank()) {
            throw StageException.permanentFailure("publish response has no remote_id");
        }
        return resp.remote_id();
    }

    // ------------------------------------------------------------------
    // Private helpers
    // ------------------------------------------------------------------

    private String post(String path, Object body, String opName) {
        HttpRequest req = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + path))
                .timeout(requestTimeout)
                .header("Content-Type", "application/json")
                .header("Accept",       "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(toJson(body)))
                .build();
        return send(req, opName);
    }

    /** Send and classify; returns the body of a 2xx response. */
    private String send(HttpRequest req, String opName) {
        HttpResponse<String> resp;
        try {
            resp = http.send(req, HttpResponse.BodyHandlers.ofString());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw StageException.transientFailure(opName + " interrupted", e);
        } catch (IOException e) {
            // includes HttpTimeoutException and connection failures
            throw StageException.transientFailure(opName + " failed: " + e.getMessage(), e);
        }

        int status = resp.statusCode();
        if (status >= 200 && status < 300) {
            return resp.body();
        }
        String message = opName + " failed: HTTP " + status + ": " + resp.body();
        if (isPermanent(status)) {
            throw StageException.permanentFailure(message);
        }
        throw new StageException(StageException.Kind.TRANSIENT, message);
    }

    static boolean isPermanent(int status) {
        return status >= 400 && status < 500 && status != 408 && status != 429;
    }

    private <T> T parse(String body, Class<T> type, String opName) {
        try {
            T value = json.readValue(body, type);
            if (value == null) {
                throw StageException.permanentFailure(opName + " returned an empty body");
            }
            return value;
        } catch (JsonProcessingException e) {
            throw StageException.permanentFailure(
                    "Failed to parse " + opName + " response: " + e.getOriginalMessage());
        }
    }

    private String toJson(Object obj) {
        try {
            return json.writeValueAsString(obj);
        } catch (JsonProcessingException e) {
            throw StageException.permanentFailure("JSON serialization failed: " + e.getOriginalMessage());
        }
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
