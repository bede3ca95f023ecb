package com.cmflineage.sync;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

/**
 * JSON over HTTP to a central {@code CentralHttpServer}. I/O errors, 5xx answers and expired push
 * sessions (410) are retriable; other 4xx answers mean the central store rejected the batch and
 * re-sending it will not help.
 */
public class HttpSyncTransport implements SyncTransport {
    private static final MediaType JSON = MediaType.parse("application/json");

    private final OkHttpClient httpClient;
    private final ObjectMapper mapper;
    private final HttpUrl baseUrl;
    private final int chunkSize;

    public HttpSyncTransport(OkHttpClient httpClient, String baseUrl) {
        this(httpClient, baseUrl, Integer.MAX_VALUE);
    }

    public HttpSyncTransport(OkHttpClient httpClient, String baseUrl, int chunkSize) {
        if (chunkSize < 1) {
            throw new IllegalArgumentException("chunkSize must be >= 1");
        }
        this.httpClient = httpClient;
        this.chunkSize = chunkSize;
        this.mapper = SyncJson.mapper();
        HttpUrl parsed = HttpUrl.parse(baseUrl);
        if (parsed == null) {
            throw new IllegalArgumentException("Invalid central URL: " + baseUrl);
        }
        this.baseUrl = parsed;
    }

    public static HttpSyncTransport create(String baseUrl, Duration timeout) {
        return create(baseUrl, timeout, Integer.MAX_VALUE);
    }

    public static HttpSyncTransport create(String baseUrl, Duration timeout, int chunkSize) {
        OkHttpClient client = new OkHttpClient.Builder()
                .callTimeout(timeout)
                .readTimeout(timeout)
                .build();
        return new HttpSyncTransport(client, baseUrl, chunkSize);
    }

    @Override
    public PushReceipt push(SyncBatch batch) {
        if (batch.size() <= chunkSize) {
            return post("sync/push", batch, PushReceipt.class);
        }
        JsonNode opened = post("sync/sessions", Map.of("sourceStoreId", batch.sourceStoreId()), JsonNode.class);
        String sessionId = opened.path("sessionId").asText();
        List<BatchEntry> entries = batch.entries();
        try {
            for (int from = 0; from < entries.size(); from += chunkSize) {
                List<BatchEntry> chunk = entries.subList(from, Math.min(entries.size(), from + chunkSize));
                post("sync/sessions/" + sessionId + "/entries",
                        new SyncBatch(batch.sourceStoreId(), batch.highWaterMark(), chunk), JsonNode.class);
            }
        } catch (SyncTransportException e) {
            abort(sessionId, e);
            throw e;
        }
        return post("sync/sessions/" + sessionId + "/commit", Map.of("highWaterMark", batch.highWaterMark()),
                PushReceipt.class);
    }

    @Override
    public SyncBatch pull(PullRequest request) {
        return post("sync/pull", request, SyncBatch.class);
    }

    private <T> T post(String path, Object body, Class<T> responseType) {
        HttpUrl url = baseUrl.newBuilder().addPathSegments(path).build();
        try {
            String payload = mapper.writeValueAsString(body);
            Request request = new Request.Builder()
                    .url(url)
                    .post(RequestBody.create(payload, JSON))
                    .build();
            try (Response response = httpClient.newCall(request).execute()) {
                ResponseBody responseBody = response.body();
                String text = responseBody == null ? "" : responseBody.string();
                if (!response.isSuccessful()) {
                    throw new SyncTransportException("POST " + url + " failed status=" + response.code()
                            + " error=" + errorMessage(text), response.code() >= 500 || response.code() == 410);
                }
                return mapper.readValue(text, responseType);
            }
        } catch (IOException e) {
            throw new SyncTransportException("POST " + url + " failed: " + e.getMessage(), e);
        }
    }

    private void abort(String sessionId, SyncTransportException cause) {
        try {
            post("sync/sessions/" + sessionId + "/abort", Map.of(), JsonNode.class);
        } catch (SyncTransportException e) {
            cause.addSuppressed(e);
        }
    }

    private String errorMessage(String body) {
        try {
            JsonNode root = mapper.readTree(body);
            return root.path("error").asText(body);
        } catch (IOException e) {
            return body;
        }
    }
}
