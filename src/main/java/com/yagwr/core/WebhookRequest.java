package com.yagwr.core;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Snapshot of an inbound webhook delivery.
 * Immutable after creation; the acceptor thread hands a copy to the dispatch worker.
 *
 * @param clientAddress Remote address of the sender
 * @param path          Request target, including the query string
 * @param requestLine   First line of the HTTP request
 * @param headers       Header names and values; names are unique ignoring case
 * @param body          Raw body, or null when the request carried no Content-Length
 */
public record WebhookRequest(
        String clientAddress,
        String path,
        String requestLine,
        Map<String, String> headers,
        byte[] body
) {

    public static final String TOKEN_HEADER = "X-Gitlab-Token";
    public static final String EVENT_HEADER = "X-Gitlab-Event";
    public static final String HOST_HEADER = "Host";

    public WebhookRequest {
        headers = Collections.unmodifiableMap(new LinkedHashMap<>(headers));
        body = body != null ? body.clone() : null;
    }

    @Override
    public byte[] body() {
        return body != null ? body.clone() : null;
    }

    /**
     * Get a header value, ignoring the case of the name.
     */
    public Optional<String> header(String name) {
        for (Map.Entry<String, String> entry : headers.entrySet()) {
            if (entry.getKey().equalsIgnoreCase(name)) {
                return Optional.of(entry.getValue());
            }
        }
        return Optional.empty();
    }

    /**
     * Flat view checked by rule conditions: {@code path}, {@code gitlab_token},
     * {@code gitlab_event} and {@code gitlab_host}. Absent headers leave their key out.
     */
    public Map<String, String> projection() {
        Map<String, String> data = new HashMap<>();
        if (path != null) {
            data.put("path", path);
        }
        header(TOKEN_HEADER).ifPresent(v -> data.put("gitlab_token", v));
        header(EVENT_HEADER).ifPresent(v -> data.put("gitlab_event", v));
        header(HOST_HEADER).ifPresent(v -> data.put("gitlab_host", v));
        return data;
    }

    /**
     * Collapse raw header fields into a map. A repeated name keeps the last value,
     * spelled the way it was last received.
     *
     * @param fields header name/value pairs in arrival order
     */
    public static Map<String, String> collapseHeaders(List<Map.Entry<String, String>> fields) {
        Map<String, String> headers = new LinkedHashMap<>();
        for (Map.Entry<String, String> field : fields) {
            headers.keySet().removeIf(name -> name.equalsIgnoreCase(field.getKey()));
            headers.put(field.getKey(), field.getValue());
        }
        return headers;
    }

    @Override
    public String toString() {
        return "WebhookRequest{client=" + clientAddress +
               ", requestLine='" + requestLine + '\'' +
               ", headers=" + headers.size() +
               ", bodyLength=" + (body != null ? body.length : -1) + '}';
    }
}
