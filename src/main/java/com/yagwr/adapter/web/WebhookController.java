package com.yagwr.adapter.web;

import com.yagwr.core.DispatchController;
import com.yagwr.core.WebhookRequest;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RestController;

import java.io.IOException;
import java.util.AbstractMap;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Receives Gitlab webhook deliveries on any path.
 * <p>
 * Gitlab expects an answer as fast as possible and ignores the status code, so the request
 * is queued for the dispatch worker and {@code 200 OK} is returned whatever happens next.
 */
@RestController
public class WebhookController {

    private static final Logger log = LoggerFactory.getLogger(WebhookController.class);

    private final DispatchController dispatchController;

    public WebhookController(DispatchController dispatchController) {
        this.dispatchController = dispatchController;
    }

    @PostMapping("/**")
    public ResponseEntity<Void> receive(HttpServletRequest request) {
        String client = request.getRemoteAddr();
        log.debug("Parsing incoming request from {}", client);

        String target = request.getRequestURI();
        if (request.getQueryString() != null) {
            target += "?" + request.getQueryString();
        }
        String requestLine = request.getMethod() + " " + target + " " + request.getProtocol();

        try {
            WebhookRequest webhook = new WebhookRequest(
                    client, target, requestLine, readHeaders(request), readBody(request));
            dispatchController.handOff(webhook);
        } catch (IOException e) {
            log.error("Unable to read request body from {}", client, e);
        }

        log.info("{} \"{}\" 200", client, requestLine);
        return ResponseEntity.ok().build();
    }

    private static Map<String, String> readHeaders(HttpServletRequest request) {
        List<Map.Entry<String, String>> fields = new ArrayList<>();
        for (String name : Collections.list(request.getHeaderNames())) {
            for (String value : Collections.list(request.getHeaders(name))) {
                fields.add(new AbstractMap.SimpleImmutableEntry<>(name, value));
            }
        }
        return WebhookRequest.collapseHeaders(fields);
    }

    private static byte[] readBody(HttpServletRequest request) throws IOException {
        if (request.getHeader("Content-Length") == null) {
            return null;
        }
        long length = request.getContentLengthLong();
        if (length < 0 || length > Integer.MAX_VALUE) {
            throw new IOException("Invalid Content-Length: " + request.getHeader("Content-Length"));
        }
        return request.getInputStream().readNBytes((int) length);
    }
}
