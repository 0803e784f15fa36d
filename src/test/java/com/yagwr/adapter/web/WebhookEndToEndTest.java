package com.yagwr.adapter.web;

import com.yagwr.YagwrApplication;
import com.yagwr.core.DispatchController;
import com.yagwr.dispatch.DispatchWorker;
import com.yagwr.dispatch.WorkerState;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Posts webhooks to the running application and checks the actions they trigger.
 */
@EnabledOnOs({OS.LINUX, OS.MAC})
@SpringBootTest(classes = YagwrApplication.class, webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
class WebhookEndToEndTest {

    private static final Path WORK_DIR;
    private static final Path ENV_OUT;
    private static final Path BODY_OUT;
    private static final Path CHUNKED_OUT;
    private static final Path FORM_OUT;

    static {
        try {
            WORK_DIR = Files.createTempDirectory("yagwr-e2e");
            ENV_OUT = WORK_DIR.resolve("env.out");
            BODY_OUT = WORK_DIR.resolve("body.out");
            CHUNKED_OUT = WORK_DIR.resolve("chunked.out");
            FORM_OUT = WORK_DIR.resolve("form.out");
            Path rules = WORK_DIR.resolve("rules.yml");
            Files.writeString(rules, String.join("\n",
                    "- condition: \"gitlab_event=Push Hook\"",
                    "  action: \"env > " + ENV_OUT + "\"",
                    "- condition:",
                    "    all:",
                    "      - \"path ~= /deploy\"",
                    "      - \"gitlab_token = s3cret\"",
                    "  action: \"cat > " + BODY_OUT + "\"",
                    "- condition: \"path = /chunked\"",
                    "  action: \"wc -c | tr -d ' ' > " + CHUNKED_OUT + "\"",
                    "- condition: \"path = /form\"",
                    "  action: \"cat > " + FORM_OUT + "\"",
                    "- condition: \"not valid\"",
                    "  action: \"echo skipped\"",
                    ""));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    @DynamicPropertySource
    static void properties(DynamicPropertyRegistry registry) {
        registry.add("yagwr.rules-file", () -> WORK_DIR.resolve("rules.yml").toString());
    }

    @LocalServerPort
    private int port;

    @Autowired
    private TestRestTemplate restTemplate;

    @Autowired
    private DispatchController dispatchController;

    @Autowired
    private DispatchWorker dispatchWorker;

    @Test
    @DisplayName("Invalid rules are skipped at startup and the worker is running")
    void startsWithValidRules() {
        assertEquals(4, dispatchController.getRules().size());
        assertTrue(dispatchController.isReady());
        assertEquals(WorkerState.RUNNING, dispatchWorker.getState());
    }

    @Test
    @DisplayName("Push hook exports the event header to the action")
    void pushHookRunsAction() throws Exception {
        HttpHeaders headers = new HttpHeaders();
        headers.set("X-Gitlab-Event", "Push Hook");

        ResponseEntity<String> response = post("/", headers, "{}");

        assertEquals(HttpStatus.OK, response.getStatusCode());
        assertNull(response.getBody());
        List<String> lines = waitForLines(ENV_OUT, "YAGWR_X_Gitlab_Event=Push Hook");
        assertTrue(lines.contains("YAGWR_X_Gitlab_Event=Push Hook"));
    }

    @Test
    @DisplayName("Body reaches the action on standard input")
    void bodyIsPiped() throws Exception {
        HttpHeaders headers = new HttpHeaders();
        headers.set("X-Gitlab-Token", "s3cret");
        String payload = "{\"object_kind\":\"deployment\",\"status\":\"success\"}";

        post("/deploy/production", headers, payload);

        List<String> lines = waitForLines(BODY_OUT, payload);
        assertEquals(List.of(payload), lines);
    }

    @Test
    @DisplayName("Requests that match nothing are still acknowledged")
    void unmatchedRequestIsAcknowledged() {
        ResponseEntity<String> response = post("/anything?ref=main", new HttpHeaders(), "ignored");

        assertEquals(HttpStatus.OK, response.getStatusCode());
    }

    @Test
    @DisplayName("A chunked request without Content-Length gives the action an empty input")
    void chunkedBodyIsNotRead() throws Exception {
        String statusLine;
        try (Socket socket = new Socket("127.0.0.1", port)) {
            OutputStream out = socket.getOutputStream();
            out.write(String.join("\r\n",
                    "POST /chunked HTTP/1.1",
                    "Host: localhost",
                    "Transfer-Encoding: chunked",
                    "Connection: close",
                    "",
                    "7",
                    "a=1&b=2",
                    "0",
                    "",
                    "").getBytes(StandardCharsets.US_ASCII));
            out.flush();
            BufferedReader in = new BufferedReader(
                    new InputStreamReader(socket.getInputStream(), StandardCharsets.US_ASCII));
            statusLine = in.readLine();
        }

        assertNotNull(statusLine);
        assertTrue(statusLine.startsWith("HTTP/1.1 200"), statusLine);
        assertEquals(List.of("0"), waitForLines(CHUNKED_OUT, "0"));
    }

    @Test
    @DisplayName("A form-encoded body reaches the action unchanged")
    void formBodyIsPiped() throws Exception {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_FORM_URLENCODED);

        post("/form", headers, "a=1&b=2");

        assertEquals(List.of("a=1&b=2"), waitForLines(FORM_OUT, "a=1&b=2"));
    }

    private ResponseEntity<String> post(String path, HttpHeaders headers, String body) {
        return restTemplate.exchange(path, HttpMethod.POST, new HttpEntity<>(body, headers), String.class);
    }

    private static List<String> waitForLines(Path file, String expected) throws Exception {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(10);
        while (System.nanoTime() < deadline) {
            if (Files.exists(file)) {
                List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
                if (lines.contains(expected)) {
                    return lines;
                }
            }
            Thread.sleep(50);
        }
        fail("'" + expected + "' not written to " + file);
        return List.of();
    }
}
