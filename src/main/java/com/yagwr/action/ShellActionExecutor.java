package com.yagwr.action;

import com.yagwr.core.WebhookRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.regex.Pattern;

/**
 * Executes actions as shell commands.
 * <p>
 * Every request header is exported as {@code YAGWR_<NAME>}, where whitespace and hyphens
 * in the name become underscores. The request body is written to standard input.
 * No timeout is applied to the process.
 */
public class ShellActionExecutor implements ActionExecutor, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ShellActionExecutor.class);

    public static final String ENV_PREFIX = "YAGWR_";
    private static final Pattern NAME_SEPARATORS = Pattern.compile("[\\s-]");

    private final String shell;
    private final ExecutorService streamPool;

    public ShellActionExecutor(String shell) {
        this.shell = shell;
        AtomicInteger threadCount = new AtomicInteger();
        this.streamPool = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r);
            t.setName("action-io-" + threadCount.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    public ActionResult execute(WebhookRequest request, String action) throws IOException, InterruptedException {
        ProcessBuilder builder = new ProcessBuilder(shell, "-c", action);
        builder.environment().putAll(environmentFor(request));

        log.debug("Creating subprocess for command: {}", action);
        Process process = builder.start();

        byte[] body = request.body();
        CompletableFuture<Void> stdin = CompletableFuture.runAsync(() -> writeInput(process, body), streamPool);
        CompletableFuture<byte[]> stdout = CompletableFuture.supplyAsync(
                () -> readFully(process.getInputStream()), streamPool);
        CompletableFuture<byte[]> stderr = CompletableFuture.supplyAsync(
                () -> readFully(process.getErrorStream()), streamPool);

        int exitCode = process.waitFor();
        ActionResult result = new ActionResult(exitCode, decode(join(stdout)), decode(join(stderr)));
        join(stdin);

        log.debug("Return code: {}", exitCode);
        if (!result.stdout().isEmpty()) {
            log.debug("STDOUT:\n{}", result.stdout());
        }
        if (!result.stderr().isEmpty()) {
            log.debug("STDERR:\n{}", result.stderr());
        }
        if (!result.isSuccess()) {
            log.warn("Command '{}' failed with exit code {}, payload was\n{}\n----",
                    action, exitCode, body != null ? decode(body) : "<no body>");
        }
        return result;
    }

    /**
     * Environment variables added for a request, one per header.
     */
    public static Map<String, String> environmentFor(WebhookRequest request) {
        Map<String, String> env = new LinkedHashMap<>();
        for (Map.Entry<String, String> header : request.headers().entrySet()) {
            env.put(variableName(header.getKey()), header.getValue());
        }
        return env;
    }

    /**
     * {@code X-Gitlab-Event} becomes {@code YAGWR_X_Gitlab_Event}; the case is kept.
     */
    public static String variableName(String headerName) {
        return ENV_PREFIX + NAME_SEPARATORS.matcher(headerName).replaceAll("_");
    }

    private static void writeInput(Process process, byte[] body) {
        try (OutputStream out = process.getOutputStream()) {
            if (body != null) {
                out.write(body);
            }
        } catch (IOException e) {
            // The command may exit without reading its input
            log.debug("Could not write payload to stdin: {}", e.getMessage());
        }
    }

    private static byte[] readFully(InputStream in) {
        try (in) {
            return in.readAllBytes();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static <T> T join(CompletableFuture<T> future) throws IOException, InterruptedException {
        try {
            return future.get();
        } catch (ExecutionException e) {
            if (e.getCause() instanceof UncheckedIOException io) {
                throw io.getCause();
            }
            throw new IOException("Action I/O failed", e.getCause());
        }
    }

    private static String decode(byte[] bytes) {
        return new String(bytes, StandardCharsets.UTF_8).strip();
    }

    @Override
    public void close() {
        streamPool.shutdownNow();
    }
}
