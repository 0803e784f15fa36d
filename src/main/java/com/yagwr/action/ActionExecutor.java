package com.yagwr.action;

import com.yagwr.core.WebhookRequest;

import java.io.IOException;

/**
 * Runs the action of a matching rule for a webhook request.
 */
public interface ActionExecutor {

    /**
     * Run the action and wait for it to finish.
     * A failing command is reported through {@link ActionResult#exitCode()}, not thrown.
     *
     * @param request the request that matched
     * @param action  the rule's action
     * @return exit status and captured output
     * @throws IOException          if the action cannot be started
     * @throws InterruptedException if the calling thread is interrupted while waiting;
     *                              the running process is left alone
     */
    ActionResult execute(WebhookRequest request, String action) throws IOException, InterruptedException;
}
