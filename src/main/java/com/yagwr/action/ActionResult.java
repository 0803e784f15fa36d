package com.yagwr.action;

/**
 * Outcome of one action run.
 *
 * @param exitCode Process exit status
 * @param stdout   Captured standard output, UTF-8 decoded and trimmed
 * @param stderr   Captured standard error, UTF-8 decoded and trimmed
 */
public record ActionResult(int exitCode, String stdout, String stderr) {

    public boolean isSuccess() {
        return exitCode == 0;
    }
}
