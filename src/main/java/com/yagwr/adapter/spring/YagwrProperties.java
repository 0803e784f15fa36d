package com.yagwr.adapter.spring;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Spring Boot configuration properties for the webhook runner.
 */
@ConfigurationProperties(prefix = "yagwr")
public class YagwrProperties {

    /**
     * Path to the YAML rules file.
     * Supports classpath: prefix for classpath resources.
     */
    private String rulesFile = "rules.yml";

    /**
     * Shell used to run actions, invoked as {@code <shell> -c <action>}.
     */
    private String shell = "/bin/sh";

    /**
     * Name of the dispatch worker thread.
     */
    private String workerName = "dispatch-worker";

    /**
     * How long startup waits for the dispatch worker to accept requests.
     */
    private Duration startupTimeout = Duration.ofSeconds(10);

    public String getRulesFile() {
        return rulesFile;
    }

    public void setRulesFile(String rulesFile) {
        this.rulesFile = rulesFile;
    }

    public String getShell() {
        return shell;
    }

    public void setShell(String shell) {
        this.shell = shell;
    }

    public String getWorkerName() {
        return workerName;
    }

    public void setWorkerName(String workerName) {
        this.workerName = workerName;
    }

    public Duration getStartupTimeout() {
        return startupTimeout;
    }

    public void setStartupTimeout(Duration startupTimeout) {
        this.startupTimeout = startupTimeout;
    }
}
