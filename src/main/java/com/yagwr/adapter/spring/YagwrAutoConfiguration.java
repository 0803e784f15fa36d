package com.yagwr.adapter.spring;

import com.yagwr.action.ActionExecutor;
import com.yagwr.action.ShellActionExecutor;
import com.yagwr.core.DispatchController;
import com.yagwr.dispatch.ConcurrencyBridge;
import com.yagwr.dispatch.DispatchWorker;
import com.yagwr.exception.ConfigurationException;
import com.yagwr.rule.RuleLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Spring Boot auto-configuration for the webhook runner.
 * <p>
 * The dispatch worker is started while the context refreshes and startup blocks until it
 * accepts requests, so the web server never opens before the worker is ready.
 */
@Configuration
@EnableConfigurationProperties(YagwrProperties.class)
public class YagwrAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(YagwrAutoConfiguration.class);

    @Bean
    @ConditionalOnMissingBean
    public DispatchController dispatchController(YagwrProperties properties) {
        return new DispatchController(RuleLoader.load(properties.getRulesFile()));
    }

    @Bean
    @ConditionalOnMissingBean
    public ActionExecutor actionExecutor(YagwrProperties properties) {
        log.info("Actions run through {}", properties.getShell());
        return new ShellActionExecutor(properties.getShell());
    }

    @Bean
    @ConditionalOnMissingBean
    public DispatchWorker dispatchWorker(DispatchController controller, ActionExecutor actionExecutor) {
        return new DispatchWorker(controller, actionExecutor);
    }

    @Bean(destroyMethod = "stop")
    @ConditionalOnMissingBean
    public ConcurrencyBridge dispatchBridge(YagwrProperties properties,
                                            DispatchWorker worker,
                                            DispatchController controller) throws InterruptedException {
        ConcurrencyBridge bridge = new ConcurrencyBridge(properties.getWorkerName(), worker);
        bridge.start();

        if (!controller.awaitReady(properties.getStartupTimeout())) {
            bridge.stop();
            throw new ConfigurationException("Dispatch worker did not start within " + properties.getStartupTimeout());
        }
        log.info("Dispatch worker '{}' ready", properties.getWorkerName());
        return bridge;
    }
}
