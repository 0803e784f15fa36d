package com.yagwr.spring;

import com.yagwr.adapter.spring.YagwrAutoConfiguration;
import org.springframework.context.annotation.Import;

import java.lang.annotation.*;

/**
 * Registers the rule set, the shell action executor and the dispatch worker, and starts
 * the worker thread before the embedded web server accepts webhooks.
 * <p>
 * Put it next to {@code @SpringBootApplication}; the rules file is read from
 * {@code yagwr.rules-file}:
 * <pre>
 * &#64;SpringBootApplication
 * &#64;EnableWebhookRunner
 * public class HookServer {
 *     public static void main(String[] args) {
 *         SpringApplication.run(HookServer.class, "--yagwr.rules-file=/etc/yagwr/rules.yml");
 *     }
 * }
 * </pre>
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
@Import(YagwrAutoConfiguration.class)
public @interface EnableWebhookRunner {
}
