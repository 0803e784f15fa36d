package com.yagwr;

import com.yagwr.spring.EnableWebhookRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Gitlab webhook runner: listens for webhook deliveries and runs the actions of matching rules.
 * <p>
 * Options are Spring Boot properties, e.g.
 * {@code --server.port=7777 --yagwr.rules-file=/etc/yagwr/rules.yml --logging.level.com.yagwr=DEBUG}.
 */
@SpringBootApplication
@EnableWebhookRunner
public class YagwrApplication {

    private static final Logger log = LoggerFactory.getLogger(YagwrApplication.class);

    public static void main(String[] args) {
        try {
            SpringApplication.run(YagwrApplication.class, args);
        } catch (RuntimeException e) {
            log.error("Webhook runner failed to start or its HTTP server stopped with an error", e);
            System.exit(1);
        }
    }
}
