package com.yagwr.rule;

import com.yagwr.exception.ConfigurationException;
import com.yagwr.exception.YagwrException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Loads rules from YAML files.
 * <p>
 * The file holds a list of {@code condition}/{@code action} mappings; a single mapping
 * is accepted as a one-element list. Malformed rules are logged and skipped.
 */
public class RuleLoader {

    private static final Logger log = LoggerFactory.getLogger(RuleLoader.class);

    private RuleLoader() {
    }

    /**
     * Load rules from a path.
     * Supports classpath: prefix for classpath resources.
     *
     * @param path Path to the rules file
     * @return Rules in declaration order, never empty
     * @throws ConfigurationException if the file cannot be read or no rule is usable
     */
    public static List<Rule> load(String path) {
        log.info("Loading rules from: {}", path);

        Resource resource = getResource(path);
        try (InputStream inputStream = resource.getInputStream()) {
            return parse(new Yaml().load(inputStream));
        } catch (IOException | YAMLException e) {
            throw new ConfigurationException("Failed to load rules from: " + path, e);
        }
    }

    private static Resource getResource(String path) {
        if (path.startsWith("classpath:")) {
            String resourcePath = path.substring("classpath:".length());
            return new ClassPathResource(resourcePath);
        }
        return new FileSystemResource(path);
    }

    /**
     * Build rules from an already parsed YAML document.
     *
     * @param document a list of rule mappings or a single rule mapping
     * @return Rules in declaration order, never empty
     * @throws ConfigurationException if no rule is usable
     */
    public static List<Rule> parse(Object document) {
        if (document == null) {
            throw new ConfigurationException("Rules file is empty");
        }

        List<?> descriptions;
        if (document instanceof Map<?, ?>) {
            descriptions = List.of(document);
        } else if (document instanceof List<?> list) {
            descriptions = list;
        } else {
            throw new ConfigurationException("Rules must be a list of mappings, found: " + document);
        }

        List<Rule> rules = new ArrayList<>();
        for (int i = 0; i < descriptions.size(); i++) {
            Object item = descriptions.get(i);
            if (!(item instanceof Map<?, ?> description)) {
                log.error("Rule {} is not a mapping, skipping: {}", i + 1, item);
                continue;
            }
            try {
                Rule rule = Rule.fromDescription(description);
                rules.add(rule);
                log.info("Loaded rule {}: condition={} action={}",
                        i + 1, rule.condition().toDescription(), rule.action());
            } catch (YagwrException e) {
                log.error("Unable to load rule {}: {}", i + 1, e.getMessage());
            }
        }

        if (rules.isEmpty()) {
            throw new ConfigurationException("No valid rule found");
        }

        log.info("Loaded {} of {} rules", rules.size(), descriptions.size());
        return List.copyOf(rules);
    }
}
