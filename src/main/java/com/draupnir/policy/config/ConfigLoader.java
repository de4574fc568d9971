package com.draupnir.policy.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Optional;

/**
 * Resolves the policy rules. Lookup order: the explicit file, {@value #DEFAULT_CONFIG}
 * in the working directory, the classpath resource, built-in defaults.
 * <p>
 * Rules only tune warnings, so a file that cannot be used never fails startup: it is
 * logged and {@link PolicyRulesConfig#defaults()} takes its place. An explicit file that
 * does not exist does not fall through to the other locations.
 */
@Slf4j
public class ConfigLoader {

    public static final String DEFAULT_CONFIG = "policy-rules.yaml";

    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory())
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    public PolicyRulesConfig load(String rulesFile) {
        if (rulesFile != null && !rulesFile.isEmpty()) {
            return loadFromFile(rulesFile);
        }
        Path local = Paths.get(DEFAULT_CONFIG);
        if (Files.isRegularFile(local)) {
            log.info("Using policy rules from working directory: {}", local.toAbsolutePath());
            return loadFromFile(local.toString());
        }
        return loadDefault();
    }

    /**
     * Rules from the classpath resource
     */
    public PolicyRulesConfig loadDefault() {
        try (InputStream is = getClass().getClassLoader().getResourceAsStream(DEFAULT_CONFIG)) {
            if (is == null) {
                log.warn("No '{}' on the classpath, using built-in rules", DEFAULT_CONFIG);
                return PolicyRulesConfig.defaults();
            }
            return parse(is, "classpath:" + DEFAULT_CONFIG).orElseGet(PolicyRulesConfig::defaults);
        } catch (IOException e) {
            log.error("Cannot read classpath rules, using built-in rules", e);
            return PolicyRulesConfig.defaults();
        }
    }

    public PolicyRulesConfig loadFromFile(String rulesFile) {
        Path path = Paths.get(rulesFile);
        if (!Files.isRegularFile(path)) {
            log.warn("Rules file '{}' not found, using built-in rules", rulesFile);
            return PolicyRulesConfig.defaults();
        }
        try (InputStream is = Files.newInputStream(path)) {
            return parse(is, rulesFile).orElseGet(PolicyRulesConfig::defaults);
        } catch (IOException e) {
            log.error("Cannot read rules file '{}', using built-in rules", rulesFile, e);
            return PolicyRulesConfig.defaults();
        }
    }

    /**
     * Empty when the source is blank or not valid rules YAML
     */
    private Optional<PolicyRulesConfig> parse(InputStream is, String source) {
        try {
            PolicyRulesConfig rules = yamlMapper.readValue(is, PolicyRulesConfig.class);
            if (rules == null) {
                log.warn("Rules source '{}' is empty, using built-in rules", source);
                return Optional.empty();
            }
            log.info("Loaded policy rules from '{}': {}", source, rules);
            return Optional.of(rules);
        } catch (IOException e) {
            log.error("Invalid rules in '{}', using built-in rules: {}", source, e.getMessage());
            return Optional.empty();
        }
    }
}
