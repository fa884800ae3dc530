package com.archvalidation.application;

import com.archvalidation.config.ValidationProperties;
import com.archvalidation.interfaces.api.dto.CreateRuleRequest;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.List;

/**
 * Loads the default rule set at startup. Rules whose name already exists
 * are left untouched, so restarts do not duplicate or overwrite rules.
 */
@Component
@ConditionalOnProperty(prefix = "validation.rules", name = "seed-defaults", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class ValidationRuleSeeds implements ApplicationRunner {

    static final String SEED_PRINCIPAL = "system";

    private final RuleService ruleService;
    private final ResourceLoader resourceLoader;
    private final ObjectMapper objectMapper;
    private final ValidationProperties properties;

    @Override
    public void run(ApplicationArguments args) {
        String location = properties.getRules().getDefaultsLocation();
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            log.warn("Default rules not found at {}", location);
            return;
        }

        List<CreateRuleRequest> definitions;
        try (InputStream in = resource.getInputStream()) {
            definitions = objectMapper.readValue(in, new TypeReference<List<CreateRuleRequest>>() {});
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read default rules from " + location, e);
        }

        int created = ruleService.seedRules(definitions);
        log.info("Default rules loaded from {}: {} defined, {} created", location, definitions.size(), created);
    }
}
