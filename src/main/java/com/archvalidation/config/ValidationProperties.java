package com.archvalidation.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Externalized settings under the {@code validation} prefix.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "validation")
public class ValidationProperties {

    @Valid
    private Security security = new Security();

    @Valid
    private Cycle cycle = new Cycle();

    @Valid
    private Rules rules = new Rules();

    @Valid
    private Issues issues = new Issues();

    @Data
    public static class Security {
        /**
         * HMAC secret for HS256 bearer tokens, at least 32 bytes.
         */
        @NotBlank
        private String jwtSecret;

        @NotNull
        private Duration clockSkew = Duration.ofSeconds(30);
    }

    @Data
    public static class Cycle {
        /**
         * Run cycles inside the request instead of on the worker pool.
         */
        private boolean synchronous = false;

        @NotNull
        private Duration timeout = Duration.ofMinutes(5);

        @Min(1)
        private int poolSize = 4;

        @Min(0)
        private int queueCapacity = 100;
    }

    @Data
    public static class Rules {
        private boolean seedDefaults = true;

        @NotBlank
        private String defaultsLocation = "classpath:validation/default-rules.json";
    }

    @Data
    public static class Issues {
        @Min(1)
        @Max(10_000)
        private int maxPageSize = 1000;
    }
}
