package com.archvalidation.config;

import com.archvalidation.domain.model.ArchitectureLayer;
import com.archvalidation.domain.model.Severity;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.convert.converter.Converter;
import org.springframework.format.FormatterRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * Accepts the lower-case wire values of enums in query parameters
 * ({@code severity=high}, {@code source_layer=Business}).
 */
@Configuration
public class WebConfiguration implements WebMvcConfigurer {

    @Override
    public void addFormatters(FormatterRegistry registry) {
        registry.addConverter(String.class, Severity.class, (Converter<String, Severity>) Severity::fromValue);
        registry.addConverter(String.class, ArchitectureLayer.class,
            (Converter<String, ArchitectureLayer>) ArchitectureLayer::fromValue);
    }
}
