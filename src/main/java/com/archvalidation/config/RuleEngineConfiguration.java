package com.archvalidation.config;

import com.archvalidation.domain.rules.RuleEvaluator;
import com.archvalidation.domain.rules.RuleLogicParser;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the framework-free rule engine into the context.
 */
@Configuration
public class RuleEngineConfiguration {

    @Bean
    public RuleLogicParser ruleLogicParser() {
        return new RuleLogicParser();
    }

    @Bean
    public RuleEvaluator ruleEvaluator(RuleLogicParser ruleLogicParser) {
        return new RuleEvaluator(ruleLogicParser);
    }
}
