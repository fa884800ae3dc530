package com.archvalidation.config;

import com.archvalidation.domain.model.ValidationRule;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.springframework.context.annotation.Configuration;
import org.springframework.stereotype.Component;

/**
 * Performance monitoring of the validation engine.
 *
 * Tracks:
 * - Repository latency per adapter method
 * - Rule evaluation latency per rule type
 * - Authorization checks
 * - Cycle and issue counters
 *
 * Metrics carry no tenant data.
 */
@Configuration
@Slf4j
public class PerformanceConfiguration {

    /**
     * Aspect for timing repository operations.
     */
    @Aspect
    @Component
    @Slf4j
    public static class RepositoryPerformanceAspect {

        private final MeterRegistry meterRegistry;

        public RepositoryPerformanceAspect(MeterRegistry meterRegistry) {
            this.meterRegistry = meterRegistry;
        }

        @Around("execution(* com.archvalidation.infrastructure.persistence.*RepositoryAdapter.*(..))")
        public Object timeRepositoryMethod(ProceedingJoinPoint joinPoint) throws Throwable {
            return time(meterRegistry, joinPoint, "repository.operation", "Repository operation timing",
                "method", joinPoint.getSignature().toShortString(), "success", "failure");
        }
    }

    /**
     * Aspect for timing single-rule evaluations.
     */
    @Aspect
    @Component
    @Slf4j
    public static class RuleEvaluationAspect {

        private final MeterRegistry meterRegistry;

        public RuleEvaluationAspect(MeterRegistry meterRegistry) {
            this.meterRegistry = meterRegistry;
        }

        @Around("execution(* com.archvalidation.domain.rules.RuleEvaluator.evaluate(..)) && args(rule, ..)")
        public Object timeRuleEvaluation(ProceedingJoinPoint joinPoint, ValidationRule rule) throws Throwable {
            return time(meterRegistry, joinPoint, "validation.rule.evaluation", "Rule evaluation timing",
                "rule_type", rule.getRuleType().getValue(), "success", "aborted");
        }
    }

    /**
     * Aspect for timing security operations.
     */
    @Aspect
    @Component
    @Slf4j
    public static class SecurityPerformanceAspect {

        private final MeterRegistry meterRegistry;

        public SecurityPerformanceAspect(MeterRegistry meterRegistry) {
            this.meterRegistry = meterRegistry;
        }

        @Around("execution(* com.archvalidation.infrastructure.security.SecurityKernel.authorize*(..))")
        public Object timeSecurityCheck(ProceedingJoinPoint joinPoint) throws Throwable {
            return time(meterRegistry, joinPoint, "security.authorization", "Authorization check timing",
                "method", joinPoint.getSignature().toShortString(), "granted", "denied");
        }
    }

    private static Object time(
            MeterRegistry meterRegistry,
            ProceedingJoinPoint joinPoint,
            String timerName,
            String description,
            String tagName,
            String tagValue,
            String successOutcome,
            String failureOutcome) throws Throwable {

        Timer.Sample sample = Timer.start(meterRegistry);
        try {
            Object result = joinPoint.proceed();
            sample.stop(Timer.builder(timerName)
                .tag(tagName, tagValue)
                .tag("outcome", successOutcome)
                .description(description)
                .register(meterRegistry));
            return result;
        } catch (Exception e) {
            sample.stop(Timer.builder(timerName)
                .tag(tagName, tagValue)
                .tag("outcome", failureOutcome)
                .description(description)
                .register(meterRegistry));
            throw e;
        }
    }

    /**
     * Counters for validation activity.
     */
    @Component
    @Slf4j
    public static class ValidationMetrics {

        private final MeterRegistry meterRegistry;

        public ValidationMetrics(MeterRegistry meterRegistry) {
            this.meterRegistry = meterRegistry;
            log.info("Initialized validation metrics");
        }

        public void recordCycleStarted() {
            meterRegistry.counter("validation.cycles.started").increment();
        }

        public void recordCycleCompleted(int issuesFound, int suppressed) {
            meterRegistry.counter("validation.cycles.completed").increment();
            meterRegistry.counter("validation.issues.found").increment(issuesFound);
            meterRegistry.counter("validation.issues.suppressed").increment(suppressed);
        }

        public void recordCycleFailed(String reason) {
            meterRegistry.counter("validation.cycles.failed", "reason", reason).increment();
        }

        public void recordCycleCancelled() {
            meterRegistry.counter("validation.cycles.cancelled").increment();
        }

        public void recordExceptionCreated() {
            meterRegistry.counter("validation.exceptions.created").increment();
        }
    }
}
