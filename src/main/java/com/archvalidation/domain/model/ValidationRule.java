package com.archvalidation.domain.model;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * A global validation rule. Rules are shared by every tenant and are
 * switched on and off rather than deleted.
 *
 * <p>{@code ruleLogic} holds the JSON rule definition read by
 * {@link com.archvalidation.domain.rules.RuleLogicParser}.
 */
@Entity
@Table(name = "validation_rules")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class ValidationRule {

    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "name", nullable = false, unique = true, length = 200)
    private String name;

    @Column(name = "description", nullable = false, length = 2000)
    private String description;

    @Enumerated(EnumType.STRING)
    @Column(name = "rule_type", nullable = false, length = 20)
    private RuleType ruleType;

    @Enumerated(EnumType.STRING)
    @Column(name = "scope", nullable = false, length = 20)
    private ArchitectureLayer scope;

    @Column(name = "rule_logic", nullable = false, length = 10000)
    private String ruleLogic;

    @Column(name = "is_active", nullable = false)
    private boolean active;

    @Enumerated(EnumType.STRING)
    @Column(name = "severity", nullable = false, length = 20)
    private Severity severity;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Version
    @Column(name = "version", nullable = false)
    private Long version;

    private ValidationRule(
            UUID id,
            String name,
            String description,
            RuleType ruleType,
            ArchitectureLayer scope,
            String ruleLogic,
            Severity severity,
            Instant createdAt) {

        this.id = id;
        this.name = name;
        this.description = description;
        this.ruleType = ruleType;
        this.scope = scope;
        this.ruleLogic = ruleLogic;
        this.severity = severity;
        this.active = true;
        this.createdAt = createdAt;
        this.updatedAt = createdAt;
    }

    public static ValidationRule create(
            String name,
            String description,
            RuleType ruleType,
            ArchitectureLayer scope,
            String ruleLogic,
            Severity severity,
            Instant createdAt) {

        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Rule name is required");
        }
        if (ruleType == null || scope == null || ruleLogic == null) {
            throw new IllegalArgumentException("Rule type, scope and logic are required");
        }
        return new ValidationRule(
            UUID.randomUUID(),
            name.trim(),
            description != null ? description : "",
            ruleType,
            scope,
            ruleLogic,
            severity != null ? severity : Severity.MEDIUM,
            createdAt
        );
    }

    /**
     * Set the activation flag.
     *
     * @return true if the flag changed
     */
    public boolean setActive(boolean active, Instant changedAt) {
        if (this.active == active) {
            return false;
        }
        this.active = active;
        this.updatedAt = changedAt;
        return true;
    }

    public void revise(String description, String ruleLogic, Severity severity, Instant changedAt) {
        if (description != null) {
            this.description = description;
        }
        if (ruleLogic != null) {
            this.ruleLogic = ruleLogic;
        }
        if (severity != null) {
            this.severity = severity;
        }
        this.updatedAt = changedAt;
    }
}
