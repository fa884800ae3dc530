package com.archvalidation.application;

import com.archvalidation.application.exception.DuplicateResourceException;
import com.archvalidation.application.exception.ResourceNotFoundException;
import com.archvalidation.domain.model.RuleType;
import com.archvalidation.domain.model.ValidationRule;
import com.archvalidation.domain.repository.ValidationRuleRepository;
import com.archvalidation.domain.rules.InvalidRuleLogicException;
import com.archvalidation.domain.rules.RuleLogicParser;
import com.archvalidation.infrastructure.audit.AuditService;
import com.archvalidation.infrastructure.security.SecurityContext;
import com.archvalidation.infrastructure.security.SecurityKernel;
import com.archvalidation.interfaces.api.dto.CreateRuleRequest;
import com.archvalidation.interfaces.api.dto.UpdateRuleRequest;
import com.archvalidation.interfaces.api.dto.ValidationRuleResponse;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.TextNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.CacheEvict;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Application service for the global rule set.
 *
 * <p>Rule logic is checked with {@link RuleLogicParser} before it is stored.
 * The rule listing is cached and every write evicts it.
 */
@Service
@Transactional
@RequiredArgsConstructor
@Slf4j
public class RuleService {

    public static final String RULES_CACHE = "validationRules";

    private final ValidationRuleRepository ruleRepository;
    private final RuleLogicParser ruleLogicParser;
    private final SecurityKernel securityKernel;
    private final SecurityContextProvider securityContextProvider;
    private final AuditService auditService;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Transactional(readOnly = true)
    @Cacheable(value = RULES_CACHE, key = "#activeOnly")
    public List<ValidationRuleResponse> listRules(boolean activeOnly) {
        List<ValidationRule> rules = activeOnly ? ruleRepository.findActive() : ruleRepository.findAll();
        return rules.stream().map(this::toResponse).toList();
    }

    /**
     * Create a rule.
     *
     * @throws DuplicateResourceException if the name is taken
     * @throws InvalidRuleLogicException if the logic cannot be interpreted
     */
    @CacheEvict(value = RULES_CACHE, allEntries = true)
    public ValidationRuleResponse createRule(CreateRuleRequest request) {
        SecurityContext context = securityContextProvider.getCurrentContext();
        securityKernel.authorizeAdministration(context, "rule.create");

        ValidationRule rule = store(request);
        auditService.record(AuditService.RULE_CREATED, null, rule.getId().toString(),
            context.getPrincipalId(), rule.getName());
        log.info("Validation rule created: id={}, name={}, type={}, scope={}",
            rule.getId(), rule.getName(), rule.getRuleType(), rule.getScope());
        return toResponse(rule);
    }

    /**
     * Toggle and/or revise a rule. Absent fields are left unchanged.
     */
    @CacheEvict(value = RULES_CACHE, allEntries = true)
    public ValidationRuleResponse updateRule(UUID ruleId, UpdateRuleRequest request) {
        SecurityContext context = securityContextProvider.getCurrentContext();
        securityKernel.authorizeAdministration(context, "rule.update");

        ValidationRule rule = ruleRepository.findById(ruleId)
            .orElseThrow(() -> ResourceNotFoundException.of("Validation rule", ruleId));
        Instant now = clock.instant();

        String ruleLogic = null;
        if (request.getRuleLogic() != null) {
            ruleLogic = normalizeLogic(request.getRuleLogic(), rule.getRuleType());
        }
        if (request.getDescription() != null || ruleLogic != null || request.getSeverity() != null) {
            rule.revise(request.getDescription(), ruleLogic, request.getSeverity(), now);
        }
        if (request.getIsActive() != null && rule.setActive(request.getIsActive(), now)) {
            log.info("Validation rule toggled: id={}, name={}, active={}", ruleId, rule.getName(), rule.isActive());
        }

        rule = ruleRepository.save(rule);
        auditService.record(AuditService.RULE_UPDATED, null, ruleId.toString(), context.getPrincipalId(),
            "active=" + rule.isActive());
        return toResponse(rule);
    }

    /**
     * Store rules that do not exist yet, skipping names already present.
     * Used at startup; no caller check.
     *
     * @return number of rules created
     */
    @CacheEvict(value = RULES_CACHE, allEntries = true)
    public int seedRules(List<CreateRuleRequest> definitions) {
        List<ValidationRule> created = new ArrayList<>();
        for (CreateRuleRequest definition : definitions) {
            if (ruleRepository.existsByName(definition.getName().trim())) {
                continue;
            }
            created.add(store(definition));
        }
        created.forEach(rule -> auditService.record(AuditService.RULE_CREATED, null, rule.getId().toString(),
            ValidationRuleSeeds.SEED_PRINCIPAL, rule.getName()));
        return created.size();
    }

    private ValidationRule store(CreateRuleRequest request) {
        if (ruleRepository.existsByName(request.getName().trim())) {
            throw new DuplicateResourceException("A rule named '" + request.getName().trim() + "' already exists");
        }
        String ruleLogic = normalizeLogic(request.getRuleLogic(), request.getRuleType());
        return ruleRepository.save(ValidationRule.create(
            request.getName(),
            request.getDescription(),
            request.getRuleType(),
            request.getScope(),
            ruleLogic,
            request.getSeverity(),
            clock.instant()));
    }

    /**
     * Accept rule logic either as a JSON object or as a string holding one,
     * validate it, and return the JSON text to store.
     */
    private String normalizeLogic(JsonNode ruleLogic, RuleType ruleType) {
        String text = ruleLogic.isTextual() ? ruleLogic.asText() : ruleLogic.toString();
        ruleLogicParser.parse(text, ruleType);
        return text;
    }

    private ValidationRuleResponse toResponse(ValidationRule rule) {
        return ValidationRuleResponse.builder()
            .id(rule.getId())
            .name(rule.getName())
            .description(rule.getDescription())
            .ruleType(rule.getRuleType())
            .scope(rule.getScope())
            .ruleLogic(readLogic(rule))
            .isActive(rule.isActive())
            .severity(rule.getSeverity())
            .createdAt(rule.getCreatedAt())
            .updatedAt(rule.getUpdatedAt())
            .build();
    }

    private JsonNode readLogic(ValidationRule rule) {
        try {
            return objectMapper.readTree(rule.getRuleLogic());
        } catch (JsonProcessingException e) {
            log.debug("Stored logic of rule {} is not JSON, returning it as text", rule.getId());
            return TextNode.valueOf(rule.getRuleLogic());
        }
    }
}
