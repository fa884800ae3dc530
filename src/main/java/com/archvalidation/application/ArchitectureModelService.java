package com.archvalidation.application;

import com.archvalidation.application.exception.InvalidRequestException;
import com.archvalidation.domain.model.ArchitectureElement;
import com.archvalidation.domain.model.ArchitectureLayer;
import com.archvalidation.domain.model.ElementKey;
import com.archvalidation.domain.model.ElementRelationship;
import com.archvalidation.domain.repository.ArchitectureModelRepository;
import com.archvalidation.infrastructure.audit.AuditService;
import com.archvalidation.infrastructure.security.SecurityContext;
import com.archvalidation.infrastructure.security.SecurityKernel;
import com.archvalidation.interfaces.api.dto.ModelImportRequest;
import com.archvalidation.interfaces.api.dto.ModelImportRequest.ElementPayload;
import com.archvalidation.interfaces.api.dto.ModelImportRequest.RelationshipPayload;
import com.archvalidation.interfaces.api.dto.ModelSummaryResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Application service for the tenant's architecture model, the input of
 * every validation cycle.
 *
 * <p>Elements are upserted by (type, id). Relationships must connect
 * elements present in the model after the import; an import with a dangling
 * relationship is rejected as a whole.
 */
@Service
@Transactional
@RequiredArgsConstructor
@Slf4j
public class ArchitectureModelService {

    private final ArchitectureModelRepository modelRepository;
    private final SecurityKernel securityKernel;
    private final SecurityContextProvider securityContextProvider;
    private final AuditService auditService;
    private final Clock clock;

    /**
     * Import elements and relationships into the caller's tenant.
     *
     * @throws InvalidRequestException on unknown element types without a layer, or dangling relationships
     */
    public ModelSummaryResponse importModel(ModelImportRequest request) {
        SecurityContext context = securityContextProvider.getCurrentContext();
        securityKernel.authorizeAdministration(context, "model.import");
        String tenantId = context.getTenantId();
        Instant now = clock.instant();

        if (request.isReplace()) {
            modelRepository.deleteModel(tenantId);
        }

        Map<ElementKey, ArchitectureElement> model = new LinkedHashMap<>();
        for (ArchitectureElement existing : modelRepository.findElements(tenantId)) {
            model.put(existing.key(), existing);
        }

        List<ArchitectureElement> added = new ArrayList<>();
        for (ElementPayload payload : request.getElements()) {
            ArchitectureElement incoming;
            try {
                incoming = ArchitectureElement.create(
                    tenantId,
                    payload.getType(),
                    payload.getId(),
                    payload.getName(),
                    payload.getLayer(),
                    payload.getProperties(),
                    payload.getLastModified() != null ? payload.getLastModified() : now);
            } catch (IllegalArgumentException e) {
                throw new InvalidRequestException("Invalid element " + payload.getType() + ":" + payload.getId()
                    + ": " + e.getMessage(), e);
            }
            ArchitectureElement existing = model.get(incoming.key());
            if (existing != null) {
                existing.refreshFrom(incoming);
            } else {
                model.put(incoming.key(), incoming);
                added.add(incoming);
            }
        }

        Set<RelationshipKey> known = new HashSet<>();
        for (ElementRelationship existing : modelRepository.findRelationships(tenantId)) {
            known.add(RelationshipKey.of(existing));
        }

        List<ElementRelationship> relationships = new ArrayList<>();
        List<String> dangling = new ArrayList<>();
        for (RelationshipPayload payload : request.getRelationships()) {
            ElementRelationship relationship;
            try {
                relationship = ElementRelationship.create(
                    tenantId,
                    new ElementKey(payload.getSourceType(), payload.getSourceId()),
                    new ElementKey(payload.getTargetType(), payload.getTargetId()),
                    payload.getRelationshipType());
            } catch (IllegalArgumentException e) {
                throw new InvalidRequestException("Invalid relationship: " + e.getMessage(), e);
            }
            if (!model.containsKey(relationship.source()) || !model.containsKey(relationship.target())) {
                dangling.add(relationship.source() + " -[" + relationship.getRelationshipType() + "]-> "
                    + relationship.target());
                continue;
            }
            if (known.add(RelationshipKey.of(relationship))) {
                relationships.add(relationship);
            }
        }
        if (!dangling.isEmpty()) {
            throw new InvalidRequestException("Relationships reference elements missing from the model: "
                + String.join(", ", dangling.subList(0, Math.min(dangling.size(), 10)))
                + (dangling.size() > 10 ? " (+" + (dangling.size() - 10) + " more)" : ""));
        }

        modelRepository.saveElements(added);
        modelRepository.saveRelationships(relationships);

        auditService.record(AuditService.MODEL_IMPORTED, tenantId, tenantId, context.getPrincipalId(),
            String.format("elements=%d relationships=%d replace=%s",
                request.getElements().size(), relationships.size(), request.isReplace()));
        log.info("Architecture model imported: tenant={}, elements={} ({} new), relationships={}, replace={}",
            tenantId, request.getElements().size(), added.size(), relationships.size(), request.isReplace());

        ModelSummaryResponse summary = summarize(tenantId, model.values(), known.size());
        summary.setElementsImported(request.getElements().size());
        summary.setRelationshipsImported(relationships.size());
        return summary;
    }

    @Transactional(readOnly = true)
    public ModelSummaryResponse getSummary() {
        SecurityContext context = securityContextProvider.getCurrentContext();
        String tenantId = context.getTenantId();
        return summarize(tenantId, modelRepository.findElements(tenantId), modelRepository.countRelationships(tenantId));
    }

    private static ModelSummaryResponse summarize(
            String tenantId,
            Iterable<ArchitectureElement> elements,
            long relationshipCount) {
        Map<String, Long> byLayer = new LinkedHashMap<>();
        for (ArchitectureLayer layer : ArchitectureLayer.values()) {
            byLayer.put(layer.getValue(), 0L);
        }
        long total = 0;
        for (ArchitectureElement element : elements) {
            byLayer.merge(element.getLayer().getValue(), 1L, Long::sum);
            total++;
        }
        return ModelSummaryResponse.builder()
            .tenantId(tenantId)
            .elementCount(total)
            .relationshipCount(relationshipCount)
            .elementsByLayer(byLayer)
            .build();
    }

    private record RelationshipKey(ElementKey source, ElementKey target, String relationshipType) {
        static RelationshipKey of(ElementRelationship relationship) {
            return new RelationshipKey(relationship.source(), relationship.target(), relationship.getRelationshipType());
        }
    }
}
