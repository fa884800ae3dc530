package com.archvalidation.domain.model;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class ValidationIssueTest {

    private static final Instant DETECTED = Instant.parse("2024-06-01T12:00:00Z");

    private static ValidationIssue issue() {
        return ValidationIssue.builder()
            .tenantId("tenant-a")
            .entityType("goal")
            .entityId("G1")
            .issueType(IssueType.MISSING_LINK)
            .severity(Severity.MEDIUM)
            .description("gap")
            .detectedAt(DETECTED)
            .build();
    }

    @Test
    void resolveIsIdempotent() {
        ValidationIssue issue = issue();
        Instant first = DETECTED.plusSeconds(60);

        assertTrue(issue.resolve("u1", first));
        assertFalse(issue.resolve("u2", first.plusSeconds(60)));

        assertTrue(issue.isResolved());
        assertEquals(first, issue.getResolvedAt());
        assertEquals("u1", issue.getResolvedBy());
    }

    @Test
    void requiresCoreFields() {
        assertThrows(IllegalArgumentException.class, () -> ValidationIssue.builder()
            .tenantId("tenant-a")
            .entityType("goal")
            .entityId("G1")
            .severity(Severity.LOW)
            .description("no type")
            .build());
    }

    @Test
    void overlongTextIsAbbreviatedToTheColumnSize() {
        String longText = "y".repeat(ValidationIssue.TEXT_MAX_LENGTH + 500);

        ValidationIssue issue = ValidationIssue.builder()
            .tenantId("tenant-a")
            .entityType("capability")
            .entityId("A1")
            .issueType(IssueType.INVALID_ENUM)
            .severity(Severity.LOW)
            .description(longText)
            .recommendedFix(longText)
            .detectedAt(DETECTED)
            .build();

        assertEquals(ValidationIssue.TEXT_MAX_LENGTH, issue.getDescription().length());
        assertTrue(issue.getDescription().endsWith(ValidationIssue.ELLIPSIS));
        assertEquals(ValidationIssue.TEXT_MAX_LENGTH, issue.getRecommendedFix().length());
        assertEquals("gap", issue().getDescription());
    }
}
