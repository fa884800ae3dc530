package com.archvalidation.domain.rules;

import com.archvalidation.domain.model.ArchitectureLayer;
import com.archvalidation.domain.model.IssueType;
import com.archvalidation.domain.model.RuleType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RuleLogicParserTest {

    private final RuleLogicParser parser = new RuleLogicParser();

    @Nested
    @DisplayName("structured documents")
    class Structured {

        @Test
        void readsTargetPredicateAndOverrides() {
            RuleLogic logic = parser.parse("""
                {
                  "target": {"element_type": "goal"},
                  "min_count": 2,
                  "predicate": {"op": "links", "direction": "outgoing",
                                "target_type": "capability", "relationship_type": "realizes", "min": 1},
                  "issue_type": "missing_link",
                  "recommended_fix": "Link it"
                }
                """, RuleType.TRACEABILITY);

            assertEquals(new RuleTarget("goal", null), logic.target());
            assertEquals(2, logic.minCount());
            assertEquals(new LinksPredicate(LinkDirection.OUTGOING, "capability", null, "realizes", 1), logic.predicate());
            assertEquals(IssueType.MISSING_LINK, logic.issueType());
            assertEquals("Link it", logic.recommendedFix());
        }

        @Test
        void readsNestedCombinators() {
            RuleLogic logic = parser.parse("""
                {
                  "target": {"layer": "Implementation"},
                  "predicate": {"op": "all", "of": [
                    {"op": "has_fields", "fields": ["owner"]},
                    {"op": "not", "predicate": {"op": "field_in", "field": "status", "values": ["retired"]}},
                    {"op": "any", "of": [{"op": "fresh", "max_age_days": 30}, {"op": "links"}]}
                  ]}
                }
                """, RuleType.COMPLETENESS);

            assertEquals(ArchitectureLayer.IMPLEMENTATION, logic.target().layer());
            AllPredicate all = assertInstanceOf(AllPredicate.class, logic.predicate());
            assertEquals(3, all.of().size());
            assertInstanceOf(HasFieldsPredicate.class, all.of().get(0));
            assertInstanceOf(NotPredicate.class, all.of().get(1));
            AnyPredicate any = assertInstanceOf(AnyPredicate.class, all.of().get(2));
            assertEquals(new FreshPredicate(30), any.of().get(0));
        }

        @Test
        void acceptsPopulationCheckWithoutPredicate() {
            RuleLogic logic = parser.parse("{\"target\": {\"element_type\": \"goal\"}, \"min_count\": 1}",
                RuleType.COMPLETENESS);

            assertNull(logic.predicate());
            assertEquals(1, logic.minCount());
        }
    }

    @Nested
    @DisplayName("legacy flat documents")
    class Legacy {

        @Test
        void translatesTraceabilityShape() {
            RuleLogic logic = parser.parse("""
                {"source_type": "Goal", "target_type": "capability",
                 "relationship_type": "realizes", "min_connections": 2}
                """, RuleType.TRACEABILITY);

            assertEquals(new RuleTarget("goal", null), logic.target());
            assertEquals(new LinksPredicate(LinkDirection.OUTGOING, "capability", null, "realizes", 2), logic.predicate());
            assertEquals(IssueType.MISSING_LINK, logic.issueType());
            assertNull(logic.minCount());
        }

        @Test
        void traceabilityMinConnectionsDefaultsToOne() {
            RuleLogic logic = parser.parse("{\"source_type\": \"goal\"}", RuleType.TRACEABILITY);

            assertEquals(1, ((LinksPredicate) logic.predicate()).min());
        }

        @Test
        void translatesCompletenessShape() {
            RuleLogic logic = parser.parse("""
                {"element_type": "goal", "required_fields": ["description", "owner"], "min_count": 3}
                """, RuleType.COMPLETENESS);

            assertEquals(new RuleTarget("goal", null), logic.target());
            assertEquals(3, logic.minCount());
            assertEquals(new HasFieldsPredicate(List.of("description", "owner")), logic.predicate());
        }

        @Test
        void completenessWithoutFieldsIsPopulationOnly() {
            RuleLogic logic = parser.parse("{\"element_type\": \"goal\"}", RuleType.COMPLETENESS);

            assertNull(logic.predicate());
            assertEquals(1, logic.minCount());
        }

        @Test
        void translatesAlignmentShape() {
            RuleLogic logic = parser.parse("{\"source_layer\": \"Business\", \"target_layer\": \"motivation\"}",
                RuleType.ALIGNMENT);

            assertEquals(new RuleTarget(null, ArchitectureLayer.BUSINESS), logic.target());
            assertEquals(new LinksPredicate(LinkDirection.ANY, null, ArchitectureLayer.MOTIVATION, null, 1),
                logic.predicate());
            assertEquals(IssueType.BROKEN_TRACEABILITY, logic.issueType());
        }
    }

    @Nested
    @DisplayName("rejected documents")
    class Rejected {

        @Test
        void rejectsEmptyAndMalformedJson() {
            assertThrows(InvalidRuleLogicException.class, () -> parser.parse("  ", RuleType.TRACEABILITY));
            assertThrows(InvalidRuleLogicException.class, () -> parser.parse("{not json", RuleType.TRACEABILITY));
            assertThrows(InvalidRuleLogicException.class, () -> parser.parse("[1, 2]", RuleType.TRACEABILITY));
        }

        @Test
        void rejectsUnknownOperator() {
            InvalidRuleLogicException e = assertThrows(InvalidRuleLogicException.class, () -> parser.parse(
                "{\"target\": {\"element_type\": \"goal\"}, \"predicate\": {\"op\": \"regex\"}}",
                RuleType.COMPLETENESS));

            assertTrue(e.getMessage().contains("predicate"));
        }

        @Test
        void rejectsUnknownTopLevelProperty() {
            assertThrows(InvalidRuleLogicException.class, () -> parser.parse(
                "{\"target\": {\"element_type\": \"goal\"}, \"min_count\": 1, \"weight\": 3}",
                RuleType.COMPLETENESS));
        }

        @Test
        void rejectsTargetWithoutTypeOrLayer() {
            assertThrows(InvalidRuleLogicException.class, () -> parser.parse(
                "{\"target\": {}, \"min_count\": 1}", RuleType.COMPLETENESS));
        }

        @Test
        void rejectsLogicWithNothingToCheck() {
            assertThrows(InvalidRuleLogicException.class, () -> parser.parse(
                "{\"target\": {\"element_type\": \"goal\"}}", RuleType.COMPLETENESS));
        }

        @Test
        void rejectsInvalidArguments() {
            assertThrows(InvalidRuleLogicException.class, () -> parser.parse(
                "{\"target\": {\"element_type\": \"goal\"}, \"predicate\": {\"op\": \"fresh\", \"max_age_days\": 0}}",
                RuleType.COMPLETENESS));
            assertThrows(InvalidRuleLogicException.class, () -> parser.parse(
                "{\"target\": {\"element_type\": \"goal\"}, \"predicate\": {\"op\": \"has_fields\", \"fields\": []}}",
                RuleType.COMPLETENESS));
            assertThrows(InvalidRuleLogicException.class, () -> parser.parse(
                "{\"source_type\": \"goal\", \"min_connections\": \"two\"}", RuleType.TRACEABILITY));
        }

        @Test
        void rejectsUnknownLayer() {
            assertThrows(InvalidRuleLogicException.class, () -> parser.parse(
                "{\"source_layer\": \"Strategy\", \"target_layer\": \"Business\"}", RuleType.ALIGNMENT));
        }
    }
}
