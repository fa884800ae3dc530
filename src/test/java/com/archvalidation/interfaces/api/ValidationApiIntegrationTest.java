package com.archvalidation.interfaces.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.SignatureAlgorithm;
import io.jsonwebtoken.security.Keys;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.ResultActions;
import org.springframework.test.web.servlet.request.MockHttpServletRequestBuilder;

import java.nio.charset.StandardCharsets;
import java.security.Key;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * End-to-end API flows against H2 with synchronous cycles.
 *
 * Rules are global, so every test works in its own tenant and the only goal
 * rule is the shared one created in {@link #ensureGoalRule()}.
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class ValidationApiIntegrationTest {

    private static final String GOAL_RULE = "goal_realizes_capability";
    private static final String GOAL_RULE_BODY = """
        {"name": "goal_realizes_capability",
         "description": "Goals are realized by capabilities",
         "rule_type": "traceability",
         "scope": "Motivation",
         "severity": "high",
         "rule_logic": {"target": {"element_type": "goal"},
                        "predicate": {"op": "links", "direction": "outgoing",
                                      "target_type": "capability", "relationship_type": "realizes"}}}
        """;

    @Autowired
    MockMvc mockMvc;

    @Autowired
    ObjectMapper objectMapper;

    @Value("${validation.security.jwt-secret}")
    String jwtSecret;

    private String tenant;
    private String adminToken;
    private String viewerToken;

    @BeforeEach
    void setUp() throws Exception {
        tenant = "tenant-" + UUID.randomUUID();
        adminToken = token("admin-1", tenant, "Admin");
        viewerToken = token("viewer-1", tenant, "Viewer");
        ensureGoalRule();
    }

    private String token(String userId, String tenantId, String role) {
        Key key = Keys.hmacShaKeyFor(jwtSecret.getBytes(StandardCharsets.UTF_8));
        return Jwts.builder()
            .claim("user_id", userId)
            .claim("tenant_id", tenantId)
            .claim("role", role)
            .setExpiration(Date.from(Instant.now().plus(1, ChronoUnit.HOURS)))
            .signWith(key, SignatureAlgorithm.HS256)
            .compact();
    }

    private ResultActions perform(MockHttpServletRequestBuilder request, String token) throws Exception {
        return mockMvc.perform(request.header(HttpHeaders.AUTHORIZATION, "Bearer " + token));
    }

    private ResultActions performJson(MockHttpServletRequestBuilder request, String token, String body) throws Exception {
        return perform(request.contentType(MediaType.APPLICATION_JSON).content(body), token);
    }

    private JsonNode json(ResultActions result) throws Exception {
        return objectMapper.readTree(result.andReturn().getResponse().getContentAsString());
    }

    private void ensureGoalRule() throws Exception {
        int status = performJson(post("/validation/rules"), adminToken, GOAL_RULE_BODY)
            .andReturn().getResponse().getStatus();
        assertTrue(status == 201 || status == 409, "unexpected status " + status);
    }

    private void importGoals(String... goalIds) throws Exception {
        StringBuilder elements = new StringBuilder();
        for (String goalId : goalIds) {
            if (elements.length() > 0) {
                elements.append(',');
            }
            elements.append("{\"id\": \"").append(goalId).append("\", \"type\": \"goal\", \"name\": \"")
                .append(goalId).append("\"}");
        }
        performJson(post("/validation/model"), adminToken, "{\"elements\": [" + elements + "]}")
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.element_count").value(goalIds.length));
    }

    private JsonNode runCycle(String token) throws Exception {
        return json(perform(post("/validation/run"), token)
            .andExpect(status().isAccepted()));
    }

    private List<String> issueEntityIds(String token) throws Exception {
        JsonNode issues = json(perform(get("/validation/issues"), token).andExpect(status().isOk())).get("issues");
        List<String> ids = new ArrayList<>();
        issues.forEach(issue -> ids.add(issue.get("entity_id").asText()));
        return ids;
    }

    @Nested
    @DisplayName("validation cycles")
    class Cycles {

        @Test
        void emptyTenantCompletesWithoutIssuesAndFullMaturity() throws Exception {
            JsonNode run = runCycle(adminToken);

            assertEquals("completed", run.get("status").asText());
            assertEquals(0, run.get("cycle").get("total_issues_found").asInt());
            assertEquals(1.0, run.get("cycle").get("maturity_score").asDouble(), 1e-9);

            perform(get("/validation/scorecard"), viewerToken)
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.overall_maturity_score").value(1.0))
                .andExpect(jsonPath("$.layer_scores.length()").value(5))
                .andExpect(jsonPath("$.summary.total_layers").value(5));
        }

        @Test
        void unlinkedGoalsAreReportedAndScored() throws Exception {
            importGoals("G1", "G2");

            JsonNode run = runCycle(adminToken);

            assertEquals("completed", run.get("status").asText());
            assertEquals(2, run.get("cycle").get("total_issues_found").asInt());
            assertTrue(run.get("cycle").get("maturity_score").asDouble() < 1.0);
            List<String> ids = issueEntityIds(viewerToken);
            assertTrue(ids.containsAll(List.of("G1", "G2")));

            perform(get("/validation/traceability-matrix").param("source_layer", "Motivation"), viewerToken)
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].target_layer").value("Business"))
                .andExpect(jsonPath("$[0].missing_connections").value(2))
                .andExpect(jsonPath("$[0].connection_count").value(0));

            String cycleId = run.get("validation_cycle_id").asText();
            perform(get("/validation/cycles/" + cycleId), viewerToken)
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.execution_status").value("completed"));
            perform(get("/validation/history"), viewerToken)
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.total_cycles").value(1))
                .andExpect(jsonPath("$.cycles[0].id").value(cycleId));
        }

        @Test
        void exceptionOnGoalSuppressesItsIssue() throws Exception {
            importGoals("G1", "G2");
            performJson(post("/validation/exceptions"), adminToken,
                "{\"entity_type\": \"goal\", \"entity_id\": \"G1\", \"reason\": \"planned for next quarter\"}")
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.is_active").value(true))
                .andExpect(jsonPath("$.is_effective").value(true));

            JsonNode run = runCycle(adminToken);

            assertEquals(1, run.get("cycle").get("suppressed_issues").asInt());
            List<String> ids = issueEntityIds(viewerToken);
            assertFalse(ids.contains("G1"));
            assertTrue(ids.contains("G2"));
        }

        @Test
        void completedCycleCannotBeCancelled() throws Exception {
            String cycleId = runCycle(adminToken).get("validation_cycle_id").asText();

            perform(post("/validation/cycles/" + cycleId + "/cancel"), adminToken)
                .andExpect(status().isConflict());
        }

        @Test
        void viewerCannotStartCycle() throws Exception {
            perform(post("/validation/run"), viewerToken)
                .andExpect(status().isForbidden());
        }

        @Test
        void overlongFieldInReasonStillCompletesTheCycle() throws Exception {
            StringBuilder values = new StringBuilder();
            for (int i = 0; i < 300; i++) {
                values.append(i == 0 ? "" : ", ").append("\"status-").append(i).append('"');
            }
            String ruleId = json(performJson(post("/validation/rules"), adminToken, """
                {"name": "capability_status_%s", "rule_type": "completeness", "scope": "Business",
                 "severity": "low",
                 "rule_logic": {"target": {"element_type": "capability"},
                                "predicate": {"op": "field_in", "field": "status", "values": [%s]}}}
                """.formatted(UUID.randomUUID(), values)).andExpect(status().isCreated())).get("id").asText();
            try {
                performJson(post("/validation/model"), adminToken, """
                    {"elements": [{"id": "A1", "type": "capability", "name": "Sell",
                                   "properties": {"status": "bogus"}}]}
                    """).andExpect(status().isOk());

                JsonNode run = runCycle(adminToken);

                assertEquals("completed", run.get("status").asText());
                JsonNode issues = json(perform(get("/validation/issues"), viewerToken)).get("issues");
                JsonNode statusIssue = null;
                for (JsonNode issue : issues) {
                    if (ruleId.equals(issue.get("rule_id").asText())) {
                        statusIssue = issue;
                    }
                }
                assertNotNull(statusIssue);
                assertEquals("A1", statusIssue.get("entity_id").asText());
                assertEquals("invalid_enum", statusIssue.get("issue_type").asText());
                assertTrue(statusIssue.get("description").asText().length() <= 2000);
                assertTrue(statusIssue.get("metadata").get("reasons").get(0).asText()
                    .startsWith("field 'status' has value 'bogus'"));
            } finally {
                performJson(patch("/validation/rules/" + ruleId), adminToken, "{\"is_active\": false}")
                    .andExpect(status().isOk());
            }
        }

        @Test
        void historyPagingFollowsItsOwnLimits() throws Exception {
            perform(get("/validation/history"), viewerToken)
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.skip").value(0))
                .andExpect(jsonPath("$.limit").value(50));
            perform(get("/validation/history").param("limit", "100"), viewerToken)
                .andExpect(status().isOk());
            perform(get("/validation/history").param("limit", "101"), viewerToken)
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.code").value("validation_failed"))
                .andExpect(jsonPath("$.field_errors[0].field").value("limit"))
                .andExpect(jsonPath("$.field_errors[0].constraint").value("Max"));
            perform(get("/validation/history").param("skip", "-1"), viewerToken)
                .andExpect(status().isUnprocessableEntity());
        }

        @Test
        void matrixRefreshRebuildsFromTheCurrentModel() throws Exception {
            importGoals("G1");

            JsonNode cells = json(perform(post("/validation/traceability-matrix/refresh"), adminToken)
                .andExpect(status().isOk()));

            JsonNode goalCell = null;
            for (JsonNode cell : cells) {
                if ("goal".equals(cell.get("source_entity_type").asText())
                        && "capability".equals(cell.get("target_entity_type").asText())) {
                    goalCell = cell;
                }
            }
            assertNotNull(goalCell);
            assertEquals(1, goalCell.get("missing_connections").asInt());
            perform(get("/validation/traceability-matrix").param("source_layer", "Motivation"), viewerToken)
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].target_layer").value("Business"))
                .andExpect(jsonPath("$[0].missing_connections").value(1));
            perform(post("/validation/traceability-matrix/refresh"), viewerToken)
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("access_denied"));
        }

        @Test
        void scorecardIsNotFoundBeforeFirstCycle() throws Exception {
            perform(get("/validation/scorecard"), viewerToken)
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.status").value(404))
                .andExpect(jsonPath("$.code").value("not_found"));
        }
    }

    @Nested
    @DisplayName("issues")
    class Issues {

        @Test
        void resolveIsIdempotent() throws Exception {
            importGoals("G1");
            runCycle(adminToken);
            JsonNode issue = json(perform(get("/validation/issues"), viewerToken)).get("issues").get(0);
            String issueId = issue.get("id").asText();

            JsonNode first = json(perform(post("/validation/issues/" + issueId + "/resolve"), viewerToken)
                .andExpect(status().isOk()));
            JsonNode second = json(perform(post("/validation/issues/" + issueId + "/resolve"), viewerToken)
                .andExpect(status().isOk()));

            assertTrue(first.get("is_resolved").asBoolean());
            assertTrue(second.get("is_resolved").asBoolean());
            assertEquals("viewer-1", second.get("resolved_by").asText());
            perform(get("/validation/issues").param("resolved", "false"), viewerToken)
                .andExpect(jsonPath("$.total_count").value(0));
        }

        @Test
        void tenantsDoNotSeeEachOthersData() throws Exception {
            importGoals("G1");
            String cycleId = runCycle(adminToken).get("validation_cycle_id").asText();
            String issueId = json(perform(get("/validation/issues"), viewerToken)).get("issues").get(0).get("id").asText();

            String otherTenant = "tenant-" + UUID.randomUUID();
            String otherViewer = token("viewer-2", otherTenant, "Viewer");

            perform(get("/validation/issues"), otherViewer)
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.total_count").value(0))
                .andExpect(jsonPath("$.high_count").value(0));
            perform(get("/validation/cycles/" + cycleId), otherViewer)
                .andExpect(status().isNotFound());
            perform(get("/validation/scorecard").param("validation_cycle_id", cycleId), otherViewer)
                .andExpect(status().isNotFound());
            perform(post("/validation/issues/" + issueId + "/resolve"), otherViewer)
                .andExpect(status().isForbidden());
            perform(get("/validation/model"), otherViewer)
                .andExpect(jsonPath("$.element_count").value(0));
        }

        @Test
        void pageLimitIsValidated() throws Exception {
            perform(get("/validation/issues").param("limit", "1001"), viewerToken)
                .andExpect(status().isUnprocessableEntity());
            perform(get("/validation/issues").param("severity", "urgent"), viewerToken)
                .andExpect(status().isUnprocessableEntity());
        }
    }

    @Nested
    @DisplayName("rules")
    class Rules {

        @Test
        void togglingTwiceRestoresRule() throws Exception {
            String name = "device_link_" + UUID.randomUUID();
            JsonNode created = json(performJson(post("/validation/rules"), adminToken, """
                {"name": "%s", "rule_type": "traceability", "scope": "Technology",
                 "rule_logic": {"source_type": "device", "target_type": "node"}}
                """.formatted(name)).andExpect(status().isCreated()));
            String ruleId = created.get("id").asText();
            assertTrue(created.get("is_active").asBoolean());
            assertEquals("medium", created.get("severity").asText());

            performJson(patch("/validation/rules/" + ruleId), adminToken, "{\"is_active\": false}")
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.is_active").value(false));
            performJson(patch("/validation/rules/" + ruleId), adminToken, "{\"is_active\": true}")
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.is_active").value(true));

            JsonNode rules = json(perform(get("/validation/rules").param("active_only", "true"), viewerToken));
            List<String> names = new ArrayList<>();
            rules.forEach(rule -> names.add(rule.get("name").asText()));
            assertTrue(names.contains(name));
        }

        @Test
        void duplicateNameConflicts() throws Exception {
            performJson(post("/validation/rules"), adminToken, GOAL_RULE_BODY)
                .andExpect(status().isConflict());
        }

        @Test
        void uninterpretableLogicIsRejected() throws Exception {
            performJson(post("/validation/rules"), adminToken, """
                {"name": "broken_rule", "rule_type": "completeness", "scope": "Business",
                 "rule_logic": {"target": {"element_type": "capability"}, "predicate": {"op": "regex"}}}
                """)
                .andExpect(status().isUnprocessableEntity());
        }

        @Test
        void editorCannotCreateRules() throws Exception {
            performJson(post("/validation/rules"), token("editor-1", tenant, "Editor"), GOAL_RULE_BODY)
                .andExpect(status().isForbidden());
        }

        @Test
        void unknownRuleIsNotFound() throws Exception {
            performJson(patch("/validation/rules/" + UUID.randomUUID()), adminToken, "{\"is_active\": false}")
                .andExpect(status().isNotFound());
        }
    }

    @Nested
    @DisplayName("exceptions and model")
    class ExceptionsAndModel {

        @Test
        void expiryInThePastIsRejected() throws Exception {
            performJson(post("/validation/exceptions"), adminToken, """
                {"entity_type": "goal", "entity_id": "G1", "reason": "late",
                 "expires_at": "2020-01-01T00:00:00Z"}
                """)
                .andExpect(status().isUnprocessableEntity());
        }

        @Test
        void deactivatedExceptionIsListedOnlyWithInactive() throws Exception {
            String exceptionId = json(performJson(post("/validation/exceptions"), adminToken,
                "{\"entity_type\": \"Goal\", \"entity_id\": \"G7\", \"reason\": \"accepted\"}")
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.entity_type").value("goal"))).get("id").asText();

            perform(post("/validation/exceptions/" + exceptionId + "/deactivate"), adminToken)
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.is_active").value(false));

            perform(get("/validation/exceptions"), viewerToken)
                .andExpect(jsonPath("$.length()").value(0));
            perform(get("/validation/exceptions").param("include_inactive", "true"), viewerToken)
                .andExpect(jsonPath("$.length()").value(1));
        }

        @Test
        void danglingRelationshipIsRejected() throws Exception {
            performJson(post("/validation/model"), adminToken, """
                {"elements": [{"id": "G1", "type": "goal", "name": "Grow"}],
                 "relationships": [{"source_type": "goal", "source_id": "G1",
                                    "target_type": "capability", "target_id": "C404",
                                    "relationship_type": "realizes"}]}
                """)
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.code").value("invalid_request"));
        }

        @Test
        void paddedIdsMatchBetweenModelAndExceptions() throws Exception {
            performJson(post("/validation/model"), adminToken,
                "{\"elements\": [{\"id\": \" G1 \", \"type\": \"Goal\", \"name\": \"Grow\"}]}")
                .andExpect(status().isOk());
            performJson(post("/validation/exceptions"), adminToken,
                "{\"entity_type\": \"goal \", \"entity_id\": \"G1  \", \"reason\": \"planned\"}")
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.entity_id").value("G1"));

            JsonNode run = runCycle(adminToken);

            assertEquals(1, run.get("cycle").get("suppressed_issues").asInt());
            assertTrue(issueEntityIds(viewerToken).isEmpty());
        }

        @Test
        void linkedGoalPasses() throws Exception {
            performJson(post("/validation/model"), adminToken, """
                {"elements": [{"id": "G1", "type": "goal", "name": "Grow"},
                              {"id": "C1", "type": "capability", "name": "Sell"}],
                 "relationships": [{"source_type": "goal", "source_id": "G1",
                                    "target_type": "capability", "target_id": "C1",
                                    "relationship_type": "realizes"}]}
                """)
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.relationship_count").value(1))
                .andExpect(jsonPath("$.elements_by_layer.Business").value(1));

            runCycle(adminToken);

            assertFalse(issueEntityIds(viewerToken).contains("G1"));
        }
    }

    @Nested
    @DisplayName("authentication and operations")
    class Operations {

        @Test
        void missingTokenIsUnauthorized() throws Exception {
            mockMvc.perform(get("/validation/issues"))
                .andExpect(status().isUnauthorized());
        }

        @Test
        void invalidTokenIsUnauthorized() throws Exception {
            perform(get("/validation/issues"), "not-a-jwt")
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("unauthenticated"));
        }

        @Test
        void healthIsPublic() throws Exception {
            mockMvc.perform(get("/validation/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("healthy"));
        }

        @Test
        void healthIgnoresMalformedBearer() throws Exception {
            perform(get("/validation/health"), "garbage")
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("healthy"));
        }

        @Test
        void metricsArePublic() throws Exception {
            mockMvc.perform(get("/validation/metrics"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.total_rules").isNumber());
        }
    }
}
