package com.reporting.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.hamcrest.Matchers.greaterThanOrEqualTo;
import static org.hamcrest.Matchers.startsWith;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.fail;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
class AggregationControllerTest {

    private static final String BASE = "/api/v1/aggregation";

    private static final String REVENUE_REQUEST = "{"
            + "\"business_id\": \"biz-1\","
            + "\"aggregation_type\": \"business_metrics\","
            + "\"data\": [{\"revenue\": 100, \"region\": \"eu\"}, {\"revenue\": 300, \"region\": \"us\"}],"
            + "\"rules\": ["
            + "  {\"field\": \"revenue\", \"operation\": \"sum\", \"order\": 1},"
            + "  {\"field\": \"revenue\", \"operation\": \"max\", \"order\": 2, \"enabled\": false},"
            + "  {\"field\": \"region\", \"operation\": \"group_by\", \"order\": 3,"
            + "   \"parameters\": {\"aggregate\": \"sum\", \"target\": \"revenue\"}}"
            + "]}";

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Nested
    @DisplayName("POST /aggregate")
    class Aggregate {

        @Test
        @DisplayName("Runs the rules and returns the result")
        void testAggregate_Success() throws Exception {
            mockMvc.perform(post(BASE + "/aggregate")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(REVENUE_REQUEST))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.aggregation_id", startsWith("agg_")))
                    .andExpect(jsonPath("$.status").value("success"))
                    .andExpect(jsonPath("$.is_successful").value(true))
                    .andExpect(jsonPath("$.aggregated_data.aggregations.revenue_sum").value(400.0))
                    .andExpect(jsonPath("$.aggregated_data.aggregations.region_groups.eu").value(100.0))
                    .andExpect(jsonPath("$.aggregated_data.aggregations.revenue_max").doesNotExist())
                    .andExpect(jsonPath("$.original_data[0].revenue").value(100))
                    .andExpect(jsonPath("$.summary.total_rules").value(3))
                    .andExpect(jsonPath("$.summary.applied_count").value(2))
                    .andExpect(jsonPath("$.summary.skipped_count").value(1))
                    .andExpect(jsonPath("$.skipped_rules[0].operation").value("max"))
                    .andExpect(jsonPath("$.processing_time").isNumber())
                    .andExpect(jsonPath("$.processing_time_ms").doesNotExist());
        }

        @Test
        @DisplayName("Treats null rule parameters as absent")
        void testAggregate_NullParameters() throws Exception {
            String body = "{\"aggregation_type\": \"custom\","
                    + "\"data\": [{\"a\": 1}, {\"a\": 2}, {\"a\": 3}, {\"a\": 4}],"
                    + "\"rules\": [{\"field\": \"a\", \"operation\": \"sum\", \"parameters\": null},"
                    + "{\"field\": \"a\", \"operation\": \"percentile\", \"order\": 1, \"parameters\": null}]}";

            mockMvc.perform(post(BASE + "/aggregate")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(body))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.status").value("success"))
                    .andExpect(jsonPath("$.aggregated_data.aggregations.a_sum").value(10.0))
                    .andExpect(jsonPath("$.aggregated_data.aggregations.a_p90").value(4.0))
                    .andExpect(jsonPath("$.applied_rules[0].parameters").isEmpty());
        }

        @Test
        @DisplayName("Uses a registered schema")
        void testAggregate_WithSchema() throws Exception {
            String body = "{\"aggregation_type\": \"business_metrics\","
                    + "\"schema_id\": \"business_metrics_default\","
                    + "\"data\": {\"records\": [{\"revenue\": 100}, {\"revenue\": 300}]}}";

            mockMvc.perform(post(BASE + "/aggregate")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(body))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.aggregated_data.aggregations.revenue_sum").value(400.0))
                    .andExpect(jsonPath("$.aggregated_data.aggregations.revenue_average").value(200.0));
        }

        @Test
        @DisplayName("Reports partial success when a rule fails")
        void testAggregate_PartialFailure() throws Exception {
            String body = "{\"aggregation_type\": \"financial\","
                    + "\"data\": [{\"amount\": 5}],"
                    + "\"rules\": [{\"field\": \"amount\", \"operation\": \"sum\"},"
                    + "{\"field\": \"amount\", \"operation\": \"teleport\"}]}";

            mockMvc.perform(post(BASE + "/aggregate")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(body))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.status").value("partial"))
                    .andExpect(jsonPath("$.failed_rules[0].rule.operation").value("teleport"))
                    .andExpect(jsonPath("$.failed_rules[0].error").isNotEmpty());
        }

        @Test
        @DisplayName("Rejects a request without aggregation_type")
        void testAggregate_MissingType() throws Exception {
            mockMvc.perform(post(BASE + "/aggregate")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"data\": [1, 2]}"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.error_code").value("VALIDATION_ERROR"))
                    .andExpect(jsonPath("$.message").value("aggregation_type is required"))
                    .andExpect(jsonPath("$.timestamp").exists());
        }

        @Test
        @DisplayName("Rejects an unknown aggregation_type")
        void testAggregate_UnknownType() throws Exception {
            mockMvc.perform(post(BASE + "/aggregate")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"aggregation_type\": \"astrology\", \"data\": [1]}"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.error_code").value("VALIDATION_ERROR"));
        }

        @Test
        @DisplayName("Rejects a request without data")
        void testAggregate_MissingData() throws Exception {
            mockMvc.perform(post(BASE + "/aggregate")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"aggregation_type\": \"custom\", \"data\": null}"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.message").value("data is required"));
        }

        @Test
        @DisplayName("Rejects malformed JSON")
        void testAggregate_MalformedJson() throws Exception {
            mockMvc.perform(post(BASE + "/aggregate")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"aggregation_type\": "))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.error_code").value("VALIDATION_ERROR"));
        }
    }

    @Nested
    @DisplayName("Jobs")
    class Jobs {

        @Test
        @DisplayName("Submitted job runs in the background and completes")
        void testSubmitJob_CompletesInBackground() throws Exception {
            String response = mockMvc.perform(post(BASE + "/jobs")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(REVENUE_REQUEST))
                    .andExpect(status().isAccepted())
                    .andExpect(jsonPath("$.job_id", startsWith("job_")))
                    .andExpect(jsonPath("$.status").value("pending"))
                    .andReturn().getResponse().getContentAsString();
            String jobId = objectMapper.readTree(response).get("job_id").asText();

            JsonNode job = awaitTerminal(jobId);

            assertEquals("completed", job.get("status").asText());
            assertEquals(100, job.get("progress").asInt());
            assertEquals(400.0, job.at("/result/aggregated_data/aggregations/revenue_sum").asDouble());
        }

        @Test
        @DisplayName("Rejects an invalid submission")
        void testSubmitJob_InvalidRequest() throws Exception {
            mockMvc.perform(post(BASE + "/jobs")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"aggregation_type\": \"business_metrics\"}"))
                    .andExpect(status().isBadRequest());
        }

        @Test
        @DisplayName("Unknown jobs return 404")
        void testGetJob_UnknownId() throws Exception {
            mockMvc.perform(get(BASE + "/jobs/job_0_000000"))
                    .andExpect(status().isNotFound())
                    .andExpect(jsonPath("$.error_code").value("NOT_FOUND"));
            mockMvc.perform(post(BASE + "/jobs/job_0_000000/cancel"))
                    .andExpect(status().isNotFound());
        }

        @Test
        @DisplayName("Cancelling a finished job reports false")
        void testCancelJob_FinishedJob() throws Exception {
            String response = mockMvc.perform(post(BASE + "/jobs")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(REVENUE_REQUEST))
                    .andReturn().getResponse().getContentAsString();
            String jobId = objectMapper.readTree(response).get("job_id").asText();
            awaitTerminal(jobId);

            mockMvc.perform(post(BASE + "/jobs/" + jobId + "/cancel"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.job_id").value(jobId))
                    .andExpect(jsonPath("$.cancelled").value(false));
        }

        @Test
        @DisplayName("Listing caps the page size")
        void testListJobs_CapsLimit() throws Exception {
            mockMvc.perform(get(BASE + "/jobs").param("limit", "500").param("page", "0"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.pagination.limit").value(100))
                    .andExpect(jsonPath("$.pagination.page").value(1))
                    .andExpect(jsonPath("$.pagination.total", greaterThanOrEqualTo(0)));
        }

        @Test
        @DisplayName("Listing rejects an unknown status")
        void testListJobs_InvalidStatus() throws Exception {
            mockMvc.perform(get(BASE + "/jobs").param("status", "sleeping"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.error_code").value("VALIDATION_ERROR"));
        }

        private JsonNode awaitTerminal(String jobId) throws Exception {
            for (int attempt = 0; attempt < 100; attempt++) {
                String body = mockMvc.perform(get(BASE + "/jobs/" + jobId))
                        .andExpect(status().isOk())
                        .andReturn().getResponse().getContentAsString();
                JsonNode job = objectMapper.readTree(body);
                String status = job.get("status").asText();
                if ("completed".equals(status) || "failed".equals(status)) {
                    return job;
                }
                Thread.sleep(50);
            }
            fail("job " + jobId + " did not finish");
            return null;
        }
    }

    @Nested
    @DisplayName("Schemas")
    class Schemas {

        @Test
        @DisplayName("Default schemas are available")
        void testGetSchema_Defaults() throws Exception {
            mockMvc.perform(get(BASE + "/schemas/risk_assessment_default"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.type").value("risk_assessment"))
                    .andExpect(jsonPath("$.rules.length()").value(2))
                    .andExpect(jsonPath("$.rules[1].parameters.percentile").value(95));

            mockMvc.perform(get(BASE + "/schemas").param("type", "business_metrics"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$[0].id").value("business_metrics_default"));
        }

        @Test
        @DisplayName("Unknown schema returns 404")
        void testGetSchema_UnknownId() throws Exception {
            mockMvc.perform(get(BASE + "/schemas/nope"))
                    .andExpect(status().isNotFound())
                    .andExpect(jsonPath("$.message").value("schema not found: nope"));
        }

        @Test
        @DisplayName("Registered schema can be used by id")
        void testRegisterSchema_UsableById() throws Exception {
            String schema = "{\"id\": \"orders_v1\", \"name\": \"Orders\", \"type\": \"financial\","
                    + "\"version\": \"1.0.0\","
                    + "\"rules\": [{\"field\": \"amount\", \"operation\": \"median\", \"order\": 1}]}";

            mockMvc.perform(post(BASE + "/schemas")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(schema))
                    .andExpect(status().isCreated())
                    .andExpect(jsonPath("$.id").value("orders_v1"))
                    .andExpect(jsonPath("$.created_at").exists());

            mockMvc.perform(post(BASE + "/aggregate")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"aggregation_type\": \"financial\", \"schema_id\": \"orders_v1\","
                                    + "\"data\": [{\"amount\": 1}, {\"amount\": 9}, {\"amount\": 4}]}"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.aggregated_data.aggregations.amount_median").value(4.0));
        }
    }

    @Test
    @DisplayName("Schema registered with null rules has an empty rule set")
    void testRegisterSchema_NullRules() throws Exception {
        mockMvc.perform(post(BASE + "/schemas")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"id\": \"empty_v1\", \"type\": \"custom\", \"rules\": null}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.rules").isEmpty());
    }

    @Test
    void testHealth() throws Exception {
        mockMvc.perform(get(BASE + "/health"))
                .andExpect(status().isOk())
                .andExpect(content().string("OK"));
    }
}
