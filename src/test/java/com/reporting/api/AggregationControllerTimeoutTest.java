package com.reporting.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.reporting.domain.evaluation.RuleEvaluator;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.web.servlet.MockMvc;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Synchronous runs over the configured timeout are answered with 408.
 */
@SpringBootTest
@AutoConfigureMockMvc
@TestPropertySource(properties = "app.aggregation.timeout-seconds=1")
class AggregationControllerTimeoutTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private RuleEvaluator ruleEvaluator;

    @Test
    void testAggregate_DeadlineExceeded() throws Exception {
        // Given
        when(ruleEvaluator.apply(any(), any(), any())).thenAnswer(invocation -> {
            Thread.sleep(1100);
            return invocation.getArgument(0, JsonNode.class);
        });
        String body = "{\"aggregation_type\": \"business_metrics\","
                + "\"data\": [{\"revenue\": 1}],"
                + "\"rules\": [{\"field\": \"revenue\", \"operation\": \"sum\", \"order\": 1},"
                + "{\"field\": \"revenue\", \"operation\": \"max\", \"order\": 2}]}";

        // When / Then
        mockMvc.perform(post("/api/v1/aggregation/aggregate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isRequestTimeout())
                .andExpect(jsonPath("$.error_code").value("CANCELLED"))
                .andExpect(jsonPath("$.message").value("aggregation cancelled: deadline exceeded"))
                .andExpect(jsonPath("$.timestamp").exists());
    }
}
